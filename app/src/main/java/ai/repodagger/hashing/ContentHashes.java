package ai.repodagger.hashing;

import ai.repodagger.DaggerException.FileAccessException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * SHA-256 of the raw bytes of every file in the relation graph. Computed completely before any dependency digest is
 * taken, then only read, so digest tasks can share it without locking.
 */
public final class ContentHashes {
    private static final Logger logger = LogManager.getLogger(ContentHashes.class);

    public static final int DIGEST_LENGTH = 32;
    private static final byte[] MISSING = new byte[DIGEST_LENGTH];

    private final Map<String, byte[]> digests;

    private ContentHashes(Map<String, byte[]> digests) {
        this.digests = digests;
    }

    public static ContentHashes compute(Collection<String> files, Path baseDir) throws FileAccessException {
        var digests = new HashMap<String, byte[]>(files.size() * 2);
        for (var file : files) {
            var path = baseDir.resolve(file);
            try {
                digests.put(file, sha256(Files.readAllBytes(path)));
            } catch (IOException e) {
                throw new FileAccessException("error while reading file '%s': %s".formatted(path, e), e);
            }
        }
        logger.debug("Hashed {} files", digests.size());
        return new ContentHashes(digests);
    }

    /** Feeds the digest of {@code file} into {@code digest}; files never hashed contribute zero bytes. */
    void feed(String file, MessageDigest digest) {
        digest.update(digests.getOrDefault(file, MISSING));
    }

    public static byte[] sha256(byte[] data) {
        return newSha256().digest(data);
    }

    static MessageDigest newSha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
