package ai.repodagger.hashing;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.HexFormat;
import java.util.List;

/**
 * The cache key of an input file: a SHA-256 over the run parameters, the input path, and the path and content
 * digest of every file in its closure.
 */
public final class DependencyDigest {

    /** Bumped whenever the same input could produce a different digest, which invalidates every stored key. */
    public static final long ALGORITHM_VERSION = 1L;

    private final long algorithmVersion;
    private final String salt;
    private final byte[] configHash;
    private final ContentHashes contentHashes;

    public DependencyDigest(String salt, byte[] configHash, ContentHashes contentHashes) {
        this(ALGORITHM_VERSION, salt, configHash, contentHashes);
    }

    DependencyDigest(long algorithmVersion, String salt, byte[] configHash, ContentHashes contentHashes) {
        this.algorithmVersion = algorithmVersion;
        this.salt = salt;
        this.configHash = configHash.clone();
        this.contentHashes = contentHashes;
    }

    /** Hex digest of {@code file} given its sorted closure. Safe to call from several threads. */
    public String compute(String file, List<String> closure) {
        var digest = ContentHashes.newSha256();
        digest.update(ByteBuffer.allocate(Long.BYTES)
                .order(ByteOrder.LITTLE_ENDIAN)
                .putLong(algorithmVersion)
                .array());
        digest.update(salt.getBytes(StandardCharsets.UTF_8));
        digest.update(configHash);
        digest.update(file.getBytes(StandardCharsets.UTF_8));
        for (var dep : closure) {
            digest.update(dep.getBytes(StandardCharsets.UTF_8));
            contentHashes.feed(dep, digest);
        }
        return HexFormat.of().formatHex(digest.digest());
    }
}
