package ai.repodagger.glob;

import ai.repodagger.DaggerException;
import ai.repodagger.DaggerException.FileAccessException;
import ai.repodagger.util.PathUtil;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

/**
 * Enumerates the regular files under a root directory whose root-relative path matches a {@link GlobPattern}.
 * Results are {@code /}-separated, relative to the root and sorted.
 */
public final class FileGlobber {

    private FileGlobber() {}

    public static List<String> glob(Path root, String glob) throws DaggerException {
        return glob(root, GlobPattern.compile(glob));
    }

    /**
     * Walks only below the pattern's literal directory prefix, and no deeper than the pattern can reach. A missing
     * start directory yields no matches; any other I/O failure during the walk is an error.
     */
    public static List<String> glob(Path root, GlobPattern pattern) throws FileAccessException {
        if (pattern.isLiteral()) {
            var candidate = root.resolve(pattern.glob());
            return Files.isRegularFile(candidate) ? List.of(PathUtil.normalizeRelative(pattern.glob())) : List.of();
        }

        var prefix = pattern.literalDirectoryPrefix();
        var start = prefix.isEmpty() ? root : root.resolve(prefix);
        if (!Files.isDirectory(start)) {
            return List.of();
        }
        int maxDepth = pattern.maxDepthBelowPrefix();

        try (Stream<Path> stream = Files.walk(start, maxDepth)) {
            return stream.filter(Files::isRegularFile)
                    .map(p -> PathUtil.toUnixPath(root.relativize(p)))
                    .filter(pattern::matches)
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new FileAccessException("error scanning '%s' for '%s': %s".formatted(start, pattern, e), e);
        } catch (UncheckedIOException e) {
            throw new FileAccessException(
                    "error scanning '%s' for '%s': %s".formatted(start, pattern, e.getCause()), e.getCause());
        }
    }
}
