package ai.repodagger.util;

import java.nio.file.Path;

/** Helpers for the {@code /}-separated, base-dir-relative path strings used throughout the relation map. */
public final class PathUtil {

    private PathUtil() {}

    public static String toUnixPath(Path path) {
        return path.toString().replace('\\', '/');
    }

    /** Strips leading {@code ./} segments and collapses duplicate separators. */
    public static String normalizeRelative(String relPath) {
        var s = relPath.replace('\\', '/');
        while (s.startsWith("./")) {
            s = s.substring(2);
        }
        while (s.contains("//")) {
            s = s.replace("//", "/");
        }
        return s;
    }

    /** Directory part of a relative path; the empty string stands for the base directory itself. */
    public static String parentOf(String relPath) {
        int slash = relPath.lastIndexOf('/');
        return slash < 0 ? "" : relPath.substring(0, slash);
    }

    /** Joins a relative directory (possibly empty) and a relative path. */
    public static String join(String dir, String relPath) {
        return dir.isEmpty() ? relPath : dir + "/" + relPath;
    }
}
