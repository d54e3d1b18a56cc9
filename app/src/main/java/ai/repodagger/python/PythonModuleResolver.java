package ai.repodagger.python;

import ai.repodagger.DaggerException.UnsupportedImportException;
import ai.repodagger.config.DaggerConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Maps a dotted python module name to the files implementing it and its ancestor packages.
 *
 * <p>Results are memoized per module name for the lifetime of the resolver, including empty results. The cache is a
 * plain {@link HashMap}: a resolver must only be used from one thread.
 */
public final class PythonModuleResolver {
    private static final Logger logger = LogManager.getLogger(PythonModuleResolver.class);

    /** File suffixes probed next to the module path, in the order they are reported. */
    private static final List<String> MODULE_FILE_SUFFIXES = List.of(".py", ".pyx", ".pyi", ".c");

    private final DaggerConfig config;
    private final Path baseDir;
    private final Map<String, List<String>> cache = new HashMap<>();

    public PythonModuleResolver(DaggerConfig config, Path baseDir) {
        this.config = config;
        this.baseDir = baseDir;
    }

    /**
     * Returns base-dir-relative paths of every existing form of {@code module}, followed by those of its parent
     * package when at least one form existed. Candidates accumulate: a package directory with an {@code __init__.py}
     * and a same-named {@code .pyi} stub both contribute.
     *
     * @throws UnsupportedImportException for relative module names
     */
    public List<String> resolve(String module) throws UnsupportedImportException {
        var cached = cache.get(module);
        if (cached != null) {
            return cached;
        }

        if (module.startsWith(".")) {
            throw new UnsupportedImportException("relative imports are not supported: '%s'".formatted(module));
        }

        if (!config.isUnderRootPythonPackage(module)) {
            cache.put(module, List.of());
            return List.of();
        }

        var paths = new ArrayList<String>();
        boolean found = false;

        var dirPath = module.replace('.', '/');
        var initPath = dirPath + "/__init__.py";
        if (Files.isRegularFile(baseDir.resolve(initPath))) {
            paths.add(initPath);
            found = true;
        }
        if (Files.isDirectory(baseDir.resolve(dirPath))) {
            // namespace package, no file to import
            found = true;
        }
        for (var suffix : MODULE_FILE_SUFFIXES) {
            var filePath = dirPath + suffix;
            if (Files.isRegularFile(baseDir.resolve(filePath))) {
                paths.add(filePath);
                found = true;
            }
        }

        if (found) {
            int lastDot = module.lastIndexOf('.');
            if (lastDot > 0) {
                paths.addAll(resolve(module.substring(0, lastDot)));
            }
        } else {
            logger.debug("Python module '{}' not found under {}", module, baseDir);
        }

        var result = List.copyOf(paths);
        cache.put(module, result);
        return result;
    }

    /** Number of distinct module names resolved so far. */
    public int cachedModuleCount() {
        return cache.size();
    }
}
