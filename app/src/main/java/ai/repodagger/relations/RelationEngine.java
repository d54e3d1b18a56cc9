package ai.repodagger.relations;

import ai.repodagger.DaggerException;
import ai.repodagger.DaggerException.FileAccessException;
import ai.repodagger.DaggerException.PatternException;
import ai.repodagger.DaggerException.UnresolvedModuleException;
import ai.repodagger.config.DaggerConfig;
import ai.repodagger.config.PathRule;
import ai.repodagger.config.RuleActions;
import ai.repodagger.glob.FileGlobber;
import ai.repodagger.glob.GlobPattern;
import ai.repodagger.python.PythonImports;
import ai.repodagger.python.PythonModuleResolver;
import ai.repodagger.util.PathUtil;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Evaluates the configured rules against a single file and returns the files it directly relates to.
 *
 * <p>Compiled globs, compiled regexes and the {@link PythonModuleResolver} memo are unsynchronized caches shared by
 * every visit. An engine must therefore be driven from a single thread, which {@link GraphBuilder} does.
 */
public final class RelationEngine {
    private static final Logger logger = LogManager.getLogger(RelationEngine.class);

    private final DaggerConfig config;
    private final Path baseDir;
    private final PythonModuleResolver pythonResolver;
    private final Map<String, Pattern> regexCache = new HashMap<>();
    private final Map<String, GlobPattern> globCache = new HashMap<>();

    public RelationEngine(DaggerConfig config, Path baseDir) {
        this(config, baseDir, new PythonModuleResolver(config, baseDir));
    }

    public RelationEngine(DaggerConfig config, Path baseDir, PythonModuleResolver pythonResolver) {
        this.config = config;
        this.baseDir = baseDir;
        this.pythonResolver = pythonResolver;
    }

    public PythonModuleResolver pythonResolver() {
        return pythonResolver;
    }

    /**
     * Relations of {@code file}: the output of every matching path rule and regex rule, merged with the global
     * dependencies, sorted and de-duplicated. Globally excluded files only get the global dependencies.
     */
    public List<String> visitFile(String file) throws DaggerException {
        var relations = new ArrayList<>(config.globalDeps());

        if (matchesAny(config.globalExclude(), file)) {
            logger.debug("Skipping globally excluded file: {}", file);
            return sortedDistinct(relations);
        }
        logger.debug("Visiting: {}", file);

        var visit = new FileVisit(file);
        for (var entry : config.pathRules().entrySet()) {
            var rulePattern = entry.getKey();
            boolean matched;
            try {
                matched = compileGlob(rulePattern).matches(file);
            } catch (PatternException e) {
                throw DaggerException.withContext("error matching rule '%s'".formatted(rulePattern), e);
            }
            if (!matched) {
                continue;
            }
            logger.debug("Matched rule: {}", rulePattern);
            try {
                applyPathRule(entry.getValue(), visit, relations);
            } catch (DaggerException e) {
                throw DaggerException.withContext("error while running path_rule '%s'".formatted(rulePattern), e);
            }
        }
        return sortedDistinct(relations);
    }

    private void applyPathRule(PathRule rule, FileVisit visit, List<String> relations) throws DaggerException {
        applyActions(rule.actions(), visit, CaptureGroups.NONE, relations);

        for (var regexEntry : rule.regexRules().entrySet()) {
            var regexPattern = regexEntry.getKey();
            var regexActions = regexEntry.getValue();
            try {
                if (matchesAny(regexActions.exclude(), visit.file)) {
                    continue;
                }
                var matcher = compileRegex(regexPattern).matcher(visit.text());
                while (matcher.find()) {
                    var captures = CaptureGroups.of(matcher);
                    if (logger.isDebugEnabled()) {
                        logger.debug("Matched regex rule: {} {} {}", visit.file, regexPattern, captures.groups());
                    }
                    applyActions(regexActions, visit, captures, relations);
                }
            } catch (DaggerException e) {
                throw DaggerException.withContext("error while running regex rule '%s'".formatted(regexPattern), e);
            }
        }
    }

    private void applyActions(RuleActions actions, FileVisit visit, CaptureGroups captures, List<String> relations)
            throws DaggerException {
        for (var pattern : captures.apply(actions.visit())) {
            try {
                relations.addAll(FileGlobber.glob(baseDir, compileGlob(pattern)));
            } catch (DaggerException e) {
                throw DaggerException.withContext("error while visiting '%s'".formatted(pattern), e);
            }
        }

        var fileDir = PathUtil.parentOf(visit.file);
        for (var pattern : captures.apply(actions.visitSiblings())) {
            try {
                globUnder(fileDir, pattern, relations);
            } catch (DaggerException e) {
                throw DaggerException.withContext("error while visiting sibling '%s'".formatted(pattern), e);
            }
        }

        var grandSiblingPatterns = captures.apply(actions.visitGrandSiblings());
        if (!grandSiblingPatterns.isEmpty()) {
            // from the file's own directory up to and including the base directory
            var dir = fileDir;
            while (true) {
                for (var pattern : grandSiblingPatterns) {
                    try {
                        globUnder(dir, pattern, relations);
                    } catch (DaggerException e) {
                        throw DaggerException.withContext(
                                "error while visiting grand sibling '%s' at '%s'".formatted(pattern, dir), e);
                    }
                }
                if (dir.isEmpty()) {
                    break;
                }
                dir = PathUtil.parentOf(dir);
            }
        }

        if (actions.needsPythonImports()) {
            applyPythonActions(actions, visit, captures, relations);
        }
    }

    private void applyPythonActions(
            RuleActions actions, FileVisit visit, CaptureGroups captures, List<String> relations)
            throws DaggerException {
        var imports = visit.pythonImports();

        for (var moduleName : captures.apply(actions.visitPythonAllSubmodulesFor())) {
            String fullModuleName;
            if (config.isUnderRootPythonPackage(moduleName)) {
                fullModuleName = moduleName;
            } else {
                fullModuleName = imports.boundNames().get(moduleName);
                if (fullModuleName == null) {
                    throw new UnresolvedModuleException("module ident '%s' not found".formatted(moduleName));
                }
            }
            logger.debug("Visiting all submodules of: {} -> {}", moduleName, fullModuleName);

            var pattern = fullModuleName.replace('.', '/') + "/**/*.py";
            try {
                relations.addAll(FileGlobber.glob(baseDir, compileGlob(pattern)));
            } catch (DaggerException e) {
                throw DaggerException.withContext(
                        "error while visiting submodule '%s'".formatted(fullModuleName), e);
            }
        }

        for (var module : imports.modules()) {
            try {
                relations.addAll(pythonResolver.resolve(module));
            } catch (DaggerException e) {
                throw DaggerException.withContext("error while resolving python module '%s'".formatted(module), e);
            }
        }
    }

    /** Globs relative to {@code dir} and records the matches re-anchored to the base directory. */
    private void globUnder(String dir, String pattern, List<String> relations) throws DaggerException {
        var root = dir.isEmpty() ? baseDir : baseDir.resolve(dir);
        for (var match : FileGlobber.glob(root, compileGlob(pattern))) {
            relations.add(PathUtil.join(dir, match));
        }
    }

    private boolean matchesAny(List<String> globs, String file) throws PatternException {
        for (var glob : globs) {
            GlobPattern pattern;
            try {
                pattern = compileGlob(glob);
            } catch (PatternException e) {
                throw new PatternException(
                        "error matching exclusion '%s' on '%s': %s".formatted(glob, file, e.getMessage()), e);
            }
            if (pattern.matches(file)) {
                return true;
            }
        }
        return false;
    }

    private GlobPattern compileGlob(String glob) throws PatternException {
        var cached = globCache.get(glob);
        if (cached == null) {
            cached = GlobPattern.compile(glob);
            globCache.put(glob, cached);
        }
        return cached;
    }

    private Pattern compileRegex(String regex) throws PatternException {
        var cached = regexCache.get(regex);
        if (cached == null) {
            try {
                cached = Pattern.compile(regex);
            } catch (PatternSyntaxException e) {
                throw new PatternException(
                        "error while compiling regex rule '%s': %s".formatted(regex, e.getDescription()), e);
            }
            regexCache.put(regex, cached);
        }
        return cached;
    }

    private static List<String> sortedDistinct(List<String> relations) {
        return List.copyOf(new TreeSet<>(relations));
    }

    /** Per-visit state: the file text is read at most once, and parsed for imports at most once. */
    private final class FileVisit {
        private final String file;
        private @Nullable String text;
        private @Nullable PythonImports imports;

        FileVisit(String file) {
            this.file = file;
        }

        String text() throws FileAccessException {
            if (text == null) {
                try {
                    text = new String(Files.readAllBytes(baseDir.resolve(file)), StandardCharsets.UTF_8);
                } catch (IOException e) {
                    throw new FileAccessException("error while reading file '%s': %s".formatted(file, e), e);
                }
            }
            return text;
        }

        PythonImports pythonImports() throws FileAccessException {
            if (imports == null) {
                imports = PythonImports.parse(text());
            }
            return imports;
        }
    }
}
