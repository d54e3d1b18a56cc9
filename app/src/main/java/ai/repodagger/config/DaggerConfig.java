package ai.repodagger.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * The decoded configuration file.
 *
 * @param baseDir root of every relative path, itself relative to the directory holding the config file
 * @param inputs globs selecting the files a digest is produced for
 * @param globalDeps files every visited file is related to
 * @param globalExclude globs of files that never get rule relations
 * @param rootPythonPackages dotted package prefixes eligible for import resolution
 * @param pathRules glob to rule, in declaration order
 */
public record DaggerConfig(
        @JsonProperty("base_dir") String baseDir,
        @JsonProperty("inputs") List<String> inputs,
        @JsonProperty("global_deps") List<String> globalDeps,
        @JsonProperty("global_exclude") List<String> globalExclude,
        @JsonProperty("root_python_packages") List<String> rootPythonPackages,
        @JsonProperty("path_rules") Map<String, PathRule> pathRules) {

    @JsonCreator
    public DaggerConfig(
            @JsonProperty("base_dir") @Nullable String baseDir,
            @JsonProperty("inputs") @Nullable List<String> inputs,
            @JsonProperty("global_deps") @Nullable List<String> globalDeps,
            @JsonProperty("global_exclude") @Nullable List<String> globalExclude,
            @JsonProperty("root_python_packages") @Nullable List<String> rootPythonPackages,
            @JsonProperty("path_rules") @Nullable Map<String, PathRule> pathRules) {
        this.baseDir = baseDir == null ? "" : baseDir;
        this.inputs = listOrEmpty(inputs);
        this.globalDeps = listOrEmpty(globalDeps);
        this.globalExclude = listOrEmpty(globalExclude);
        this.rootPythonPackages = listOrEmpty(rootPythonPackages);
        this.pathRules = pathRules == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(pathRules));
    }

    /** Copy of this config with the input globs replaced, used for the command line override. */
    public DaggerConfig withInputs(List<String> newInputs) {
        return new DaggerConfig(baseDir, newInputs, globalDeps, globalExclude, rootPythonPackages, pathRules);
    }

    /** True if {@code module} is one of the root packages or a dotted descendant of one. */
    public boolean isUnderRootPythonPackage(String module) {
        for (var root : rootPythonPackages) {
            if (module.equals(root) || module.startsWith(root + ".")) {
                return true;
            }
        }
        return false;
    }

    static List<String> listOrEmpty(@Nullable List<String> values) {
        return values == null ? List.of() : List.copyOf(values);
    }
}
