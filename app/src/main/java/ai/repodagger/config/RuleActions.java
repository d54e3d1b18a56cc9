package ai.repodagger.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * The action vocabulary shared by path rules and regex rules. Every string may contain {@code $0, $1, ...}
 * placeholders which are replaced by the capture groups of the regex match that triggered the actions.
 *
 * @param visit globs resolved against the base directory
 * @param visitSiblings globs resolved against the visited file's directory
 * @param visitGrandSiblings globs resolved against the visited file's directory and each ancestor up to the base
 *     directory
 * @param visitImportedPythonModules parse python imports of the visited file and relate it to the imported modules
 * @param visitPythonAllSubmodulesFor module identifiers whose whole package tree is related to the visited file
 * @param exclude globs of files for which this block is skipped (honoured on regex rules)
 */
public record RuleActions(
        @JsonProperty("visit") List<String> visit,
        @JsonProperty("visit_siblings") List<String> visitSiblings,
        @JsonProperty("visit_grand_siblings") List<String> visitGrandSiblings,
        @JsonProperty("visit_imported_python_modules") boolean visitImportedPythonModules,
        @JsonProperty("visit_python_all_submodules_for") List<String> visitPythonAllSubmodulesFor,
        @JsonProperty("exclude") List<String> exclude) {

    @JsonCreator
    public RuleActions(
            @JsonProperty("visit") @Nullable List<String> visit,
            @JsonProperty("visit_siblings") @Nullable List<String> visitSiblings,
            @JsonProperty("visit_grand_siblings") @Nullable List<String> visitGrandSiblings,
            @JsonProperty("visit_imported_python_modules") boolean visitImportedPythonModules,
            @JsonProperty("visit_python_all_submodules_for") @Nullable List<String> visitPythonAllSubmodulesFor,
            @JsonProperty("exclude") @Nullable List<String> exclude) {
        this.visit = DaggerConfig.listOrEmpty(visit);
        this.visitSiblings = DaggerConfig.listOrEmpty(visitSiblings);
        this.visitGrandSiblings = DaggerConfig.listOrEmpty(visitGrandSiblings);
        this.visitImportedPythonModules = visitImportedPythonModules;
        this.visitPythonAllSubmodulesFor = DaggerConfig.listOrEmpty(visitPythonAllSubmodulesFor);
        this.exclude = DaggerConfig.listOrEmpty(exclude);
    }

    /** True when applying these actions needs the parsed python imports of the file. */
    public boolean needsPythonImports() {
        return visitImportedPythonModules || !visitPythonAllSubmodulesFor.isEmpty();
    }
}
