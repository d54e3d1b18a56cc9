package ai.repodagger.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * Actions applied to every file matching the owning glob, plus regex rules applied once per match against the file
 * text. The action fields are written inline in the YAML next to {@code regex_rules}.
 */
public record PathRule(
        @JsonProperty("visit") List<String> visit,
        @JsonProperty("visit_siblings") List<String> visitSiblings,
        @JsonProperty("visit_grand_siblings") List<String> visitGrandSiblings,
        @JsonProperty("visit_imported_python_modules") boolean visitImportedPythonModules,
        @JsonProperty("visit_python_all_submodules_for") List<String> visitPythonAllSubmodulesFor,
        @JsonProperty("exclude") List<String> exclude,
        @JsonProperty("regex_rules") Map<String, RuleActions> regexRules) {

    @JsonCreator
    public PathRule(
            @JsonProperty("visit") @Nullable List<String> visit,
            @JsonProperty("visit_siblings") @Nullable List<String> visitSiblings,
            @JsonProperty("visit_grand_siblings") @Nullable List<String> visitGrandSiblings,
            @JsonProperty("visit_imported_python_modules") boolean visitImportedPythonModules,
            @JsonProperty("visit_python_all_submodules_for") @Nullable List<String> visitPythonAllSubmodulesFor,
            @JsonProperty("exclude") @Nullable List<String> exclude,
            @JsonProperty("regex_rules") @Nullable Map<String, RuleActions> regexRules) {
        this.visit = DaggerConfig.listOrEmpty(visit);
        this.visitSiblings = DaggerConfig.listOrEmpty(visitSiblings);
        this.visitGrandSiblings = DaggerConfig.listOrEmpty(visitGrandSiblings);
        this.visitImportedPythonModules = visitImportedPythonModules;
        this.visitPythonAllSubmodulesFor = DaggerConfig.listOrEmpty(visitPythonAllSubmodulesFor);
        this.exclude = DaggerConfig.listOrEmpty(exclude);
        // insertion order is the YAML order
        this.regexRules = regexRules == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(regexRules));
    }

    /** The top-level actions of this rule. */
    @JsonIgnore
    public RuleActions actions() {
        return new RuleActions(
                visit, visitSiblings, visitGrandSiblings, visitImportedPythonModules, visitPythonAllSubmodulesFor, exclude);
    }
}
