package com.prrules.analyzer.rules;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * JSON object a {@link RuleBackend} answers with.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BackendRuleResponse(
        @JsonProperty("rule_text") String ruleText,
        @JsonProperty("rule_category") String ruleCategory,
        @JsonProperty("rule_severity") String ruleSeverity,
        @JsonProperty("explanation") String explanation,
        @JsonProperty("examples") List<String> examples,
        @JsonProperty("related_concepts") List<String> relatedConcepts
) {

    public boolean hasRequiredFields() {
        return notBlank(ruleText) && notBlank(ruleCategory) && notBlank(ruleSeverity);
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
