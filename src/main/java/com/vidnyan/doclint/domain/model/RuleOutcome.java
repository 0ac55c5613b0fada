package com.vidnyan.doclint.domain.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * A judgment placed in its document: severity of the rule plus the recovered source line.
 * {@code line} is only set (and always &gt;= 1) for failing outcomes.
 */
public record RuleOutcome(
    Judgment judgment,
    Rule.Severity severity,
    Integer line
) {

    public static final String ENGINE_ERROR_RULE_ID = "engine_error";

    public static RuleOutcome passed(Judgment judgment, Rule.Severity severity) {
        return new RuleOutcome(judgment, severity, null);
    }

    public static RuleOutcome failed(Judgment judgment, Rule.Severity severity, int line) {
        if (line < 1) {
            throw new IllegalArgumentException("line must be >= 1 but was " + line);
        }
        return new RuleOutcome(judgment, severity, line);
    }

    /**
     * Outcome describing a document that could not be evaluated at all.
     */
    public static RuleOutcome engineError(String message) {
        Judgment judgment = new Judgment(ENGINE_ERROR_RULE_ID, false, "Engine error: " + message,
                List.of(), FailureCause.ENGINE_ERROR);
        return new RuleOutcome(judgment, Rule.Severity.ERROR, 1);
    }

    public String ruleId() {
        return judgment.ruleId();
    }

    public boolean pass() {
        return judgment.pass();
    }

    public String rationale() {
        return judgment.rationale();
    }

    public List<JsonNode> suggestedFixes() {
        return judgment.suggestedFixes();
    }

    public FailureCause cause() {
        return judgment.cause();
    }
}
