package com.vidnyan.doclint.domain.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.util.List;

/**
 * Parsed pass/fail verdict for one task.
 * Suggested fixes are opaque JSON values; only the line locator looks inside them.
 */
public record Judgment(
    String ruleId,
    boolean pass,
    String rationale,
    List<JsonNode> suggestedFixes,
    FailureCause cause
) {

    public static final String RETRY_HINT = "Verify API key/org; try again.";

    public Judgment {
        rationale = rationale != null ? rationale : "";
        suggestedFixes = suggestedFixes != null ? List.copyOf(suggestedFixes) : List.of();
        if (pass) {
            cause = FailureCause.NONE;
        } else if (cause == null || cause == FailureCause.NONE) {
            cause = FailureCause.VIOLATION;
        }
    }

    /**
     * Verdict actually produced by the oracle.
     */
    public static Judgment judged(String ruleId, boolean pass, String rationale, List<JsonNode> suggestedFixes) {
        return new Judgment(ruleId, pass, rationale, suggestedFixes,
                pass ? FailureCause.NONE : FailureCause.VIOLATION);
    }

    /**
     * Synthetic failing verdict standing in for a call that never produced one.
     */
    public static Judgment failed(String ruleId, FailureCause cause, String rationale) {
        return new Judgment(ruleId, false, rationale, List.of(TextNode.valueOf(RETRY_HINT)), cause);
    }
}
