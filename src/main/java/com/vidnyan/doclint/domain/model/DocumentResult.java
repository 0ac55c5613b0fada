package com.vidnyan.doclint.domain.model;

import java.util.List;

/**
 * All rule outcomes of one document, in rule input order.
 */
public record DocumentResult(
    Document document,
    boolean overallPass,
    List<RuleOutcome> outcomes
) {

    public DocumentResult {
        outcomes = List.copyOf(outcomes);
    }

    /**
     * Fold outcomes into a result; the document passes only if every outcome passed.
     */
    public static DocumentResult of(Document document, List<RuleOutcome> outcomes) {
        boolean overall = outcomes.stream().allMatch(RuleOutcome::pass);
        return new DocumentResult(document, overall, outcomes);
    }

    /**
     * Synthetic result for a document whose processing failed outside the judgment path.
     */
    public static DocumentResult engineError(Document document, String message) {
        return new DocumentResult(document, false, List.of(RuleOutcome.engineError(message)));
    }

    public int passedCount() {
        return (int) outcomes.stream().filter(RuleOutcome::pass).count();
    }

    public int failedCount() {
        return outcomes.size() - passedCount();
    }
}
