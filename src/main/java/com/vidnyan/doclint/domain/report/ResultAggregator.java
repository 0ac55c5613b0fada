package com.vidnyan.doclint.domain.report;

import com.vidnyan.doclint.domain.model.DocumentResult;
import com.vidnyan.doclint.domain.model.FailureCause;
import com.vidnyan.doclint.domain.model.Rule;
import com.vidnyan.doclint.domain.model.RuleOutcome;
import com.vidnyan.doclint.domain.model.Summary;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Folds per-document results into the run summary.
 * Document pass/fail comes from {@link DocumentResult#overallPass()} as computed by the scheduler;
 * outcomes are only visited to build the failure taxonomy.
 */
public class ResultAggregator {

    public Summary aggregate(String model, List<DocumentResult> documentResults) {
        int passed = 0;
        Map<FailureCause, Integer> byCause = new EnumMap<>(FailureCause.class);
        Map<Rule.Severity, Integer> bySeverity = new EnumMap<>(Rule.Severity.class);

        for (DocumentResult result : documentResults) {
            if (result.overallPass()) {
                passed++;
            }
            for (RuleOutcome outcome : result.outcomes()) {
                if (outcome.pass()) continue;
                byCause.merge(outcome.cause(), 1, Integer::sum);
                bySeverity.merge(outcome.severity(), 1, Integer::sum);
            }
        }

        int checked = documentResults.size();
        return new Summary(model, checked, passed, checked - passed, byCause, bySeverity, documentResults);
    }
}
