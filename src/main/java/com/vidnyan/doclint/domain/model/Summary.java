package com.vidnyan.doclint.domain.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Final outcome of one engine run.
 * {@code passed} and {@code failed} count documents; the two maps count failing rule outcomes
 * and iterate in enum order. {@code model} names the oracle model that judged the run.
 */
public record Summary(
    String model,
    int checked,
    int passed,
    int failed,
    Map<FailureCause, Integer> failuresByCause,
    Map<Rule.Severity, Integer> failuresBySeverity,
    List<DocumentResult> documentResults
) {

    public Summary {
        failuresByCause = enumOrdered(failuresByCause);
        failuresBySeverity = enumOrdered(failuresBySeverity);
        documentResults = List.copyOf(documentResults);
    }

    public boolean hasFailures() {
        return failed > 0;
    }

    public int failureCount(FailureCause cause) {
        return failuresByCause.getOrDefault(cause, 0);
    }

    public int failureCount(Rule.Severity severity) {
        return failuresBySeverity.getOrDefault(severity, 0);
    }

    // Iterates in enum declaration order.
    private static <K extends Enum<K>> Map<K, Integer> enumOrdered(Map<K, Integer> counts) {
        if (counts.isEmpty()) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(new EnumMap<>(counts));
    }
}
