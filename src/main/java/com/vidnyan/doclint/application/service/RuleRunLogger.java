package com.vidnyan.doclint.application.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.vidnyan.doclint.domain.model.Document;
import com.vidnyan.doclint.domain.model.DocumentResult;
import com.vidnyan.doclint.domain.model.EvaluationTask;
import com.vidnyan.doclint.domain.model.RuleOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;

/**
 * Compact progress log. Each rule's block is built first and logged as one message
 * so concurrent workers never interleave their lines.
 */
@Slf4j
@RequiredArgsConstructor
public class RuleRunLogger {

    static final int MAX_FIXES_SHOWN = 3;
    private static final String INDENT = "      ";

    private final boolean showPassDetails;

    public void ruleFinished(EvaluationTask task, RuleOutcome outcome, Duration elapsed) {
        log.info(formatRule(task, outcome, elapsed));
    }

    public void documentFinished(Document document, DocumentResult result) {
        log.info("  [{}] ▶ Summary: {} passed, {} failed  {}",
                document.displayName(), result.passedCount(), result.failedCount(),
                result.overallPass() ? "✅" : "❌");
    }

    String formatRule(EvaluationTask task, RuleOutcome outcome, Duration elapsed) {
        StringBuilder sb = new StringBuilder();
        sb.append("  [").append(task.document().displayName()).append("] ▶ ")
                .append(outcome.ruleId()).append("  ")
                .append(outcome.pass() ? "PASS" : "FAIL")
                .append("  (").append(elapsed.toMillis()).append(" ms)");

        if (outcome.pass() && !showPassDetails) {
            return sb.toString();
        }

        if (!outcome.rationale().isEmpty()) {
            sb.append('\n').append(INDENT).append("• rationale: ").append(outcome.rationale());
        }
        if (outcome.line() != null) {
            sb.append('\n').append(INDENT).append("• line: ").append(outcome.line());
        }

        List<JsonNode> fixes = outcome.suggestedFixes();
        fixes.stream().limit(MAX_FIXES_SHOWN).forEach(fix ->
                sb.append('\n').append(INDENT).append("• fix: ").append(render(fix)));
        int extra = fixes.size() - MAX_FIXES_SHOWN;
        if (extra > 0) {
            sb.append('\n').append(INDENT)
                    .append("(+").append(extra).append(" more suggestion").append(extra > 1 ? "s" : "").append(')');
        }
        return sb.toString();
    }

    private static String render(JsonNode fix) {
        return fix.isTextual() ? fix.asText() : fix.toString();
    }
}
