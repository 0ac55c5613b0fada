package com.vidnyan.doclint.application.service;

import com.vidnyan.doclint.domain.location.LineLocator;
import com.vidnyan.doclint.domain.model.Document;
import com.vidnyan.doclint.domain.model.DocumentResult;
import com.vidnyan.doclint.domain.model.EvaluationTask;
import com.vidnyan.doclint.domain.model.Judgment;
import com.vidnyan.doclint.domain.model.Rule;
import com.vidnyan.doclint.domain.model.RuleOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.List;

/**
 * Expands documents x rules into tasks and runs them in two nested bounded pools:
 * up to {@code documentConcurrency} documents at once, and within each document up to
 * {@code ruleConcurrency} rules at once.
 *
 * <p>Results come back in input order at both levels. A document that fails outside the
 * judgment path becomes a synthetic {@code engine_error} result; nothing is thrown per task.
 */
@Slf4j
@RequiredArgsConstructor
public class TaskScheduler {

    static final String MDC_DOCUMENT = "document";

    private final OracleClient oracleClient;
    private final LineLocator lineLocator;
    private final WorkerPool workerPool;
    private final RuleRunLogger runLogger;

    public List<DocumentResult> run(List<Document> documents, List<Rule> rules,
                                    int documentConcurrency, int ruleConcurrency) {
        return workerPool.drain(documents.size(), documentConcurrency,
                index -> processIsolated(index, documents.get(index), rules, ruleConcurrency));
    }

    private DocumentResult processIsolated(int documentIndex, Document document, List<Rule> rules,
                                           int ruleConcurrency) {
        MDC.put(MDC_DOCUMENT, document.path());
        try {
            return process(documentIndex, document, rules, ruleConcurrency);
        } catch (RuntimeException e) {
            log.error("Engine error while evaluating {}", document.path(), e);
            return DocumentResult.engineError(document, describe(e));
        } finally {
            MDC.remove(MDC_DOCUMENT);
        }
    }

    private DocumentResult process(int documentIndex, Document document, List<Rule> rules, int ruleConcurrency) {
        String content = document.requireContent();
        log.info("📄 {}", document.path());

        List<RuleOutcome> outcomes = workerPool.drain(rules.size(), ruleConcurrency,
                ruleIndex -> evaluate(new EvaluationTask(documentIndex, ruleIndex, document, rules.get(ruleIndex)),
                        content));

        DocumentResult result = DocumentResult.of(document, outcomes);
        runLogger.documentFinished(document, result);
        return result;
    }

    private RuleOutcome evaluate(EvaluationTask task, String content) {
        long start = System.nanoTime();
        Judgment judgment = oracleClient.evaluate(task);
        Rule.Severity severity = task.rule().severity();

        RuleOutcome outcome;
        if (judgment.pass()) {
            outcome = RuleOutcome.passed(judgment, severity);
        } else if (judgment.cause().isSynthetic()) {
            outcome = RuleOutcome.failed(judgment, severity, 1);
        } else {
            outcome = RuleOutcome.failed(judgment, severity, lineLocator.locate(content, judgment.suggestedFixes()));
        }

        runLogger.ruleFinished(task, outcome, Duration.ofNanos(System.nanoTime() - start));
        return outcome;
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
