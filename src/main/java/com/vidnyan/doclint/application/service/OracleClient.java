package com.vidnyan.doclint.application.service;

import com.vidnyan.doclint.application.port.out.OracleTransport;
import com.vidnyan.doclint.application.port.out.PromptComposer;
import com.vidnyan.doclint.domain.model.EvaluationTask;
import com.vidnyan.doclint.domain.model.FailureCause;
import com.vidnyan.doclint.domain.model.Judgment;
import com.vidnyan.doclint.domain.model.Rule;
import com.vidnyan.doclint.domain.oracle.OracleFailure;
import com.vidnyan.doclint.domain.oracle.OracleFailureClassifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.support.RetryTemplate;

/**
 * Issues one oracle evaluation per task.
 *
 * <p>Calls run through a {@link RetryTemplate} built by {@link OracleRetry}: retryable failures
 * are retried with backoff until the attempt budget is spent, fatal failures end the call at once.
 * Every failure, including an unparseable response, comes back as a failing {@link Judgment},
 * so callers never handle exceptions per task.
 */
@Slf4j
@RequiredArgsConstructor
public class OracleClient {

    static final String CALL_FAILED = "LLM call failed: ";
    static final String QUOTA_RATIONALE = CALL_FAILED + "insufficient quota.";

    private final OracleTransport transport;
    private final PromptComposer promptComposer;
    private final JudgmentParser parser;
    private final RetryTemplate retryTemplate;

    public Judgment evaluate(EvaluationTask task) {
        Rule rule = task.rule();

        String prompt;
        try {
            prompt = promptComposer.compose(rule, task.document());
        } catch (RuntimeException e) {
            log.warn("Prompt construction failed for {}: {}", task.describe(), e.getMessage());
            return Judgment.failed(rule.id(), FailureCause.ORACLE_ERROR, CALL_FAILED + e.getMessage());
        }

        String response;
        try {
            response = retryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    log.warn("Retrying oracle call for {} (attempt {}) after: {}", task.describe(),
                            context.getRetryCount() + 1, context.getLastThrowable().getMessage());
                }
                return transport.call(prompt);
            });
        } catch (BackOffInterruptedException e) {
            log.warn("Oracle call for {} interrupted during backoff", task.describe());
            return Judgment.failed(rule.id(), FailureCause.ORACLE_ERROR, CALL_FAILED + "interrupted");
        } catch (RuntimeException e) {
            OracleFailure failure = OracleFailureClassifier.classify(e);
            log.warn("Oracle call for {} gave up: {}", task.describe(), failure.message());
            return toJudgment(rule, failure);
        }

        try {
            return parser.parse(response, rule);
        } catch (MalformedJudgmentException e) {
            log.warn("Unparseable oracle response for {}: {}", task.describe(), e.getMessage());
            return Judgment.failed(rule.id(), FailureCause.MALFORMED_RESPONSE,
                    CALL_FAILED + "malformed response: " + e.getMessage());
        }
    }

    private Judgment toJudgment(Rule rule, OracleFailure failure) {
        if (failure instanceof OracleFailure.FatalFailure fatal && fatal.quotaExhausted()) {
            return Judgment.failed(rule.id(), FailureCause.ORACLE_QUOTA, QUOTA_RATIONALE);
        }
        FailureCause cause = failure instanceof OracleFailure.RetryableFailure
                ? FailureCause.ORACLE_UNAVAILABLE
                : FailureCause.ORACLE_ERROR;
        return Judgment.failed(rule.id(), cause, CALL_FAILED + failure.message());
    }
}
