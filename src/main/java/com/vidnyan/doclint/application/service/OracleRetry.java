package com.vidnyan.doclint.application.service;

import com.vidnyan.doclint.domain.oracle.OracleFailure;
import com.vidnyan.doclint.domain.oracle.OracleFailureClassifier;
import com.vidnyan.doclint.domain.oracle.RetryPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.policy.ExceptionClassifierRetryPolicy;
import org.springframework.retry.policy.NeverRetryPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

/**
 * Builds the {@link RetryTemplate} for oracle calls.
 * Only failures classified as {@link OracleFailure.RetryableFailure} are retried, up to
 * {@link RetryPolicy#maxAttempts()} attempts in total; anything else ends the call on the first failure.
 */
public final class OracleRetry {

    private OracleRetry() {
    }

    public static RetryTemplate template(RetryPolicy retryPolicy, Sleeper sleeper) {
        SimpleRetryPolicy transientFailures = new SimpleRetryPolicy(retryPolicy.maxAttempts());
        NeverRetryPolicy fatalFailures = new NeverRetryPolicy();

        ExceptionClassifierRetryPolicy classified = new ExceptionClassifierRetryPolicy();
        classified.setExceptionClassifier(error ->
                OracleFailureClassifier.classify(error) instanceof OracleFailure.RetryableFailure
                        ? transientFailures
                        : fatalFailures);

        RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(classified);
        template.setBackOffPolicy(new JitteredBackOffPolicy(retryPolicy, sleeper));
        return template;
    }
}
