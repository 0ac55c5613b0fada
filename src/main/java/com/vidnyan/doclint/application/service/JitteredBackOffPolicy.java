package com.vidnyan.doclint.application.service;

import com.vidnyan.doclint.domain.oracle.RetryPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.SleepingBackOffPolicy;

/**
 * Exponential backoff with uniform jitter: {@code base * 2^(n-1) + uniform[0, maxJitter)}
 * before the n-th retry. Delays come from {@link RetryPolicy#backoff(int)}.
 */
@Slf4j
public class JitteredBackOffPolicy implements SleepingBackOffPolicy<JitteredBackOffPolicy> {

    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;

    public JitteredBackOffPolicy(RetryPolicy retryPolicy, Sleeper sleeper) {
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
    }

    @Override
    public JitteredBackOffPolicy withSleeper(Sleeper sleeper) {
        return new JitteredBackOffPolicy(retryPolicy, sleeper);
    }

    @Override
    public BackOffContext start(RetryContext context) {
        return new AttemptContext();
    }

    @Override
    public void backOff(BackOffContext backOffContext) throws BackOffInterruptedException {
        AttemptContext attempts = (AttemptContext) backOffContext;
        attempts.completed++;
        long delay = retryPolicy.backoff(attempts.completed).toMillis();
        log.debug("Backing off {} ms after attempt {}", delay, attempts.completed);
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackOffInterruptedException("Thread interrupted while sleeping", e);
        }
    }

    /**
     * Failed attempts seen so far in one retry operation.
     */
    static class AttemptContext implements BackOffContext {
        int completed;
    }
}
