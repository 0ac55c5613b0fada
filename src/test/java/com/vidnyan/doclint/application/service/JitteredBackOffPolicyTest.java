package com.vidnyan.doclint.application.service;

import com.vidnyan.doclint.domain.oracle.RetryPolicy;
import org.junit.jupiter.api.Test;
import org.springframework.retry.backoff.BackOffContext;
import org.springframework.retry.backoff.BackOffInterruptedException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JitteredBackOffPolicyTest {

    @Test
    void backOff_ShouldDoubleDelayPerAttempt() {
        // Arrange
        List<Long> sleeps = new ArrayList<>();
        JitteredBackOffPolicy policy = new JitteredBackOffPolicy(
                new RetryPolicy(4, Duration.ofMillis(100), Duration.ZERO), sleeps::add);

        // Act
        BackOffContext context = policy.start(null);
        policy.backOff(context);
        policy.backOff(context);
        policy.backOff(context);

        // Assert
        assertEquals(List.of(100L, 200L, 400L), sleeps);
    }

    @Test
    void backOff_ShouldStartOverForEachOperation() {
        List<Long> sleeps = new ArrayList<>();
        JitteredBackOffPolicy policy = new JitteredBackOffPolicy(
                new RetryPolicy(3, Duration.ofMillis(300), Duration.ofMillis(200)), sleeps::add);

        policy.backOff(policy.start(null));
        policy.backOff(policy.start(null));

        assertEquals(2, sleeps.size());
        sleeps.forEach(delay -> assertTrue(delay >= 300 && delay < 500, "delay " + delay));
    }

    @Test
    void withSleeper_ShouldKeepPolicyAndSwapSleeper() {
        List<Long> sleeps = new ArrayList<>();
        JitteredBackOffPolicy policy = new JitteredBackOffPolicy(
                new RetryPolicy(3, Duration.ofMillis(10), Duration.ZERO), millis -> fail("original sleeper used"));

        JitteredBackOffPolicy swapped = policy.withSleeper(sleeps::add);
        swapped.backOff(swapped.start(null));

        assertEquals(List.of(10L), sleeps);
    }

    @Test
    void backOff_Interrupted_ShouldRestoreFlagAndThrow() {
        JitteredBackOffPolicy policy = new JitteredBackOffPolicy(RetryPolicy.defaults(),
                millis -> { throw new InterruptedException(); });

        assertThrows(BackOffInterruptedException.class, () -> policy.backOff(policy.start(null)));
        assertTrue(Thread.interrupted());
    }
}
