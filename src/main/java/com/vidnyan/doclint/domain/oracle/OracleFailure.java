package com.vidnyan.doclint.domain.oracle;

/**
 * Classified result of a failed oracle attempt.
 * A {@link RetryableFailure} drives the backoff loop; a {@link FatalFailure} ends it immediately.
 */
public sealed interface OracleFailure permits OracleFailure.RetryableFailure, OracleFailure.FatalFailure {

    String message();

    /**
     * Rate limiting or a server-side error.
     */
    record RetryableFailure(int statusCode, String message) implements OracleFailure {}

    /**
     * Anything that will not get better by asking again.
     */
    record FatalFailure(int statusCode, String message, boolean quotaExhausted) implements OracleFailure {}
}
