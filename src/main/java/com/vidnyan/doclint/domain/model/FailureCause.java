package com.vidnyan.doclint.domain.model;

/**
 * Why a judgment did not pass.
 */
public enum FailureCause {
    NONE,
    VIOLATION,            // Oracle judged the document against the rule and it failed
    ORACLE_QUOTA,         // Quota / billing exhausted, never retried
    ORACLE_UNAVAILABLE,   // Transient failures outlasted the retry budget
    ORACLE_ERROR,         // Any other non-retryable call failure
    MALFORMED_RESPONSE,   // Oracle answered but not with a usable judgment
    ENGINE_ERROR;         // The document itself could not be processed

    /**
     * True for failures produced by the engine rather than judged by the oracle.
     */
    public boolean isSynthetic() {
        return this != NONE && this != VIOLATION;
    }
}
