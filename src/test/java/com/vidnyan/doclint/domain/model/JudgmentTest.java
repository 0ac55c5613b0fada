package com.vidnyan.doclint.domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JudgmentTest {

    @Test
    void constructor_FailingWithoutCause_ShouldDefaultToViolation() {
        Judgment judgment = new Judgment("R1", false, null, null, FailureCause.NONE);

        assertEquals(FailureCause.VIOLATION, judgment.cause());
        assertEquals("", judgment.rationale());
        assertTrue(judgment.suggestedFixes().isEmpty());
    }

    @Test
    void constructor_Passing_ShouldClearCause() {
        Judgment judgment = new Judgment("R1", true, "ok", List.of(), FailureCause.ORACLE_ERROR);

        assertEquals(FailureCause.NONE, judgment.cause());
    }

    @Test
    void failed_ShouldCarryRemediationHint() {
        Judgment judgment = Judgment.failed("R1", FailureCause.ORACLE_UNAVAILABLE, "LLM call failed: 503");

        assertFalse(judgment.pass());
        assertTrue(judgment.cause().isSynthetic());
        assertEquals(1, judgment.suggestedFixes().size());
        assertEquals(Judgment.RETRY_HINT, judgment.suggestedFixes().get(0).asText());
    }
}
