package com.bigo.inferrer.analysis;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class CancellationTokenTest {

    @Test
    void explicitCancellation() {
        CancellationToken token = CancellationToken.create();
        assertFalse(token.isCancelled());
        token.throwIfCancelled();

        token.cancel();
        assertTrue(token.isCancelled());
        AnalysisCancelledException e = assertThrows(AnalysisCancelledException.class, token::throwIfCancelled);
        assertEquals("Analysis cancelled", e.getMessage());
    }

    @Test
    void expiredBudget() {
        CancellationToken token = CancellationToken.withTimeout(Duration.ZERO);
        assertTrue(token.isCancelled());
        AnalysisCancelledException e = assertThrows(AnalysisCancelledException.class, token::throwIfCancelled);
        assertEquals("Analysis time budget exceeded", e.getMessage());
    }

    @Test
    void generousBudgetIsNotCancelled() {
        assertFalse(CancellationToken.withTimeout(Duration.ofHours(1)).isCancelled());
    }

    @Test
    void sharedTokenCannotBeCancelled() {
        assertThrows(IllegalStateException.class, () -> CancellationToken.none().cancel());
        assertFalse(CancellationToken.none().isCancelled());
    }
}
