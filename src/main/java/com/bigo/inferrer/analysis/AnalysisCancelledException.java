package com.bigo.inferrer.analysis;

/**
 * Raised when the caller cancels an analysis. Never produces a partial result.
 */
public class AnalysisCancelledException extends RuntimeException {

    public AnalysisCancelledException(String message) {
        super(message);
    }
}
