package com.github.tubetune.exception;

/**
 * Failure of a single extraction strategy. Never leaves the source resolver:
 * the resolver absorbs it and moves on to the next strategy.
 */
public class ExtractionStrategyException extends Exception {

    public enum Reason {
        AUTH_WALL,
        GEO_BLOCKED,
        UNAVAILABLE,
        MALFORMED_RESPONSE,
        NO_RESULTS,
        TOOL_FAILURE,
        TIMEOUT
    }

    private final String strategy;
    private final Reason reason;

    public ExtractionStrategyException(String strategy, Reason reason, String message) {
        super(message);
        this.strategy = strategy;
        this.reason = reason;
    }

    public ExtractionStrategyException(String strategy, Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.strategy = strategy;
        this.reason = reason;
    }

    public String getStrategy() {
        return strategy;
    }

    public Reason getReason() {
        return reason;
    }
}
