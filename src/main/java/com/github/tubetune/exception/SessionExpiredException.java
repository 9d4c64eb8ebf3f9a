package com.github.tubetune.exception;

/**
 * Exception thrown when a callback references a superseded generation or a session past its TTL.
 */
public class SessionExpiredException extends PipelineException {

    private final String ownerId;
    private final long generation;

    public SessionExpiredException(String ownerId, long generation) {
        super(FailureKind.SESSION_EXPIRED,
                "Search session generation " + generation + " is not live for owner " + ownerId);
        this.ownerId = ownerId;
        this.generation = generation;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public long getGeneration() {
        return generation;
    }
}
