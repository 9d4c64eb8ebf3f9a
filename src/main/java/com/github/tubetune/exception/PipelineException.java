package com.github.tubetune.exception;

/**
 * Base exception for every terminal failure of the extraction-and-delivery pipeline.
 * The message is diagnostic only; users see the text mapped from {@link #getKind()}.
 */
public class PipelineException extends RuntimeException {

    private final FailureKind kind;

    public PipelineException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public PipelineException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind getKind() {
        return kind;
    }
}
