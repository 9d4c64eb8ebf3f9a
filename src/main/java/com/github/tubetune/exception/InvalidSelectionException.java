package com.github.tubetune.exception;

/**
 * Exception thrown when a page or item index falls outside a live session, or a callback payload is malformed.
 */
public class InvalidSelectionException extends PipelineException {

    public InvalidSelectionException(String message) {
        super(FailureKind.INVALID_SELECTION, message);
    }
}
