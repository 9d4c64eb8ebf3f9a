package com.github.tubetune.exception;

/**
 * Exception thrown when the incoming text cannot be turned into a locator (empty or blank input).
 */
public class ClassificationException extends PipelineException {

    private final String input;

    public ClassificationException(String message, String input) {
        super(FailureKind.NOTHING_TO_SEARCH, message);
        this.input = input;
    }

    public String getInput() {
        return input;
    }
}
