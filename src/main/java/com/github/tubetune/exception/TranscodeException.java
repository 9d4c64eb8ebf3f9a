package com.github.tubetune.exception;

import java.util.List;

/**
 * Exception thrown when the codec collaborator fails or produces no output.
 */
public class TranscodeException extends PipelineException {

    private final List<String> command;
    private final Integer exitCode;

    public TranscodeException(String message, List<String> command) {
        super(FailureKind.TRANSCODE_FAILED, message);
        this.command = command;
        this.exitCode = null;
    }

    public TranscodeException(String message, List<String> command, Integer exitCode) {
        super(FailureKind.TRANSCODE_FAILED, message);
        this.command = command;
        this.exitCode = exitCode;
    }

    public TranscodeException(String message, Throwable cause, List<String> command) {
        super(FailureKind.TRANSCODE_FAILED, message, cause);
        this.command = command;
        this.exitCode = null;
    }

    protected TranscodeException(FailureKind kind, String message, List<String> command) {
        super(kind, message);
        this.command = command;
        this.exitCode = null;
    }

    public List<String> getCommand() {
        return command;
    }

    public Integer getExitCode() {
        return exitCode;
    }
}
