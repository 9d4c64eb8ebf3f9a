package com.github.tubetune.exception;

import java.time.Duration;
import java.util.List;

/**
 * Exception thrown when the codec collaborator exceeds its hard wall-clock timeout.
 */
public class TranscodeTimeoutException extends TranscodeException {

    private final Duration timeout;

    public TranscodeTimeoutException(List<String> command, Duration timeout) {
        super(FailureKind.TRANSCODE_TIMEOUT, "Transcode timeout exceeded (" + timeout.toSeconds() + "s)", command);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
