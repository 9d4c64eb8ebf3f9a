package com.github.tubetune.service.process;

import lombok.Value;

/**
 * Captured outcome of one external process run.
 */
@Value
public class ProcessResult {

    int exitCode;
    String stdout;
    String stderr;
    boolean timedOut;

    public boolean isSuccess() {
        return !timedOut && exitCode == 0;
    }

    /**
     * Tail of stderr for log lines, never the full tool output.
     */
    public String stderrSnippet(int maxLength) {
        if (stderr == null || stderr.isBlank()) {
            return "<no output>";
        }
        String trimmed = stderr.strip();
        return trimmed.length() <= maxLength ? trimmed : "..." + trimmed.substring(trimmed.length() - maxLength);
    }
}
