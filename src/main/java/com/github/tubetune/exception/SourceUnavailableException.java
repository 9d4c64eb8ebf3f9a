package com.github.tubetune.exception;

import java.util.List;

/**
 * Exception thrown when every configured extraction strategy has been exhausted.
 * Carries only the names of the strategies that were attempted, never their individual errors.
 */
public class SourceUnavailableException extends PipelineException {

    private final String locator;
    private final List<String> attemptedStrategies;

    public SourceUnavailableException(String locator, List<String> attemptedStrategies) {
        super(FailureKind.SOURCE_UNAVAILABLE,
                "Source unavailable after " + attemptedStrategies.size() + " strategies: " + locator);
        this.locator = locator;
        this.attemptedStrategies = List.copyOf(attemptedStrategies);
    }

    public String getLocator() {
        return locator;
    }

    public List<String> getAttemptedStrategies() {
        return attemptedStrategies;
    }
}
