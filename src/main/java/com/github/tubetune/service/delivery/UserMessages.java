package com.github.tubetune.service.delivery;

import com.github.tubetune.config.TubeTuneProperties;
import com.github.tubetune.exception.FailureKind;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * User-facing texts. Every failure kind maps to one fixed message; internal
 * error details never reach the user.
 */
@Component
@RequiredArgsConstructor
public class UserMessages {

    private final TubeTuneProperties properties;

    public String failure(FailureKind kind) {
        String configured = properties.getMessages().getFailures().get(kind);
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        return kind.getDefaultMessage();
    }

    public String nothingFound() {
        return properties.getMessages().getNothingFound();
    }

    public String processing() {
        return properties.getMessages().getProcessing();
    }

    public String searching() {
        return properties.getMessages().getSearching();
    }
}
