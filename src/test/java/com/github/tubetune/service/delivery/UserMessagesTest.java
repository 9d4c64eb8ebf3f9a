package com.github.tubetune.service.delivery;

import com.github.tubetune.config.TubeTuneProperties;
import com.github.tubetune.exception.FailureKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("UserMessages")
class UserMessagesTest {

    private TubeTuneProperties properties;
    private UserMessages messages;

    @BeforeEach
    void setUp() {
        properties = new TubeTuneProperties();
        messages = new UserMessages(properties);
    }

    @ParameterizedTest
    @EnumSource(FailureKind.class)
    @DisplayName("every failure kind should have a default text")
    void shouldUseDefaults(FailureKind kind) {
        String text = messages.failure(kind);

        assertEquals(kind.getDefaultMessage(), text);
        assertTrue(text.startsWith("❌"));
    }

    @Test
    @DisplayName("a configured text should replace the default")
    void configuredTextShouldWin() {
        properties.getMessages().getFailures().put(FailureKind.SESSION_EXPIRED, "Search again please");

        assertEquals("Search again please", messages.failure(FailureKind.SESSION_EXPIRED));
        assertEquals(FailureKind.GENERAL.getDefaultMessage(), messages.failure(FailureKind.GENERAL));
    }

    @Test
    @DisplayName("a blank configured text should fall back to the default")
    void blankTextShouldFallBack() {
        properties.getMessages().getFailures().put(FailureKind.GENERAL, "  ");

        assertEquals(FailureKind.GENERAL.getDefaultMessage(), messages.failure(FailureKind.GENERAL));
    }

    @Test
    @DisplayName("status texts should come from configuration")
    void statusTextsShouldComeFromConfiguration() {
        properties.getMessages().setSearching("Looking...");

        assertEquals("Looking...", messages.searching());
        assertEquals(properties.getMessages().getProcessing(), messages.processing());
        assertEquals(properties.getMessages().getNothingFound(), messages.nothingFound());
    }
}
