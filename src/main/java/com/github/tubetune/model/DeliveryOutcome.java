package com.github.tubetune.model;

import com.github.tubetune.exception.FailureKind;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * What one inbound request ended with, and the text the user was sent.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DeliveryOutcome {

    public enum Type {
        DELIVERED,
        SEARCH_RESULTS,
        PAGE_SHOWN,
        FAILED
    }

    Type type;
    FailureKind failureKind;
    String message;

    public static DeliveryOutcome delivered(String title) {
        return new DeliveryOutcome(Type.DELIVERED, null, title);
    }

    public static DeliveryOutcome searchResults(String query) {
        return new DeliveryOutcome(Type.SEARCH_RESULTS, null, query);
    }

    public static DeliveryOutcome pageShown(String query) {
        return new DeliveryOutcome(Type.PAGE_SHOWN, null, query);
    }

    public static DeliveryOutcome failed(FailureKind kind, String message) {
        return new DeliveryOutcome(Type.FAILED, kind, message);
    }
}
