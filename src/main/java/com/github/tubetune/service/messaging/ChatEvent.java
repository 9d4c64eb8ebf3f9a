package com.github.tubetune.service.messaging;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * JSON payloads pushed to chat clients.
 */
public final class ChatEvent {

    public static final String STATUS = "status";
    public static final String PROGRESS = "progress";
    public static final String SEARCH_RESULTS = "search-results";
    public static final String AUDIO = "audio";
    public static final String ERROR = "error";

    private ChatEvent() {
    }

    @Value
    public static class Text {
        String text;
    }

    @Value
    public static class Progress {
        String taskId;
        int percent;
    }

    @Value
    public static class Button {
        String label;
        String callbackData;
    }

    @Value
    @Builder
    public static class SearchResults {
        String query;
        int page;
        int totalPages;
        @Singular
        List<Button> results;
        @Singular("navigation")
        List<Button> navigation;
    }

    @Value
    @Builder
    public static class Audio {
        String title;
        String performer;
        long durationSeconds;
        String fileName;
        long sizeBytes;
        String data;
        String thumbnail;
    }
}
