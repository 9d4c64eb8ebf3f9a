package com.github.tubetune.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Classified user input: either one specific video or a free-text search.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class MediaLocator {

    public enum Type {
        DIRECT_URL,
        SEARCH_QUERY
    }

    Type type;
    String normalizedUrl;
    String videoId;
    String text;

    public static MediaLocator directUrl(String normalizedUrl, String videoId) {
        return new MediaLocator(Type.DIRECT_URL, normalizedUrl, videoId, null);
    }

    public static MediaLocator searchQuery(String text) {
        return new MediaLocator(Type.SEARCH_QUERY, null, null, text);
    }

    public boolean isDirectUrl() {
        return type == Type.DIRECT_URL;
    }

    /**
     * @return URL for direct locators, query text otherwise
     */
    public String describe() {
        return isDirectUrl() ? normalizedUrl : text;
    }
}
