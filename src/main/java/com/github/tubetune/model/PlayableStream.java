package com.github.tubetune.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Direct, time-limited stream location of one candidate's audio.
 */
@Value
@Builder
public class PlayableStream {

    String url;

    /**
     * Container extension, e.g. "m4a" or "webm".
     */
    String ext;

    @Singular
    Map<String, String> headers;

    /**
     * Expected size in bytes, null when the platform does not announce it.
     */
    Long expectedSize;
}
