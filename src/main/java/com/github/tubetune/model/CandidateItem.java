package com.github.tubetune.model;

import lombok.Builder;
import lombok.Value;

import java.util.Optional;

@Value
@Builder(toBuilder = true)
public class CandidateItem {

    String id;
    String title;
    String uploader;
    long durationSeconds;
    String thumbnailUrl;

    /**
     * Canonical watch URL, used to probe items that carry no stream.
     */
    String sourceRef;

    PlayableStream stream;

    public Optional<PlayableStream> getStream() {
        return Optional.ofNullable(stream);
    }

    public boolean hasStream() {
        return stream != null;
    }
}
