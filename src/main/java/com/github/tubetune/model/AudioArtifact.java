package com.github.tubetune.model;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Finished MP3 inside a workspace. Valid only until that workspace is closed.
 */
@Value
@Builder(toBuilder = true)
public class AudioArtifact {

    Path file;
    String title;
    String uploader;
    long durationSeconds;
    Path cover;
    long sizeBytes;

    public Optional<Path> getCover() {
        return Optional.ofNullable(cover);
    }
}
