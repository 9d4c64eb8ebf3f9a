package com.github.tubetune.service.codec;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Audio and image conversions. Every call is bounded by a hard timeout.
 * Failures are reported as {@link com.github.tubetune.exception.TranscodeException}
 * or {@link com.github.tubetune.exception.TranscodeTimeoutException}.
 */
public interface AudioCodec {

    /**
     * Extract the audio of {@code input} as constant-bitrate MP3.
     */
    void transcode(Path input, Path output, int bitrateKbps, Duration timeout);

    /**
     * Convert an image (WebP, PNG, ...) to JPEG.
     */
    void convertImage(Path input, Path outputJpeg, Duration timeout);

    /**
     * Write ID3v2.3 title and artist tags and, if {@code cover} is not null, attach it as front cover.
     */
    void embedMetadata(Path audio, Path cover, String title, String artist, Path output, Duration timeout);
}
