package com.github.tubetune;

import com.github.tubetune.exception.TranscodeException;
import com.github.tubetune.service.codec.AudioCodec;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Codec copying files instead of converting them.
 * A transcode fails when the input contains the configured marker.
 */
public class FakeAudioCodec implements AudioCodec {

    private volatile String transcodeFailureMarker;
    private volatile boolean taggingFails;
    private volatile int transcodedSize = -1;

    private final List<String> embeddedTitles = new CopyOnWriteArrayList<>();
    private final List<Path> embeddedCovers = new CopyOnWriteArrayList<>();
    private final List<Path> convertedImages = new CopyOnWriteArrayList<>();

    public FakeAudioCodec failTranscodeWhenInputContains(String marker) {
        this.transcodeFailureMarker = marker;
        return this;
    }

    public FakeAudioCodec failTagging() {
        this.taggingFails = true;
        return this;
    }

    public FakeAudioCodec transcodedSize(int bytes) {
        this.transcodedSize = bytes;
        return this;
    }

    @Override
    public void transcode(Path input, Path output, int bitrateKbps, Duration timeout) {
        try {
            String content = new String(Files.readAllBytes(input), StandardCharsets.UTF_8);
            String marker = transcodeFailureMarker;
            if (marker != null && content.contains(marker)) {
                throw new TranscodeException("ffmpeg exited with code 1", List.of("ffmpeg"), 1);
            }
            byte[] mp3 = transcodedSize >= 0 ? new byte[transcodedSize] : ("MP3:" + content).getBytes(StandardCharsets.UTF_8);
            Files.write(output, mp3);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public void convertImage(Path input, Path outputJpeg, Duration timeout) {
        convertedImages.add(input);
        copy(input, outputJpeg);
    }

    @Override
    public void embedMetadata(Path audio, Path cover, String title, String artist, Path output, Duration timeout) {
        if (taggingFails) {
            throw new TranscodeException("Tagging failed", List.of("ffmpeg"), 1);
        }
        embeddedTitles.add(title);
        if (cover != null) {
            embeddedCovers.add(cover);
        }
        copy(audio, output);
    }

    private static void copy(Path from, Path to) {
        try {
            Files.copy(from, to, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public List<String> getEmbeddedTitles() {
        return embeddedTitles;
    }

    public List<Path> getEmbeddedCovers() {
        return embeddedCovers;
    }

    public List<Path> getConvertedImages() {
        return convertedImages;
    }
}
