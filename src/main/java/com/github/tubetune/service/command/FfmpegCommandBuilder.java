package com.github.tubetune.service.command;

import com.github.tubetune.config.TubeTuneProperties;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Builder for constructing ffmpeg command-line arguments.
 * Centralizes all ffmpeg command construction logic for consistency and testability.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FfmpegCommandBuilder {

    private static final String LOG_LEVEL = "error";

    private final TubeTuneProperties properties;

    /**
     * Build ffmpeg command extracting the audio track as constant-bitrate MP3.
     *
     * @param inputFile Downloaded source stream
     * @param outputFile MP3 output
     * @param bitrateKbps Target bitrate
     * @return ffmpeg command arguments
     */
    public List<String> buildTranscodeCommand(@NonNull Path inputFile, @NonNull Path outputFile, int bitrateKbps) {
        List<String> command = baseCommand();
        command.add("-i");
        command.add(inputFile.toString());
        command.add("-vn");  // No video
        command.add("-map");
        command.add("0:a:0");
        command.add("-c:a");
        command.add("libmp3lame");
        command.add("-b:a");
        command.add(bitrateKbps + "k");
        command.add("-y");
        command.add(outputFile.toString());

        log.debug("Built transcode command: {}", String.join(" ", command));
        return command;
    }

    /**
     * Build ffmpeg command converting a thumbnail (WebP, PNG, ...) to a single JPEG frame.
     *
     * @param inputFile Downloaded thumbnail
     * @param outputFile JPEG output
     * @return ffmpeg command arguments
     */
    public List<String> buildImageConversionCommand(@NonNull Path inputFile, @NonNull Path outputFile) {
        List<String> command = baseCommand();
        command.add("-i");
        command.add(inputFile.toString());
        command.add("-frames:v");
        command.add("1");
        command.add("-q:v");
        command.add("2");
        command.add("-y");
        command.add(outputFile.toString());

        log.debug("Built image conversion command: {}", String.join(" ", command));
        return command;
    }

    /**
     * Build ffmpeg command writing ID3v2.3 title/artist tags and, when present,
     * the cover as attached picture. Audio is stream-copied.
     *
     * @param audioFile Transcoded MP3
     * @param coverFile JPEG cover, may be null
     * @param title Track title
     * @param artist Track artist
     * @param outputFile Tagged MP3
     * @return ffmpeg command arguments
     */
    public List<String> buildMetadataCommand(
            @NonNull Path audioFile,
            Path coverFile,
            String title,
            String artist,
            @NonNull Path outputFile) {

        List<String> command = baseCommand();
        command.add("-i");
        command.add(audioFile.toString());

        if (coverFile != null) {
            command.add("-i");
            command.add(coverFile.toString());
            command.add("-map");
            command.add("0:a");
            command.add("-map");
            command.add("1:v");
            command.add("-c:v");
            command.add("copy");
            command.add("-disposition:v:0");
            command.add("attached_pic");
            command.add("-metadata:s:v");
            command.add("title=Album cover");
            command.add("-metadata:s:v");
            command.add("comment=Cover (front)");
        } else {
            command.add("-map");
            command.add("0:a");
        }

        command.add("-c:a");
        command.add("copy");
        command.add("-id3v2_version");
        command.add("3");

        if (title != null) {
            command.add("-metadata");
            command.add("title=" + title);
        }
        if (artist != null) {
            command.add("-metadata");
            command.add("artist=" + artist);
        }

        command.add("-y");
        command.add(outputFile.toString());

        log.debug("Built metadata command: {}", String.join(" ", command));
        return command;
    }

    private List<String> baseCommand() {
        List<String> command = new ArrayList<>();
        command.add(properties.getExtractor().getFfmpegPath());
        command.add("-hide_banner");
        command.add("-nostdin");
        command.add("-loglevel");
        command.add(LOG_LEVEL);
        return command;
    }
}
