package com.github.tubetune.service.codec;

import com.github.tubetune.exception.TranscodeException;
import com.github.tubetune.exception.TranscodeTimeoutException;
import com.github.tubetune.service.command.FfmpegCommandBuilder;
import com.github.tubetune.service.process.ProcessResult;
import com.github.tubetune.service.process.ProcessRunner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class FfmpegAudioCodec implements AudioCodec {

    private static final int LOG_SNIPPET_MAX = 2_000;

    private final FfmpegCommandBuilder commandBuilder;
    private final ProcessRunner processRunner;

    @Override
    public void transcode(Path input, Path output, int bitrateKbps, Duration timeout) {
        execute(commandBuilder.buildTranscodeCommand(input, output, bitrateKbps), output, timeout, "Transcode");
    }

    @Override
    public void convertImage(Path input, Path outputJpeg, Duration timeout) {
        execute(commandBuilder.buildImageConversionCommand(input, outputJpeg), outputJpeg, timeout, "Image conversion");
    }

    @Override
    public void embedMetadata(Path audio, Path cover, String title, String artist, Path output, Duration timeout) {
        execute(commandBuilder.buildMetadataCommand(audio, cover, title, artist, output), output, timeout, "Tagging");
    }

    private void execute(List<String> command, Path output, Duration timeout, String operation) {
        ProcessResult result;
        try {
            result = processRunner.run(command, timeout);
        } catch (IOException e) {
            throw new TranscodeException(operation + " could not start ffmpeg: " + e.getMessage(), e, command);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TranscodeException(operation + " interrupted", e, command);
        }

        if (result.isTimedOut()) {
            throw new TranscodeTimeoutException(command, timeout);
        }
        if (result.getExitCode() != 0) {
            log.error("{} failed with exit code {}: {}", operation, result.getExitCode(),
                    result.stderrSnippet(LOG_SNIPPET_MAX));
            throw new TranscodeException(operation + " failed with exit code " + result.getExitCode(),
                    command, result.getExitCode());
        }
        if (!hasContent(output)) {
            throw new TranscodeException(operation + " produced no output", command, result.getExitCode());
        }

        log.debug("{} completed: {}", operation, output.getFileName());
    }

    private boolean hasContent(Path file) {
        try {
            return Files.exists(file) && Files.size(file) > 0;
        } catch (IOException e) {
            return false;
        }
    }
}
