package com.github.tubetune.service.command;

import com.github.tubetune.config.TubeTuneProperties;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Builder for yt-dlp metadata commands. yt-dlp is only used to resolve
 * metadata and stream URLs; the transfer itself goes through the HTTP client.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class YtDlpCommandBuilder {

    private final TubeTuneProperties properties;

    /**
     * Build a command dumping the full metadata of one video as JSON.
     *
     * @param url Canonical watch URL
     * @param playerClient Player client persona, e.g. "ios"
     * @return yt-dlp command arguments
     */
    public List<String> buildProbeCommand(@NonNull String url, @NonNull String playerClient) {
        List<String> command = baseCommand(playerClient);
        command.add("--no-playlist");
        command.add(url);

        log.debug("Built probe command: {}", String.join(" ", command));
        return command;
    }

    /**
     * Build a flat search command returning at most {@code maxResults} entries.
     *
     * @param query Search phrase
     * @param maxResults Result cap
     * @param playerClient Player client persona
     * @return yt-dlp command arguments
     */
    public List<String> buildSearchCommand(@NonNull String query, int maxResults, @NonNull String playerClient) {
        List<String> command = baseCommand(playerClient);
        command.add("--flat-playlist");
        command.add("ytsearch" + maxResults + ":" + query);

        log.debug("Built search command: {}", String.join(" ", command));
        return command;
    }

    private List<String> baseCommand(String playerClient) {
        List<String> command = new ArrayList<>();
        command.add(properties.getExtractor().getYtDlpPath());
        command.add("-J");
        command.add("--no-progress");
        command.add("--skip-download");
        command.add("--extractor-args");
        command.add("youtube:player_client=" + playerClient);
        addCookies(command);
        return command;
    }

    private void addCookies(List<String> command) {
        if (!properties.getExtractor().hasCookies()) {
            return;
        }
        Path cookiesPath = Path.of(properties.getExtractor().getCookiesFile()).toAbsolutePath();
        if (Files.exists(cookiesPath)) {
            command.add("--cookies");
            command.add(cookiesPath.toString());
        } else {
            log.warn("Cookies file configured but missing: {}", cookiesPath);
        }
    }
}
