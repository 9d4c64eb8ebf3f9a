package com.github.tubetune.service.resolve;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.github.tubetune.exception.ExtractionStrategyException;
import com.github.tubetune.exception.ExtractionStrategyException.Reason;
import com.github.tubetune.model.CandidateItem;
import com.github.tubetune.model.MediaLocator;
import com.github.tubetune.service.command.YtDlpCommandBuilder;
import com.github.tubetune.service.parser.YtDlpMetadataParser;
import com.github.tubetune.service.process.ProcessResult;
import com.github.tubetune.service.process.ProcessRunner;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Resolves through yt-dlp, impersonating one player client of the platform.
 */
@Slf4j
public class YtDlpExtractionStrategy implements ExtractionStrategy {

    public static final String NAME_PREFIX = "yt-dlp:";

    private static final int LOG_SNIPPET_MAX = 500;

    private static final List<String> AUTH_WALL_MARKERS = List.of(
            "sign in to confirm",
            "use --cookies",
            "--cookies-from-browser",
            "login required",
            "confirm your age",
            "inappropriate for some users");

    private static final List<String> GEO_MARKERS = List.of(
            "available in your country",
            "blocked it in your country",
            "geo restrict",
            "geo-restrict");

    private static final List<String> UNAVAILABLE_MARKERS = List.of(
            "video unavailable",
            "private video",
            "has been removed",
            "is not available",
            "members-only",
            "premieres in");

    private final String playerClient;
    private final YtDlpCommandBuilder commandBuilder;
    private final ProcessRunner processRunner;
    private final YtDlpMetadataParser parser;
    private final Duration timeout;

    public YtDlpExtractionStrategy(String playerClient,
                                   YtDlpCommandBuilder commandBuilder,
                                   ProcessRunner processRunner,
                                   YtDlpMetadataParser parser,
                                   Duration timeout) {
        this.playerClient = playerClient;
        this.commandBuilder = commandBuilder;
        this.processRunner = processRunner;
        this.parser = parser;
        this.timeout = timeout;
    }

    @Override
    public String getName() {
        return NAME_PREFIX + playerClient;
    }

    @Override
    public List<CandidateItem> resolve(MediaLocator locator, int maxResults) throws ExtractionStrategyException {
        if (locator.isDirectUrl()) {
            String json = run(commandBuilder.buildProbeCommand(locator.getNormalizedUrl(), playerClient));
            CandidateItem item = parse(() -> parser.parseVideo(json));
            if (!item.hasStream()) {
                throw new ExtractionStrategyException(getName(), Reason.UNAVAILABLE,
                        "No directly downloadable audio format for " + item.getId());
            }
            return List.of(item);
        }

        String json = run(commandBuilder.buildSearchCommand(locator.getText(), maxResults, playerClient));
        List<CandidateItem> items = parse(() -> parser.parseSearch(json));
        if (items.isEmpty()) {
            throw new ExtractionStrategyException(getName(), Reason.NO_RESULTS,
                    "No usable search results for: " + locator.getText());
        }
        return items;
    }

    private String run(List<String> command) throws ExtractionStrategyException {
        ProcessResult result;
        try {
            result = processRunner.run(command, timeout);
        } catch (IOException e) {
            throw new ExtractionStrategyException(getName(), Reason.TOOL_FAILURE,
                    "Cannot start yt-dlp: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExtractionStrategyException(getName(), Reason.TIMEOUT, "Interrupted while waiting for yt-dlp", e);
        }

        if (result.isTimedOut()) {
            throw new ExtractionStrategyException(getName(), Reason.TIMEOUT,
                    "yt-dlp timed out after " + timeout.toSeconds() + "s");
        }
        if (result.getExitCode() != 0) {
            Reason reason = classifyFailure(result.getStderr());
            throw new ExtractionStrategyException(getName(), reason,
                    "yt-dlp exit=" + result.getExitCode() + " log=" + result.stderrSnippet(LOG_SNIPPET_MAX));
        }
        return result.getStdout();
    }

    private <T> T parse(MetadataSupplier<T> supplier) throws ExtractionStrategyException {
        try {
            return supplier.get();
        } catch (JsonProcessingException e) {
            throw new ExtractionStrategyException(getName(), Reason.MALFORMED_RESPONSE,
                    "Unreadable yt-dlp output: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Map yt-dlp's error output to a failure reason.
     *
     * @param stderr Tool error output
     * @return Best matching reason, TOOL_FAILURE when nothing matches
     */
    static Reason classifyFailure(String stderr) {
        if (stderr == null) {
            return Reason.TOOL_FAILURE;
        }
        String normalized = stderr.toLowerCase(Locale.ROOT).replace('’', '\'');
        if (AUTH_WALL_MARKERS.stream().anyMatch(normalized::contains)) {
            return Reason.AUTH_WALL;
        }
        if (GEO_MARKERS.stream().anyMatch(normalized::contains)) {
            return Reason.GEO_BLOCKED;
        }
        if (UNAVAILABLE_MARKERS.stream().anyMatch(normalized::contains)) {
            return Reason.UNAVAILABLE;
        }
        return Reason.TOOL_FAILURE;
    }

    @FunctionalInterface
    private interface MetadataSupplier<T> {
        T get() throws JsonProcessingException;
    }
}
