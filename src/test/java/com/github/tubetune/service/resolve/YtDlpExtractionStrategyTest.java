package com.github.tubetune.service.resolve;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tubetune.config.TubeTuneProperties;
import com.github.tubetune.exception.ExtractionStrategyException;
import com.github.tubetune.exception.ExtractionStrategyException.Reason;
import com.github.tubetune.model.CandidateItem;
import com.github.tubetune.model.MediaLocator;
import com.github.tubetune.service.command.YtDlpCommandBuilder;
import com.github.tubetune.service.parser.YtDlpMetadataParser;
import com.github.tubetune.service.process.ProcessResult;
import com.github.tubetune.service.process.ProcessRunner;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("YtDlpExtractionStrategy")
class YtDlpExtractionStrategyTest {

    private static final MediaLocator DIRECT =
            MediaLocator.directUrl("https://www.youtube.com/watch?v=dQw4w9WgXcQ", "dQw4w9WgXcQ");

    /**
     * Runner answering with a canned result instead of starting a process.
     */
    static class CannedProcessRunner extends ProcessRunner {
        private final ProcessResult result;
        private final IOException failure;
        final List<List<String>> commands = new ArrayList<>();

        CannedProcessRunner(ProcessResult result) {
            this.result = result;
            this.failure = null;
        }

        CannedProcessRunner(IOException failure) {
            this.result = null;
            this.failure = failure;
        }

        @Override
        public ProcessResult run(List<String> command, Duration timeout) throws IOException {
            commands.add(command);
            if (failure != null) {
                throw failure;
            }
            return result;
        }
    }

    private static YtDlpExtractionStrategy strategy(ProcessRunner runner) {
        return new YtDlpExtractionStrategy("android_vr",
                new YtDlpCommandBuilder(new TubeTuneProperties()),
                runner,
                new YtDlpMetadataParser(new ObjectMapper()),
                Duration.ofSeconds(5));
    }

    @Nested
    @DisplayName("classifyFailure")
    class ClassifyFailureTests {

        @ParameterizedTest
        @CsvSource(delimiter = '|', value = {
            "ERROR: [youtube] abc: Sign in to confirm you’re not a bot. Use --cookies-from-browser | AUTH_WALL",
            "ERROR: [youtube] abc: Sign in to confirm your age | AUTH_WALL",
            "ERROR: [youtube] abc: The uploader has not made this video available in your country | GEO_BLOCKED",
            "ERROR: [youtube] abc: Video unavailable | UNAVAILABLE",
            "ERROR: [youtube] abc: Private video. Sign in if granted access | UNAVAILABLE",
            "ERROR: unable to download webpage: HTTP Error 500 | TOOL_FAILURE"
        })
        @DisplayName("should map tool output to a reason")
        void shouldMapOutput(String stderr, Reason expected) {
            assertEquals(expected, YtDlpExtractionStrategy.classifyFailure(stderr));
        }

        @Test
        @DisplayName("should treat missing output as tool failure")
        void shouldHandleNull() {
            assertEquals(Reason.TOOL_FAILURE, YtDlpExtractionStrategy.classifyFailure(null));
        }
    }

    @Nested
    @DisplayName("resolve")
    class ResolveTests {

        @Test
        @DisplayName("should be named after its player client")
        void shouldBeNamedAfterClient() {
            assertEquals("yt-dlp:android_vr", strategy(new CannedProcessRunner(new IOException("x"))).getName());
        }

        @Test
        @DisplayName("should return the probed video with its stream")
        void shouldReturnProbedVideo() throws ExtractionStrategyException {
            String json = "{\"id\":\"dQw4w9WgXcQ\",\"title\":\"Song\",\"formats\":[{\"protocol\":\"https\","
                    + "\"url\":\"https://media/251\",\"ext\":\"webm\",\"acodec\":\"opus\",\"vcodec\":\"none\",\"abr\":130}]}";
            CannedProcessRunner runner = new CannedProcessRunner(new ProcessResult(0, json, "", false));

            List<CandidateItem> items = strategy(runner).resolve(DIRECT, 24);

            assertEquals(1, items.size());
            assertEquals("https://media/251", items.get(0).getStream().orElseThrow().getUrl());
            assertTrue(runner.commands.get(0).contains("youtube:player_client=android_vr"));
        }

        @Test
        @DisplayName("a video without a fetchable format should be unavailable")
        void shouldRejectVideoWithoutStream() {
            String json = "{\"id\":\"dQw4w9WgXcQ\",\"title\":\"Song\",\"formats\":[]}";
            CannedProcessRunner runner = new CannedProcessRunner(new ProcessResult(0, json, "", false));

            ExtractionStrategyException ex = assertThrows(ExtractionStrategyException.class,
                    () -> strategy(runner).resolve(DIRECT, 24));
            assertEquals(Reason.UNAVAILABLE, ex.getReason());
        }

        @Test
        @DisplayName("a non-zero exit should be classified from stderr")
        void shouldClassifyExit() {
            CannedProcessRunner runner = new CannedProcessRunner(
                    new ProcessResult(1, "", "ERROR: Sign in to confirm you're not a bot", false));

            ExtractionStrategyException ex = assertThrows(ExtractionStrategyException.class,
                    () -> strategy(runner).resolve(DIRECT, 24));
            assertEquals(Reason.AUTH_WALL, ex.getReason());
            assertEquals("yt-dlp:android_vr", ex.getStrategy());
        }

        @Test
        @DisplayName("a timed out run should be a timeout")
        void shouldReportTimeout() {
            CannedProcessRunner runner = new CannedProcessRunner(new ProcessResult(-1, "", "", true));

            ExtractionStrategyException ex = assertThrows(ExtractionStrategyException.class,
                    () -> strategy(runner).resolve(DIRECT, 24));
            assertEquals(Reason.TIMEOUT, ex.getReason());
        }

        @Test
        @DisplayName("a missing binary should be a tool failure")
        void shouldReportMissingBinary() {
            CannedProcessRunner runner = new CannedProcessRunner(new IOException("No such file"));

            ExtractionStrategyException ex = assertThrows(ExtractionStrategyException.class,
                    () -> strategy(runner).resolve(DIRECT, 24));
            assertEquals(Reason.TOOL_FAILURE, ex.getReason());
        }

        @Test
        @DisplayName("garbage output should be a malformed response")
        void shouldReportMalformed() {
            CannedProcessRunner runner = new CannedProcessRunner(new ProcessResult(0, "WARNING: nope", "", false));

            ExtractionStrategyException ex = assertThrows(ExtractionStrategyException.class,
                    () -> strategy(runner).resolve(DIRECT, 24));
            assertEquals(Reason.MALFORMED_RESPONSE, ex.getReason());
        }

        @Test
        @DisplayName("an empty search should report no results")
        void shouldReportNoResults() {
            CannedProcessRunner runner = new CannedProcessRunner(new ProcessResult(0, "{\"entries\":[]}", "", false));

            ExtractionStrategyException ex = assertThrows(ExtractionStrategyException.class,
                    () -> strategy(runner).resolve(MediaLocator.searchQuery("zzz"), 24));
            assertEquals(Reason.NO_RESULTS, ex.getReason());
            assertEquals("ytsearch24:zzz", runner.commands.get(0).get(runner.commands.get(0).size() - 1));
        }
    }
}
