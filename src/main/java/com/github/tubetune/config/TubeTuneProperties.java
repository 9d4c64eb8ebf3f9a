package com.github.tubetune.config;

import com.github.tubetune.exception.FailureKind;
import com.github.tubetune.util.TitlePolicy;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "tubetune")
public class TubeTuneProperties {

    private Download download = new Download();
    private Search search = new Search();
    private Extractor extractor = new Extractor();
    private Progress progress = new Progress();
    private Delivery delivery = new Delivery();
    private Messages messages = new Messages();

    @Data
    public static class Download {
        @NotBlank
        private String tempPath = "temp_downloads";

        /**
         * Ceiling for the final artifact, kept below the 50 MB upload limit of the chat transport.
         */
        @Min(1)
        private long maxArtifactBytes = 45L * 1024 * 1024;

        @Min(32)
        private int bitrateKbps = 192;

        @NotBlank
        private String format = "mp3";

        /**
         * Wall-clock budget shared by transfer and transcode.
         */
        @Min(1)
        private int stageTimeoutSeconds = 300;

        @Min(1)
        private int transcodeTimeoutSeconds = 180;

        public Duration getStageTimeout() {
            return Duration.ofSeconds(stageTimeoutSeconds);
        }

        public Duration getTranscodeTimeout() {
            return Duration.ofSeconds(transcodeTimeoutSeconds);
        }
    }

    @Data
    public static class Search {
        @Min(1)
        private int pageSize = 8;

        @Min(1)
        private int maxPages = 3;

        @Min(1)
        private int maxResults = 24;

        @Min(1)
        private int sessionTtlMinutes = 30;

        @Min(1000)
        private long evictionIntervalMs = 60_000;

        public Duration getSessionTtl() {
            return Duration.ofMinutes(sessionTtlMinutes);
        }
    }

    @Data
    public static class Extractor {
        /**
         * Ordered extraction strategies, tried first to last.
         */
        @NotEmpty
        private List<String> strategies = new ArrayList<>(List.of(
                "yt-dlp:android_vr",
                "yt-dlp:ios",
                "yt-dlp:tv_embedded",
                "yt-dlp:web",
                "watch-page"));

        @Min(1)
        private int strategyTimeoutSeconds = 20;

        @NotBlank
        private String ytDlpPath = "yt-dlp";

        @NotBlank
        private String ffmpegPath = "ffmpeg";

        /**
         * Netscape cookies file presented to the platform, optional.
         */
        private String cookiesFile;

        @NotBlank
        private String baseUrl = "https://www.youtube.com";

        @NotBlank
        private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0 Safari/537.36";

        public Duration getStrategyTimeout() {
            return Duration.ofSeconds(strategyTimeoutSeconds);
        }

        public boolean hasCookies() {
            return cookiesFile != null && !cookiesFile.isBlank();
        }
    }

    @Data
    public static class Progress {
        @Min(0)
        private long intervalMs = 1000;

        @Min(1)
        private int minDelta = 5;
    }

    @Data
    public static class Delivery {
        @NotNull
        private TitlePolicy titlePolicy = TitlePolicy.VERBATIM;
    }

    @Data
    public static class Messages {
        private Map<FailureKind, String> failures = new LinkedHashMap<>();

        @NotBlank
        private String nothingFound = "❌ No songs found. Try a different search phrase.";

        @NotBlank
        private String processing = "🔄 Processing your request...";

        @NotBlank
        private String searching = "🔍 Searching...";
    }
}
