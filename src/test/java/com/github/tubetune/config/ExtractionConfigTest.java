package com.github.tubetune.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tubetune.exception.ConfigurationException;
import com.github.tubetune.service.command.YtDlpCommandBuilder;
import com.github.tubetune.service.parser.WatchPageParser;
import com.github.tubetune.service.parser.YtDlpMetadataParser;
import com.github.tubetune.service.process.ProcessRunner;
import com.github.tubetune.service.resolve.ExtractionStrategy;
import com.github.tubetune.service.resolve.WatchPageExtractionStrategy;
import com.github.tubetune.service.resolve.YtDlpExtractionStrategy;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.concurrent.Executor;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ExtractionConfig")
class ExtractionConfigTest {

    private TubeTuneProperties properties;
    private ExtractionConfig config;

    @BeforeEach
    void setUp() {
        properties = new TubeTuneProperties();
        ObjectMapper mapper = new ObjectMapper();
        config = new ExtractionConfig(properties, new YtDlpCommandBuilder(properties), new ProcessRunner(),
                new YtDlpMetadataParser(mapper), new WatchPageParser(mapper), new OkHttpClient());
    }

    @Test
    @DisplayName("should create a yt-dlp strategy per player client")
    void shouldCreateYtDlpStrategy() {
        ExtractionStrategy strategy = config.createStrategy("yt-dlp:ios");

        assertInstanceOf(YtDlpExtractionStrategy.class, strategy);
        assertEquals("yt-dlp:ios", strategy.getName());
    }

    @Test
    @DisplayName("should create the watch page strategy")
    void shouldCreateWatchPageStrategy() {
        ExtractionStrategy strategy = config.createStrategy(" watch-page ");

        assertInstanceOf(WatchPageExtractionStrategy.class, strategy);
        assertEquals(WatchPageExtractionStrategy.NAME, strategy.getName());
    }

    @ParameterizedTest
    @ValueSource(strings = {"yt-dlp:", "invidious", ""})
    @DisplayName("unknown strategy names should be rejected")
    void unknownNamesShouldBeRejected(String name) {
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> config.createStrategy(name));

        assertEquals("tubetune.extractor.strategies", e.getConfigKey());
    }

    @Test
    @DisplayName("the default chain should build in configured order")
    void defaultChainShouldBuild() {
        Executor direct = Runnable::run;

        assertNotNull(config.sourceResolver(direct));
        assertEquals(5, properties.getExtractor().getStrategies().size());
    }
}
