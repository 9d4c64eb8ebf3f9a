package com.github.tubetune.config;

import com.github.tubetune.exception.ConfigurationException;
import com.github.tubetune.service.command.YtDlpCommandBuilder;
import com.github.tubetune.service.parser.WatchPageParser;
import com.github.tubetune.service.parser.YtDlpMetadataParser;
import com.github.tubetune.service.process.ProcessRunner;
import com.github.tubetune.service.resolve.ExtractionStrategy;
import com.github.tubetune.service.resolve.SourceResolver;
import com.github.tubetune.service.resolve.WatchPageExtractionStrategy;
import com.github.tubetune.service.resolve.YtDlpExtractionStrategy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Builds the ordered strategy chain from {@code tubetune.extractor.strategies}.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class ExtractionConfig {

    private final TubeTuneProperties properties;
    private final YtDlpCommandBuilder ytDlpCommandBuilder;
    private final ProcessRunner processRunner;
    private final YtDlpMetadataParser ytDlpMetadataParser;
    private final WatchPageParser watchPageParser;
    private final OkHttpClient okHttpClient;

    @Bean
    public SourceResolver sourceResolver(@Qualifier("strategyExecutor") Executor strategyExecutor) {
        List<ExtractionStrategy> strategies = properties.getExtractor().getStrategies().stream()
                .map(this::createStrategy)
                .toList();

        log.info("Extraction strategies in order: {}", properties.getExtractor().getStrategies());
        return new SourceResolver(
                strategies,
                strategyExecutor,
                properties.getExtractor().getStrategyTimeout(),
                properties.getSearch().getMaxResults());
    }

    ExtractionStrategy createStrategy(String name) {
        String trimmed = name == null ? "" : name.strip();
        Duration timeout = properties.getExtractor().getStrategyTimeout();

        if (trimmed.startsWith(YtDlpExtractionStrategy.NAME_PREFIX)) {
            String playerClient = trimmed.substring(YtDlpExtractionStrategy.NAME_PREFIX.length());
            if (playerClient.isBlank()) {
                throw new ConfigurationException("Missing player client", "tubetune.extractor.strategies", name);
            }
            return new YtDlpExtractionStrategy(playerClient, ytDlpCommandBuilder, processRunner,
                    ytDlpMetadataParser, timeout);
        }
        if (WatchPageExtractionStrategy.NAME.equals(trimmed)) {
            return new WatchPageExtractionStrategy(okHttpClient, watchPageParser,
                    properties.getExtractor().getBaseUrl(), timeout);
        }

        throw new ConfigurationException("Unknown extraction strategy", "tubetune.extractor.strategies", name);
    }
}
