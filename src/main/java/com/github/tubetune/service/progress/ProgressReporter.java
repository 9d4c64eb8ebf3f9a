package com.github.tubetune.service.progress;

import com.github.tubetune.config.TubeTuneProperties;
import com.github.tubetune.service.messaging.MessagingGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * Opens throttled progress channels routed to the messaging gateway.
 */
@Slf4j
@Service
public class ProgressReporter {

    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(5);

    private final MessagingGateway gateway;
    private final Executor progressExecutor;
    private final Clock clock;
    private final long intervalMs;
    private final int minDelta;

    @Autowired
    public ProgressReporter(MessagingGateway gateway,
                            @Qualifier("progressExecutor") Executor progressExecutor,
                            Clock clock,
                            TubeTuneProperties properties) {
        this(gateway, progressExecutor, clock,
                properties.getProgress().getIntervalMs(),
                properties.getProgress().getMinDelta());
    }

    public ProgressReporter(MessagingGateway gateway, Executor progressExecutor, Clock clock,
                            long intervalMs, int minDelta) {
        this.gateway = gateway;
        this.progressExecutor = progressExecutor;
        this.clock = clock;
        this.intervalMs = intervalMs;
        this.minDelta = minDelta;
    }

    /**
     * Open the progress channel of one task. Close it before the terminal message is sent.
     *
     * @param ownerId Recipient
     * @param taskId Task the progress belongs to
     * @return Open channel
     */
    public ProgressChannel open(String ownerId, String taskId) {
        log.debug("Opening progress channel for task {}", taskId);
        return new ProgressChannel(ownerId, taskId, gateway, progressExecutor, clock,
                intervalMs, minDelta, CLOSE_TIMEOUT);
    }
}
