package com.github.tubetune.service.resolve;

import com.github.tubetune.exception.ExtractionStrategyException;
import com.github.tubetune.exception.ExtractionStrategyException.Reason;
import com.github.tubetune.exception.SourceUnavailableException;
import com.github.tubetune.model.CandidateItem;
import com.github.tubetune.model.MediaLocator;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Resolves a locator through an ordered list of extraction strategies.
 * <p>
 * Each attempt runs on the strategy executor with its own timeout and starts
 * from scratch. The first strategy producing at least one candidate wins;
 * when all of them fail a single {@link SourceUnavailableException} is thrown
 * and the individual errors only reach the log. The order is fixed configuration.
 */
@Slf4j
public class SourceResolver {

    private final List<ExtractionStrategy> strategies;
    private final Executor strategyExecutor;
    private final Duration attemptTimeout;
    private final int maxResults;

    public SourceResolver(List<ExtractionStrategy> strategies, Executor strategyExecutor,
                          Duration attemptTimeout, int maxResults) {
        if (strategies.isEmpty()) {
            throw new IllegalArgumentException("At least one extraction strategy is required");
        }
        this.strategies = List.copyOf(strategies);
        this.strategyExecutor = strategyExecutor;
        this.attemptTimeout = attemptTimeout;
        this.maxResults = maxResults;
    }

    /**
     * Resolve a locator to candidates.
     *
     * @param locator Direct URL or search query
     * @return Exactly one candidate with a stream for a direct URL; up to
     *         {@code maxResults} candidates in platform order for a search
     * @throws SourceUnavailableException if every strategy failed
     */
    public List<CandidateItem> resolve(MediaLocator locator) {
        List<String> attempted = new ArrayList<>();

        for (ExtractionStrategy strategy : strategies) {
            attempted.add(strategy.getName());
            log.debug("Resolving '{}' with strategy {}", locator.describe(), strategy.getName());

            try {
                List<CandidateItem> items = attempt(strategy, locator);
                if (items == null || items.isEmpty()) {
                    log.warn("Strategy {} returned no candidates for '{}'", strategy.getName(), locator.describe());
                    continue;
                }

                log.info("Resolved '{}' with strategy {} ({} candidate(s))",
                        locator.describe(), strategy.getName(), items.size());
                if (locator.isDirectUrl()) {
                    return List.of(items.get(0));
                }
                return items.size() > maxResults ? List.copyOf(items.subList(0, maxResults)) : List.copyOf(items);

            } catch (ExtractionStrategyException e) {
                log.warn("Strategy {} failed for '{}': {} - {}",
                        strategy.getName(), locator.describe(), e.getReason(), e.getMessage());
            }
        }

        log.error("All {} strategies exhausted for '{}'", attempted.size(), locator.describe());
        throw new SourceUnavailableException(locator.describe(), attempted);
    }

    private List<CandidateItem> attempt(ExtractionStrategy strategy, MediaLocator locator)
            throws ExtractionStrategyException {

        FutureTask<List<CandidateItem>> task = new FutureTask<>(() -> strategy.resolve(locator, maxResults));
        try {
            strategyExecutor.execute(task);
        } catch (RejectedExecutionException e) {
            throw new ExtractionStrategyException(strategy.getName(), Reason.TOOL_FAILURE,
                    "Strategy executor rejected the attempt", e);
        }

        try {
            return task.get(attemptTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            // Interrupts the attempt; running tools are killed by their runner
            task.cancel(true);
            throw new ExtractionStrategyException(strategy.getName(), Reason.TIMEOUT,
                    "No answer within " + attemptTimeout.toSeconds() + "s", e);
        } catch (InterruptedException e) {
            task.cancel(true);
            Thread.currentThread().interrupt();
            throw new ExtractionStrategyException(strategy.getName(), Reason.TIMEOUT,
                    "Interrupted while resolving", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ExtractionStrategyException) {
                throw (ExtractionStrategyException) cause;
            }
            throw new ExtractionStrategyException(strategy.getName(), Reason.TOOL_FAILURE,
                    "Unexpected strategy error: " + cause, cause);
        }
    }
}
