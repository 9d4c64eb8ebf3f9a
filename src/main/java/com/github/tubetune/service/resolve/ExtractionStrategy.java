package com.github.tubetune.service.resolve;

import com.github.tubetune.exception.ExtractionStrategyException;
import com.github.tubetune.model.CandidateItem;
import com.github.tubetune.model.MediaLocator;

import java.util.List;

/**
 * One way of turning a locator into candidates, e.g. a particular client persona
 * of the platform. Implementations keep no state between calls.
 */
public interface ExtractionStrategy {

    /**
     * Resolve a locator.
     *
     * @param locator Direct URL or search query
     * @param maxResults Cap for search results
     * @return For a direct URL one candidate carrying a stream; for a search the
     *         candidates in platform order, never empty
     * @throws ExtractionStrategyException if this strategy cannot produce a usable result
     */
    List<CandidateItem> resolve(MediaLocator locator, int maxResults) throws ExtractionStrategyException;

    /**
     * Name as it appears in the configured strategy list.
     *
     * @return Strategy name
     */
    String getName();
}
