package com.github.tubetune.service.session;

import com.github.tubetune.config.TubeTuneProperties;
import com.github.tubetune.exception.InvalidSelectionException;
import com.github.tubetune.exception.SessionExpiredException;
import com.github.tubetune.model.CandidateItem;
import com.github.tubetune.model.SearchPage;
import com.github.tubetune.model.SearchSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory store of the latest search of every owner.
 * <p>
 * At most one session per owner is live: a new search supersedes the previous
 * one atomically and bumps the generation. Callbacks carrying any other
 * generation, or reaching a session past its TTL, are rejected with
 * {@link SessionExpiredException}. Synchronization is per owner key.
 */
@Slf4j
@Service
public class SearchSessionStore {

    private final ConcurrentHashMap<String, SearchSession> sessions = new ConcurrentHashMap<>();
    private final AtomicLong generations = new AtomicLong();
    private final Clock clock;
    private final Duration ttl;
    private final int pageSize;
    private final int maxPages;

    @Autowired
    public SearchSessionStore(TubeTuneProperties properties, Clock clock) {
        this(clock,
                properties.getSearch().getSessionTtl(),
                properties.getSearch().getPageSize(),
                properties.getSearch().getMaxPages());
    }

    public SearchSessionStore(Clock clock, Duration ttl, int pageSize, int maxPages) {
        this.clock = clock;
        this.ttl = ttl;
        this.pageSize = pageSize;
        this.maxPages = maxPages;
    }

    /**
     * Store a new search, superseding the owner's previous one.
     *
     * @param ownerId Owner
     * @param query Search phrase, shown with the results
     * @param items Resolved candidates in platform order
     * @return Generation of the new live session
     */
    public long put(String ownerId, String query, List<CandidateItem> items) {
        int cap = pageSize * maxPages;
        List<CandidateItem> kept = List.copyOf(items.size() > cap ? items.subList(0, cap) : items);

        SearchSession session = sessions.compute(ownerId, (key, previous) -> SearchSession.builder()
                .ownerId(ownerId)
                .query(query)
                .items(kept)
                .generation(generations.incrementAndGet())
                .createdAt(clock.instant())
                .build());

        log.debug("Stored search session for {} (generation {}, {} items)",
                ownerId, session.getGeneration(), kept.size());
        return session.getGeneration();
    }

    /**
     * Return one page of a live session and record it as the viewed page.
     *
     * @param ownerId Owner
     * @param generation Generation from the callback
     * @param pageIndex 0-based page
     * @return Page view
     * @throws SessionExpiredException if the generation is not live or the TTL elapsed
     * @throws InvalidSelectionException if the page does not exist
     */
    public SearchPage getPage(String ownerId, long generation, int pageIndex) {
        AtomicReference<SearchPage> page = new AtomicReference<>();

        sessions.compute(ownerId, (key, session) -> {
            SearchSession live = requireLive(ownerId, generation, session);
            int totalPages = totalPages(live);
            if (pageIndex < 0 || pageIndex >= totalPages) {
                throw new InvalidSelectionException("Page " + pageIndex + " out of range 0.." + (totalPages - 1));
            }
            live.setCurrentPage(pageIndex);
            page.set(slice(live, pageIndex, totalPages));
            return live;
        });

        return page.get();
    }

    /**
     * Pick one item of a live session. The session stays live so another
     * result can be picked from the same list.
     *
     * @param ownerId Owner
     * @param generation Generation from the callback
     * @param itemIndex Absolute 0-based index into the session
     * @return Selected candidate
     * @throws SessionExpiredException if the generation is not live or the TTL elapsed
     * @throws InvalidSelectionException if the index does not exist
     */
    public CandidateItem select(String ownerId, long generation, int itemIndex) {
        AtomicReference<CandidateItem> selected = new AtomicReference<>();

        sessions.compute(ownerId, (key, session) -> {
            SearchSession live = requireLive(ownerId, generation, session);
            if (itemIndex < 0 || itemIndex >= live.getItems().size()) {
                throw new InvalidSelectionException("Item " + itemIndex + " out of range 0.."
                        + (live.getItems().size() - 1));
            }
            selected.set(live.getItems().get(itemIndex));
            return live;
        });

        return selected.get();
    }

    @Scheduled(fixedDelayString = "${tubetune.search.eviction-interval-ms:60000}")
    public void scheduledEviction() {
        int removed = evictExpired();
        if (removed > 0) {
            log.debug("Evicted {} expired search session(s)", removed);
        }
    }

    /**
     * Remove every session past its TTL.
     *
     * @return Number of sessions removed
     */
    public int evictExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (SearchSession session : sessions.values()) {
            if (isExpired(session, now) && sessions.remove(session.getOwnerId(), session)) {
                removed++;
            }
        }
        return removed;
    }

    public int size() {
        return sessions.size();
    }

    private SearchSession requireLive(String ownerId, long generation, SearchSession session) {
        if (session == null || session.getGeneration() != generation) {
            throw new SessionExpiredException(ownerId, generation);
        }
        if (isExpired(session, clock.instant())) {
            throw new SessionExpiredException(ownerId, generation);
        }
        return session;
    }

    private boolean isExpired(SearchSession session, Instant now) {
        return !session.getCreatedAt().plus(ttl).isAfter(now);
    }

    private int totalPages(SearchSession session) {
        int pages = (session.getItems().size() + pageSize - 1) / pageSize;
        return Math.max(1, Math.min(maxPages, pages));
    }

    private SearchPage slice(SearchSession session, int pageIndex, int totalPages) {
        int from = Math.min(pageIndex * pageSize, session.getItems().size());
        int to = Math.min(from + pageSize, session.getItems().size());
        return SearchPage.builder()
                .query(session.getQuery())
                .generation(session.getGeneration())
                .pageIndex(pageIndex)
                .totalPages(totalPages)
                .firstIndex(from)
                .items(session.getItems().subList(from, to))
                .build();
    }
}
