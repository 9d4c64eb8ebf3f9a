package com.github.tubetune.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * Cached search results of one owner. The item list never changes after creation;
 * only the viewed page moves.
 */
@Data
@Builder
public class SearchSession {

    private final String ownerId;
    private final String query;
    private final List<CandidateItem> items;
    private final long generation;
    private final Instant createdAt;

    @Builder.Default
    private volatile int currentPage = 0;
}
