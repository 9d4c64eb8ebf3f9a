package com.github.tubetune.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class SearchPage {

    String query;
    long generation;
    int pageIndex;
    int totalPages;

    /**
     * Absolute session index of the first item of this page.
     */
    int firstIndex;

    List<CandidateItem> items;

    public boolean hasPrevious() {
        return pageIndex > 0;
    }

    public boolean hasNext() {
        return pageIndex < totalPages - 1;
    }
}
