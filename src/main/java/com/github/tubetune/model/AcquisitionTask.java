package com.github.tubetune.model;

import com.github.tubetune.exception.FailureKind;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

/**
 * One acquisition in flight. Lives only as long as its request.
 */
@Data
@Builder
public class AcquisitionTask {

    @Builder.Default
    private String id = UUID.randomUUID().toString();

    private String ownerId;

    /**
     * Candidate to acquire, or null when the target is {@link #locator}.
     */
    private CandidateItem candidate;

    private MediaLocator locator;

    private Instant startedAt;

    @Builder.Default
    private volatile AcquisitionStatus status = AcquisitionStatus.PENDING;

    @Builder.Default
    private volatile int progressPercent = 0;

    private volatile FailureKind failureKind;

    public String getDisplayName() {
        if (candidate != null && candidate.getTitle() != null) {
            return candidate.getTitle();
        }
        return locator != null ? locator.describe() : id;
    }
}
