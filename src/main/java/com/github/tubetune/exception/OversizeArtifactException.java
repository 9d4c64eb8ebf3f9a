package com.github.tubetune.exception;

/**
 * Exception thrown when the artifact (actual or estimated) exceeds the delivery ceiling.
 */
public class OversizeArtifactException extends PipelineException {

    private final long sizeBytes;
    private final long limitBytes;
    private final boolean estimated;

    public OversizeArtifactException(long sizeBytes, long limitBytes, boolean estimated) {
        super(FailureKind.OVERSIZE_ARTIFACT, String.format("%s size %d bytes exceeds limit %d bytes",
                estimated ? "Estimated" : "Artifact", sizeBytes, limitBytes));
        this.sizeBytes = sizeBytes;
        this.limitBytes = limitBytes;
        this.estimated = estimated;
    }

    public long getSizeBytes() {
        return sizeBytes;
    }

    public long getLimitBytes() {
        return limitBytes;
    }

    public boolean isEstimated() {
        return estimated;
    }
}
