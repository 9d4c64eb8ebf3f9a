package com.github.tubetune.model;

public enum AcquisitionStatus {
    PENDING("Pending"),
    PROBING("Resolving source"),
    TRANSFERRING("Downloading"),
    TRANSCODING("Converting"),
    FINALIZING("Tagging"),
    SUCCEEDED("Succeeded"),
    FAILED("Failed");

    private final String displayName;

    AcquisitionStatus(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
