package com.github.tubetune.service.progress;

/**
 * Receiver of raw progress percentages from the acquisition worker.
 */
@FunctionalInterface
public interface ProgressSink {

    void report(int percent);
}
