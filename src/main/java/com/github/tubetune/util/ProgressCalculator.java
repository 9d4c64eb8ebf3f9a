package com.github.tubetune.util;

import lombok.experimental.UtilityClass;

/**
 * Utility class for transfer progress and size estimates.
 */
@UtilityClass
public class ProgressCalculator {

    /**
     * Percentage of a transfer, floored and capped below completion.
     *
     * @param transferredBytes Bytes written so far
     * @param totalBytes Expected total, {@code <= 0} when unknown
     * @return Percentage in 0..99, or -1 when the total is unknown
     */
    public static int transferPercent(long transferredBytes, long totalBytes) {
        if (totalBytes <= 0) {
            return -1;
        }
        if (transferredBytes <= 0) {
            return 0;
        }
        long percent = transferredBytes * 100 / totalBytes;
        return (int) Math.min(PipelineConstants.MAX_REPORTED_PERCENT, percent);
    }

    /**
     * Estimated size of the transcoded output.
     *
     * @param durationSeconds Track duration
     * @param bitrateKbps Output bitrate
     * @return Estimated bytes, 0 when the duration is unknown
     */
    public static long estimateOutputBytes(long durationSeconds, int bitrateKbps) {
        if (durationSeconds <= 0 || bitrateKbps <= 0) {
            return 0;
        }
        return durationSeconds * bitrateKbps * 1000L / 8;
    }
}
