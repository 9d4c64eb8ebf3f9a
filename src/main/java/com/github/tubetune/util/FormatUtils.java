package com.github.tubetune.util;

import lombok.experimental.UtilityClass;

/**
 * Utility class for formatting sizes, durations and result labels.
 */
@UtilityClass
public class FormatUtils {

    /**
     * Format bytes to human-readable size string using binary units.
     *
     * @param bytes Size in bytes
     * @return Formatted string like "4.21 MB", "512.00 KB" or "0 B"
     */
    public static String formatSize(long bytes) {
        if (bytes >= 1024L * 1024 * 1024) {
            return String.format("%.2f GB", bytes / (1024.0 * 1024 * 1024));
        } else if (bytes >= 1024L * 1024) {
            return String.format("%.2f MB", bytes / (1024.0 * 1024));
        } else if (bytes >= 1024L) {
            return String.format("%.2f KB", bytes / 1024.0);
        } else {
            return String.format("%d B", Math.max(0, bytes));
        }
    }

    /**
     * Truncate a title for a result button label.
     *
     * @param title Title to shorten
     * @param maxLength Maximum characters kept before the ellipsis
     * @return Title, or its first {@code maxLength} characters followed by "..."
     */
    public static String truncate(String title, int maxLength) {
        if (title == null) {
            return "";
        }
        if (title.length() <= maxLength) {
            return title;
        }
        return title.substring(0, maxLength) + "...";
    }
}
