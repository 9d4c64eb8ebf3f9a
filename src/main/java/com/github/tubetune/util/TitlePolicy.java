package com.github.tubetune.util;

import java.util.List;

/**
 * How the delivered track title is derived from the source title.
 */
public enum TitlePolicy {

    /**
     * Source title as published.
     */
    VERBATIM {
        @Override
        public String apply(String title, String uploader) {
            return title;
        }
    },

    /**
     * Removes a leading uploader name and the separator that follows it,
     * e.g. "Artist - Song" uploaded by "Artist" becomes "Song".
     */
    STRIP_UPLOADER {
        @Override
        public String apply(String title, String uploader) {
            if (title == null || uploader == null || uploader.isBlank() || !title.startsWith(uploader)) {
                return title;
            }
            String stripped = title.substring(uploader.length()).strip();
            for (String separator : SEPARATORS) {
                if (stripped.startsWith(separator)) {
                    stripped = stripped.substring(separator.length()).strip();
                    break;
                }
            }
            return stripped.isEmpty() ? title : stripped;
        }
    };

    private static final List<String> SEPARATORS = List.of("-", "–", "|", ":", "•");

    public abstract String apply(String title, String uploader);
}
