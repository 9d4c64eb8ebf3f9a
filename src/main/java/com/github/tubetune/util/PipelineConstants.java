package com.github.tubetune.util;

import java.time.Duration;

/**
 * Constants used throughout the extraction and delivery pipeline.
 */
public final class PipelineConstants {

    private PipelineConstants() {
        // Utility class, no instantiation
    }

    // ========== Platform ==========

    /**
     * Length of a platform video id.
     */
    public static final int VIDEO_ID_LENGTH = 11;

    /**
     * Canonical single-video URL prefix; the video id is appended.
     */
    public static final String WATCH_URL_PREFIX = "https://www.youtube.com/watch?v=";

    // ========== Files ==========

    /**
     * Extension of the delivered audio file.
     */
    public static final String AUDIO_EXTENSION = ".mp3";

    /**
     * Extension of the normalized cover image.
     */
    public static final String COVER_EXTENSION = ".jpg";

    /**
     * Stem of the downloaded source stream inside a workspace.
     * Intermediate stems start with a dot, which a sanitized title never does.
     */
    public static final String SOURCE_FILE_STEM = ".source";

    /**
     * Stem of the transcoded file before tags are embedded.
     */
    public static final String TRANSCODED_FILE_STEM = ".transcoded";

    /**
     * Stem of the downloaded thumbnail.
     */
    public static final String THUMBNAIL_FILE_STEM = ".thumbnail";

    /**
     * Stem of the normalized JPEG cover.
     */
    public static final String COVER_FILE_STEM = ".cover";

    /**
     * Maximum length of a sanitized filename stem.
     */
    public static final int MAX_FILENAME_LENGTH = 100;

    /**
     * Filename used when a title sanitizes to nothing.
     */
    public static final String FALLBACK_FILENAME = "audio";

    /**
     * Workspaces older than this are left over from a crashed process and removed at startup.
     */
    public static final Duration STALE_WORKSPACE_AGE = Duration.ofHours(1);

    // ========== Progress ==========

    /**
     * Highest percentage ever reported; completion is signalled by delivery, not by 100%.
     */
    public static final int MAX_REPORTED_PERCENT = 99;

    /**
     * Copy buffer size for stream transfers.
     */
    public static final int TRANSFER_BUFFER_SIZE = 64 * 1024;

    // ========== Presentation ==========

    /**
     * Maximum title characters shown on a search result button.
     */
    public static final int RESULT_LABEL_MAX_LENGTH = 50;

    /**
     * Title used when the source reports none.
     */
    public static final String UNKNOWN_TITLE = "Unknown Title";

    /**
     * Uploader used when the source reports none.
     */
    public static final String UNKNOWN_UPLOADER = "Unknown Artist";
}
