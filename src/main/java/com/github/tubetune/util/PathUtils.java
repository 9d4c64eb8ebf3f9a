package com.github.tubetune.util;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility class for file path operations and filename sanitization.
 */
@Slf4j
@UtilityClass
public class PathUtils {

    /**
     * Sanitize a track title into a filename stem.
     * Invalid filesystem characters become underscores, the result is capped at
     * {@link PipelineConstants#MAX_FILENAME_LENGTH} characters and stripped of
     * leading/trailing spaces and dots.
     *
     * @param filename Original title
     * @return Sanitized filename, "audio" when nothing usable is left
     */
    public static String sanitizeFilename(String filename) {
        if (filename == null || filename.isBlank()) {
            return PipelineConstants.FALLBACK_FILENAME;
        }

        String sanitized = filename.replaceAll("[<>:\"/\\\\|?*\\p{Cntrl}]", "_");
        if (sanitized.length() > PipelineConstants.MAX_FILENAME_LENGTH) {
            sanitized = sanitized.substring(0, PipelineConstants.MAX_FILENAME_LENGTH);
        }
        sanitized = sanitized.replaceAll("^[ .]+|[ .]+$", "");

        return sanitized.isEmpty() ? PipelineConstants.FALLBACK_FILENAME : sanitized;
    }

    /**
     * Create directory structure if it doesn't exist.
     *
     * @param path Directory path to create
     * @return true if directory exists or was created successfully, false otherwise
     */
    public static boolean createDirectoryStructure(Path path) {
        try {
            if (!Files.exists(path)) {
                Files.createDirectories(path);
                log.debug("Created directory structure: {}", path);
            }
            return true;
        } catch (IOException e) {
            log.error("Failed to create directory structure: {}", path, e);
            return false;
        }
    }

    /**
     * Get file extension from filename or URL path, without the leading dot.
     *
     * @param filename Filename to extract extension from
     * @return Lower-case extension, or empty string if none
     */
    public static String getExtension(String filename) {
        if (filename == null || filename.isBlank()) {
            return "";
        }

        int query = filename.indexOf('?');
        String path = query >= 0 ? filename.substring(0, query) : filename;
        int lastSlash = path.lastIndexOf('/');
        int lastDot = path.lastIndexOf('.');
        if (lastDot > lastSlash + 1 && lastDot < path.length() - 1) {
            return path.substring(lastDot + 1).toLowerCase();
        }

        return "";
    }
}
