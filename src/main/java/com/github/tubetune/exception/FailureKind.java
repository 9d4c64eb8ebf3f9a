package com.github.tubetune.exception;

/**
 * Terminal failure categories of a request, each with one fixed user-facing message.
 */
public enum FailureKind {
    NOTHING_TO_SEARCH("❌ Nothing to search. Send a YouTube link or a song name."),
    SOURCE_UNAVAILABLE("❌ This song is not available right now. Try another result or send the YouTube link."),
    SESSION_EXPIRED("❌ This search has expired. Please search again."),
    INVALID_SELECTION("❌ Invalid selection. Please search again."),
    TRANSFER_TIMEOUT("❌ The download took too long. Please try again later."),
    TRANSFER_FAILED("❌ The song could not be downloaded. Check the link and try again."),
    TRANSCODE_TIMEOUT("❌ The conversion took too long. Please try again later."),
    TRANSCODE_FAILED("❌ The song could not be converted to MP3. Please try again."),
    OVERSIZE_ARTIFACT("❌ The file is too large (over 45MB) to be sent."),
    FILESYSTEM_ERROR("❌ An internal storage error occurred. Please try again later."),
    GENERAL("❌ Something went wrong. Please try again later.");

    private final String defaultMessage;

    FailureKind(String defaultMessage) {
        this.defaultMessage = defaultMessage;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
