package com.github.tubetune.service.messaging;

import com.github.tubetune.model.AudioArtifact;
import com.github.tubetune.model.SearchPage;

/**
 * Outbound side of the chat transport. Implementations must be safe to call
 * from many request threads at once.
 */
public interface MessagingGateway {

    void sendStatus(String ownerId, String text);

    void sendProgress(String ownerId, String taskId, int percent);

    void sendSearchResults(String ownerId, String query, SearchPage page);

    /**
     * Deliver the finished audio. The artifact's files are deleted right after
     * this call returns, so the implementation must have fully read them by then.
     *
     * @param ownerId Recipient
     * @param artifact Finished audio
     */
    void sendAudio(String ownerId, AudioArtifact artifact);

    void sendError(String ownerId, String text);
}
