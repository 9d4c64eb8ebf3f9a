package com.github.tubetune.service.messaging;

import com.github.tubetune.exception.WorkspaceException;
import com.github.tubetune.model.AudioArtifact;
import com.github.tubetune.model.CallbackData;
import com.github.tubetune.model.CandidateItem;
import com.github.tubetune.model.SearchPage;
import com.github.tubetune.util.FormatUtils;
import com.github.tubetune.util.PipelineConstants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Pushes chat messages to each owner's connected SSE clients.
 * Events for an owner with no open stream are dropped.
 */
@Slf4j
@Service
public class SseMessagingGateway implements MessagingGateway {

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<SseEmitter>> emitters = new ConcurrentHashMap<>();

    /**
     * Register a new SSE emitter for an owner
     */
    public SseEmitter createEmitter(String ownerId) {
        SseEmitter emitter = new SseEmitter(Long.MAX_VALUE);

        emitters.computeIfAbsent(ownerId, k -> new CopyOnWriteArrayList<>()).add(emitter);

        emitter.onCompletion(() -> removeEmitter(ownerId, emitter));
        emitter.onTimeout(() -> removeEmitter(ownerId, emitter));
        emitter.onError(e -> removeEmitter(ownerId, emitter));

        log.info("New SSE emitter registered for {}. Total: {}", ownerId, emitters.get(ownerId).size());

        return emitter;
    }

    @Override
    public void sendStatus(String ownerId, String text) {
        send(ownerId, ChatEvent.STATUS, new ChatEvent.Text(text));
    }

    @Override
    public void sendProgress(String ownerId, String taskId, int percent) {
        log.debug("Progress for task {}: {}%", taskId, percent);
        send(ownerId, ChatEvent.PROGRESS, new ChatEvent.Progress(taskId, percent));
    }

    @Override
    public void sendSearchResults(String ownerId, String query, SearchPage page) {
        send(ownerId, ChatEvent.SEARCH_RESULTS, toSearchResults(query, page));
    }

    @Override
    public void sendAudio(String ownerId, AudioArtifact artifact) {
        // Files are read here, before the workspace behind them is closed
        String data = readBase64(artifact.getFile());
        String thumbnail = artifact.getCover().map(SseMessagingGateway::readBase64).orElse(null);

        ChatEvent.Audio audio = ChatEvent.Audio.builder()
                .title(artifact.getTitle())
                .performer(artifact.getUploader())
                .durationSeconds(artifact.getDurationSeconds())
                .fileName(artifact.getFile().getFileName().toString())
                .sizeBytes(artifact.getSizeBytes())
                .data(data)
                .thumbnail(thumbnail)
                .build();

        log.info("Sending audio '{}' ({}) to {}", artifact.getTitle(),
                FormatUtils.formatSize(artifact.getSizeBytes()), ownerId);
        send(ownerId, ChatEvent.AUDIO, audio);
    }

    @Override
    public void sendError(String ownerId, String text) {
        send(ownerId, ChatEvent.ERROR, new ChatEvent.Text(text));
    }

    public int getActiveConnections() {
        return emitters.values().stream()
                .mapToInt(CopyOnWriteArrayList::size)
                .sum();
    }

    /**
     * Build the result keyboard: one button per item, labelled with its absolute
     * number and truncated title, plus previous/next navigation where it applies.
     */
    static ChatEvent.SearchResults toSearchResults(String query, SearchPage page) {
        ChatEvent.SearchResults.SearchResultsBuilder builder = ChatEvent.SearchResults.builder()
                .query(query)
                .page(page.getPageIndex())
                .totalPages(page.getTotalPages());

        List<CandidateItem> items = page.getItems();
        for (int i = 0; i < items.size(); i++) {
            int index = page.getFirstIndex() + i;
            String label = (index + 1) + ". "
                    + FormatUtils.truncate(items.get(i).getTitle(), PipelineConstants.RESULT_LABEL_MAX_LENGTH);
            builder.result(new ChatEvent.Button(label,
                    CallbackData.song(page.getGeneration(), index).encode()));
        }

        if (page.hasPrevious()) {
            builder.navigation(new ChatEvent.Button("⬅️ Previous",
                    CallbackData.page(page.getGeneration(), page.getPageIndex() - 1).encode()));
        }
        if (page.hasNext()) {
            builder.navigation(new ChatEvent.Button("Next ➡️",
                    CallbackData.page(page.getGeneration(), page.getPageIndex() + 1).encode()));
        }
        return builder.build();
    }

    private void send(String ownerId, String eventName, Object payload) {
        CopyOnWriteArrayList<SseEmitter> emitterList = emitters.get(ownerId);

        if (emitterList == null || emitterList.isEmpty()) {
            log.debug("No SSE client for {}, dropping '{}' event", ownerId, eventName);
            return;
        }

        for (SseEmitter emitter : emitterList) {
            try {
                emitter.send(SseEmitter.event()
                        .name(eventName)
                        .data(payload));

            } catch (IOException | IllegalStateException e) {
                log.warn("Failed to send SSE event to {}: {}", ownerId, e.getMessage());
                removeEmitter(ownerId, emitter);
            }
        }
    }

    private static String readBase64(Path file) {
        try {
            return Base64.getEncoder().encodeToString(Files.readAllBytes(file));
        } catch (IOException e) {
            throw new WorkspaceException("Failed to read artifact", file, e);
        }
    }

    private void removeEmitter(String ownerId, SseEmitter emitter) {
        CopyOnWriteArrayList<SseEmitter> emitterList = emitters.get(ownerId);
        if (emitterList != null) {
            emitterList.remove(emitter);
            log.info("SSE emitter removed for {}. Remaining: {}", ownerId, emitterList.size());
        }
    }
}
