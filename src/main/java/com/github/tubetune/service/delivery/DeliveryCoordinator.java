package com.github.tubetune.service.delivery;

import com.github.tubetune.exception.FailureKind;
import com.github.tubetune.exception.PipelineException;
import com.github.tubetune.exception.SourceUnavailableException;
import com.github.tubetune.model.AcquisitionTask;
import com.github.tubetune.model.AudioArtifact;
import com.github.tubetune.model.CallbackData;
import com.github.tubetune.model.CandidateItem;
import com.github.tubetune.model.DeliveryOutcome;
import com.github.tubetune.model.MediaLocator;
import com.github.tubetune.model.SearchPage;
import com.github.tubetune.service.acquisition.AcquisitionWorker;
import com.github.tubetune.service.messaging.MessagingGateway;
import com.github.tubetune.service.progress.ProgressChannel;
import com.github.tubetune.service.progress.ProgressReporter;
import com.github.tubetune.service.resolve.LocatorClassifier;
import com.github.tubetune.service.resolve.SourceResolver;
import com.github.tubetune.service.session.SearchSessionStore;
import com.github.tubetune.util.Workspace;
import com.github.tubetune.util.WorkspaceFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * Runs every inbound event as its own unit of work on the request executor.
 * <p>
 * A request owns its workspace and progress channel; both are released on every
 * exit path before the terminal message is sent. Failures end as one fixed user
 * message per {@link FailureKind}.
 */
@Slf4j
@Service
public class DeliveryCoordinator {

    private final LocatorClassifier classifier;
    private final SourceResolver resolver;
    private final SearchSessionStore sessionStore;
    private final AcquisitionWorker worker;
    private final ProgressReporter progressReporter;
    private final MessagingGateway gateway;
    private final WorkspaceFactory workspaceFactory;
    private final UserMessages messages;
    private final Executor requestExecutor;

    public DeliveryCoordinator(LocatorClassifier classifier,
                               SourceResolver resolver,
                               SearchSessionStore sessionStore,
                               AcquisitionWorker worker,
                               ProgressReporter progressReporter,
                               MessagingGateway gateway,
                               WorkspaceFactory workspaceFactory,
                               UserMessages messages,
                               @Qualifier("requestExecutor") Executor requestExecutor) {
        this.classifier = classifier;
        this.resolver = resolver;
        this.sessionStore = sessionStore;
        this.worker = worker;
        this.progressReporter = progressReporter;
        this.gateway = gateway;
        this.workspaceFactory = workspaceFactory;
        this.messages = messages;
        this.requestExecutor = requestExecutor;
    }

    /**
     * Handle a text message: a link is acquired directly, anything else is searched.
     */
    public CompletableFuture<DeliveryOutcome> submitText(String ownerId, String text) {
        return submit(ownerId, () -> handleText(ownerId, text));
    }

    /**
     * Show another page of the owner's live search.
     */
    public CompletableFuture<DeliveryOutcome> submitPage(String ownerId, long generation, int pageIndex) {
        return submit(ownerId, () -> handlePage(ownerId, generation, pageIndex));
    }

    /**
     * Acquire one item of the owner's live search.
     */
    public CompletableFuture<DeliveryOutcome> submitSelection(String ownerId, long generation, int itemIndex) {
        return submit(ownerId, () -> handleSelection(ownerId, generation, itemIndex));
    }

    /**
     * Decode a button payload and dispatch it as page navigation or selection.
     */
    public CompletableFuture<DeliveryOutcome> submitCallback(String ownerId, String callbackData) {
        return submit(ownerId, () -> {
            CallbackData callback = CallbackData.parse(callbackData);
            return switch (callback.getAction()) {
                case PAGE -> handlePage(ownerId, callback.getGeneration(), callback.getIndex());
                case SONG -> handleSelection(ownerId, callback.getGeneration(), callback.getIndex());
            };
        });
    }

    private CompletableFuture<DeliveryOutcome> submit(String ownerId, Supplier<DeliveryOutcome> work) {
        try {
            return CompletableFuture.supplyAsync(() -> runGuarded(ownerId, work), requestExecutor);
        } catch (RejectedExecutionException e) {
            log.error("Request executor rejected work for {}", ownerId, e);
            return CompletableFuture.completedFuture(fail(ownerId, FailureKind.GENERAL));
        }
    }

    private DeliveryOutcome runGuarded(String ownerId, Supplier<DeliveryOutcome> work) {
        try {
            return work.get();
        } catch (PipelineException e) {
            log.warn("Request of {} failed ({}): {}", ownerId, e.getKind(), e.getMessage());
            return fail(ownerId, e.getKind());
        } catch (RuntimeException e) {
            log.error("Unexpected error handling request of {}", ownerId, e);
            return fail(ownerId, FailureKind.GENERAL);
        }
    }

    private DeliveryOutcome handleText(String ownerId, String text) {
        MediaLocator locator = classifier.classify(text);
        log.info("Request from {}: {} {}", ownerId, locator.getType(), locator.describe());

        if (locator.isDirectUrl()) {
            return acquire(ownerId, AcquisitionTask.builder()
                    .ownerId(ownerId)
                    .locator(locator)
                    .build());
        }
        return search(ownerId, locator);
    }

    private DeliveryOutcome search(String ownerId, MediaLocator locator) {
        gateway.sendStatus(ownerId, messages.searching());

        List<CandidateItem> items;
        try {
            items = resolver.resolve(locator);
        } catch (SourceUnavailableException e) {
            log.info("No results for '{}' from {}", locator.getText(), ownerId);
            String text = messages.nothingFound();
            sendErrorQuietly(ownerId, text);
            return DeliveryOutcome.failed(FailureKind.SOURCE_UNAVAILABLE, text);
        }

        long generation = sessionStore.put(ownerId, locator.getText(), items);
        SearchPage page = sessionStore.getPage(ownerId, generation, 0);
        gateway.sendSearchResults(ownerId, locator.getText(), page);
        return DeliveryOutcome.searchResults(locator.getText());
    }

    private DeliveryOutcome handlePage(String ownerId, long generation, int pageIndex) {
        SearchPage page = sessionStore.getPage(ownerId, generation, pageIndex);
        gateway.sendSearchResults(ownerId, page.getQuery(), page);
        return DeliveryOutcome.pageShown(page.getQuery());
    }

    private DeliveryOutcome handleSelection(String ownerId, long generation, int itemIndex) {
        CandidateItem item = sessionStore.select(ownerId, generation, itemIndex);
        log.info("Selection from {}: {} ({})", ownerId, item.getTitle(), item.getId());
        return acquire(ownerId, AcquisitionTask.builder()
                .ownerId(ownerId)
                .candidate(item)
                .build());
    }

    private DeliveryOutcome acquire(String ownerId, AcquisitionTask task) {
        gateway.sendStatus(ownerId, messages.processing());

        try (Workspace workspace = workspaceFactory.open(ownerId)) {
            AudioArtifact artifact;
            try (ProgressChannel progress = progressReporter.open(ownerId, task.getId())) {
                artifact = worker.acquire(task, workspace, progress);
            }
            gateway.sendAudio(ownerId, artifact);
            log.info("Delivered '{}' to {}", artifact.getTitle(), ownerId);
            return DeliveryOutcome.delivered(artifact.getTitle());
        }
    }

    private DeliveryOutcome fail(String ownerId, FailureKind kind) {
        String text = messages.failure(kind);
        sendErrorQuietly(ownerId, text);
        return DeliveryOutcome.failed(kind, text);
    }

    private void sendErrorQuietly(String ownerId, String text) {
        try {
            gateway.sendError(ownerId, text);
        } catch (RuntimeException e) {
            log.warn("Could not send error message to {}: {}", ownerId, e.getMessage());
        }
    }
}
