package com.github.tubetune.service.acquisition;

import com.github.tubetune.config.TubeTuneProperties;
import com.github.tubetune.exception.FailureKind;
import com.github.tubetune.exception.OversizeArtifactException;
import com.github.tubetune.exception.PipelineException;
import com.github.tubetune.exception.TranscodeException;
import com.github.tubetune.exception.TranscodeTimeoutException;
import com.github.tubetune.exception.WorkspaceException;
import com.github.tubetune.model.AcquisitionStatus;
import com.github.tubetune.model.AcquisitionTask;
import com.github.tubetune.model.AudioArtifact;
import com.github.tubetune.model.CandidateItem;
import com.github.tubetune.model.MediaLocator;
import com.github.tubetune.model.PlayableStream;
import com.github.tubetune.service.codec.AudioCodec;
import com.github.tubetune.service.progress.ProgressSink;
import com.github.tubetune.service.resolve.SourceResolver;
import com.github.tubetune.service.state.AcquisitionStateMachine;
import com.github.tubetune.util.PathUtils;
import com.github.tubetune.util.PipelineConstants;
import com.github.tubetune.util.ProgressCalculator;
import com.github.tubetune.util.TitlePolicy;
import com.github.tubetune.util.Workspace;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Turns one candidate or direct URL into a tagged MP3 inside the caller's workspace.
 * <p>
 * Steps: probe (when no stream is known), transfer, transcode, cover and tags,
 * size validation. Transfer plus transcode share one wall-clock deadline.
 * Nothing is retried and nothing outside the workspace is written; the caller
 * owns cleanup.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AcquisitionWorker {

    private static final Set<String> JPEG_EXTENSIONS = Set.of("jpg", "jpeg");

    private final SourceResolver sourceResolver;
    private final MediaFetcher mediaFetcher;
    private final AudioCodec audioCodec;
    private final AcquisitionStateMachine stateMachine;
    private final TubeTuneProperties properties;
    private final Clock clock;

    /**
     * Run the acquisition of one task.
     *
     * @param task Task with either a candidate or a direct-URL locator
     * @param workspace Workspace exclusively owned by the task
     * @param progressSink Receiver of transfer percentages
     * @return Finished artifact inside {@code workspace}
     * @throws PipelineException on any terminal failure; the task is then FAILED
     */
    public AudioArtifact acquire(AcquisitionTask task, Workspace workspace, ProgressSink progressSink) {
        task.setStartedAt(clock.instant());
        try {
            CandidateItem item = probe(task);
            checkEstimatedSize(item);

            // Deadline covers transfer and transcode
            Instant deadline = clock.instant().plus(properties.getDownload().getStageTimeout());

            Path source = transfer(task, item, workspace, deadline, progressSink);
            Path transcoded = transcode(task, source, workspace, deadline);
            Path output = finalizeArtifact(task, item, transcoded, workspace, deadline);

            long size = sizeOf(output);
            long limit = properties.getDownload().getMaxArtifactBytes();
            if (size > limit) {
                throw new OversizeArtifactException(size, limit, false);
            }

            stateMachine.transitionOrThrow(task, AcquisitionStatus.SUCCEEDED);
            log.info("Task {} produced {} ({} bytes)", task.getId(), output.getFileName(), size);

            return AudioArtifact.builder()
                    .file(output)
                    .title(finalTitle(item))
                    .uploader(item.getUploader())
                    .durationSeconds(item.getDurationSeconds())
                    .cover(findCover(workspace))
                    .sizeBytes(size)
                    .build();

        } catch (PipelineException e) {
            markFailed(task, e.getKind());
            throw e;
        } catch (RuntimeException e) {
            markFailed(task, FailureKind.GENERAL);
            throw e;
        }
    }

    private CandidateItem probe(AcquisitionTask task) {
        CandidateItem candidate = task.getCandidate();
        if (candidate != null && candidate.hasStream()) {
            return candidate;
        }

        stateMachine.transitionOrThrow(task, AcquisitionStatus.PROBING);
        MediaLocator locator = candidate != null
                ? MediaLocator.directUrl(candidate.getSourceRef(), candidate.getId())
                : task.getLocator();

        CandidateItem probed = sourceResolver.resolve(locator).get(0);
        log.debug("Task {} probed {} ({}s)", task.getId(), probed.getId(), probed.getDurationSeconds());
        return probed;
    }

    private void checkEstimatedSize(CandidateItem item) {
        long estimated = ProgressCalculator.estimateOutputBytes(
                item.getDurationSeconds(), properties.getDownload().getBitrateKbps());
        long limit = properties.getDownload().getMaxArtifactBytes();
        if (estimated > limit) {
            log.info("Rejecting {}: estimated {} bytes exceeds {}", item.getId(), estimated, limit);
            throw new OversizeArtifactException(estimated, limit, true);
        }
    }

    private Path transfer(AcquisitionTask task, CandidateItem item, Workspace workspace,
                          Instant deadline, ProgressSink progressSink) {
        stateMachine.transitionOrThrow(task, AcquisitionStatus.TRANSFERRING);

        PlayableStream stream = item.getStream()
                .orElseThrow(() -> new PipelineException(FailureKind.SOURCE_UNAVAILABLE,
                        "Probed candidate has no stream: " + item.getId()));
        Path source = workspace.resolve(PipelineConstants.SOURCE_FILE_STEM + "." + stream.getExt());

        mediaFetcher.fetch(stream, source, deadline, (transferred, total) -> {
            int percent = ProgressCalculator.transferPercent(transferred, total);
            if (percent > task.getProgressPercent()) {
                task.setProgressPercent(percent);
                progressSink.report(percent);
            }
        });
        return source;
    }

    private Path transcode(AcquisitionTask task, Path source, Workspace workspace, Instant deadline) {
        stateMachine.transitionOrThrow(task, AcquisitionStatus.TRANSCODING);

        Duration timeout = remaining(deadline, properties.getDownload().getTranscodeTimeout());
        if (timeout.isZero()) {
            throw new TranscodeTimeoutException(List.of(), properties.getDownload().getStageTimeout());
        }

        Path transcoded = workspace.resolve(PipelineConstants.TRANSCODED_FILE_STEM + PipelineConstants.AUDIO_EXTENSION);
        audioCodec.transcode(source, transcoded, properties.getDownload().getBitrateKbps(), timeout);

        if (sizeOf(transcoded) <= 0) {
            throw new TranscodeException("Transcode produced no output", List.of());
        }
        deleteQuietly(source);
        return transcoded;
    }

    private Path finalizeArtifact(AcquisitionTask task, CandidateItem item, Path transcoded,
                                  Workspace workspace, Instant deadline) {
        stateMachine.transitionOrThrow(task, AcquisitionStatus.FINALIZING);

        String title = finalTitle(item);
        Path output = workspace.resolve(PathUtils.sanitizeFilename(title) + PipelineConstants.AUDIO_EXTENSION);
        Path cover = fetchCover(item, workspace, deadline);

        Duration timeout = remaining(deadline, properties.getDownload().getTranscodeTimeout());
        if (timeout.isZero()) {
            throw new TranscodeTimeoutException(List.of(), properties.getDownload().getStageTimeout());
        }
        try {
            audioCodec.embedMetadata(transcoded, cover, title, item.getUploader(), output, timeout);
            deleteQuietly(transcoded);
        } catch (TranscodeTimeoutException e) {
            throw e;
        } catch (TranscodeException e) {
            // Untagged audio is still delivered
            log.warn("Task {} tagging failed, delivering untagged audio: {}", task.getId(), e.getMessage());
            move(transcoded, output);
        }
        return output;
    }

    private Path fetchCover(CandidateItem item, Workspace workspace, Instant deadline) {
        String thumbnailUrl = item.getThumbnailUrl();
        if (thumbnailUrl == null || thumbnailUrl.isBlank()) {
            return null;
        }

        Instant coverDeadline = earliest(deadline, clock.instant().plus(properties.getExtractor().getStrategyTimeout()));
        String ext = PathUtils.getExtension(thumbnailUrl);
        Path cover = workspace.resolve(PipelineConstants.COVER_FILE_STEM + PipelineConstants.COVER_EXTENSION);

        try {
            if (JPEG_EXTENSIONS.contains(ext)) {
                mediaFetcher.fetch(PlayableStream.builder().url(thumbnailUrl).ext(ext).build(),
                        cover, coverDeadline, TransferListener.NONE);
            } else {
                Path thumbnail = workspace.resolve(PipelineConstants.THUMBNAIL_FILE_STEM + "."
                        + (ext.isEmpty() ? "img" : ext));
                mediaFetcher.fetch(PlayableStream.builder().url(thumbnailUrl).ext(ext).build(),
                        thumbnail, coverDeadline, TransferListener.NONE);
                Duration timeout = remaining(coverDeadline, properties.getDownload().getTranscodeTimeout());
                if (timeout.isZero()) {
                    return null;
                }
                audioCodec.convertImage(thumbnail, cover, timeout);
                deleteQuietly(thumbnail);
            }
            return cover;
        } catch (PipelineException e) {
            log.warn("Cover for {} unavailable, continuing without: {}", item.getId(), e.getMessage());
            deleteQuietly(cover);
            return null;
        }
    }

    private String finalTitle(CandidateItem item) {
        TitlePolicy policy = properties.getDelivery().getTitlePolicy();
        String title = policy.apply(item.getTitle(), item.getUploader());
        return title == null || title.isBlank() ? PipelineConstants.UNKNOWN_TITLE : title;
    }

    private Path findCover(Workspace workspace) {
        Path cover = workspace.resolve(PipelineConstants.COVER_FILE_STEM + PipelineConstants.COVER_EXTENSION);
        return Files.exists(cover) ? cover : null;
    }

    private void markFailed(AcquisitionTask task, FailureKind kind) {
        if (stateMachine.fail(task)) {
            task.setFailureKind(kind);
            log.info("Task {} failed in {}: {}", task.getId(), task.getDisplayName(), kind);
        }
    }

    private Duration remaining(Instant deadline, Duration cap) {
        Duration left = Duration.between(clock.instant(), deadline);
        if (left.isNegative() || left.isZero()) {
            return Duration.ZERO;
        }
        return left.compareTo(cap) < 0 ? left : cap;
    }

    private static Instant earliest(Instant a, Instant b) {
        return a.isBefore(b) ? a : b;
    }

    private long sizeOf(Path file) {
        try {
            return Files.exists(file) ? Files.size(file) : 0;
        } catch (IOException e) {
            throw new WorkspaceException("Cannot read file size", file, e);
        }
    }

    private void move(Path from, Path to) {
        try {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new WorkspaceException("Cannot move file", to, e);
        }
    }

    private void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete intermediate file {}: {}", file, e.getMessage());
        }
    }
}
