package com.github.tubetune.util;

import com.github.tubetune.config.TubeTuneProperties;
import com.github.tubetune.exception.WorkspaceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Creates per-request workspaces under the configured temp path and keeps
 * track of the open ones so a JVM shutdown can remove them.
 */
@Slf4j
@Component
public class WorkspaceFactory {

    private static final Pattern WORKSPACE_NAME =
            Pattern.compile(".+-[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}");

    private final Path root;
    private final Clock clock;
    private final Set<Workspace> openWorkspaces = ConcurrentHashMap.newKeySet();

    @Autowired
    public WorkspaceFactory(TubeTuneProperties properties, Clock clock) {
        this(Paths.get(properties.getDownload().getTempPath()), clock);
        removeStaleWorkspaces(PipelineConstants.STALE_WORKSPACE_AGE);
        registerShutdownHook();
    }

    public WorkspaceFactory(Path root, Clock clock) {
        this.root = root.toAbsolutePath().normalize();
        this.clock = clock;
        if (!PathUtils.createDirectoryStructure(this.root)) {
            throw new WorkspaceException("Cannot create temp root", this.root, null);
        }
    }

    /**
     * Open a fresh workspace {@code <root>/<owner>-<uuid>}.
     *
     * @param ownerId Requesting user
     * @return Open workspace, to be closed by the caller
     */
    public Workspace open(String ownerId) {
        String stem = PathUtils.sanitizeFilename(ownerId).replace(' ', '_');
        Path directory = root.resolve(stem + "-" + UUID.randomUUID());
        Workspace workspace = new Workspace(directory, ownerId, openWorkspaces::remove);
        openWorkspaces.add(workspace);
        return workspace;
    }

    public int getOpenCount() {
        return openWorkspaces.size();
    }

    public Path getRoot() {
        return root;
    }

    /**
     * Remove workspace directories under the root not modified within {@code maxAge}.
     * Only directories named like {@link #open(String)} names them are candidates;
     * workspaces opened by this process are never touched.
     *
     * @param maxAge Age threshold
     * @return Number of workspaces removed
     */
    public int removeStaleWorkspaces(Duration maxAge) {
        Instant cutoff = clock.instant().minus(maxAge);
        List<Path> stale = new ArrayList<>();
        try (Stream<Path> entries = Files.list(root)) {
            entries.filter(WorkspaceFactory::isWorkspaceDirectory)
                    .filter(path -> isOlderThan(path, cutoff))
                    .filter(path -> openWorkspaces.stream().noneMatch(w -> w.getDirectory().equals(path)))
                    .forEach(stale::add);
        } catch (IOException e) {
            log.warn("Cannot list temp root {}: {}", root, e.getMessage());
            return 0;
        }

        int removed = 0;
        for (Path path : stale) {
            if (Workspace.deleteRecursively(path)) {
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Removed {} stale workspace(s) from {}", removed, root);
        }
        return removed;
    }

    private static boolean isWorkspaceDirectory(Path path) {
        return Files.isDirectory(path) && WORKSPACE_NAME.matcher(path.getFileName().toString()).matches();
    }

    private boolean isOlderThan(Path path, Instant cutoff) {
        try {
            return Files.getLastModifiedTime(path).toInstant().isBefore(cutoff);
        } catch (IOException e) {
            log.debug("Cannot read modification time of {}", path);
            return false;
        }
    }

    /**
     * Close every workspace still open.
     */
    public void closeAll() {
        for (Workspace workspace : new ArrayList<>(openWorkspaces)) {
            workspace.close();
        }
    }

    private void registerShutdownHook() {
        Runtime.getRuntime().addShutdownHook(new Thread(this::closeAll, "WorkspaceFactory-ShutdownHook"));
        log.debug("Registered shutdown hook for workspace cleanup");
    }
}
