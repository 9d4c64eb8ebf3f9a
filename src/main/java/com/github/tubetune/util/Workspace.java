package com.github.tubetune.util;

import com.github.tubetune.exception.WorkspaceException;
import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Private scratch directory owned by exactly one request.
 * Implements Closeable for use with try-with-resources: closing deletes the
 * directory and everything in it, whatever state the request ended in.
 */
@Slf4j
public class Workspace implements Closeable {

    private final Path directory;
    private final String ownerId;
    private final Consumer<Workspace> onClose;
    private volatile boolean closed = false;

    /**
     * Create the directory and take ownership of it.
     *
     * @param directory Directory to create, must not exist yet
     * @param ownerId Requesting user, for logging
     * @param onClose Callback invoked once after deletion, may be null
     * @throws WorkspaceException if the directory cannot be created
     */
    public Workspace(Path directory, String ownerId, Consumer<Workspace> onClose) {
        this.directory = directory;
        this.ownerId = ownerId;
        this.onClose = onClose;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new WorkspaceException("Cannot create workspace", directory, e);
        }
        log.debug("Opened workspace {} for owner {}", directory, ownerId);
    }

    /**
     * Resolve a file name inside this workspace.
     *
     * @param fileName Plain file name
     * @return Path inside the workspace directory
     */
    public Path resolve(String fileName) {
        if (closed) {
            throw new IllegalStateException("Workspace already closed: " + directory);
        }
        Path resolved = directory.resolve(fileName).normalize();
        if (!resolved.startsWith(directory)) {
            throw new IllegalArgumentException("File name escapes workspace: " + fileName);
        }
        return resolved;
    }

    public Path getDirectory() {
        return directory;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Delete the workspace directory recursively. Idempotent.
     */
    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
        }

        deleteRecursively(directory);
        if (onClose != null) {
            onClose.accept(this);
        }
    }

    /**
     * Recursively delete a directory and its contents.
     *
     * @param root Directory to delete
     * @return true if nothing is left at {@code root}
     */
    static boolean deleteRecursively(Path root) {
        try {
            if (Files.exists(root)) {
                try (Stream<Path> paths = Files.walk(root)) {
                    paths.sorted(Comparator.reverseOrder())
                            .forEach(path -> {
                                try {
                                    Files.deleteIfExists(path);
                                } catch (IOException e) {
                                    log.warn("Failed to delete: {}", path, e);
                                }
                            });
                }
                log.debug("Deleted workspace: {}", root);
            }
        } catch (IOException e) {
            log.warn("Failed to delete workspace: {}", root, e);
        }
        return !Files.exists(root);
    }
}
