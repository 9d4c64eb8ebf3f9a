package com.github.tubetune.exception;

import java.nio.file.Path;

/**
 * Exception thrown when a request workspace cannot be created or written.
 */
public class WorkspaceException extends PipelineException {

    private final Path path;

    public WorkspaceException(String message, Path path, Throwable cause) {
        super(FailureKind.FILESYSTEM_ERROR, message, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
