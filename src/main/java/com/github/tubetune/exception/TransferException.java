package com.github.tubetune.exception;

/**
 * Exception thrown when the source stream cannot be fetched into the workspace.
 */
public class TransferException extends PipelineException {

    private final String url;
    private final Integer httpStatus;

    public TransferException(String message, String url) {
        super(FailureKind.TRANSFER_FAILED, message);
        this.url = url;
        this.httpStatus = null;
    }

    public TransferException(String message, String url, Integer httpStatus) {
        super(FailureKind.TRANSFER_FAILED, message);
        this.url = url;
        this.httpStatus = httpStatus;
    }

    public TransferException(String message, Throwable cause, String url) {
        super(FailureKind.TRANSFER_FAILED, message, cause);
        this.url = url;
        this.httpStatus = null;
    }

    protected TransferException(FailureKind kind, String message, String url) {
        super(kind, message);
        this.url = url;
        this.httpStatus = null;
    }

    public String getUrl() {
        return url;
    }

    public Integer getHttpStatus() {
        return httpStatus;
    }
}
