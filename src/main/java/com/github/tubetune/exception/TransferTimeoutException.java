package com.github.tubetune.exception;

/**
 * Exception thrown when the transfer does not finish within the stage deadline.
 */
public class TransferTimeoutException extends TransferException {

    private final long transferredBytes;

    public TransferTimeoutException(String url, long transferredBytes) {
        super(FailureKind.TRANSFER_TIMEOUT, "Transfer deadline exceeded after " + transferredBytes + " bytes", url);
        this.transferredBytes = transferredBytes;
    }

    public long getTransferredBytes() {
        return transferredBytes;
    }
}
