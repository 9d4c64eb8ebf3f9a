package com.github.tubetune.service.acquisition;

import com.github.tubetune.model.PlayableStream;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Copies a remote stream into a local file.
 */
public interface MediaFetcher {

    /**
     * Fetch a stream into {@code target}.
     *
     * @param stream Stream location and request headers
     * @param target File to write, replaced if present
     * @param deadline Hard wall-clock limit for the whole transfer
     * @param listener Progress listener
     * @return Bytes written
     * @throws com.github.tubetune.exception.TransferTimeoutException if the deadline passes
     * @throws com.github.tubetune.exception.TransferException on HTTP or I/O errors
     */
    long fetch(PlayableStream stream, Path target, Instant deadline, TransferListener listener);
}
