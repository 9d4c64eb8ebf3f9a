package com.github.tubetune.service.acquisition;

import com.github.tubetune.exception.TransferException;
import com.github.tubetune.exception.TransferTimeoutException;
import com.github.tubetune.model.PlayableStream;
import com.github.tubetune.util.PipelineConstants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.TimeUnit;

@Slf4j
@Service
@RequiredArgsConstructor
public class OkHttpMediaFetcher implements MediaFetcher {

    private final OkHttpClient httpClient;
    private final Clock clock;

    @Override
    public long fetch(PlayableStream stream, Path target, Instant deadline, TransferListener listener) {
        String url = stream.getUrl();
        long remainingMs = Duration.between(clock.instant(), deadline).toMillis();
        if (remainingMs <= 0) {
            throw new TransferTimeoutException(url, 0);
        }

        Request.Builder requestBuilder = new Request.Builder().url(url);
        for (Map.Entry<String, String> header : stream.getHeaders().entrySet()) {
            requestBuilder.header(header.getKey(), header.getValue());
        }

        Call call = httpClient.newCall(requestBuilder.build());
        // Spans the whole call, body included
        call.timeout().timeout(remainingMs, TimeUnit.MILLISECONDS);

        long transferred = 0;
        try (Response response = call.execute()) {
            if (!response.isSuccessful()) {
                throw new TransferException("Unexpected response code: " + response.code(), url, response.code());
            }
            ResponseBody body = response.body();
            if (body == null) {
                throw new TransferException("Empty response body", url);
            }

            long total = body.contentLength() > 0
                    ? body.contentLength()
                    : (stream.getExpectedSize() != null ? stream.getExpectedSize() : -1);

            byte[] buffer = new byte[PipelineConstants.TRANSFER_BUFFER_SIZE];
            try (InputStream in = body.byteStream();
                 OutputStream out = Files.newOutputStream(target)) {
                int read;
                while ((read = in.read(buffer)) != -1) {
                    out.write(buffer, 0, read);
                    transferred += read;
                    listener.onProgress(transferred, total);
                    if (clock.instant().isAfter(deadline)) {
                        call.cancel();
                        throw new TransferTimeoutException(url, transferred);
                    }
                }
            }

            if (transferred == 0) {
                throw new TransferException("Stream was empty", url);
            }
            log.debug("Transferred {} bytes to {}", transferred, target.getFileName());
            return transferred;

        } catch (InterruptedIOException e) {
            if (!clock.instant().isBefore(deadline) || call.isCanceled()) {
                throw new TransferTimeoutException(url, transferred);
            }
            throw new TransferException("Transfer stalled: " + e.getMessage(), e, url);
        } catch (IOException e) {
            if (call.isCanceled() && !clock.instant().isBefore(deadline)) {
                throw new TransferTimeoutException(url, transferred);
            }
            throw new TransferException("Transfer failed: " + e.getMessage(), e, url);
        }
    }
}
