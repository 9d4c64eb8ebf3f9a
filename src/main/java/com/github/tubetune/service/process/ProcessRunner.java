package com.github.tubetune.service.process;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs external tools (yt-dlp, ffmpeg) with a hard wall-clock timeout.
 * Stdout and stderr are drained on their own threads so a chatty tool can never
 * block past its deadline.
 */
@Slf4j
@Component
public class ProcessRunner {

    private static final long DRAIN_GRACE_SECONDS = 5;

    // Track running processes so shutdown can kill them
    private final ConcurrentHashMap<Long, Process> runningProcesses = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public ProcessRunner() {
        Runtime.getRuntime().addShutdownHook(new Thread(this::killAll, "ProcessRunner-ShutdownHook"));
    }

    /**
     * Run a command to completion or until the timeout expires.
     * On timeout or interruption the process and its descendants are killed.
     *
     * @param command Command line
     * @param timeout Hard wall-clock limit
     * @return Exit code and captured output
     * @throws IOException if the process cannot be started
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public ProcessResult run(@NonNull List<String> command, @NonNull Duration timeout)
            throws IOException, InterruptedException {

        log.debug("Executing: {}", String.join(" ", command));

        Process process = new ProcessBuilder(command).start();
        long key = sequence.incrementAndGet();
        runningProcesses.put(key, process);

        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();
        Thread stdoutReader = drain(process.getInputStream(), stdout, "proc-out-" + key);
        Thread stderrReader = drain(process.getErrorStream(), stderr, "proc-err-" + key);

        try {
            boolean completed = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);

            if (!completed) {
                log.warn("Process timed out after {}s: {}", timeout.toSeconds(), command.get(0));
                kill(process);
                process.waitFor(DRAIN_GRACE_SECONDS, TimeUnit.SECONDS);
            }

            stdoutReader.join(TimeUnit.SECONDS.toMillis(DRAIN_GRACE_SECONDS));
            stderrReader.join(TimeUnit.SECONDS.toMillis(DRAIN_GRACE_SECONDS));

            int exitCode = completed ? process.exitValue() : -1;
            return new ProcessResult(exitCode, snapshot(stdout), snapshot(stderr), !completed);
        } catch (InterruptedException e) {
            kill(process);
            throw e;
        } finally {
            runningProcesses.remove(key);
        }
    }

    /**
     * Kill every process still running.
     */
    public void killAll() {
        runningProcesses.values().forEach(this::kill);
    }

    public int getRunningCount() {
        return runningProcesses.size();
    }

    private void kill(Process process) {
        if (process.isAlive()) {
            log.debug("Killing process {} and descendants", process.pid());
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
        }
    }

    private static String snapshot(StringBuilder sink) {
        synchronized (sink) {
            return sink.toString();
        }
    }

    private Thread drain(InputStream stream, StringBuilder sink, String name) {
        Thread reader = new Thread(() -> {
            try (BufferedReader buffered = new BufferedReader(
                    new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = buffered.readLine()) != null) {
                    synchronized (sink) {
                        sink.append(line).append('\n');
                    }
                }
            } catch (IOException e) {
                log.debug("Output stream closed for {}: {}", name, e.getMessage());
            }
        }, name);
        reader.setDaemon(true);
        reader.start();
        return reader;
    }
}
