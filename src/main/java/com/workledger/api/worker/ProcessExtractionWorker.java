package com.workledger.api.worker;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.workledger.api.config.ExtractionProperties;
import com.workledger.api.dto.ExtractedEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Runs the extraction worker as a child process.
 * <p>
 * The request goes in on stdin as one JSON document. The worker writes its full result to
 * {@code <results-dir>/timesheet_results_<job id>.json} before exiting; that file is
 * authoritative over the exit code. stdout and stderr are only kept for diagnostics.
 */
@Component
public class ProcessExtractionWorker implements ExtractionWorker {

    private static final Logger logger = LoggerFactory.getLogger(ProcessExtractionWorker.class);

    static final String RESULTS_DIR_ENV = "EXTRACTION_RESULTS_DIR";
    private static final long STREAM_JOIN_MILLIS = 1000;
    private static final long KILL_WAIT_SECONDS = 5;

    private final ExtractionProperties.Worker settings;
    private final ObjectMapper objectMapper;

    public ProcessExtractionWorker(ExtractionProperties properties, ObjectMapper objectMapper) {
        this.settings = properties.getWorker();
        this.objectMapper = objectMapper;
    }

    @Override
    public WorkerResult run(WorkerRequest request) {
        UUID jobId = request.jobId();
        Path resultFile = resultFile(jobId);
        Duration timeout = settings.getTimeout();

        // 1. Start the process
        Process process;
        try {
            Files.createDirectories(resultFile.getParent());
            process = processBuilder().start();
        } catch (IOException e) {
            logger.error("[Extraction {}] Failed to start worker {}", jobId, settings.getCommand(), e);
            return WorkerResult.failed("Failed to execute extraction worker: " + e.getMessage(),
                    List.of(e.getMessage()));
        }
        logger.info("[Extraction {}] Worker started (pid {}), timeout {}", jobId, process.pid(), timeout);

        StreamDrainer stdout = new StreamDrainer(jobId, "stdout", process.getInputStream(), false);
        StreamDrainer stderr = new StreamDrainer(jobId, "stderr", process.getErrorStream(), true);
        Thread stdoutThread = stdout.start();
        Thread stderrThread = stderr.start();

        // 2. Hand over the request and close stdin, off-thread so a worker that never reads
        //    cannot block us past the timeout
        Thread stdinThread = new Thread(() -> writeRequest(process, request), "extraction-stdin-" + jobId);
        stdinThread.setDaemon(true);
        stdinThread.start();

        // 3. Wait for exit or timeout, whichever comes first
        boolean exited;
        try {
            exited = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            kill(jobId, process);
            return WorkerResult.failed("Extraction worker was interrupted", List.of(stderr.text()));
        }

        if (!exited) {
            kill(jobId, process);
            join(stdoutThread, stderrThread);
            logger.warn("[Extraction {}] Worker killed after {}", jobId, timeout);
            return WorkerResult.timedOut("Extraction worker timed out after " + describe(timeout),
                    List.of("Timeout", stderr.text()));
        }

        join(stdoutThread, stderrThread);
        int exitCode = process.exitValue();
        logger.info("[Extraction {}] Worker exited with code {}", jobId, exitCode);

        // 4. The result file decides
        return readResult(jobId, resultFile, exitCode, stderr.text());
    }

    @Override
    public boolean discardResult(UUID jobId) {
        Path resultFile = resultFile(jobId);
        try {
            boolean deleted = Files.deleteIfExists(resultFile);
            if (deleted) {
                logger.info("[Extraction {}] Cleaned up results file {}", jobId, resultFile);
            }
            return deleted;
        } catch (IOException e) {
            logger.error("[Extraction {}] Cleanup of {} failed", jobId, resultFile, e);
            return false;
        }
    }

    Path resultFile(UUID jobId) {
        return Paths.get(settings.getResultsDir()).toAbsolutePath()
                .resolve("timesheet_results_" + jobId + ".json");
    }

    private ProcessBuilder processBuilder() {
        ProcessBuilder builder = new ProcessBuilder(settings.getCommand())
                .redirectErrorStream(false);
        if (settings.getWorkingDir() != null && !settings.getWorkingDir().isBlank()) {
            builder.directory(new File(settings.getWorkingDir()));
        }
        builder.environment().put(RESULTS_DIR_ENV,
                Paths.get(settings.getResultsDir()).toAbsolutePath().toString());
        return builder;
    }

    private WorkerResult readResult(UUID jobId, Path resultFile, int exitCode, String stderrText) {
        ResultDocument document;
        try {
            document = objectMapper.readValue(resultFile.toFile(), ResultDocument.class);
        } catch (IOException e) {
            logger.error("[Extraction {}] Error reading results file {}: {}", jobId, resultFile, e.getMessage());
            return WorkerResult.failed(
                    "Worker completed but results file couldn't be read. Exit code: " + exitCode,
                    List.of(stderrText, e.getMessage()));
        }

        boolean hasRows = document.extractedData() != null && !document.extractedData().isEmpty();
        if (Boolean.TRUE.equals(document.success()) || hasRows) {
            if (exitCode != 0) {
                logger.warn("[Extraction {}] Worker exited with {} but reported success", jobId, exitCode);
            }
            return WorkerResult.succeeded(document.extractedData(), document.message());
        }

        List<String> errors = new ArrayList<>();
        if (document.errors() != null) {
            errors.addAll(document.errors());
        }
        errors.add(stderrText);
        String message = document.message() != null && !document.message().isBlank()
                ? document.message()
                : "Worker process failed with code " + exitCode;
        return WorkerResult.failed(message, errors);
    }

    private void writeRequest(Process process, WorkerRequest request) {
        try (OutputStream stdin = process.getOutputStream()) {
            objectMapper.writeValue(stdin, request);
        } catch (IOException e) {
            // The worker may have exited before reading; its result file still decides the outcome
            logger.warn("[Extraction {}] Could not write request to worker stdin: {}",
                    request.jobId(), e.getMessage());
        }
    }

    private void kill(UUID jobId, Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            if (!process.waitFor(KILL_WAIT_SECONDS, TimeUnit.SECONDS)) {
                logger.error("[Extraction {}] Worker pid {} still alive after kill", jobId, process.pid());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void join(Thread... threads) {
        for (Thread thread : threads) {
            try {
                thread.join(STREAM_JOIN_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private static String describe(Duration timeout) {
        if (timeout.toSecondsPart() == 0 && timeout.toMinutes() > 0) {
            long minutes = timeout.toMinutes();
            return minutes + (minutes == 1 ? " minute" : " minutes");
        }
        return timeout.toMillis() + " ms";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ResultDocument(
            Boolean success,
            @JsonProperty("extracted_data") List<ExtractedEntry> extractedData,
            String message,
            List<String> errors
    ) {}

    /**
     * Copies one output stream of the worker into a bounded buffer and the log.
     */
    private final class StreamDrainer implements Runnable {

        private final UUID jobId;
        private final String name;
        private final InputStream stream;
        private final boolean keep;
        private final StringBuffer buffer = new StringBuffer();

        StreamDrainer(UUID jobId, String name, InputStream stream, boolean keep) {
            this.jobId = jobId;
            this.name = name;
            this.stream = stream;
            this.keep = keep;
        }

        Thread start() {
            Thread thread = new Thread(this, "extraction-" + name + "-" + jobId);
            thread.setDaemon(true);
            thread.start();
            return thread;
        }

        @Override
        public void run() {
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    logger.debug("[Extraction {}] worker {}: {}", jobId, name, line);
                    if (keep) {
                        append(line);
                    }
                }
            } catch (IOException e) {
                logger.debug("[Extraction {}] worker {} closed: {}", jobId, name, e.getMessage());
            }
        }

        private void append(String line) {
            buffer.append(line).append('\n');
            int overflow = buffer.length() - settings.getMaxDiagnosticChars();
            if (overflow > 0) {
                buffer.delete(0, overflow);
            }
        }

        String text() {
            return buffer.toString();
        }
    }
}
