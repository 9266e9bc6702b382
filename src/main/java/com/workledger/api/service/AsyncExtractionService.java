package com.workledger.api.service;

import com.workledger.api.config.ExtractionProperties;
import com.workledger.api.dto.TimesheetEntryDTO;
import com.workledger.api.worker.ExtractionWorker;
import com.workledger.api.worker.WorkerRequest;
import com.workledger.api.worker.WorkerResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

@Service
public class AsyncExtractionService {

    private static final Logger logger = LoggerFactory.getLogger(AsyncExtractionService.class);

    private final ExtractionProgressService progressService;
    private final HeartbeatProgressSimulator heartbeatSimulator;
    private final ExtractionWorker worker;
    private final TimesheetPostProcessor postProcessor;
    private final TimesheetMergeService mergeService;
    private final ExtractionNotificationService notificationService;
    private final ExtractionProperties properties;

    public AsyncExtractionService(ExtractionProgressService progressService,
                                  HeartbeatProgressSimulator heartbeatSimulator,
                                  ExtractionWorker worker,
                                  TimesheetPostProcessor postProcessor,
                                  TimesheetMergeService mergeService,
                                  ExtractionNotificationService notificationService,
                                  ExtractionProperties properties) {
        this.progressService = progressService;
        this.heartbeatSimulator = heartbeatSimulator;
        this.worker = worker;
        this.postProcessor = postProcessor;
        this.mergeService = mergeService;
        this.notificationService = notificationService;
        this.properties = properties;
    }

    /**
     * Runs one extraction end to end on the extraction executor.
     * Whatever happens, the job is terminal when this returns and the worker's
     * result file has been discarded.
     */
    @Async("extractionExecutor")
    public void processExtraction(ExtractionContext context) {
        UUID jobId = context.jobId();

        if (!progressService.isActive(jobId)) {
            logger.warn("[Extraction {}] Job is not active, skipping", jobId);
            return;
        }

        try {
            runPipeline(context);
        } catch (Exception e) {
            logger.error("[Extraction {}] Extraction failed", jobId, e);
            progressService.fail(jobId, "Error: " + describe(e));
        } finally {
            if (worker.discardResult(jobId)) {
                logger.debug("[Extraction {}] Result file removed", jobId);
            }
        }
    }

    private void runPipeline(ExtractionContext context) {
        UUID jobId = context.jobId();
        logger.info("[Extraction {}] Starting for user {} ({} to {})",
                jobId, context.userId(), context.startDate(), context.endDate());

        // 1. Employee/project mapping
        progressService.advance(jobId, 15, "Preparing employee mapping...");
        pause();

        EmployeeProjectMap mapping = EmployeeProjectMap.build(
                context.employees(), context.projects(), properties.getClientSuffix());
        logger.info("[Extraction {}] Built mapping for {} employees", jobId, mapping.size());

        progressService.advance(jobId, 25, "Connecting to Gmail (" + context.startDate() + " to " + context.endDate() + ")...");
        pause();

        // 2. Worker, with the heartbeat running until it resolves
        progressService.advance(jobId, 30, "Processing emails and attachments...");

        WorkerRequest request = new WorkerRequest(
                context.gmailSettings().getGmailEmail(),
                context.gmailSettings().getGmailPassword(),
                context.senderFilter(),
                mapping.asMap(),
                jobId,
                context.startDate().toString(),
                context.endDate().toString());

        WorkerResult result;
        try (HeartbeatProgressSimulator.Heartbeat ignored = heartbeatSimulator.start(jobId)) {
            result = worker.run(request);
        }

        if (!result.success()) {
            String error = result.message() != null ? result.message() : "Failed to extract timesheets";
            logger.error("[Extraction {}] Worker {}: {} {}", jobId,
                    result.outcome() == WorkerResult.Outcome.TIMED_OUT ? "timed out" : "failed",
                    error, result.errors());
            progressService.fail(jobId, error);
            return;
        }

        // 3. Analysis
        progressService.advance(jobId, 80, "Analyzing extracted data...");
        pause();

        if (result.extractedData().isEmpty()) {
            logger.info("[Extraction {}] No timesheet entries found", jobId);
            progressService.completeEmpty(jobId);
            return;
        }

        LeaveCalendar calendar = postProcessor.loadCalendar();
        List<TimesheetEntryDTO> entries = postProcessor.process(result.extractedData(), mapping, calendar);
        logger.info("[Extraction {}] {} of {} extracted rows kept after post-processing",
                jobId, entries.size(), result.extractedData().size());

        // 4. Merge
        progressService.advance(jobId, 95, "Saving " + entries.size() + " entries to database...");

        int written;
        try {
            written = mergeService.merge(entries);
        } catch (RuntimeException e) {
            logger.error("[Extraction {}] Timesheet merge failed", jobId, e);
            progressService.fail(jobId, "Database error: " + describe(e));
            return;
        }

        // 5. Notify and finish
        notificationService.notifyEmployees(jobId, entries, context.extractedBy());
        progressService.complete(jobId, entries, written);
        logger.info("[Extraction {}] Completed: {} entries, {} rows written", jobId, entries.size(), written);
    }

    private void pause() {
        Duration delay = properties.getPhaseDelay();
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
