package com.workledger.api.service;

import com.workledger.api.dto.TimesheetEntryDTO;
import com.workledger.api.model.ExtractionJob;
import com.workledger.api.repository.ExtractionJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Every write to the extraction_progress table goes through here.
 * After creation, writes only land while the job is still processing, and
 * progress is never lowered. A terminal job is never touched again.
 */
@Service
public class ExtractionProgressService {

    private static final Logger logger = LoggerFactory.getLogger(ExtractionProgressService.class);

    private final ExtractionJobRepository jobRepository;
    private final Clock clock;

    public ExtractionProgressService(ExtractionJobRepository jobRepository, Clock clock) {
        this.jobRepository = jobRepository;
        this.clock = clock;
    }

    /**
     * Inserts the initial row (progress 5). Commits on return, so the detached
     * pipeline can see it. A unique-index violation means another active job
     * for the same user won the race.
     */
    @Transactional
    public ExtractionJob createJob(UUID jobId, String userId, String searchMethod, String extractedBy) {
        ExtractionJob job = new ExtractionJob(jobId, userId, now());
        job.setSearchMethod(searchMethod);
        job.setExtractedBy(extractedBy);
        return jobRepository.saveAndFlush(job);
    }

    @Transactional(readOnly = true)
    public boolean hasActiveJob(String userId) {
        return jobRepository.existsByUserIdAndProcessingTrue(userId);
    }

    @Transactional(readOnly = true)
    public Optional<ExtractionJob> find(UUID jobId) {
        return jobRepository.findById(jobId);
    }

    @Transactional(readOnly = true)
    public boolean isActive(UUID jobId) {
        return jobRepository.findById(jobId).map(ExtractionJob::isProcessing).orElse(false);
    }

    @Transactional
    public boolean advance(UUID jobId, int progress, String message) {
        int updated = jobRepository.advanceProgress(jobId, progress, message, now());
        if (updated == 0) {
            logger.debug("[Extraction {}] Ignored progress {} ({}): job is terminal or already further along",
                    jobId, progress, message);
        }
        return updated > 0;
    }

    @Transactional
    public boolean updateMessage(UUID jobId, String message) {
        return jobRepository.updateMessage(jobId, message, now()) > 0;
    }

    /**
     * Heartbeat step: reads the current progress and moves it up by {@code step}, capped at
     * {@code ceiling}. Returns the new value, or empty when nothing was written (terminal job,
     * already at or past the ceiling, or another writer moved progress in between).
     */
    @Transactional
    public Optional<Integer> nudge(UUID jobId, int step, int ceiling) {
        Optional<ExtractionJob> current = jobRepository.findById(jobId);
        if (current.isEmpty() || current.get().isTerminal()) {
            return Optional.empty();
        }

        int progress = current.get().getProgress();
        if (progress >= ceiling) {
            return Optional.empty();
        }

        int next = Math.min(progress + step, ceiling);
        int updated = jobRepository.compareAndSetProgress(jobId, progress, next, heartbeatMessage(next), now());
        return updated > 0 ? Optional.of(next) : Optional.empty();
    }

    @Transactional
    public boolean completeEmpty(UUID jobId) {
        return finish(jobId, job -> {
            job.setProgress(100);
            job.setMessage("Extraction completed - no timesheet entries found");
            job.setTotalEntries(0);
            job.setTotalEntriesProcessed(0);
            job.setTotalEntriesInserted(0);
            job.setExtractedEntries(new ArrayList<>());
        });
    }

    @Transactional
    public boolean complete(UUID jobId, List<TimesheetEntryDTO> entries, int insertedCount) {
        return finish(jobId, job -> {
            job.setProgress(100);
            job.setMessage("Extraction completed successfully");
            job.setTotalEntries(entries.size());
            job.setTotalEntriesProcessed(entries.size());
            job.setTotalEntriesInserted(insertedCount);
            job.setExtractedEntries(new ArrayList<>(entries));
        });
    }

    /**
     * Terminal failure. Progress stays where it was.
     */
    @Transactional
    public boolean fail(UUID jobId, String error) {
        return finish(jobId, job -> {
            job.setError(error);
            job.setMessage("Extraction failed");
        });
    }

    private boolean finish(UUID jobId, Consumer<ExtractionJob> outcome) {
        Optional<ExtractionJob> locked = jobRepository.findByIdForUpdate(jobId);
        if (locked.isEmpty()) {
            logger.warn("[Extraction {}] Terminal update for unknown job ignored", jobId);
            return false;
        }

        ExtractionJob job = locked.get();
        if (job.isTerminal()) {
            logger.warn("[Extraction {}] Job already terminal, later outcome ignored", jobId);
            return false;
        }

        outcome.accept(job);
        OffsetDateTime now = now();
        job.setProcessing(false);
        job.setUpdatedAt(now);
        job.setCompletedAt(now);
        jobRepository.save(job);
        return true;
    }

    static String heartbeatMessage(int progress) {
        if (progress < 50) {
            return "Processing email attachments...";
        } else if (progress < 70) {
            return "Extracting timesheet data...";
        }
        return "Finalizing extraction...";
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}
