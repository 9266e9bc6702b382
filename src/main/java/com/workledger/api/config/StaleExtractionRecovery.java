package com.workledger.api.config;

import com.workledger.api.model.ExtractionJob;
import com.workledger.api.repository.ExtractionJobRepository;
import com.workledger.api.service.ExtractionProgressService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Closes jobs left processing by an instance that died mid-run.
 * A job counts as abandoned once it has gone quiet for longer than the worker timeout plus a grace period.
 * The sweep runs at startup and then every {@code extraction.recovery.sweep-interval}, so a job orphaned
 * shortly before a restart is still closed once it crosses the cutoff.
 */
@Component
public class StaleExtractionRecovery implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(StaleExtractionRecovery.class);

    static final String INTERRUPTED_ERROR = "Extraction interrupted before completion";

    private final ExtractionJobRepository jobRepository;
    private final ExtractionProgressService progressService;
    private final ExtractionProperties properties;
    private final Clock clock;

    public StaleExtractionRecovery(ExtractionJobRepository jobRepository,
                                   ExtractionProgressService progressService,
                                   ExtractionProperties properties,
                                   Clock clock) {
        this.jobRepository = jobRepository;
        this.progressService = progressService;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public void run(String... args) {
        if (!properties.getRecovery().isEnabled()) {
            logger.info("Stale extraction recovery disabled");
            return;
        }
        int recovered = recoverAbandoned();
        logger.info("Startup sweep recovered {} abandoned extractions", recovered);
    }

    @Scheduled(fixedDelayString = "${extraction.recovery.sweep-interval:PT1M}",
            initialDelayString = "${extraction.recovery.sweep-interval:PT1M}")
    public void sweep() {
        if (!properties.getRecovery().isEnabled()) {
            return;
        }
        int recovered = recoverAbandoned();
        if (recovered > 0) {
            logger.info("Periodic sweep recovered {} abandoned extractions", recovered);
        }
    }

    /**
     * @return how many still-processing jobs past the cutoff were marked failed
     */
    int recoverAbandoned() {
        OffsetDateTime cutoff = OffsetDateTime.now(clock)
                .minus(properties.getWorker().getTimeout())
                .minus(properties.getRecovery().getGrace());
        List<ExtractionJob> stale = jobRepository.findByProcessingTrueAndUpdatedAtBefore(cutoff);
        if (stale.isEmpty()) {
            logger.debug("No abandoned extractions older than {}", cutoff);
            return 0;
        }

        int recovered = 0;
        for (ExtractionJob job : stale) {
            if (progressService.fail(job.getJobId(), INTERRUPTED_ERROR)) {
                logger.warn("[Extraction {}] Abandoned at {}% (last update {}), marked failed",
                        job.getJobId(), job.getProgress(), job.getUpdatedAt());
                recovered++;
            }
        }
        return recovered;
    }
}
