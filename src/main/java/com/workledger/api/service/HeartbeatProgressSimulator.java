package com.workledger.api.service;

import com.workledger.api.config.ExtractionProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.ScheduledFuture;

/**
 * Moves a job's visible progress forward while the worker runs, so pollers see motion.
 * Each tick re-reads the stored progress and never goes past the ceiling.
 */
@Component
public class HeartbeatProgressSimulator {

    private static final Logger logger = LoggerFactory.getLogger(HeartbeatProgressSimulator.class);

    private final ExtractionProgressService progressService;
    private final TaskScheduler scheduler;
    private final ExtractionProperties.Heartbeat settings;

    public HeartbeatProgressSimulator(ExtractionProgressService progressService,
                                      @Qualifier("heartbeatScheduler") TaskScheduler scheduler,
                                      ExtractionProperties properties) {
        this.progressService = progressService;
        this.scheduler = scheduler;
        this.settings = properties.getHeartbeat();
    }

    /**
     * Starts ticking for the job. Close the returned handle on every exit path;
     * after {@code close()} returns no further tick will write.
     */
    public Heartbeat start(UUID jobId) {
        Heartbeat heartbeat = new Heartbeat(jobId);
        heartbeat.future = scheduler.scheduleWithFixedDelay(heartbeat::tick,
                Instant.now().plus(settings.getInterval()), settings.getInterval());
        return heartbeat;
    }

    public final class Heartbeat implements AutoCloseable {

        private final UUID jobId;
        private volatile ScheduledFuture<?> future;
        private boolean closed;
        private int ticks;

        private Heartbeat(UUID jobId) {
            this.jobId = jobId;
        }

        private synchronized void tick() {
            if (closed) {
                return;
            }
            ticks++;
            try {
                progressService.nudge(jobId, settings.getStep(), settings.getCeiling())
                        .ifPresent(progress -> logger.debug("[Extraction {}] Heartbeat -> {}%", jobId, progress));
            } catch (RuntimeException e) {
                // One failed tick must not end the schedule
                logger.warn("[Extraction {}] Heartbeat tick failed: {}", jobId, e.getMessage());
            }
        }

        // Waits for an in-flight tick, so nothing writes after this returns
        @Override
        public synchronized void close() {
            if (closed) {
                return;
            }
            closed = true;
            if (future != null) {
                future.cancel(false);
            }
            logger.debug("[Extraction {}] Heartbeat stopped after {} ticks", jobId, ticks);
        }

        public synchronized boolean isClosed() {
            return closed;
        }

        public synchronized int ticks() {
            return ticks;
        }
    }
}
