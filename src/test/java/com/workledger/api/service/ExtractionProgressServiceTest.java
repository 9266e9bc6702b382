package com.workledger.api.service;

import com.workledger.api.dto.TimesheetEntryDTO;
import com.workledger.api.model.ExtractionJob;
import com.workledger.api.repository.ExtractionJobRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ExtractionProgressServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-01T10:00:00Z"), ZoneOffset.UTC);

    @Mock
    private ExtractionJobRepository jobRepository;

    private ExtractionProgressService progressService;

    private UUID jobId;

    @BeforeEach
    void setUp() {
        progressService = new ExtractionProgressService(jobRepository, CLOCK);
        jobId = UUID.randomUUID();
    }

    @Test
    @DisplayName("A new job starts processing at 5%")
    void createJobWritesInitialRow() {
        // given
        when(jobRepository.saveAndFlush(any(ExtractionJob.class))).thenAnswer(inv -> inv.getArgument(0));

        // when
        ExtractionJob job = progressService.createJob(jobId, "user-1", "Date range: a to b", "Dana");

        // then
        assertThat(job.isProcessing()).isTrue();
        assertThat(job.getProgress()).isEqualTo(5);
        assertThat(job.getMessage()).isEqualTo("Starting extraction...");
        assertThat(job.getExtractedBy()).isEqualTo("Dana");
        assertThat(job.getCreatedAt()).isEqualTo(OffsetDateTime.now(CLOCK));
    }

    @Test
    @DisplayName("Heartbeat moves progress up by one step from the stored value")
    void nudgeAdvancesFromStoredProgress() {
        // given
        when(jobRepository.findById(jobId)).thenReturn(Optional.of(job(30, true)));
        when(jobRepository.compareAndSetProgress(eq(jobId), eq(30), eq(33), anyString(), any())).thenReturn(1);

        // when
        Optional<Integer> next = progressService.nudge(jobId, 3, 75);

        // then
        assertThat(next).contains(33);
        verify(jobRepository).compareAndSetProgress(jobId, 30, 33, "Processing email attachments...",
                OffsetDateTime.now(CLOCK));
    }

    @Test
    @DisplayName("Heartbeat never passes the ceiling")
    void nudgeCapsAtCeiling() {
        // given
        when(jobRepository.findById(jobId)).thenReturn(Optional.of(job(74, true)));
        when(jobRepository.compareAndSetProgress(eq(jobId), eq(74), eq(75), anyString(), any())).thenReturn(1);

        // when / then
        assertThat(progressService.nudge(jobId, 3, 75)).contains(75);
    }

    @Test
    @DisplayName("Heartbeat leaves progress alone at or above the ceiling")
    void nudgeSkipsWhenAtCeiling() {
        when(jobRepository.findById(jobId)).thenReturn(Optional.of(job(80, true)));

        assertThat(progressService.nudge(jobId, 3, 75)).isEmpty();
        verify(jobRepository, never()).compareAndSetProgress(any(), anyInt(), anyInt(), anyString(), any());
    }

    @Test
    @DisplayName("Heartbeat does not write to a terminal job")
    void nudgeSkipsTerminalJob() {
        when(jobRepository.findById(jobId)).thenReturn(Optional.of(job(40, false)));

        assertThat(progressService.nudge(jobId, 3, 75)).isEmpty();
        verify(jobRepository, never()).compareAndSetProgress(any(), anyInt(), anyInt(), anyString(), any());
    }

    @Test
    @DisplayName("A lost compare-and-set reports no write")
    void nudgeLosesRace() {
        when(jobRepository.findById(jobId)).thenReturn(Optional.of(job(30, true)));
        when(jobRepository.compareAndSetProgress(eq(jobId), eq(30), eq(33), anyString(), any())).thenReturn(0);

        assertThat(progressService.nudge(jobId, 3, 75)).isEmpty();
    }

    @Test
    @DisplayName("Failure records the error and keeps the last progress")
    void failKeepsProgress() {
        // given
        ExtractionJob job = job(42, true);
        when(jobRepository.findByIdForUpdate(jobId)).thenReturn(Optional.of(job));

        // when
        boolean finished = progressService.fail(jobId, "Extraction worker timed out after 5 minutes");

        // then
        assertThat(finished).isTrue();
        assertThat(job.isProcessing()).isFalse();
        assertThat(job.getProgress()).isEqualTo(42);
        assertThat(job.getError()).contains("timed out");
        assertThat(job.getCompletedAt()).isEqualTo(OffsetDateTime.now(CLOCK));
        verify(jobRepository).save(job);
    }

    @Test
    @DisplayName("A terminal job is never updated again")
    void terminalJobIsNotRewritten() {
        // given
        ExtractionJob job = job(100, false);
        when(jobRepository.findByIdForUpdate(jobId)).thenReturn(Optional.of(job));

        // when
        boolean finished = progressService.fail(jobId, "late failure");

        // then
        assertThat(finished).isFalse();
        assertThat(job.getError()).isNull();
        verify(jobRepository, never()).save(any());
    }

    @Test
    @DisplayName("Completion stores the processed rows and counts")
    void completeStoresEntries() {
        // given
        ExtractionJob job = job(95, true);
        when(jobRepository.findByIdForUpdate(jobId)).thenReturn(Optional.of(job));
        TimesheetEntryDTO row = new TimesheetEntryDTO("2024-05-01", "Wednesday", BigDecimal.TEN, BigDecimal.TEN,
                "WORK", "acme", "Portal", "Alice", "E1", "alice@example.com");

        // when
        progressService.complete(jobId, List.of(row), 1);

        // then
        assertThat(job.getProgress()).isEqualTo(100);
        assertThat(job.getMessage()).isEqualTo("Extraction completed successfully");
        assertThat(job.getTotalEntries()).isEqualTo(1);
        assertThat(job.getTotalEntriesInserted()).isEqualTo(1);
        assertThat(job.getExtractedEntries()).containsExactly(row);
        assertThat(job.getError()).isNull();
    }

    @Test
    @DisplayName("An empty result completes at 100% with zero counts")
    void completeEmpty() {
        ExtractionJob job = job(80, true);
        when(jobRepository.findByIdForUpdate(jobId)).thenReturn(Optional.of(job));

        progressService.completeEmpty(jobId);

        assertThat(job.getProgress()).isEqualTo(100);
        assertThat(job.getTotalEntries()).isZero();
        assertThat(job.getTotalEntriesInserted()).isZero();
        assertThat(job.getError()).isNull();
        assertThat(job.isProcessing()).isFalse();
    }

    @Test
    void heartbeatMessagesFollowPhase() {
        assertThat(ExtractionProgressService.heartbeatMessage(33)).isEqualTo("Processing email attachments...");
        assertThat(ExtractionProgressService.heartbeatMessage(51)).isEqualTo("Extracting timesheet data...");
        assertThat(ExtractionProgressService.heartbeatMessage(75)).isEqualTo("Finalizing extraction...");
    }

    private ExtractionJob job(int progress, boolean processing) {
        ExtractionJob job = new ExtractionJob(jobId, "user-1", OffsetDateTime.now(CLOCK).minusMinutes(1));
        job.setProgress(progress);
        job.setProcessing(processing);
        return job;
    }
}
