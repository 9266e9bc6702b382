package com.workledger.api.repository;

import com.workledger.api.model.ExtractionJob;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ExtractionJobRepository extends JpaRepository<ExtractionJob, UUID> {

    boolean existsByUserIdAndProcessingTrue(String userId);

    Optional<ExtractionJob> findByJobIdAndUserId(UUID jobId, String userId);

    Optional<ExtractionJob> findFirstByUserIdOrderByCreatedAtDesc(String userId);

    List<ExtractionJob> findByProcessingTrueAndUpdatedAtBefore(OffsetDateTime cutoff);

    // Row lock for terminal transitions, so a heartbeat tick cannot interleave
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT j FROM ExtractionJob j WHERE j.jobId = :jobId")
    Optional<ExtractionJob> findByIdForUpdate(@Param("jobId") UUID jobId);

    // ===================================================================
    // Guarded updates: no effect once the job is terminal, never lower progress
    // ===================================================================

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE ExtractionJob j
               SET j.progress = :progress, j.message = :message, j.updatedAt = :now
             WHERE j.jobId = :jobId
               AND j.processing = true
               AND j.progress <= :progress
            """)
    int advanceProgress(@Param("jobId") UUID jobId,
                        @Param("progress") int progress,
                        @Param("message") String message,
                        @Param("now") OffsetDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE ExtractionJob j
               SET j.message = :message, j.updatedAt = :now
             WHERE j.jobId = :jobId
               AND j.processing = true
            """)
    int updateMessage(@Param("jobId") UUID jobId,
                      @Param("message") String message,
                      @Param("now") OffsetDateTime now);

    // Compare-and-set on the progress value read by the heartbeat
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE ExtractionJob j
               SET j.progress = :newProgress, j.message = :message, j.updatedAt = :now
             WHERE j.jobId = :jobId
               AND j.processing = true
               AND j.progress = :expectedProgress
            """)
    int compareAndSetProgress(@Param("jobId") UUID jobId,
                              @Param("expectedProgress") int expectedProgress,
                              @Param("newProgress") int newProgress,
                              @Param("message") String message,
                              @Param("now") OffsetDateTime now);
}
