package com.workledger.api.model;

import com.workledger.api.dto.TimesheetEntryDTO;
import io.hypersistence.utils.hibernate.type.json.JsonType;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.Type;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * One row per extraction run. Polled by clients through the status endpoint.
 */
@Entity
@Table(name = "extraction_progress")
@Getter
@Setter
public class ExtractionJob {

    @Id
    @Column(name = "extraction_id", nullable = false, updatable = false)
    private UUID jobId;

    @Column(name = "user_id", nullable = false, updatable = false)
    private String userId;

    @Column(name = "is_processing", nullable = false)
    private boolean processing;

    @Column(nullable = false)
    private int progress;

    @Column(length = 255)
    private String message;

    @Column(columnDefinition = "TEXT")
    private String error;

    @Column(name = "search_method")
    private String searchMethod;

    @Column(name = "extracted_by")
    private String extractedBy;

    @Column(name = "total_entries")
    private Integer totalEntries;

    @Column(name = "total_entries_processed")
    private Integer totalEntriesProcessed;

    @Column(name = "total_entries_inserted_into_db")
    private Integer totalEntriesInserted;

    // Denormalized copy of the processed rows, kept for the polling client
    @Type(JsonType.class)
    @Column(name = "new_extracted_entries", columnDefinition = "jsonb")
    private List<TimesheetEntryDTO> extractedEntries = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    protected ExtractionJob() {
    }

    public ExtractionJob(UUID jobId, String userId, OffsetDateTime createdAt) {
        this.jobId = jobId;
        this.userId = userId;
        this.processing = true;
        this.progress = 5;
        this.message = "Starting extraction...";
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    public boolean isTerminal() {
        return !processing;
    }
}
