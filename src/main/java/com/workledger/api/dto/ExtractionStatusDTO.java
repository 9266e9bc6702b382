package com.workledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.workledger.api.model.ExtractionJob;

import java.util.List;
import java.util.UUID;

/**
 * Read-only view of an extraction job for polling clients.
 * {@code success} is derived: no error, and either still running or something was extracted.
 */
public record ExtractionStatusDTO(
        boolean success,
        @JsonProperty("is_processing") boolean processing,
        int progress,
        String message,
        String error,
        List<TimesheetEntryDTO> data,
        Status status,
        UUID extractionId
) {

    public record Status(Result result) {}

    public record Result(
            @JsonProperty("total_entries") int totalEntries,
            @JsonProperty("total_entries_processed") int totalEntriesProcessed,
            @JsonProperty("total_entries_inserted_into_db") int totalEntriesInserted,
            @JsonProperty("search_method") String searchMethod,
            @JsonProperty("new_extracted_entries") List<TimesheetEntryDTO> newExtractedEntries
    ) {}

    // Convenience constructor mapping from the entity
    public ExtractionStatusDTO(ExtractionJob job) {
        this(
                job.getError() == null && (job.isProcessing() || !entriesOf(job).isEmpty()),
                job.isProcessing(),
                job.getProgress(),
                job.getMessage(),
                job.getError(),
                entriesOf(job),
                new Status(new Result(
                        valueOrZero(job.getTotalEntries()),
                        valueOrZero(job.getTotalEntriesProcessed()),
                        valueOrZero(job.getTotalEntriesInserted()),
                        job.getSearchMethod() != null ? job.getSearchMethod() : "",
                        entriesOf(job)
                )),
                job.getJobId()
        );
    }

    public static ExtractionStatusDTO notFound() {
        return new ExtractionStatusDTO(
                false, false, 0, "No extraction found", null, List.of(),
                new Status(new Result(0, 0, 0, "", List.of())), null
        );
    }

    private static List<TimesheetEntryDTO> entriesOf(ExtractionJob job) {
        return job.getExtractedEntries() != null ? job.getExtractedEntries() : List.of();
    }

    private static int valueOrZero(Integer value) {
        return value != null ? value : 0;
    }
}
