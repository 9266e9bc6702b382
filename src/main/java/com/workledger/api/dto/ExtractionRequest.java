package com.workledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ExtractionRequest(
        String userId,
        @JsonProperty("sender_filter") String senderFilter,
        @JsonProperty("start_date") String startDate,
        @JsonProperty("end_date") String endDate,
        @JsonProperty("extracted_by") String extractedBy
) {

    public ExtractionRequest withExtractedBy(String extractedBy) {
        return new ExtractionRequest(userId, senderFilter, startDate, endDate, extractedBy);
    }
}
