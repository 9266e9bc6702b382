package com.workledger.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * A raw row as reported by the extraction worker, before enrichment.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExtractedEntry(
        String date,
        String day,
        BigDecimal hours,
        String client,
        String project,
        @JsonProperty("employee_name") String employeeName,
        @JsonProperty("employee_id") String employeeId,
        @JsonProperty("sender_email") String senderEmail,
        String activity
) {}
