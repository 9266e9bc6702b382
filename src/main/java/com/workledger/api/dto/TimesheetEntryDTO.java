package com.workledger.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * A post-processed extraction row: project and required hours resolved from the
 * employee mapping, activity reclassified against the holiday and leave calendars.
 * This is both the merge input and the shape returned to polling clients.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TimesheetEntryDTO(
        String date,
        String day,
        BigDecimal hours,
        @JsonProperty("required_hours") BigDecimal requiredHours,
        String activity,
        String client,
        String project,
        @JsonProperty("employee_name") String employeeName,
        @JsonProperty("employee_id") String employeeId,
        @JsonProperty("sender_email") String senderEmail
) {}
