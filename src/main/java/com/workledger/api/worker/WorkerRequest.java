package com.workledger.api.worker;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.workledger.api.service.EmployeeProjectMap;

import java.util.Map;
import java.util.UUID;

/**
 * The JSON document written to the worker's stdin.
 * {@code results_id} tells the worker which result file to write.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkerRequest(
        @JsonProperty("gmail_email") String gmailEmail,
        @JsonProperty("gmail_password") String gmailPassword,
        @JsonProperty("sender_filter") String senderFilter,
        @JsonProperty("employee_mapping") Map<String, EmployeeProjectMap.EmployeeMapping> employeeMapping,
        @JsonProperty("results_id") UUID jobId,
        @JsonProperty("start_date") String startDate,
        @JsonProperty("end_date") String endDate
) {

    @Override
    public String toString() {
        // Credentials stay out of logs
        return "WorkerRequest[jobId=" + jobId + ", gmailEmail=" + gmailEmail + ", senderFilter=" + senderFilter
                + ", employees=" + (employeeMapping != null ? employeeMapping.size() : 0)
                + ", startDate=" + startDate + ", endDate=" + endDate + "]";
    }
}
