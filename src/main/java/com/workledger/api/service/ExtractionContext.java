package com.workledger.api.service;

import com.workledger.api.model.Employee;
import com.workledger.api.model.GmailSettings;
import com.workledger.api.model.Project;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Everything the detached pipeline needs, loaded and validated during admission.
 */
public record ExtractionContext(
        UUID jobId,
        String userId,
        GmailSettings gmailSettings,
        List<Employee> employees,
        List<Project> projects,
        String senderFilter,
        LocalDate startDate,
        LocalDate endDate,
        String extractedBy
) {

    @Override
    public String toString() {
        return "ExtractionContext[jobId=" + jobId + ", userId=" + userId + ", employees=" + employees.size()
                + ", projects=" + projects.size() + ", range=" + startDate + ".." + endDate + "]";
    }
}
