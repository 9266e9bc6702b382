package com.workledger.api.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.workledger.api.model.Employee;
import com.workledger.api.model.Project;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory lookup from lowercase employee email to identity and client assignments.
 * Rebuilt for every extraction run and sent to the worker as {@code employee_mapping}.
 */
public final class EmployeeProjectMap {

    private static final Logger logger = LoggerFactory.getLogger(EmployeeProjectMap.class);

    private final Map<String, EmployeeMapping> byEmail;
    private final String clientSuffix;

    private EmployeeProjectMap(Map<String, EmployeeMapping> byEmail, String clientSuffix) {
        this.byEmail = byEmail;
        this.clientSuffix = clientSuffix;
    }

    public record EmployeeMapping(
            String name,
            @JsonProperty("employee_id") String employeeId,
            Map<String, ProjectAssignment> projects
    ) {}

    public record ProjectAssignment(
            String project,
            @JsonProperty("required_hours") BigDecimal requiredHours
    ) {}

    /**
     * One entry per distinct employee email, then each project row attached under its
     * employee by normalized client name. A project whose employee is missing from the
     * employee list gets a minimal entry of its own instead of failing the run.
     */
    public static EmployeeProjectMap build(List<Employee> employees, List<Project> projects, String clientSuffix) {
        Map<String, EmployeeMapping> byEmail = new LinkedHashMap<>();

        for (Employee employee : employees) {
            if (employee.getEmail() == null || employee.getEmail().isBlank()) {
                logger.warn("Skipping employee {} without an email", employee.getEmployeeId());
                continue;
            }
            byEmail.putIfAbsent(emailKey(employee.getEmail()),
                    new EmployeeMapping(employee.getName(), employee.getEmployeeId(), new LinkedHashMap<>()));
        }

        for (Project project : projects) {
            if (project.getEmployeeEmail() == null || project.getClient() == null) {
                logger.warn("Skipping project row {} without employee email or client", project.getId());
                continue;
            }
            String emailKey = emailKey(project.getEmployeeEmail());
            String client = normalizeClient(project.getClient(), clientSuffix);
            BigDecimal requiredHours = project.getHours() != null ? project.getHours() : BigDecimal.ZERO;

            EmployeeMapping mapping = byEmail.get(emailKey);
            if (mapping == null) {
                logger.warn("Employee {} found in projects but not in employees table", project.getEmployeeEmail());
                mapping = new EmployeeMapping(project.getEmployeeName(), project.getEmployeeId(), new LinkedHashMap<>());
                byEmail.put(emailKey, mapping);
            }

            // A repeated client keeps the first project name, the latest row sets the hours
            ProjectAssignment existing = mapping.projects().get(client);
            String projectName = existing != null ? existing.project() : project.getProjectName();
            mapping.projects().put(client, new ProjectAssignment(projectName, requiredHours));
        }

        return new EmployeeProjectMap(byEmail, clientSuffix);
    }

    public Optional<ProjectAssignment> resolve(String senderEmail, String client) {
        if (senderEmail == null || client == null) {
            return Optional.empty();
        }
        EmployeeMapping mapping = byEmail.get(emailKey(senderEmail));
        if (mapping == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(mapping.projects().get(normalizeClient(client, clientSuffix)));
    }

    public Optional<EmployeeMapping> employee(String email) {
        return email == null ? Optional.empty() : Optional.ofNullable(byEmail.get(emailKey(email)));
    }

    public Map<String, EmployeeMapping> asMap() {
        return Collections.unmodifiableMap(byEmail);
    }

    public int size() {
        return byEmail.size();
    }

    static String normalizeClient(String client, String suffix) {
        String lower = client.toLowerCase(Locale.ROOT);
        if (suffix != null && !suffix.isEmpty()) {
            lower = lower.replace(suffix.toLowerCase(Locale.ROOT), "");
        }
        return lower.trim();
    }

    private static String emailKey(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
