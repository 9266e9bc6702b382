package com.workledger.api.service;

import com.workledger.api.config.ExtractionProperties;
import com.workledger.api.dto.ExtractionRequest;
import com.workledger.api.exception.ExtractionConflictException;
import com.workledger.api.exception.ExtractionRejectedException;
import com.workledger.api.exception.ExtractionValidationException;
import com.workledger.api.exception.MissingPrerequisiteException;
import com.workledger.api.model.Employee;
import com.workledger.api.model.GmailSettings;
import com.workledger.api.model.Project;
import com.workledger.api.repository.EmployeeRepository;
import com.workledger.api.repository.GmailSettingsRepository;
import com.workledger.api.repository.ProjectRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Validates a new extraction request, records the job and hands it to the background pipeline.
 * Checks run in a fixed order and the first violation wins.
 */
@Service
public class ExtractionAdmissionService {

    private static final Logger logger = LoggerFactory.getLogger(ExtractionAdmissionService.class);

    static final String CONFLICT_MESSAGE = "An extraction is already in progress. Please wait.";
    static final String DEFAULT_EXTRACTED_BY = "Manager";

    private final ExtractionProgressService progressService;
    private final AsyncExtractionService asyncExtractionService;
    private final GmailSettingsRepository gmailSettingsRepository;
    private final EmployeeRepository employeeRepository;
    private final ProjectRepository projectRepository;
    private final ExtractionProperties properties;
    private final Clock clock;

    // Users with an admission currently in flight on this instance
    private final Set<String> admitting = ConcurrentHashMap.newKeySet();

    public ExtractionAdmissionService(ExtractionProgressService progressService,
                                      AsyncExtractionService asyncExtractionService,
                                      GmailSettingsRepository gmailSettingsRepository,
                                      EmployeeRepository employeeRepository,
                                      ProjectRepository projectRepository,
                                      ExtractionProperties properties,
                                      Clock clock) {
        this.progressService = progressService;
        this.asyncExtractionService = asyncExtractionService;
        this.gmailSettingsRepository = gmailSettingsRepository;
        this.employeeRepository = employeeRepository;
        this.projectRepository = projectRepository;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * @return the new job id; the pipeline is already running when this returns
     * @throws ExtractionValidationException bad input or missing prerequisite data
     * @throws ExtractionConflictException the user already has an active job
     * @throws ExtractionRejectedException the background executor refused the job
     */
    public UUID admit(ExtractionRequest request) {
        String userId = request.userId();
        if (userId == null || userId.isBlank()) {
            throw new ExtractionValidationException("User ID is required");
        }

        if (!admitting.add(userId)) {
            logger.warn("Concurrent extraction request for user {} rejected", userId);
            throw new ExtractionConflictException(CONFLICT_MESSAGE);
        }
        try {
            return admitExclusively(userId, request);
        } finally {
            admitting.remove(userId);
        }
    }

    private UUID admitExclusively(String userId, ExtractionRequest request) {
        if (progressService.hasActiveJob(userId)) {
            throw new ExtractionConflictException(CONFLICT_MESSAGE);
        }

        if (isBlank(request.startDate()) || isBlank(request.endDate())) {
            throw new ExtractionValidationException("Start date and end date are required.");
        }
        LocalDate startDate = parseDate(request.startDate());
        LocalDate endDate = parseDate(request.endDate());

        if (startDate.isAfter(endDate)) {
            throw new ExtractionValidationException("Start date must be before or equal to end date");
        }
        if (startDate.isAfter(LocalDate.now(clock))) {
            throw new ExtractionValidationException("Start date cannot be in the future");
        }
        if (ChronoUnit.DAYS.between(startDate, endDate) > properties.getMaxRangeDays()) {
            throw new ExtractionValidationException(
                    "Date range cannot exceed " + properties.getMaxRangeDays() + " days");
        }

        GmailSettings gmailSettings = gmailSettingsRepository.findByUserId(userId)
                .filter(GmailSettings::isComplete)
                .orElseThrow(() -> new MissingPrerequisiteException(
                        "Gmail credentials not found. Please connect Gmail first."));

        List<Employee> employees = employeeRepository.findAll();
        if (employees.isEmpty()) {
            throw new MissingPrerequisiteException("Employee data not found. Please upload employee CSV first.");
        }
        List<Project> projects = projectRepository.findAll();
        if (projects.isEmpty()) {
            throw new MissingPrerequisiteException("Project data not found. Please upload project CSV first.");
        }

        String extractedBy = isBlank(request.extractedBy()) ? DEFAULT_EXTRACTED_BY : request.extractedBy();
        String searchMethod = "Date range: " + startDate + " to " + endDate;

        UUID jobId = UUID.randomUUID();
        try {
            progressService.createJob(jobId, userId, searchMethod, extractedBy);
        } catch (DataIntegrityViolationException e) {
            // Another instance admitted a job for this user between our check and insert
            logger.warn("Active-job index rejected extraction for user {}", userId);
            throw new ExtractionConflictException(CONFLICT_MESSAGE);
        }

        ExtractionContext context = new ExtractionContext(jobId, userId, gmailSettings, employees, projects,
                isBlank(request.senderFilter()) ? null : request.senderFilter().trim(),
                startDate, endDate, extractedBy);

        try {
            asyncExtractionService.processExtraction(context);
        } catch (TaskRejectedException e) {
            logger.error("[Extraction {}] Executor rejected the extraction", jobId, e);
            progressService.fail(jobId, "Background process failed: " + e.getMessage());
            throw new ExtractionRejectedException("Extraction service is busy. Please try again shortly.", e);
        }

        logger.info("[Extraction {}] Admitted for user {} ({})", jobId, userId, searchMethod);
        return jobId;
    }

    // yyyy-MM-dd, or an ISO date-time whose date part is used
    static LocalDate parseDate(String value) {
        String trimmed = value.trim();
        try {
            return LocalDate.parse(trimmed);
        } catch (DateTimeParseException notADate) {
            try {
                return DateTimeFormatter.ISO_DATE_TIME.parse(trimmed, LocalDate::from);
            } catch (DateTimeParseException e) {
                throw new ExtractionValidationException("Invalid date format provided");
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
