package com.workledger.api.controller;

import com.workledger.api.dto.ExtractionRequest;
import com.workledger.api.dto.ExtractionStartResponse;
import com.workledger.api.dto.ExtractionStatusDTO;
import com.workledger.api.exception.ExtractionValidationException;
import com.workledger.api.security.AuthenticatedUser;
import com.workledger.api.service.ExtractionAdmissionService;
import com.workledger.api.service.ExtractionStatusService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/extract-timesheet")
public class ExtractionController {

    private static final Logger logger = LoggerFactory.getLogger(ExtractionController.class);

    private final ExtractionAdmissionService admissionService;
    private final ExtractionStatusService statusService;

    public ExtractionController(ExtractionAdmissionService admissionService,
                                ExtractionStatusService statusService) {
        this.admissionService = admissionService;
        this.statusService = statusService;
    }

    /**
     * Starts an extraction in the background and returns its id right away.
     * Clients then poll the GET endpoint with that id. Without an explicit
     * {@code extracted_by}, notifications name the authenticated caller.
     */
    @PostMapping
    public ResponseEntity<ExtractionStartResponse> startExtraction(@RequestBody ExtractionRequest request,
                                                                   Authentication authentication) {
        AuthenticatedUser caller = currentUser(authentication);
        logger.info("Extraction requested for user {} by {} ({} to {})", request.userId(),
                caller != null ? caller.userId() : "anonymous", request.startDate(), request.endDate());

        if ((request.extractedBy() == null || request.extractedBy().isBlank())
                && caller != null && caller.displayName() != null) {
            request = request.withExtractedBy(caller.displayName());
        }

        UUID extractionId = admissionService.admit(request);

        return ResponseEntity.ok(new ExtractionStartResponse(true, "Extraction started successfully", extractionId));
    }

    @GetMapping
    public ResponseEntity<ExtractionStatusDTO> getStatus(@RequestParam(required = false) String userId,
                                                         @RequestParam(required = false) UUID extractionId) {
        if (userId == null || userId.isBlank()) {
            throw new ExtractionValidationException("User ID is required");
        }
        return ResponseEntity.ok(statusService.get(userId, extractionId));
    }

    private static AuthenticatedUser currentUser(Authentication authentication) {
        if (authentication != null && authentication.getPrincipal() instanceof AuthenticatedUser) {
            return (AuthenticatedUser) authentication.getPrincipal();
        }
        return null;
    }
}
