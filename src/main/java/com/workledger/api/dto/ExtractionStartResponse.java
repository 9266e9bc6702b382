package com.workledger.api.dto;

import java.util.UUID;

public record ExtractionStartResponse(
        boolean success,
        String message,
        UUID extractionId
) {}
