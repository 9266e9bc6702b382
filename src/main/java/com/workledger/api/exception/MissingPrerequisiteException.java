package com.workledger.api.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Upstream data the extraction depends on (mailbox credentials, employees, projects) is absent.
 */
@ResponseStatus(HttpStatus.BAD_REQUEST)
public class MissingPrerequisiteException extends ExtractionValidationException {
    public MissingPrerequisiteException(String message) {
        super(message);
    }
}
