package com.workledger.api.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT) // 409 - the user already has an active extraction
public class ExtractionConflictException extends RuntimeException {
    public ExtractionConflictException(String message) {
        super(message);
    }
}
