package com.workledger.api.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST) // 400 - bad input or date-range policy violation
public class ExtractionValidationException extends RuntimeException {
    public ExtractionValidationException(String message) {
        super(message);
    }
}
