package com.workledger.api.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE) // 503 - the background executor is saturated
public class ExtractionRejectedException extends RuntimeException {
    public ExtractionRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
