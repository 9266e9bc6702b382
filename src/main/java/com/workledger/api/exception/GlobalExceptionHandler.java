package com.workledger.api.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.context.request.WebRequest;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    // Our own client-facing errors (400, 409, 503)
    @ExceptionHandler({ExtractionValidationException.class, ExtractionConflictException.class,
            ExtractionRejectedException.class})
    public ResponseEntity<Object> handleExtractionExceptions(RuntimeException ex, WebRequest request) {
        HttpStatus status = HttpStatus.BAD_REQUEST;
        if (ex instanceof ExtractionConflictException) {
            status = HttpStatus.CONFLICT;
        } else if (ex instanceof ExtractionRejectedException) {
            status = HttpStatus.SERVICE_UNAVAILABLE;
        }

        logger.warn("Handled {} error: {}", status, ex.getMessage());

        return buildErrorResponse(ex.getMessage(), status, request);
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<Object> handleMalformedRequest(Exception ex, WebRequest request) {
        logger.warn("Malformed request: {}", ex.getMessage());
        return buildErrorResponse("Malformed request: " + ex.getMessage(), HttpStatus.BAD_REQUEST, request);
    }

    // Anything else is a 500; the stack trace is logged, never sent to the client
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Object> handleAllUncaughtException(Exception ex, WebRequest request) {
        logger.error("Unexpected error:", ex);

        return buildErrorResponse("Internal server error", HttpStatus.INTERNAL_SERVER_ERROR, request);
    }

    private ResponseEntity<Object> buildErrorResponse(String message, HttpStatus status, WebRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("timestamp", LocalDateTime.now());
        body.put("status", status.value());
        body.put("error", status.getReasonPhrase());
        body.put("message", message);
        body.put("path", request.getDescription(false).replace("uri=", ""));

        return new ResponseEntity<>(body, status);
    }
}
