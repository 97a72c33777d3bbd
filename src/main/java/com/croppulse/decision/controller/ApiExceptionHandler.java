package com.croppulse.decision.controller;

import com.croppulse.decision.exception.DecisionException;
import com.croppulse.decision.exception.InsufficientEvidenceException;
import com.croppulse.decision.exception.MalformedInputException;
import com.croppulse.decision.exception.MissingForecastException;
import com.croppulse.decision.exception.RecordFrozenException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.List;
import java.util.Map;

/**
 * Maps decision failures to responses that name what was missing:
 * {@code {"error": code, "message": text, "missing": [...]}}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(MalformedInputException.class)
    public ResponseEntity<Map<String, Object>> handleMalformedInput(MalformedInputException e) {
        return body(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler({InsufficientEvidenceException.class, MissingForecastException.class})
    public ResponseEntity<Map<String, Object>> handleUnprocessable(DecisionException e) {
        log.warn("{}: {}", e.getErrorCode(), e.getMessage());
        return body(HttpStatus.UNPROCESSABLE_ENTITY, e);
    }

    @ExceptionHandler(RecordFrozenException.class)
    public ResponseEntity<Map<String, Object>> handleFrozen(RecordFrozenException e) {
        log.error("Refused to overwrite issued record: {}", e.getMessage());
        return body(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler(DecisionException.class)
    public ResponseEntity<Map<String, Object>> handleDecision(DecisionException e) {
        log.error("Decision failed: {}", e.getMessage(), e);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, e);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of(
                "error", "MALFORMED_INPUT",
                "message", e.getMessage() == null ? "Malformed request" : e.getMessage(),
                "missing", List.of()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception e) {
        log.error("Unexpected error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of(
                "error", "INTERNAL_ERROR",
                "message", e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage(),
                "missing", List.of()));
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, DecisionException e) {
        return ResponseEntity.status(status).body(Map.of(
                "error", e.getErrorCode(),
                "message", e.getMessage(),
                "missing", e.getMissing()));
    }
}
