/*
 * Copyright (C) 2025 DNSMate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.dnsmate.api;

import com.dnsmate.application.EndpointRegistryException;
import com.dnsmate.config.RequestIdFilter;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.TransactionSystemException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.sql.SQLException;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiErrorResponse> handleApi(ApiException ex) {
        return respond(ex.getStatus(), ex.getStatus().name(), ex.getMessage());
    }

    @ExceptionHandler(EndpointRegistryException.class)
    public ResponseEntity<ApiErrorResponse> handleRegistry(EndpointRegistryException ex) {
        log.error("Endpoint registry unavailable requestId={}", currentRequestId(), ex);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "ENDPOINT_REGISTRY_UNAVAILABLE", ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiErrorResponse> handleBadRequest(IllegalArgumentException ex) {
        return respond(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getMessage());
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, ConstraintViolationException.class})
    public ResponseEntity<ApiErrorResponse> handleValidation(Exception ex) {
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Invalid request");
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        // record constructors throw IllegalArgumentException during binding
        Throwable cause = ex.getMostSpecificCause();
        if (cause instanceof IllegalArgumentException) {
            return respond(HttpStatus.BAD_REQUEST, "BAD_REQUEST", cause.getMessage());
        }
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Malformed request body");
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ApiErrorResponse> handleDataIntegrity(DataIntegrityViolationException ex) {
        return conflict("DATA_INTEGRITY_VIOLATION", "Data integrity violation", ex);
    }

    /**
     * Constraint violations raised at commit time arrive wrapped in this.
     */
    @ExceptionHandler(TransactionSystemException.class)
    public ResponseEntity<ApiErrorResponse> handleTransactionSystem(TransactionSystemException ex) {
        if (isIntegrityViolation(ex)) {
            return conflict("DATA_INTEGRITY_VIOLATION", "Data integrity violation", ex);
        }
        return internal(ex);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleAny(Exception ex) {
        if (isIntegrityViolation(ex)) {
            return conflict("DATA_INTEGRITY_VIOLATION", "Data integrity violation", ex);
        }
        return internal(ex);
    }

    private ResponseEntity<ApiErrorResponse> respond(HttpStatus status, String code, String message) {
        ApiErrorResponse body = new ApiErrorResponse(
                status.name(),
                code,
                message,
                currentRequestId()
        );
        return ResponseEntity.status(status).body(body);
    }

    private ResponseEntity<ApiErrorResponse> conflict(String code, String message, Exception ex) {
        log.warn("API conflict requestId={} code={} message={}", currentRequestId(), code, message, ex);
        return respond(HttpStatus.CONFLICT, code, message);
    }

    private ResponseEntity<ApiErrorResponse> internal(Exception ex) {
        log.error("Unhandled exception requestId={}", currentRequestId(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "UNEXPECTED_ERROR", "Unexpected error");
    }

    private String currentRequestId() {
        String rid = MDC.get(RequestIdFilter.MDC_KEY);
        return (rid == null || rid.isBlank()) ? "" : rid;
    }

    /**
     * Spring, Hibernate and SQLITE_CONSTRAINT violations, however deeply wrapped.
     */
    private boolean isIntegrityViolation(Throwable ex) {
        Throwable t = ex;
        while (t != null) {
            if (t instanceof DataIntegrityViolationException) return true;
            if (t instanceof org.hibernate.exception.ConstraintViolationException) return true;
            if (t instanceof SQLException sql) {
                String msg = sql.getMessage();
                if (msg != null && msg.contains("SQLITE_CONSTRAINT")) return true;
            }
            t = t.getCause();
        }
        return false;
    }
}
