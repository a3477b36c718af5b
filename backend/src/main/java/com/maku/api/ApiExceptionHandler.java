/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.api;

import com.maku.config.RequestIdFilter;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.TransactionSystemException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.sql.SQLException;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiErrorResponse> handleApi(ApiException ex) {
        return respond(ex.getStatus(), ex.getCode(), ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiErrorResponse> handleBadRequest(IllegalArgumentException ex) {
        return respond(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getMessage());
    }

    @ExceptionHandler({
            MethodArgumentNotValidException.class,
            ConstraintViolationException.class,
            HandlerMethodValidationException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class
    })
    public ResponseEntity<ApiErrorResponse> handleValidation(Exception ex) {
        log.debug("Rejected request requestId={} reason={}", currentRequestId(), ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Invalid request");
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ApiErrorResponse> handleDataIntegrity(DataIntegrityViolationException ex) {
        return conflict(ex);
    }

    /**
     * Constraint violations raised at commit time arrive wrapped in this exception.
     */
    @ExceptionHandler(TransactionSystemException.class)
    public ResponseEntity<ApiErrorResponse> handleTransactionSystem(TransactionSystemException ex) {
        if (isIntegrityViolation(ex)) {
            return conflict(ex);
        }
        return internal(ex);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleAny(Exception ex) {
        if (isIntegrityViolation(ex)) {
            return conflict(ex);
        }
        // unknown routes, unsupported methods and media types keep their framework status
        if (ex instanceof ErrorResponse framework) {
            HttpStatus status = HttpStatus.resolve(framework.getStatusCode().value());
            if (status != null && status.is4xxClientError()) {
                return respond(status, status.name(), status.getReasonPhrase());
            }
        }
        return internal(ex);
    }

    private ResponseEntity<ApiErrorResponse> respond(HttpStatus status, String code, String message) {
        ApiErrorResponse body = new ApiErrorResponse(status.name(), code, message, currentRequestId());
        return ResponseEntity.status(status).body(body);
    }

    private ResponseEntity<ApiErrorResponse> conflict(Exception ex) {
        log.warn("API conflict requestId={} code=DATA_INTEGRITY_VIOLATION", currentRequestId(), ex);
        return respond(HttpStatus.CONFLICT, "DATA_INTEGRITY_VIOLATION", "Data integrity violation");
    }

    private ResponseEntity<ApiErrorResponse> internal(Exception ex) {
        log.error("Unhandled exception requestId={}", currentRequestId(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "UNEXPECTED_ERROR", "Unexpected error");
    }

    private String currentRequestId() {
        String rid = MDC.get(RequestIdFilter.MDC_KEY);
        return (rid == null || rid.isBlank()) ? "" : rid;
    }

    // Spring, Hibernate or a raw SQLITE_CONSTRAINT anywhere in the cause chain
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
