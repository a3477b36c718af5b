/*
 * Copyright (C) 2025 Maku Travel
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.maku.api;

import org.springframework.http.HttpStatus;

/**
 * Business failure with a fixed HTTP status, rendered by {@link ApiExceptionHandler}.
 */
public class ApiException extends RuntimeException {
    private final HttpStatus status;
    private final String code;

    public ApiException(HttpStatus status, String message) {
        this(status, status.name(), message);
    }

    public ApiException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getCode() {
        return code;
    }
}
