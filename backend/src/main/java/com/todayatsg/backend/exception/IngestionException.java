package com.todayatsg.backend.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base of every ingestion failure. Carries a machine-readable code and the HTTP
 * status the admin API answers with when the failure reaches a controller.
 */
@Getter
public abstract class IngestionException extends RuntimeException {

    private final String code;
    private final HttpStatus status;

    protected IngestionException(String code, HttpStatus status, String message) {
        super(message);
        this.code = code;
        this.status = status;
    }

    protected IngestionException(String code, HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.status = status;
    }
}
