package com.todayatsg.backend.exception;

import org.springframework.http.HttpStatus;

public class UnknownSourceException extends IngestionException {

    public UnknownSourceException(String sourceId) {
        super("UNKNOWN_SOURCE", HttpStatus.NOT_FOUND, "Unknown source: " + sourceId);
    }
}
