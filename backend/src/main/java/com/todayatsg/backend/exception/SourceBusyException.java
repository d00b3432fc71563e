package com.todayatsg.backend.exception;

import org.springframework.http.HttpStatus;

/**
 * A source is already being scraped by another run.
 */
public class SourceBusyException extends IngestionException {

    public SourceBusyException(String message) {
        super("SOURCE_BUSY", HttpStatus.CONFLICT, message);
    }
}
