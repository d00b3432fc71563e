package com.todayatsg.backend.exception;

import org.springframework.http.HttpStatus;

/**
 * Constraint violation or database failure while writing one event.
 */
public class PersistenceException extends IngestionException {

    public PersistenceException(String message, Throwable cause) {
        super("PERSISTENCE_ERROR", HttpStatus.INTERNAL_SERVER_ERROR, message, cause);
    }
}
