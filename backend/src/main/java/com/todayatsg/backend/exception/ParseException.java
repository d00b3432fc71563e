package com.todayatsg.backend.exception;

import org.springframework.http.HttpStatus;

/**
 * The fetched document does not have the shape the source parser expects.
 */
public class ParseException extends IngestionException {

    public ParseException(String message) {
        super("PARSE_ERROR", HttpStatus.UNPROCESSABLE_ENTITY, message);
    }

    public ParseException(String message, Throwable cause) {
        super("PARSE_ERROR", HttpStatus.UNPROCESSABLE_ENTITY, message, cause);
    }
}
