package com.todayatsg.backend.exception;

import org.springframework.http.HttpStatus;

public class GeocodeException extends IngestionException {

    public GeocodeException(String message) {
        super("GEOCODE_ERROR", HttpStatus.UNPROCESSABLE_ENTITY, message);
    }
}
