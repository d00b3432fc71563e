package com.todayatsg.backend.exception;

import org.springframework.http.HttpStatus;

public class RunNotFoundException extends IngestionException {

    public RunNotFoundException(String runId) {
        super("RUN_NOT_FOUND", HttpStatus.NOT_FOUND, "No ingestion run with id " + runId);
    }
}
