package com.todayatsg.backend.exception;

import java.util.List;
import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * A candidate record could not be normalized. Names every offending field.
 */
@Getter
public class ValidationException extends IngestionException {

    private final List<String> invalidFields;

    public ValidationException(List<String> invalidFields, String message) {
        super("VALIDATION_ERROR", HttpStatus.BAD_REQUEST, message);
        this.invalidFields = List.copyOf(invalidFields);
    }
}
