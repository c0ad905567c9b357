package com.surveyindex.backend.error;

import java.util.List;

public class ValidationException extends TelemetryException {

    private final List<String> missingFields;

    public ValidationException(String message) {
        this(message, List.of());
    }

    public ValidationException(String message, List<String> missingFields) {
        super(message);
        this.missingFields = List.copyOf(missingFields);
    }

    public static ValidationException missing(List<String> fields) {
        return new ValidationException(
                "Missing required fields: " + String.join(", ", fields),
                fields
        );
    }

    public List<String> getMissingFields() {
        return missingFields;
    }
}
