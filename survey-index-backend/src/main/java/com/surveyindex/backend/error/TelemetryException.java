package com.surveyindex.backend.error;

/**
 * Base type for telemetry records the engine refuses to score.
 * Nothing is appended to history when one of these is thrown.
 */
public abstract class TelemetryException extends RuntimeException {

    protected TelemetryException(String message) {
        super(message);
    }
}
