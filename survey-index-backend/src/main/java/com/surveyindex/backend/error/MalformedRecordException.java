package com.surveyindex.backend.error;

public class MalformedRecordException extends TelemetryException {

    private final String path;

    public MalformedRecordException(String path, String expected) {
        super("Malformed field '" + path + "': expected " + expected);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
