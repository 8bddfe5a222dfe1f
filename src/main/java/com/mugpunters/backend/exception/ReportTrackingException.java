package com.mugpunters.backend.exception;

public class ReportTrackingException extends RuntimeException {

    public ReportTrackingException(String message) {
        super(message);
    }

    public ReportTrackingException(String message, Throwable cause) {
        super(message, cause);
    }
}
