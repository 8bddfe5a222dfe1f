package com.mugpunters.backend.exception;

/**
 * Bad upstream data: non-positive price, malformed report. Never retried.
 */
public class InvalidInputException extends ReportTrackingException {

    public InvalidInputException(String message) {
        super(message);
    }
}
