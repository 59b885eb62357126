package com.scanfleet.core.sonar;

/**
 * An analysis-server call failed after retries, or was rejected.
 */
public class SonarApiException extends RuntimeException {

    private final int statusCode;

    public SonarApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public SonarApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /** HTTP status, or {@code -1} when no response was received. */
    public int getStatusCode() {
        return statusCode;
    }
}
