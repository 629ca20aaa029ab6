package com.landingzone.orchestrator.dataproc;

/**
 * Thrown when the Dataproc API returns an error or is unreachable.
 */
public class JobClientException extends RuntimeException {

    private final int statusCode;

    public JobClientException(String message) {
        this(message, -1);
    }

    public JobClientException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public JobClientException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /** HTTP status returned by the API, or -1 for transport and parse failures. */
    public int statusCode() { return statusCode; }

    /** Worth asking again: no response at all, throttling, or a server-side error. */
    public boolean isTransient() {
        return statusCode == -1 || statusCode == 429 || statusCode >= 500;
    }
}
