package vkgraph.core;

/**
 * A single request attempt failed (network error, non-2xx status, unreadable body,
 * or an API error that is not a data outcome). Callers retry these.
 */
public class TransientRequestException extends Exception {
    private final int statusCode;

    public TransientRequestException(String message) {
        this(message, -1, null);
    }

    public TransientRequestException(String message, int statusCode) {
        this(message, statusCode, null);
    }

    public TransientRequestException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    private TransientRequestException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /** HTTP status of the failed attempt, or -1 when no response was received. */
    public int statusCode() {
        return statusCode;
    }
}
