package com.dpmfinder.common.exception;

import com.dpmfinder.common.model.FailureKind;

/**
 * Failure of a single call to the monitoring backend.
 *
 * <p>{@link #isTransient()} decides whether the call is worth repeating: timeouts,
 * network errors, rate limiting (429) and 5xx statuses are; other 4xx statuses
 * (authentication included) and unparseable bodies are not.
 */
public class BackendQueryException extends RuntimeException {

    private final FailureKind kind;
    private final Integer status;
    private final String request;
    private final int attempts;

    public BackendQueryException(FailureKind kind, Integer status, String request, String message, Throwable cause) {
        this(kind, status, request, message, cause, 1);
    }

    private BackendQueryException(FailureKind kind, Integer status, String request,
                                  String message, Throwable cause, int attempts) {
        super(message, cause);
        this.kind     = kind;
        this.status   = status;
        this.request  = request;
        this.attempts = attempts;
    }

    public static BackendQueryException malformed(String request, String message, Throwable cause) {
        return new BackendQueryException(FailureKind.MALFORMED_RESPONSE, null, request, message, cause);
    }

    /** Same failure, stamped with the number of attempts that were made before giving up. */
    public BackendQueryException withAttempts(int attemptCount) {
        BackendQueryException copy = new BackendQueryException(kind, status, request, getMessage(), getCause(), attemptCount);
        copy.setStackTrace(getStackTrace());
        return copy;
    }

    public boolean isTransient() {
        if (kind == FailureKind.HTTP_ERROR) {
            return status != null && status >= 500;
        }
        return kind.retryable();
    }

    public FailureKind getKind()   { return kind; }
    public Integer getStatus()     { return status; }
    public String getRequest()     { return request; }
    public int getAttempts()       { return attempts; }
}
