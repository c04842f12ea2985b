package com.dpmfinder.common.model;

/**
 * Why a backend call could not produce a usable answer.
 */
public enum FailureKind {
    TIMEOUT(true),
    NETWORK_ERROR(true),
    RATE_LIMITED(true),
    /** Any non-2xx status; transient only for 5xx, see {@code BackendQueryException#isTransient()}. */
    HTTP_ERROR(false),
    MALFORMED_RESPONSE(false);

    private final boolean retryable;

    FailureKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean retryable() {
        return retryable;
    }
}
