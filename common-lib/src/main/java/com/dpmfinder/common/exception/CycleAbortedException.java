package com.dpmfinder.common.exception;

/**
 * A cycle could not establish its metric universe (discovery or rules listing failed),
 * so no report can be produced for it.
 */
public class CycleAbortedException extends RuntimeException {

    public CycleAbortedException(String message, Throwable cause) {
        super(message, cause);
    }
}
