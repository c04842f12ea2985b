package com.dpmfinder.engine.client;

import com.dpmfinder.common.exception.BackendQueryException;
import com.dpmfinder.common.model.FailureKind;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.handler.timeout.TimeoutException;
import org.springframework.core.codec.DecodingException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Maps whatever the WebClient pipeline raised onto a {@link BackendQueryException}
 * with the matching {@link FailureKind}.
 */
final class BackendErrors {

    private static final int TOO_MANY_REQUESTS = 429;

    private BackendErrors() {}

    static BackendQueryException classify(Throwable error, String request) {
        if (error instanceof BackendQueryException bqe) {
            return bqe;
        }
        if (error instanceof WebClientResponseException wcre) {
            int status = wcre.getStatusCode().value();
            FailureKind kind = status == TOO_MANY_REQUESTS ? FailureKind.RATE_LIMITED : FailureKind.HTTP_ERROR;
            return new BackendQueryException(kind, status, request,
                "HTTP " + status + " from backend for " + request, error);
        }
        if (isTimeout(error)) {
            return new BackendQueryException(FailureKind.TIMEOUT, null, request,
                "Backend request timed out: " + request, error);
        }
        if (error instanceof DecodingException || error instanceof JsonProcessingException) {
            return BackendQueryException.malformed(request, "Unreadable backend response for " + request, error);
        }
        if (error instanceof WebClientRequestException) {
            return new BackendQueryException(FailureKind.NETWORK_ERROR, null, request,
                "Backend unreachable for " + request + ": " + error.getMessage(), error);
        }
        return new BackendQueryException(FailureKind.NETWORK_ERROR, null, request,
            "Backend call failed for " + request + ": " + error, error);
    }

    private static boolean isTimeout(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof java.util.concurrent.TimeoutException || t instanceof TimeoutException) {
                return true;
            }
            if (t.getCause() == t) break;
        }
        return false;
    }
}
