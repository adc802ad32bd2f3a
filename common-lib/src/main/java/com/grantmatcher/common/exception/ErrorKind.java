package com.grantmatcher.common.exception;

/**
 * Failure taxonomy shared by the matching pipeline and its HTTP boundary.
 *
 * <ul>
 *   <li>{@link #VALIDATION_FAILURE}: malformed filters or pagination; fix before retrying</li>
 *   <li>{@link #NOT_FOUND}: unknown profile or opportunity id; terminal for the request</li>
 *   <li>{@link #UPSTREAM_UNAVAILABLE}: candidate search or entity store failed; retry with backoff</li>
 *   <li>{@link #RATE_LIMITED}: admission denied; retry after the supplied hint</li>
 *   <li>{@link #INTERNAL}: unexpected; logged, opaque to the caller</li>
 * </ul>
 */
public enum ErrorKind {
    VALIDATION_FAILURE(400, false),
    NOT_FOUND(404, false),
    UPSTREAM_UNAVAILABLE(503, true),
    RATE_LIMITED(429, true),
    INTERNAL(500, false);

    private final int httpStatus;
    private final boolean retryable;

    ErrorKind(int httpStatus, boolean retryable) {
        this.httpStatus = httpStatus;
        this.retryable = retryable;
    }

    public int httpStatus() {
        return httpStatus;
    }

    public boolean retryable() {
        return retryable;
    }
}
