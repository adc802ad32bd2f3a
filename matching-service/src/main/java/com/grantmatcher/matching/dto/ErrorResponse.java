package com.grantmatcher.matching.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error body for every failed {@code /api/**} call. {@code error} is the
 * {@link com.grantmatcher.common.exception.ErrorKind} name.
 */
public record ErrorResponse(
    @JsonProperty("error")     String error,
    @JsonProperty("message")   String message,
    @JsonProperty("retryable") boolean retryable,
    @JsonProperty("traceId")   String traceId
) {}
