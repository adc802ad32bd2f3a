package com.grantmatcher.matching.web;

import com.grantmatcher.common.exception.ErrorKind;
import com.grantmatcher.common.exception.MatchingException;
import com.grantmatcher.common.trace.TraceContextUtil;
import com.grantmatcher.matching.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;

/**
 * Maps failures to {@link ErrorResponse} bodies. {@link ErrorKind} decides the status and the
 * retry hint; anything unclassified is an opaque 500.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(MatchingException.class)
    public ResponseEntity<ErrorResponse> handleMatching(MatchingException ex, ServerWebExchange exchange) {
        String traceId = traceId(exchange);
        ErrorKind kind = ex.getKind();
        if (kind == ErrorKind.INTERNAL) {
            TraceContextUtil.withMdc(traceId, () -> log.error("[Api] INTERNAL path={}",
                exchange.getRequest().getPath(), ex));
            return body(kind, "An unexpected error occurred", traceId);
        }
        TraceContextUtil.withMdc(traceId, () -> log.warn("[Api] {} path={} message={}",
            kind, exchange.getRequest().getPath(), ex.getMessage()));
        return body(kind, ex.getMessage(), traceId);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> handleInput(ServerWebInputException ex, ServerWebExchange exchange) {
        String traceId = traceId(exchange);
        TraceContextUtil.withMdc(traceId, () -> log.warn("[Api] MALFORMED_REQUEST path={} reason={}",
            exchange.getRequest().getPath(), ex.getReason()));
        return body(ErrorKind.VALIDATION_FAILURE, "Malformed request: " + ex.getReason(), traceId);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, ServerWebExchange exchange) {
        String traceId = traceId(exchange);
        TraceContextUtil.withMdc(traceId, () -> log.error("[Api] UNEXPECTED path={}",
            exchange.getRequest().getPath(), ex));
        return body(ErrorKind.INTERNAL, "An unexpected error occurred", traceId);
    }

    private static ResponseEntity<ErrorResponse> body(ErrorKind kind, String message, String traceId) {
        return ResponseEntity.status(kind.httpStatus())
            .body(new ErrorResponse(kind.name(), message, kind.retryable(), traceId));
    }

    private static String traceId(ServerWebExchange exchange) {
        return exchange.getAttributeOrDefault(TraceContextUtil.TRACE_ID_KEY, "unknown");
    }
}
