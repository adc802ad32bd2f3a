package com.grantmatcher.matching.ratelimit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.grantmatcher.common.exception.ErrorKind;
import com.grantmatcher.common.trace.TraceContextUtil;
import com.grantmatcher.matching.dto.ErrorResponse;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;

/**
 * Admission control for {@code /api/**}. The health probe is exempt so orchestrators can
 * still see the instance while a client is being throttled.
 */
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class RateLimitWebFilter implements WebFilter {

    static final String API_PREFIX  = "/api/";
    static final String HEALTH_PATH = "/api/diagnostics/health";

    private final SlidingWindowRateLimiter rateLimiter;
    private final ObjectMapper objectMapper;

    public RateLimitWebFilter(SlidingWindowRateLimiter rateLimiter, ObjectMapper objectMapper) {
        this.rateLimiter  = rateLimiter;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().pathWithinApplication().value();
        if (!path.startsWith(API_PREFIX) || path.equals(HEALTH_PATH)) {
            return chain.filter(exchange);
        }
        return ClientIdentityResolver.resolve(exchange)
            .flatMap(clientId -> {
                AdmissionDecision decision = rateLimiter.admit(clientId);
                if (decision.allowed()) {
                    return chain.filter(exchange);
                }
                return Mono.deferContextual(ctx -> reject(exchange, decision, TraceContextUtil.getTraceId(ctx)));
            });
    }

    private Mono<Void> reject(ServerWebExchange exchange, AdmissionDecision decision, String traceId) {
        long retryAfter = decision.retryAfterSeconds();
        ServerHttpResponse response = exchange.getResponse();
        response.setStatusCode(HttpStatus.TOO_MANY_REQUESTS);
        response.getHeaders().set(HttpHeaders.RETRY_AFTER, Long.toString(retryAfter));
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);

        ErrorResponse body = new ErrorResponse(ErrorKind.RATE_LIMITED.name(),
            "Too many requests. Retry after " + retryAfter + " seconds.",
            ErrorKind.RATE_LIMITED.retryable(), traceId);
        byte[] bytes;
        try {
            bytes = objectMapper.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            return Mono.error(e);
        }
        DataBuffer buffer = response.bufferFactory().wrap(bytes);
        return response.writeWith(Mono.just(buffer));
    }
}
