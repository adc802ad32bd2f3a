package com.grantmatcher.matching.ratelimit;

import org.springframework.http.HttpHeaders;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.security.Principal;

/**
 * Derives the rate-limit identity of a request.
 *
 * <p>Resolution order: authenticated principal ({@code user:<name>}), first entry of
 * {@code X-Forwarded-For}, {@code X-Real-IP}, then {@code ip:unknown}. The remote socket
 * address is not used; behind the gateway it is always the proxy.
 */
public final class ClientIdentityResolver {

    static final String FORWARDED_FOR = "X-Forwarded-For";
    static final String REAL_IP       = "X-Real-IP";
    static final String UNKNOWN       = "ip:unknown";

    private ClientIdentityResolver() {}

    public static Mono<String> resolve(ServerWebExchange exchange) {
        return exchange.getPrincipal()
            .map(Principal::getName)
            .filter(name -> !name.isBlank())
            .map(name -> "user:" + name)
            .defaultIfEmpty(fromHeaders(exchange.getRequest().getHeaders()));
    }

    static String fromHeaders(HttpHeaders headers) {
        String forwarded = headers.getFirst(FORWARDED_FOR);
        if (forwarded != null) {
            String first = forwarded.split(",", 2)[0].trim();
            if (!first.isEmpty()) {
                return "ip:" + first;
            }
        }
        String realIp = headers.getFirst(REAL_IP);
        if (realIp != null && !realIp.isBlank()) {
            return "ip:" + realIp.trim();
        }
        return UNKNOWN;
    }
}
