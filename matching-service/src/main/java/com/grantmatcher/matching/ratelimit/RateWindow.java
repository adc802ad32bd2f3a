package com.grantmatcher.matching.ratelimit;

import java.time.Duration;

/**
 * One admission horizon: at most {@code maxRequests} admitted requests within {@code length}.
 */
public record RateWindow(Duration length, int maxRequests) {

    public RateWindow {
        if (length == null || length.isZero() || length.isNegative()) {
            throw new IllegalArgumentException("Window length must be positive");
        }
        if (maxRequests < 1) {
            throw new IllegalArgumentException("Window must admit at least one request");
        }
    }
}
