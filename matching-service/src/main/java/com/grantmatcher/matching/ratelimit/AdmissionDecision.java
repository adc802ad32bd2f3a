package com.grantmatcher.matching.ratelimit;

import java.time.Duration;

/**
 * Result of {@link SlidingWindowRateLimiter#admit(String)}. {@code retryAfter} is
 * {@link Duration#ZERO} for admitted requests.
 */
public record AdmissionDecision(boolean allowed, Duration retryAfter) {

    private static final AdmissionDecision ADMITTED = new AdmissionDecision(true, Duration.ZERO);

    public static AdmissionDecision admitted() {
        return ADMITTED;
    }

    public static AdmissionDecision rejected(Duration retryAfter) {
        return new AdmissionDecision(false, retryAfter);
    }

    /** Whole seconds, rounded up, never below 1 for a rejection. */
    public long retryAfterSeconds() {
        if (allowed) {
            return 0;
        }
        long millis = retryAfter.toMillis();
        return Math.max(1, (millis + 999) / 1000);
    }
}
