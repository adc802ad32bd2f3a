package com.grantmatcher.matching.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable local-tier entry: a serialized payload plus its expiry policy.
 *
 * <p>{@code absoluteExpiry} is a hard deadline. {@code slidingExpiry}, when present, pushes the
 * expiry forward on every read but never past {@link #hardDeadline(Duration)}: the absolute
 * expiry when one is set, otherwise {@code createdAt + slidingCap}.
 */
public record CacheEntry(
    String key,
    String payload,
    Instant createdAt,
    Instant absoluteExpiry,
    Duration slidingExpiry
) {

    public Instant hardDeadline(Duration slidingCap) {
        return absoluteExpiry != null ? absoluteExpiry : createdAt.plus(slidingCap);
    }

    /**
     * Expiry instant after an access at {@code accessedAt} (creation counts as the first access).
     */
    public Instant expiryAfterAccess(Instant accessedAt, Duration slidingCap) {
        Instant hard = hardDeadline(slidingCap);
        if (slidingExpiry == null) {
            return hard;
        }
        Instant slid = accessedAt.plus(slidingExpiry);
        return slid.isBefore(hard) ? slid : hard;
    }
}
