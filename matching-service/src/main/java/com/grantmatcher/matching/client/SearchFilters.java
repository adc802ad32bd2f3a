package com.grantmatcher.matching.client;

import java.time.Instant;

/**
 * Structured filters forwarded to the candidate search as pre-filter hints. Every field is
 * optional; the orchestrator re-applies them to the scored results.
 */
public record SearchFilters(
    Double minAwardAmount,
    Double maxAwardAmount,
    Instant deadlineAfter,
    Instant deadlineBefore,
    Boolean requiresEssay
) {

    public static SearchFilters none() {
        return new SearchFilters(null, null, null, null, null);
    }
}
