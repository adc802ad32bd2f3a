package com.grantmatcher.matching.service;

import java.time.Instant;

/**
 * A validated search with defaults applied. Two requests that resolve to equal values
 * share a cache entry.
 */
record ResolvedSearch(
    String profileId,
    Double minAwardAmount,
    Double maxAwardAmount,
    Instant deadlineAfter,
    Instant deadlineBefore,
    Boolean requiresEssay,
    boolean eligibleOnly,
    int limit,
    int offset,
    double minSimilarity
) {}
