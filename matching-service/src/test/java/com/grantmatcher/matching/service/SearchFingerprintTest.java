package com.grantmatcher.matching.service;

import com.grantmatcher.matching.cache.KeyPattern;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class SearchFingerprintTest {

    private static ResolvedSearch search(String profileId, Double minAward, int limit, int offset) {
        return new ResolvedSearch(profileId, minAward, null, null, Instant.parse("2025-06-01T00:00:00Z"),
            null, false, limit, offset, 0.6);
    }

    @Test
    @DisplayName("key keeps the profile id in clear and hashes the rest")
    void shape() {
        String key = SearchFingerprint.of(search("p-1", null, 20, 0));

        assertTrue(key.matches("search:matches:p-1:[0-9a-f]{16}"), key);
        assertTrue(KeyPattern.compile(SearchFingerprint.profilePattern("p-1")).matches(key));
        assertFalse(KeyPattern.compile(SearchFingerprint.profilePattern("p-12")).matches(key));
    }

    @Test
    @DisplayName("canonical numbers: 100 and 100.0 hash alike")
    void canonicalNumbers() {
        assertEquals(SearchFingerprint.of(search("p-1", 100.0, 20, 0)),
            SearchFingerprint.of(search("p-1", 1e2, 20, 0)));
    }

    @Test
    @DisplayName("pagination and filters change the key")
    void sensitivity() {
        String base = SearchFingerprint.of(search("p-1", null, 20, 0));

        assertNotEquals(base, SearchFingerprint.of(search("p-1", null, 20, 20)));
        assertNotEquals(base, SearchFingerprint.of(search("p-1", null, 10, 0)));
        assertNotEquals(base, SearchFingerprint.of(search("p-1", 5.0, 20, 0)));
        assertEquals(base, SearchFingerprint.of(search("p-1", null, 20, 0)));
    }
}
