package com.grantmatcher.matching.service;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Cache keys for ranked search results: {@code search:matches:<profileId>:<hash>}.
 *
 * <p>The hash covers every field of a {@link ResolvedSearch} in a fixed order, with numbers
 * in canonical form ({@code 100} and {@code 100.0} hash alike). The profile id stays in clear
 * so {@link #profilePattern(String)} can drop every search of one profile.
 */
public final class SearchFingerprint {

    static final String PREFIX = "search:matches:";
    private static final int HASH_CHARS = 16;

    private SearchFingerprint() {}

    static String of(ResolvedSearch search) {
        String canonical = String.join("|",
            "minAward=" + number(search.minAwardAmount()),
            "maxAward=" + number(search.maxAwardAmount()),
            "after=" + value(search.deadlineAfter()),
            "before=" + value(search.deadlineBefore()),
            "essay=" + value(search.requiresEssay()),
            "eligibleOnly=" + search.eligibleOnly(),
            "limit=" + search.limit(),
            "offset=" + search.offset(),
            "minSimilarity=" + number(search.minSimilarity()));
        return PREFIX + search.profileId() + ":" + sha256(canonical).substring(0, HASH_CHARS);
    }

    public static String profilePattern(String profileId) {
        return PREFIX + profileId + ":*";
    }

    private static String number(Double value) {
        return value == null ? "-" : BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private static String value(Object value) {
        return value == null ? "-" : value.toString();
    }

    private static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
