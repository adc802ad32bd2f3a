package com.grantmatcher.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of an eligibility check. {@code meetsAll} is re-derived from the reason list
 * on construction, so the two can never disagree.
 */
public record EligibilityResult(
    @JsonProperty("meetsAll")     boolean meetsAll,
    @JsonProperty("unmetReasons") List<String> unmetReasons
) {
    public EligibilityResult {
        unmetReasons = unmetReasons == null ? List.of() : List.copyOf(unmetReasons);
        meetsAll = unmetReasons.isEmpty();
    }

    public static EligibilityResult of(List<String> unmetReasons) {
        return new EligibilityResult(unmetReasons == null || unmetReasons.isEmpty(), unmetReasons);
    }
}
