package com.grantmatcher.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A grant or scholarship opportunity with its eligibility bounds.
 *
 * <p>Every restriction is optional: a {@code null} bound or an empty list means
 * "no restriction". Lists are normalised on construction: {@code null} becomes empty and
 * {@code null} or blank elements are dropped.
 */
public record Opportunity(
    @JsonProperty("id")                      String id,
    @JsonProperty("name")                    String name,
    @JsonProperty("provider")                String provider,
    @JsonProperty("minScore")                Double minScore,
    @JsonProperty("maxScore")                Double maxScore,
    @JsonProperty("eligibleMajors")          List<String> eligibleMajors,
    @JsonProperty("requiredStates")          List<String> requiredStates,
    @JsonProperty("eligibleEthnicities")     List<String> eligibleEthnicities,
    @JsonProperty("eligibleGenders")         List<String> eligibleGenders,
    @JsonProperty("firstGenerationRequired") boolean firstGenerationRequired,
    @JsonProperty("minGraduationYear")       Integer minGraduationYear,
    @JsonProperty("maxGraduationYear")       Integer maxGraduationYear,
    @JsonProperty("essayRequired")           boolean essayRequired,
    @JsonProperty("recommendationRequired")  boolean recommendationRequired,
    @JsonProperty("awardAmount")             double awardAmount,
    @JsonProperty("deadline")                Instant deadline,
    @JsonProperty("renewable")               boolean renewable
) {
    public Opportunity {
        eligibleMajors      = restriction(eligibleMajors);
        requiredStates      = restriction(requiredStates);
        eligibleEthnicities = restriction(eligibleEthnicities);
        eligibleGenders     = restriction(eligibleGenders);
    }

    private static List<String> restriction(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
            .filter(Objects::nonNull)
            .filter(v -> !v.isBlank())
            .toList();
    }
}
