package com.grantmatcher.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Applicant-side input to a matching request.
 *
 * <p>Categorical attributes are free strings; {@code null} or blank means the attribute is
 * unknown. {@code summary} is the natural-language text the candidate search embeds.
 */
public record ApplicantProfile(
    @JsonProperty("id")              String id,
    @JsonProperty("name")            String name,
    @JsonProperty("score")           Double score,            // 0.0 – 4.0
    @JsonProperty("major")           String major,
    @JsonProperty("state")           String state,
    @JsonProperty("ethnicity")       String ethnicity,
    @JsonProperty("gender")          String gender,
    @JsonProperty("firstGeneration") boolean firstGeneration,
    @JsonProperty("graduationYear")  Integer graduationYear,
    @JsonProperty("summary")         String summary
) {}
