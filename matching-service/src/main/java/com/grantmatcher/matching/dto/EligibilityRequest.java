package com.grantmatcher.matching.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record EligibilityRequest(
    @JsonProperty("profileId")     String profileId,
    @JsonProperty("opportunityId") String opportunityId
) {}
