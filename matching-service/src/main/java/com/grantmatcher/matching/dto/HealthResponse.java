package com.grantmatcher.matching.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record HealthResponse(
    @JsonProperty("status")   String status,
    @JsonProperty("version")  String version,
    @JsonProperty("features") Map<String, Boolean> features
) {}
