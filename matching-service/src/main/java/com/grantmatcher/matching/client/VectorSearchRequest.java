package com.grantmatcher.matching.client;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Wire body of {@code POST /profiles/search}. */
public record VectorSearchRequest(
    @JsonProperty("query")            String query,
    @JsonProperty("attributeFilters") FilterGroup attributeFilters,
    @JsonProperty("minSimilarity")    double minSimilarity,
    @JsonProperty("limit")            int limit
) {

    public record FilterGroup(
        @JsonProperty("logicalOperator") String logicalOperator,
        @JsonProperty("filters")         List<AttributeFilter> filters
    ) {}

    public record AttributeFilter(
        @JsonProperty("fieldPath") String fieldPath,
        @JsonProperty("operator")  String operator,
        @JsonProperty("value")     Object value
    ) {}
}
