package com.asiainfo.errortracking.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record BreakdownValue(
        @JsonProperty("breakdown_value") String value,
        @JsonProperty("count") long count
) {
}
