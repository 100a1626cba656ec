package com.asiainfo.errortracking.domain.model;

import java.util.Objects;

public record ExecutionContext(Team team, QueryTimings timings, ResultLimitPolicy limitPolicy) {

    public ExecutionContext {
        Objects.requireNonNull(team, "team");
        Objects.requireNonNull(timings, "timings");
        Objects.requireNonNull(limitPolicy, "limitPolicy");
    }
}
