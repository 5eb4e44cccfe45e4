package com.bko.plansolve.orchestration.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AggregateReport(
        String summary,
        @JsonAlias("report") String content
) {
}
