package com.cassandra.log.analyzer.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Template for a literal (non prepared) query. Queries starting with {@code start}
 * have the values of {@code parameters} pulled out as if they had been bound.
 */
public class QueryPattern {

    private final String start;
    private final List<String> parameters;

    @JsonCreator
    public QueryPattern(@JsonProperty("start") String start,
            @JsonProperty("parameters") List<String> parameters) {
        if (start == null || start.isEmpty()) {
            throw new IllegalArgumentException("Query pattern requires a non-empty start");
        }
        this.start = start;
        this.parameters = parameters == null ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(parameters));
    }

    public String getStart() {
        return start;
    }

    public List<String> getParameters() {
        return parameters;
    }

    @Override
    public String toString() {
        return start + " " + parameters;
    }
}
