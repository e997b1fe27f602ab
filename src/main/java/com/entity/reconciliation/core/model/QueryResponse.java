package com.entity.reconciliation.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Result of a reconciliation query.
 *
 * @param id      id of the request this answers
 * @param results candidates, best first
 */
public record QueryResponse(
        @JsonProperty("id") String id,
        @JsonProperty("result") List<Candidate> results
) {
    public QueryResponse {
        results = results != null ? List.copyOf(results) : List.of();
    }

    public static QueryResponse empty(String id) {
        return new QueryResponse(id, List.of());
    }
}
