package com.entity.reconciliation.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * A scored search result.
 *
 * @param id    composite id of the candidate entity
 * @param name  entity name
 * @param types entity types, primary type first
 * @param score similarity score, never negative, conventionally 0-100 but unbounded
 * @param match whether the score is high enough to count as a confident match
 */
public record Candidate(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("type") List<EntityType> types,
        @JsonProperty("score") double score,
        @JsonProperty("match") boolean match
) {
    public Candidate {
        Objects.requireNonNull(id, "id is required");
        types = types != null ? List.copyOf(types) : List.of();
        if (Double.isNaN(score) || score < 0.0) {
            throw new IllegalArgumentException("Score must be >= 0, was " + score);
        }
    }
}
