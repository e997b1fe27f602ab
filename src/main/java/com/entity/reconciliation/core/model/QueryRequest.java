package com.entity.reconciliation.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A single reconciliation query.
 *
 * @param id         caller-supplied correlation token, echoed in the response
 * @param text       search text
 * @param type       optional type id constraint, blank when absent
 * @param limit      maximum number of candidates, {@code null} or 0 for the default
 * @param properties property constraints
 * @param strictness strictness hint ("any", "all" or "should"), not used for scoring
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record QueryRequest(
        @JsonProperty("id") String id,
        @JsonProperty("query") String text,
        @JsonProperty("type") String type,
        @JsonProperty("limit") Integer limit,
        @JsonProperty("properties") List<QueryProperty> properties,
        @JsonProperty("type_strict") String strictness
) {
    public static final int DEFAULT_LIMIT = 25;

    public QueryRequest {
        id = id != null ? id : "";
        text = text != null ? text : "";
        type = type != null ? type : "";
        properties = properties != null ? List.copyOf(properties) : List.of();
    }

    public static QueryRequest of(String text) {
        return new QueryRequest(null, text, null, null, null, null);
    }

    public static QueryRequest of(String text, String type) {
        return new QueryRequest(null, text, type, null, null, null);
    }

    /**
     * Returns the limit to apply: the requested one, or {@link #DEFAULT_LIMIT} when absent or 0.
     */
    @JsonIgnore
    public int effectiveLimit() {
        return limit == null || limit == 0 ? DEFAULT_LIMIT : limit;
    }

    @JsonIgnore
    public boolean hasType() {
        return !type.isEmpty();
    }

    public QueryRequest withId(String newId) {
        return new QueryRequest(newId, text, type, limit, properties, strictness);
    }

    public QueryRequest withLimit(int newLimit) {
        return new QueryRequest(id, text, type, newLimit, properties, strictness);
    }

    public QueryRequest withProperties(List<QueryProperty> newProperties) {
        return new QueryRequest(id, text, type, limit, newProperties, strictness);
    }
}
