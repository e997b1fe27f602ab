package com.entity.reconciliation.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A property constraint of a query.
 *
 * @param propertyId the property id
 * @param value      a plain value, or an entity reference object carrying an {@code id}
 */
public record QueryProperty(
        @JsonProperty("pid") String propertyId,
        @JsonProperty("v") Object value
) {
}
