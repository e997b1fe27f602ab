package com.entity.reconciliation.api;

import com.entity.reconciliation.core.model.Property;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Properties proposed for a type.
 *
 * @param limit      the requested limit, 0 for none
 * @param type       the type id
 * @param properties the properties of the type
 */
public record PropertyProposal(
        @JsonProperty("limit") int limit,
        @JsonProperty("type") String type,
        @JsonProperty("properties") List<Property> properties
) {
}
