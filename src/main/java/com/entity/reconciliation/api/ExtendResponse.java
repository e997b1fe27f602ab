package com.entity.reconciliation.api;

import com.entity.reconciliation.core.model.Property;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Data extension response.
 *
 * @param meta the requested properties, in request order
 * @param rows entity id to property id to values; each value is a one-entry object keyed
 *             {@code str}, {@code int}, {@code float}, {@code bool} or an {@code id}/{@code name} pair
 */
public record ExtendResponse(
        @JsonProperty("meta") List<Property> meta,
        @JsonProperty("rows") Map<String, Map<String, List<Map<String, Object>>>> rows
) {
}
