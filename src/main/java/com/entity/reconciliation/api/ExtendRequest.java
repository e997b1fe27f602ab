package com.entity.reconciliation.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Data extension request: property values wanted for a list of entities.
 *
 * @param ids        composite entity ids
 * @param properties requested properties
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExtendRequest(
        @JsonProperty("ids") List<String> ids,
        @JsonProperty("properties") List<RequestedProperty> properties
) {
    public ExtendRequest {
        ids = ids != null ? List.copyOf(ids) : List.of();
        properties = properties != null ? List.copyOf(properties) : List.of();
    }

    /**
     * @param id       property id
     * @param settings client settings, accepted but not applied
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RequestedProperty(
            @JsonProperty("id") String id,
            @JsonProperty("settings") Map<String, Object> settings
    ) {
    }
}
