package com.entity.reconciliation.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A category of entities within a store.
 *
 * @param id              unique type id within the store
 * @param name            human-readable name
 * @param description     optional description
 * @param viewUrlTemplate optional URL template turning an entity id into a page URL
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record EntityType(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("url") String viewUrlTemplate
) {
    public EntityType {
        Objects.requireNonNull(id, "id is required");
        name = name != null ? name : id;
        description = description != null ? description : "";
        viewUrlTemplate = viewUrlTemplate != null ? viewUrlTemplate : "";
    }

    public static EntityType of(String id, String name) {
        return new EntityType(id, name, "", "");
    }
}
