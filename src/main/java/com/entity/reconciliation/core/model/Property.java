package com.entity.reconciliation.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * An attribute that entities of one or more types can carry.
 *
 * @param id          unique property id within the store
 * @param name        human-readable name
 * @param description optional description
 * @param valueType   expected kind of value, not serialized
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record Property(
        String id,
        String name,
        String description,
        @JsonIgnore String valueType
) {
    public Property {
        Objects.requireNonNull(id, "id is required");
        name = name != null ? name : id;
        description = description != null ? description : "";
        valueType = valueType != null ? valueType : "";
    }

    public static Property of(String id, String name) {
        return new Property(id, name, "", "");
    }
}
