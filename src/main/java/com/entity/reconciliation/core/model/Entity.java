package com.entity.reconciliation.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A single record of a store.
 *
 * <p>Instances are immutable: the type list and property map are copied on build and
 * exposed read-only. The id is the composite id (see {@link EntityId}).</p>
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class Entity {
    private final String id;
    private final String name;
    private final String description;
    private final List<EntityType> types;
    private final Map<String, PropertyValue> properties;

    private Entity(Builder builder) {
        this.id = builder.id;
        this.name = builder.name;
        this.description = builder.description != null ? builder.description : "";
        this.types = List.copyOf(builder.types);
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(builder.properties));
    }

    @JsonProperty("id")
    public String getId() {
        return id;
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("description")
    public String getDescription() {
        return description;
    }

    @JsonProperty("type")
    public List<EntityType> getTypes() {
        return types;
    }

    @JsonIgnore
    public Map<String, PropertyValue> getProperties() {
        return properties;
    }

    /**
     * Returns the record key this entity was loaded with.
     */
    @JsonIgnore
    public String getRawKey() {
        return EntityId.rawKey(id);
    }

    /**
     * Returns true if one of this entity's types has the given id.
     */
    public boolean hasType(String typeId) {
        for (EntityType t : types) {
            if (t.id().equals(typeId)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(id, ((Entity) o).id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Entity{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", types=" + types.stream().map(EntityType::id).toList() +
                ", properties=" + properties.size() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder pre-filled with this entity, used to attach lazily loaded properties.
     */
    public static Builder builder(Entity entity) {
        return new Builder()
                .id(entity.id)
                .name(entity.name)
                .description(entity.description)
                .types(entity.types)
                .properties(entity.properties);
    }

    public static class Builder {
        private String id;
        private String name;
        private String description;
        private final List<EntityType> types = new ArrayList<>();
        private final Map<String, PropertyValue> properties = new LinkedHashMap<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder type(EntityType type) {
            this.types.add(type);
            return this;
        }

        public Builder types(List<EntityType> types) {
            this.types.clear();
            this.types.addAll(types);
            return this;
        }

        public Builder property(String propertyId, PropertyValue value) {
            this.properties.put(propertyId, value);
            return this;
        }

        public Builder properties(Map<String, PropertyValue> properties) {
            this.properties.clear();
            this.properties.putAll(properties);
            return this;
        }

        public Entity build() {
            Objects.requireNonNull(id, "id is required");
            Objects.requireNonNull(name, "name is required");
            if (types.isEmpty()) {
                throw new IllegalStateException("Entity " + id + " must belong to at least one type");
            }
            return new Entity(this);
        }
    }
}
