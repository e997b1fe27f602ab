package com.entity.reconciliation.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A single property value held by an entity.
 *
 * <p>The wrapped value is one of {@link String}, {@link Boolean}, {@link Long},
 * {@link Double} or {@link Reference}. Accessors coerce between them and never throw;
 * values that cannot be converted yield {@code false}, {@code 0} or {@code 0.0}.</p>
 */
public final class PropertyValue {

    private static final Set<String> TRUE_STRINGS = Set.of("YES", "TRUE", "T", "ON", "1");

    private final Object value;

    private PropertyValue(Object value) {
        this.value = Objects.requireNonNull(value, "value is required");
    }

    public static PropertyValue of(String value) {
        return new PropertyValue(value);
    }

    public static PropertyValue of(boolean value) {
        return new PropertyValue(value);
    }

    public static PropertyValue of(long value) {
        return new PropertyValue(value);
    }

    public static PropertyValue of(double value) {
        return new PropertyValue(value);
    }

    public static PropertyValue ofReference(String id, String name) {
        return new PropertyValue(new Reference(id, name));
    }

    /**
     * Wraps a value decoded from JSON. Objects carrying an {@code id} become entity
     * references; integral numbers become longs, other numbers doubles.
     */
    public static PropertyValue fromJson(Object raw) {
        if (raw instanceof PropertyValue pv) {
            return pv;
        }
        if (raw instanceof String s) {
            return of(s);
        }
        if (raw instanceof Boolean b) {
            return of(b.booleanValue());
        }
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short) {
            return of(((Number) raw).longValue());
        }
        if (raw instanceof Number n) {
            if (n instanceof BigDecimal bd && bd.scale() <= 0) {
                return of(bd.longValue());
            }
            return of(n.doubleValue());
        }
        if (raw instanceof Map<?, ?> m && m.get("id") instanceof String id) {
            Object name = m.get("name");
            return ofReference(id, name != null ? name.toString() : "");
        }
        return of(String.valueOf(raw));
    }

    /**
     * Coerces the value into a string. Entity references yield their id.
     */
    public String asString() {
        if (value instanceof Reference ref) {
            return ref.id();
        }
        return value.toString();
    }

    /**
     * Numbers are true when non-zero; strings when one of YES, TRUE, T, ON or 1.
     */
    public boolean asBoolean() {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Long l) {
            return l != 0L;
        }
        if (value instanceof Double d) {
            return d != 0.0;
        }
        if (value instanceof String s) {
            return TRUE_STRINGS.contains(s.toUpperCase(Locale.ROOT));
        }
        return false;
    }

    /**
     * Booleans become 0 or 1, doubles are truncated, strings and reference ids are parsed.
     */
    public long asLong() {
        if (value instanceof Boolean b) {
            return b ? 1L : 0L;
        }
        if (value instanceof Long l) {
            return l;
        }
        if (value instanceof Double d) {
            return d.longValue();
        }
        try {
            return Long.parseLong(asString().trim());
        } catch (NumberFormatException e) {
            return 0L;
        }
    }

    public double asDouble() {
        if (value instanceof Boolean b) {
            return b ? 1.0 : 0.0;
        }
        if (value instanceof Long l) {
            return l.doubleValue();
        }
        if (value instanceof Double d) {
            return d;
        }
        try {
            return Double.parseDouble(asString().trim());
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }

    public Optional<Reference> asReference() {
        return value instanceof Reference ref ? Optional.of(ref) : Optional.empty();
    }

    public boolean isReference() {
        return value instanceof Reference;
    }

    @JsonValue
    public Object rawValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return value.equals(((PropertyValue) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return asString();
    }

    /**
     * A reference to another entity, by composite id.
     */
    public record Reference(String id, String name) {
        public Reference {
            Objects.requireNonNull(id, "id is required");
            name = name != null ? name : "";
        }
    }
}
