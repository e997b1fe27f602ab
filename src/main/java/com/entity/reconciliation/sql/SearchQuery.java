package com.entity.reconciliation.sql;

import com.entity.reconciliation.core.model.EntityId;
import com.entity.reconciliation.core.model.PropertyValue;
import com.entity.reconciliation.core.model.QueryProperty;
import com.entity.reconciliation.store.InputSanitizer;
import com.entity.reconciliation.store.MalformedQueryException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A full-text search over the entity index, optionally restricted by property equality
 * constraints.
 *
 * <p>The FTS table is aliased {@code a}; every constraint joins the property value table
 * under the next letter ({@code b}, {@code c}, ...). Parameters are collected in the order
 * their placeholders are emitted: the match expression first, then one
 * (property id, value) pair per constraint. No value is ever written into the SQL text.</p>
 *
 * <pre>{@code
 * SearchQuery q = SearchQuery.builder("\"douglas\"*")
 *         .property("occupation", "writer")
 *         .property("born", Map.of("id", "place:cambridge"))
 *         .build();
 * connection.forEachRow(q.sql(), q.params(), visitor);
 * }</pre>
 */
public final class SearchQuery {

    private static final String FTS_TABLE = "recongo_entities_fts";
    private static final String PROPERTY_TABLE = "recongo_entity_properties";
    private static final char FIRST_JOIN_ALIAS = 'b';
    private static final int MAX_CONSTRAINTS = 'z' - FIRST_JOIN_ALIAS + 1;

    private final String sql;
    private final List<Object> params;

    private SearchQuery(String sql, List<Object> params) {
        this.sql = sql;
        this.params = Collections.unmodifiableList(params);
    }

    public String sql() {
        return sql;
    }

    public List<Object> params() {
        return params;
    }

    public static Builder builder(String matchExpression) {
        return new Builder(matchExpression);
    }

    /**
     * Turns free text into an FTS5 prefix match expression. Every run of letters and digits
     * becomes a quoted phrase; the last one matches as a prefix.
     *
     * @param text the query text
     * @return the match expression, empty when the text holds no searchable token
     */
    public static Optional<String> matchExpression(String text) {
        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        text.codePoints().forEach(cp -> {
            if (Character.isLetterOrDigit(cp)) {
                current.appendCodePoint(cp);
            } else if (current.length() > 0) {
                tokens.add(current.toString());
                current.setLength(0);
            }
        });
        if (current.length() > 0) {
            tokens.add(current.toString());
        }
        if (tokens.isEmpty()) {
            return Optional.empty();
        }
        StringBuilder expr = new StringBuilder();
        for (String token : tokens) {
            if (expr.length() > 0) {
                expr.append(' ');
            }
            expr.append('"').append(token).append('"');
        }
        return Optional.of(expr.append('*').toString());
    }

    /**
     * Resolves a constraint value to the text stored in the property value table.
     * Entity references compare by raw key.
     *
     * @throws MalformedQueryException if the value has no scalar or reference form
     */
    static String constraintValue(String propertyId, Object value) {
        if (value instanceof String s) {
            return s;
        }
        if (value instanceof Boolean || value instanceof Integer || value instanceof Long
                || value instanceof Short || value instanceof BigInteger) {
            return value.toString();
        }
        if (value instanceof BigDecimal bd) {
            return bd.scale() <= 0 ? bd.toBigInteger().toString() : PropertyValue.of(bd.doubleValue()).asString();
        }
        if (value instanceof Number n) {
            return PropertyValue.of(n.doubleValue()).asString();
        }
        if (value instanceof PropertyValue pv) {
            return pv.isReference() ? EntityId.rawKey(pv.asString()) : pv.asString();
        }
        if (value instanceof Map<?, ?> m) {
            if (m.get("id") instanceof String id && !id.isEmpty()) {
                return EntityId.rawKey(id);
            }
            throw new MalformedQueryException(
                    "Constraint on property '" + propertyId + "' is an object without an entity id: " + m);
        }
        throw new MalformedQueryException("Constraint on property '" + propertyId + "' has unsupported value "
                + (value == null ? "null" : value.getClass().getSimpleName()));
    }

    public static class Builder {
        private final String matchExpression;
        private final List<String> joins = new ArrayList<>();
        private final List<Object> constraintParams = new ArrayList<>();

        private Builder(String matchExpression) {
            if (matchExpression == null || matchExpression.isBlank()) {
                throw new IllegalArgumentException("matchExpression must not be blank");
            }
            this.matchExpression = matchExpression;
        }

        /**
         * Adds a property equality constraint.
         *
         * @throws MalformedQueryException if the property id is missing or the value cannot be resolved
         */
        public Builder property(String propertyId, Object value) {
            if (propertyId == null || propertyId.isBlank()) {
                throw new MalformedQueryException("Property constraint without a property id");
            }
            if (joins.size() == MAX_CONSTRAINTS) {
                throw new MalformedQueryException("Too many property constraints (max " + MAX_CONSTRAINTS + ")");
            }
            String resolved = constraintValue(propertyId, value);
            InputSanitizer.sanitizeForSql(resolved);

            char alias = (char) (FIRST_JOIN_ALIAS + joins.size());
            joins.add(alias + ".prop_id = ? AND " + alias + ".prop_value = ?"
                    + " AND a.ent_id = " + alias + ".ent_id AND a.ent_types = " + alias + ".ent_types");
            constraintParams.add(propertyId);
            constraintParams.add(resolved);
            return this;
        }

        public Builder properties(List<QueryProperty> constraints) {
            for (QueryProperty constraint : constraints) {
                if (constraint == null) {
                    throw new MalformedQueryException("Null property constraint");
                }
                property(constraint.propertyId(), constraint.value());
            }
            return this;
        }

        public SearchQuery build() {
            StringBuilder sql = new StringBuilder()
                    .append("SELECT a.ent_id AS ent_id, a.ent_name AS ent_name, a.ent_types AS ent_types, ")
                    .append("bm25(").append(FTS_TABLE).append(") AS score\n")
                    .append("FROM ").append(FTS_TABLE).append(" a");
            for (int i = 0; i < joins.size(); i++) {
                sql.append(", ").append(PROPERTY_TABLE).append(' ').append((char) (FIRST_JOIN_ALIAS + i));
            }
            sql.append("\nWHERE ").append(FTS_TABLE).append(" MATCH ?");
            for (String join : joins) {
                sql.append("\n  AND ").append(join);
            }
            sql.append("\nORDER BY score");

            List<Object> params = new ArrayList<>(1 + constraintParams.size());
            params.add(matchExpression);
            params.addAll(constraintParams);
            return new SearchQuery(sql.toString(), params);
        }
    }

    @Override
    public String toString() {
        return "SearchQuery{sql='" + sql.replace('\n', ' ') + "', params=" + params + '}';
    }
}
