package com.entity.reconciliation.sql;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Executes the SQL statements of the relational entity store.
 * Every statement works on the {@code recongo_*} schema created by {@link #createSchema()}.
 */
public class SqlQueryExecutor {
    private static final Logger log = LoggerFactory.getLogger(SqlQueryExecutor.class);

    static final List<String> SCHEMA = List.of(
            """
            CREATE TABLE recongo_metadata (
                meta_key varchar PRIMARY KEY,
                meta_value varchar
            )""",
            """
            CREATE TABLE recongo_types (
                type_id varchar PRIMARY KEY,
                type_name varchar,
                type_description varchar,
                type_url varchar
            )""",
            """
            CREATE TABLE recongo_properties (
                prop_id varchar PRIMARY KEY,
                prop_name varchar,
                prop_description varchar,
                prop_value_type varchar
            )""",
            """
            CREATE TABLE recongo_props2types (
                prop_id varchar REFERENCES recongo_properties (prop_id),
                type_id varchar REFERENCES recongo_types (type_id),
                PRIMARY KEY (prop_id, type_id)
            )""",
            """
            CREATE TABLE recongo_entities (
                ent_types varchar,
                ent_id varchar,
                ent_name varchar,
                ent_description varchar,
                PRIMARY KEY (ent_id, ent_types)
            )""",
            """
            CREATE TABLE recongo_entity_properties (
                ent_types varchar,
                ent_id varchar,
                prop_id varchar,
                prop_value varchar,
                PRIMARY KEY (ent_types, ent_id, prop_id, prop_value)
            )""",
            """
            CREATE VIRTUAL TABLE recongo_entities_fts USING fts5
                (ent_id, ent_name, ent_description, ent_types, content=recongo_entities)"""
    );

    private final SqlConnection connection;

    public SqlQueryExecutor(SqlConnection connection) {
        this.connection = connection;
    }

    public SqlConnection getConnection() {
        return connection;
    }

    // ========== Catalog ==========

    /**
     * Reads the store metadata as key/value pairs.
     */
    public Map<String, String> loadMetadata() {
        Map<String, String> metadata = new LinkedHashMap<>();
        for (Map<String, Object> row : connection.query(
                "SELECT meta_key, meta_value FROM recongo_metadata")) {
            metadata.put(text(row, "meta_key"), text(row, "meta_value"));
        }
        return metadata;
    }

    public List<Map<String, Object>> findTypes() {
        return connection.query("""
                SELECT type_id, type_name, COALESCE(type_description, '') AS type_description,
                       COALESCE(type_url, '') AS type_url
                FROM recongo_types
                ORDER BY rowid
                """);
    }

    /**
     * Lists every property. Databases written without the {@code prop_value_type} column
     * report an empty value type.
     */
    public List<Map<String, Object>> findProperties() {
        String valueType = hasPropertyValueTypes()
                ? "COALESCE(prop_value_type, '')" : "''";
        return connection.query("""
                SELECT prop_id, prop_name, COALESCE(prop_description, '') AS prop_description,
                       %s AS prop_value_type
                FROM recongo_properties
                ORDER BY rowid
                """.formatted(valueType));
    }

    boolean hasPropertyValueTypes() {
        return !connection.query("""
                SELECT name FROM pragma_table_info('recongo_properties')
                WHERE name = 'prop_value_type'
                """).isEmpty();
    }

    /**
     * Lists every (property id, type id) pair.
     */
    public List<Map<String, Object>> findPropertyTypeLinks() {
        return connection.query("SELECT prop_id, type_id FROM recongo_props2types ORDER BY rowid");
    }

    // ========== Entities ==========

    /**
     * Finds every entity row stored under a raw key, in load order.
     */
    public List<Map<String, Object>> findEntitiesByRawKey(String rawKey) {
        return connection.query("""
                SELECT ent_id, ent_name, COALESCE(ent_description, '') AS ent_description, ent_types
                FROM recongo_entities
                WHERE ent_id = ?
                ORDER BY rowid
                """, List.of(rawKey));
    }

    /**
     * Finds entities whose raw key or name starts with a prefix, ignoring ASCII case.
     * LIKE wildcards in the prefix are matched literally.
     */
    public List<Map<String, Object>> findEntitiesByPrefix(String prefix, int limit) {
        return connection.query("""
                SELECT ent_id, ent_name, COALESCE(ent_description, '') AS ent_description, ent_types
                FROM recongo_entities
                WHERE ent_id LIKE ?1 ESCAPE '\\' OR ent_name LIKE ?1 ESCAPE '\\'
                ORDER BY ent_name, ent_id, ent_types
                LIMIT ?2
                """, List.of(escapeLike(prefix) + "%", limit));
    }

    /**
     * Streams full-text hits best-first.
     */
    public void search(SearchQuery query, SqlConnection.RowVisitor visitor) {
        log.debug("Executing search: {}", query);
        connection.forEachRow(query.sql(), query.params(), visitor);
    }

    /**
     * Lists the property values of one entity row.
     *
     * @param typeList the stored comma-separated type list of the row
     * @param rawKey   the raw key of the row
     */
    public List<Map<String, Object>> findPropertyValues(String typeList, String rawKey) {
        return connection.query("""
                SELECT prop_id, prop_value
                FROM recongo_entity_properties
                WHERE ent_types = ? AND ent_id = ?
                ORDER BY prop_id, prop_value
                """, List.of(typeList, rawKey));
    }

    public long countEntities() {
        List<Map<String, Object>> rows = connection.query("SELECT COUNT(*) AS cnt FROM recongo_entities");
        return rows.isEmpty() ? 0L : ((Number) rows.get(0).get("cnt")).longValue();
    }

    // ========== Writing ==========

    public void createSchema() {
        for (String ddl : SCHEMA) {
            connection.execute(ddl);
        }
        log.debug("schema.created statements={}", SCHEMA.size());
    }

    public void insertMetadata(String key, String value) {
        connection.execute("INSERT INTO recongo_metadata (meta_key, meta_value) VALUES (?, ?)",
                List.of(key, value));
    }

    /**
     * Inserts a type, replacing the definition of an existing one in place.
     */
    public void upsertType(String id, String name, String description, String viewUrl) {
        connection.execute("""
                INSERT INTO recongo_types (type_id, type_name, type_description, type_url)
                VALUES (?, ?, ?, ?)
                ON CONFLICT (type_id) DO UPDATE SET type_name = excluded.type_name,
                    type_description = excluded.type_description, type_url = excluded.type_url
                """, List.of(id, name, description, viewUrl));
    }

    /**
     * Inserts a property, replacing the definition of an existing one in place.
     */
    public void upsertProperty(String id, String name, String description, String valueType) {
        connection.execute("""
                INSERT INTO recongo_properties (prop_id, prop_name, prop_description, prop_value_type)
                VALUES (?, ?, ?, ?)
                ON CONFLICT (prop_id) DO UPDATE SET prop_name = excluded.prop_name,
                    prop_description = excluded.prop_description,
                    prop_value_type = excluded.prop_value_type
                """, List.of(id, name, description, valueType));
    }

    public void linkPropertyToType(String propertyId, String typeId) {
        connection.execute("INSERT OR IGNORE INTO recongo_props2types (prop_id, type_id) VALUES (?, ?)",
                List.of(propertyId, typeId));
    }

    /**
     * Removes an entity row and its property values.
     */
    public void deleteEntity(String typeList, String rawKey) {
        connection.execute("DELETE FROM recongo_entity_properties WHERE ent_types = ? AND ent_id = ?",
                List.of(typeList, rawKey));
        connection.execute("DELETE FROM recongo_entities WHERE ent_types = ? AND ent_id = ?",
                List.of(typeList, rawKey));
    }

    public void insertEntity(String typeList, String rawKey, String name, String description) {
        connection.execute("""
                INSERT INTO recongo_entities (ent_types, ent_id, ent_name, ent_description)
                VALUES (?, ?, ?, ?)
                """, List.of(typeList, rawKey, name, description));
    }

    public void insertEntityProperty(String typeList, String rawKey, String propertyId, String value) {
        connection.execute("""
                INSERT OR IGNORE INTO recongo_entity_properties (ent_types, ent_id, prop_id, prop_value)
                VALUES (?, ?, ?, ?)
                """, List.of(typeList, rawKey, propertyId, value));
    }

    /**
     * Rebuilds the external-content full-text index from the entity table.
     */
    public void rebuildFullTextIndex() {
        connection.execute("INSERT INTO recongo_entities_fts(recongo_entities_fts) VALUES ('rebuild')");
    }

    // ========== Health ==========

    public boolean ping() {
        List<Map<String, Object>> rows = connection.query("SELECT 1 AS ok");
        return !rows.isEmpty();
    }

    static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    static String text(Map<String, Object> row, String column) {
        Object value = row.get(column);
        return value == null ? "" : value.toString();
    }
}
