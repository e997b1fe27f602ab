package com.entity.reconciliation.sql;

import com.entity.reconciliation.cache.CacheConfig;
import com.entity.reconciliation.cache.EntityCache;
import com.entity.reconciliation.core.model.Candidate;
import com.entity.reconciliation.core.model.Entity;
import com.entity.reconciliation.core.model.EntityId;
import com.entity.reconciliation.core.model.EntityType;
import com.entity.reconciliation.core.model.Property;
import com.entity.reconciliation.core.model.PropertyValue;
import com.entity.reconciliation.core.model.QueryRequest;
import com.entity.reconciliation.core.model.QueryResponse;
import com.entity.reconciliation.metrics.MetricsService;
import com.entity.reconciliation.metrics.NoOpMetricsService;
import com.entity.reconciliation.store.EntityStore;
import com.entity.reconciliation.store.InputSanitizer;
import com.entity.reconciliation.store.MatchScoring;
import com.entity.reconciliation.store.StoreMetadata;
import com.entity.reconciliation.store.record.TypeList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * {@link EntityStore} answering queries from a SQLite database with an FTS5 index
 * over entity ids, names and descriptions.
 *
 * <p>Metadata, types and properties are read once when the store is built. Entities
 * stay in the database; {@link #getEntity} results are cached. The full-text engine's
 * {@code bm25} relevance is rescaled with {@link MatchScoring#normalizationScale} so
 * candidates score like the in-memory engine's.</p>
 *
 * <pre>{@code
 * EntityStore store = RelationalEntityStore.builder()
 *         .pool(PoolConfig.builder().databasePath("data.sqlite").build())
 *         .cacheConfig(CacheConfig.defaults())
 *         .build();
 * }</pre>
 */
public class RelationalEntityStore implements EntityStore {
    private static final Logger log = LoggerFactory.getLogger(RelationalEntityStore.class);

    /** Metadata key naming the type assigned to rows that declare none. */
    static final String DEFAULT_TYPE_KEY = "default_type";

    private final SqlConnection connection;
    private final SqlQueryExecutor executor;
    private final EntityCache cache;
    private final MetricsService metrics;

    private final StoreMetadata metadata;
    private final Map<String, EntityType> types;
    private final Map<String, List<Property>> properties;

    private RelationalEntityStore(Builder builder) {
        this.connection = builder.connection;
        this.executor = new SqlQueryExecutor(connection);
        this.cache = EntityCache.create(builder.cacheConfig);
        this.metrics = builder.metrics;

        try {
            Map<String, EntityType> typeMap = loadTypes();
            this.metadata = loadMetadata(typeMap);
            this.types = Collections.unmodifiableMap(typeMap);
            this.properties = loadProperties();
        } catch (RuntimeException e) {
            connection.close();
            throw e;
        }

        log.info("store.opened name='{}' database={} types={}",
                metadata.name(), connection.getDatabaseName(), types.size());
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String name() {
        return metadata.name();
    }

    @Override
    public String identifierNamespace() {
        return metadata.identifierNamespace();
    }

    @Override
    public String schemaNamespace() {
        return metadata.schemaNamespace();
    }

    @Override
    public String viewUrlTemplate() {
        return metadata.viewUrlTemplate();
    }

    /**
     * Returns the metadata read from the database.
     */
    public StoreMetadata metadata() {
        return metadata;
    }

    @Override
    public Set<EntityType> types() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(types.values()));
    }

    @Override
    public List<Property> propertiesFor(String typeId) {
        return properties.getOrDefault(typeId, List.of());
    }

    @Override
    public Optional<Entity> getEntity(String id) {
        Optional<Entity> cached = cache.get(id);
        if (cached.isPresent()) {
            metrics.recordCacheHit();
            return cached;
        }
        metrics.recordCacheMiss();

        String typeId = EntityId.primaryType(id);
        String rawKey = EntityId.rawKey(id);
        for (Map<String, Object> row : executor.findEntitiesByRawKey(rawKey)) {
            Entity entity = toEntity(row);
            if (entity.hasType(typeId)) {
                Entity loaded = Entity.builder(entity)
                        .properties(loadPropertyValues(entity, SqlQueryExecutor.text(row, "ent_types"), rawKey))
                        .build();
                cache.put(id, loaded);
                return Optional.of(loaded);
            }
        }
        log.debug("lookup.miss id={}", id);
        return Optional.empty();
    }

    @Override
    public QueryResponse query(QueryRequest request) {
        InputSanitizer.validateQuery(request);
        String text = request.text();

        List<Entity> exact = exactMatches(text);
        if (!exact.isEmpty()) {
            log.debug("query.fastpath id={} hits={}", request.id(), exact.size());
            return new QueryResponse(request.id(), exact.stream().map(MatchScoring::exactMatch).toList());
        }

        Optional<String> matchExpression = SearchQuery.matchExpression(text);
        if (matchExpression.isEmpty()) {
            log.debug("query.empty id={} text has no searchable token", request.id());
            return QueryResponse.empty(request.id());
        }
        SearchQuery search = SearchQuery.builder(matchExpression.get())
                .properties(request.properties())
                .build();

        int limit = request.effectiveLimit();
        List<Candidate> results = new ArrayList<>();
        double[] scale = {0.0};
        executor.search(search, row -> {
            String rawKey = SqlQueryExecutor.text(row, "ent_id");
            String name = SqlQueryExecutor.text(row, "ent_name");
            List<String> typeIds = TypeList.parse(SqlQueryExecutor.text(row, "ent_types"), metadata.defaultTypeId());
            if (request.hasType() && !typeIds.contains(request.type())) {
                return true;
            }
            String id = EntityId.compose(typeIds.get(0), rawKey);
            double nativeScore = ((Number) row.get("score")).doubleValue();
            if (scale[0] == 0.0) {
                scale[0] = MatchScoring.normalizationScale(text, id, name, nativeScore);
            }
            double score = MatchScoring.normalize(nativeScore, scale[0]);
            results.add(new Candidate(id, name, resolveTypes(typeIds), score, MatchScoring.isMatch(score)));
            return results.size() < limit;
        });

        log.debug("query.fulltext id={} constraints={} results={}",
                request.id(), request.properties().size(), results.size());
        return new QueryResponse(request.id(), results);
    }

    @Override
    public List<Entity> queryPrefix(String text, int limit) {
        InputSanitizer.validateText(text);
        if (limit <= 0) {
            return List.of();
        }
        List<Entity> exact = exactMatches(text);
        if (!exact.isEmpty()) {
            log.debug("prefix.fastpath text='{}' hits={}", text, exact.size());
            return exact.size() > limit ? List.copyOf(exact.subList(0, limit)) : exact;
        }
        List<Entity> result = new ArrayList<>();
        for (Map<String, Object> row : executor.findEntitiesByPrefix(text, limit)) {
            result.add(toEntity(row));
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Returns the number of entity rows in the database.
     */
    public long size() {
        return executor.countEntities();
    }

    /**
     * Returns the connection the store reads through.
     */
    public SqlConnection getConnection() {
        return connection;
    }

    public EntityCache cache() {
        return cache;
    }

    @Override
    public void close() {
        cache.invalidateAll();
        connection.close();
        log.info("store.closed database={}", connection.getDatabaseName());
    }

    private List<Entity> exactMatches(String rawKey) {
        List<Entity> result = new ArrayList<>();
        for (Map<String, Object> row : executor.findEntitiesByRawKey(rawKey)) {
            result.add(toEntity(row));
        }
        return result;
    }

    private Entity toEntity(Map<String, Object> row) {
        String rawKey = SqlQueryExecutor.text(row, "ent_id");
        List<String> typeIds = TypeList.parse(SqlQueryExecutor.text(row, "ent_types"), metadata.defaultTypeId());
        return Entity.builder()
                .id(EntityId.compose(typeIds.get(0), rawKey))
                .name(SqlQueryExecutor.text(row, "ent_name"))
                .description(SqlQueryExecutor.text(row, "ent_description"))
                .types(resolveTypes(typeIds))
                .build();
    }

    private List<EntityType> resolveTypes(List<String> typeIds) {
        List<EntityType> resolved = new ArrayList<>(typeIds.size());
        for (String typeId : typeIds) {
            EntityType type = types.get(typeId);
            resolved.add(type != null ? type : EntityType.of(typeId, typeId));
        }
        return resolved;
    }

    private Map<String, PropertyValue> loadPropertyValues(Entity entity, String typeList, String rawKey) {
        Map<String, PropertyValue> values = new LinkedHashMap<>();
        for (Map<String, Object> row : executor.findPropertyValues(typeList, rawKey)) {
            String propertyId = SqlQueryExecutor.text(row, "prop_id");
            if (values.containsKey(propertyId)) {
                // multi-valued properties keep their first value
                continue;
            }
            String stored = SqlQueryExecutor.text(row, "prop_value");
            String valueType = valueTypeOf(entity, propertyId);
            values.put(propertyId, types.containsKey(valueType)
                    ? resolveReference(valueType, stored)
                    : PropertyValue.of(stored));
        }
        return values;
    }

    private String valueTypeOf(Entity entity, String propertyId) {
        for (EntityType type : entity.getTypes()) {
            for (Property property : propertiesFor(type.id())) {
                if (property.id().equals(propertyId)) {
                    return property.valueType();
                }
            }
        }
        return "";
    }

    /**
     * Turns a stored raw key back into a reference to an entity of the given type. A key
     * with no such entity keeps the type as primary type and has an empty name.
     */
    private PropertyValue resolveReference(String typeId, String rawKey) {
        for (Map<String, Object> row : executor.findEntitiesByRawKey(rawKey)) {
            Entity target = toEntity(row);
            if (target.hasType(typeId)) {
                return PropertyValue.ofReference(target.getId(), target.getName());
            }
        }
        return PropertyValue.ofReference(EntityId.compose(typeId, rawKey), "");
    }

    private Map<String, EntityType> loadTypes() {
        Map<String, EntityType> typeMap = new LinkedHashMap<>();
        for (Map<String, Object> row : executor.findTypes()) {
            EntityType type = new EntityType(
                    SqlQueryExecutor.text(row, "type_id"),
                    SqlQueryExecutor.text(row, "type_name"),
                    SqlQueryExecutor.text(row, "type_description"),
                    SqlQueryExecutor.text(row, "type_url"));
            typeMap.put(type.id(), type);
        }
        return typeMap;
    }

    private StoreMetadata loadMetadata(Map<String, EntityType> typeMap) {
        Map<String, String> values = executor.loadMetadata();
        String defaultType = values.get(DEFAULT_TYPE_KEY);
        if ((defaultType == null || defaultType.isEmpty()) && !typeMap.isEmpty()) {
            defaultType = typeMap.keySet().iterator().next();
        }
        return new StoreMetadata(
                values.get("name"),
                values.get("identifierNamespace"),
                values.get("schemaNamespace"),
                values.get("view_url"),
                defaultType);
    }

    private Map<String, List<Property>> loadProperties() {
        Map<String, List<String>> typesByProperty = new LinkedHashMap<>();
        for (Map<String, Object> row : executor.findPropertyTypeLinks()) {
            typesByProperty.computeIfAbsent(SqlQueryExecutor.text(row, "prop_id"), k -> new ArrayList<>())
                    .add(SqlQueryExecutor.text(row, "type_id"));
        }

        Map<String, List<Property>> byType = new LinkedHashMap<>();
        for (Map<String, Object> row : executor.findProperties()) {
            Property property = new Property(
                    SqlQueryExecutor.text(row, "prop_id"),
                    SqlQueryExecutor.text(row, "prop_name"),
                    SqlQueryExecutor.text(row, "prop_description"),
                    SqlQueryExecutor.text(row, "prop_value_type"));
            for (String typeId : typesByProperty.getOrDefault(property.id(), List.of())) {
                byType.computeIfAbsent(typeId, k -> new ArrayList<>()).add(property);
            }
        }
        Map<String, List<Property>> frozen = new LinkedHashMap<>();
        byType.forEach((typeId, list) -> frozen.put(typeId, List.copyOf(list)));
        return Collections.unmodifiableMap(frozen);
    }

    public static class Builder {
        private SqlConnection connection;
        private CacheConfig cacheConfig = CacheConfig.defaults();
        private MetricsService metrics = new NoOpMetricsService();

        /**
         * Reads through a pool of SQLite connections.
         */
        public Builder pool(PoolConfig poolConfig) {
            this.connection = new PooledSqlConnection(new SimpleSqlConnectionPool(poolConfig));
            return this;
        }

        /**
         * Reads through the given connection. It is closed with the store.
         */
        public Builder connection(SqlConnection connection) {
            this.connection = connection;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        public Builder metrics(MetricsService metrics) {
            this.metrics = metrics;
            return this;
        }

        public RelationalEntityStore build() {
            if (connection == null) {
                throw new IllegalStateException("A pool or connection is required");
            }
            return new RelationalEntityStore(this);
        }
    }
}
