package com.entity.reconciliation.memory;

import com.entity.reconciliation.core.model.Candidate;
import com.entity.reconciliation.core.model.Entity;
import com.entity.reconciliation.core.model.EntityId;
import com.entity.reconciliation.core.model.EntityType;
import com.entity.reconciliation.core.model.Property;
import com.entity.reconciliation.core.model.QueryRequest;
import com.entity.reconciliation.core.model.QueryResponse;
import com.entity.reconciliation.store.EntityStore;
import com.entity.reconciliation.store.InputSanitizer;
import com.entity.reconciliation.store.MatchScoring;
import com.entity.reconciliation.store.StoreMetadata;
import com.entity.reconciliation.store.record.EntityRecord;
import com.entity.reconciliation.store.record.PropertyRecord;
import com.entity.reconciliation.store.record.StoreRecord;
import com.entity.reconciliation.store.record.TypeRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * {@link EntityStore} holding every type, property and entity in memory and answering
 * queries by linear scan.
 *
 * <p>All maps are filled in the constructor and wrapped read-only; there is no
 * mutator, so concurrent readers need no locking. Property constraints of a query
 * are not used for scoring by this engine.</p>
 */
public class InMemoryEntityStore implements EntityStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryEntityStore.class);

    private static final Comparator<Candidate> BEST_FIRST =
            Comparator.comparingDouble(Candidate::score).reversed().thenComparing(Candidate::id);
    private static final Comparator<Entity> BY_NAME =
            Comparator.comparing(Entity::getName).thenComparing(Entity::getRawKey).thenComparing(Entity::getId);

    private final StoreMetadata metadata;

    // type id -> type
    private final Map<String, EntityType> types;

    // type id -> properties declared for that type
    private final Map<String, List<Property>> properties;

    // composite id -> entity
    private final Map<String, Entity> entities;

    // raw key -> entities loaded under that key, one per type list
    private final Map<String, List<Entity>> entitiesByRawKey;

    public InMemoryEntityStore(StoreMetadata metadata, Iterator<? extends StoreRecord> records) {
        this.metadata = metadata;

        Map<String, EntityType> typeMap = new LinkedHashMap<>();
        Map<String, List<Property>> propertyMap = new LinkedHashMap<>();
        List<EntityRecord> entityRecords = new ArrayList<>();

        while (records.hasNext()) {
            StoreRecord record = records.next();
            if (record instanceof TypeRecord tr) {
                typeMap.put(tr.type().id(), tr.type());
            } else if (record instanceof PropertyRecord pr) {
                for (String typeId : pr.typeIds()) {
                    addOrReplace(propertyMap.computeIfAbsent(typeId, k -> new ArrayList<>()), pr.property());
                }
            } else if (record instanceof EntityRecord er) {
                entityRecords.add(er);
            }
        }

        Map<String, Entity> entityMap = new LinkedHashMap<>();
        Map<String, List<Entity>> byRawKey = new LinkedHashMap<>();
        for (EntityRecord er : entityRecords) {
            Entity entity = toEntity(er, typeMap);
            Entity previous = entityMap.put(entity.getId(), entity);
            if (previous != null) {
                log.warn("store.duplicate id={} keeping last definition", entity.getId());
                byRawKey.get(er.rawKey()).remove(previous);
            }
            byRawKey.computeIfAbsent(er.rawKey(), k -> new ArrayList<>()).add(entity);
        }

        this.types = Collections.unmodifiableMap(typeMap);
        this.properties = freeze(propertyMap);
        this.entities = Collections.unmodifiableMap(entityMap);
        this.entitiesByRawKey = freeze(byRawKey);

        log.info("store.loaded name='{}' types={} entities={}", metadata.name(), types.size(), entities.size());
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
        String typeId = EntityId.primaryType(id);
        for (Entity entity : entitiesByRawKey.getOrDefault(EntityId.rawKey(id), List.of())) {
            if (entity.hasType(typeId)) {
                return Optional.of(entity);
            }
        }
        return Optional.empty();
    }

    @Override
    public QueryResponse query(QueryRequest request) {
        InputSanitizer.validateQuery(request);
        List<Entity> exact = entitiesByRawKey.get(request.text());
        if (exact != null) {
            log.debug("query.fastpath id={} hits={}", request.id(), exact.size());
            return new QueryResponse(request.id(), exact.stream().map(MatchScoring::exactMatch).toList());
        }

        List<Candidate> results = new ArrayList<>();
        for (Entity entity : entities.values()) {
            double score = MatchScoring.heuristicScore(request.text(), entity, request.type());
            if (score > 0.0) {
                results.add(MatchScoring.scored(entity, score));
            }
        }
        results.sort(BEST_FIRST);

        int limit = request.effectiveLimit();
        if (results.size() > limit) {
            results = results.subList(0, limit);
        }
        log.debug("query.fuzzy id={} results={}", request.id(), results.size());
        return new QueryResponse(request.id(), results);
    }

    @Override
    public List<Entity> queryPrefix(String text, int limit) {
        InputSanitizer.validateText(text);
        if (limit <= 0) {
            return List.of();
        }
        List<Entity> exact = entitiesByRawKey.get(text);
        if (exact != null) {
            log.debug("prefix.fastpath text='{}' hits={}", text, exact.size());
            return exact.size() > limit ? exact.subList(0, limit) : exact;
        }

        String low = text.toLowerCase(Locale.ROOT);
        List<Entity> result = new ArrayList<>();
        for (Entity entity : entities.values()) {
            if (entity.getName().toLowerCase(Locale.ROOT).startsWith(low)
                    || entity.getRawKey().toLowerCase(Locale.ROOT).startsWith(low)) {
                result.add(entity);
            }
        }
        result.sort(BY_NAME);
        return result.size() > limit ? List.copyOf(result.subList(0, limit)) : List.copyOf(result);
    }

    /**
     * Returns the number of entities held.
     */
    public int size() {
        return entities.size();
    }

    @Override
    public void close() {
        // nothing to release
    }

    private Entity toEntity(EntityRecord record, Map<String, EntityType> typeMap) {
        Entity.Builder builder = Entity.builder()
                .id(record.compositeId())
                .name(record.name())
                .description(record.description())
                .properties(record.properties());
        for (String typeId : record.typeIds()) {
            EntityType type = typeMap.get(typeId);
            if (type == null) {
                log.debug("store.undeclaredType type={} entity={}", typeId, record.rawKey());
                type = EntityType.of(typeId, typeId);
            }
            builder.type(type);
        }
        return builder.build();
    }

    private static void addOrReplace(List<Property> list, Property property) {
        for (int i = 0; i < list.size(); i++) {
            if (list.get(i).id().equals(property.id())) {
                list.set(i, property);
                return;
            }
        }
        list.add(property);
    }

    private static <T> Map<String, List<T>> freeze(Map<String, List<T>> source) {
        Map<String, List<T>> frozen = new LinkedHashMap<>();
        source.forEach((k, v) -> frozen.put(k, List.copyOf(v)));
        return Collections.unmodifiableMap(frozen);
    }
}
