package com.entity.reconciliation.api;

import com.entity.reconciliation.core.model.Entity;
import com.entity.reconciliation.core.model.EntityType;
import com.entity.reconciliation.core.model.Property;
import com.entity.reconciliation.core.model.PropertyValue;
import com.entity.reconciliation.core.model.QueryRequest;
import com.entity.reconciliation.core.model.QueryResponse;
import com.entity.reconciliation.health.HealthCheckRegistry;
import com.entity.reconciliation.health.HealthStatus;
import com.entity.reconciliation.store.EntityStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * The reconciliation API over an {@link EntityStore}: manifest, queries, data extension,
 * suggestions and property proposals. Transport-independent; the REST resource only
 * parses parameters and renders results.
 *
 * <p>Thread-safe as long as the store is, which every store is.</p>
 */
public class ReconciliationService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ReconciliationService.class);

    private final EntityStore store;
    private final ReconciliationOptions options;
    private final HealthCheckRegistry healthChecks;
    private final Manifest manifest;

    public ReconciliationService(EntityStore store, ReconciliationOptions options) {
        this(store, options, HealthCheckRegistry.forStore(store));
    }

    public ReconciliationService(EntityStore store, ReconciliationOptions options,
                                 HealthCheckRegistry healthChecks) {
        this.store = store;
        this.options = options;
        this.healthChecks = healthChecks;
        this.manifest = buildManifest();
        log.info("service.ready store='{}' serviceUrl={}", store.name(), options.getServiceUrl());
    }

    /**
     * Returns the manifest describing the service and its endpoints.
     */
    public Manifest manifest() {
        return manifest;
    }

    /**
     * Runs a batch of queries. Each query takes the id it is keyed by.
     *
     * @param queries query id to query
     * @return query id to candidates, in batch order
     * @throws IllegalArgumentException if a query is missing
     * @throws com.entity.reconciliation.store.StoreException if a query fails; the batch is abandoned
     */
    public Map<String, QueryResult> reconcile(Map<String, QueryRequest> queries) {
        Map<String, QueryResult> results = new LinkedHashMap<>();
        for (Map.Entry<String, QueryRequest> entry : queries.entrySet()) {
            if (entry.getValue() == null) {
                throw new IllegalArgumentException("Query '" + entry.getKey() + "' is empty");
            }
            QueryResponse response = store.query(entry.getValue().withId(entry.getKey()));
            results.put(response.id(), new QueryResult(response.results()));
        }
        log.debug("reconcile.completed queries={}", queries.size());
        return results;
    }

    /**
     * Fetches property values for entities.
     *
     * @throws EntityNotFoundException if an id is unknown; nothing is returned then
     */
    public ExtendResponse extend(ExtendRequest request) {
        List<Property> meta = new ArrayList<>();
        for (ExtendRequest.RequestedProperty requested : request.properties()) {
            meta.add(findProperty(requested.id()));
        }

        Map<String, Map<String, List<Map<String, Object>>>> rows = new LinkedHashMap<>();
        for (String id : request.ids()) {
            Entity entity = store.getEntity(id).orElseThrow(() -> new EntityNotFoundException(id));
            Map<String, List<Map<String, Object>>> row = new LinkedHashMap<>();
            for (Property property : meta) {
                PropertyValue value = entity.getProperties().get(property.id());
                row.put(property.id(), value == null ? List.of() : List.of(cell(value)));
            }
            rows.put(id, row);
        }
        return new ExtendResponse(meta, rows);
    }

    /**
     * Suggests entities whose name or id starts with the prefix.
     */
    public SuggestResponse<Entity> suggestEntities(String prefix) {
        return new SuggestResponse<>(store.queryPrefix(nullToEmpty(prefix), options.getSuggestLimit()));
    }

    /**
     * Suggests types by name prefix, falling back to a substring match when no name starts
     * with the prefix. Case is ignored.
     */
    public SuggestResponse<EntityType> suggestTypes(String prefix) {
        return new SuggestResponse<>(matchNames(List.copyOf(store.types()), EntityType::name, prefix));
    }

    /**
     * Suggests properties of any type by name, like {@link #suggestTypes}.
     */
    public SuggestResponse<Property> suggestProperties(String prefix) {
        return new SuggestResponse<>(matchNames(allProperties(), Property::name, prefix));
    }

    /**
     * Lists the properties of a type.
     *
     * @param limit maximum number of properties, 0 or less for all
     */
    public PropertyProposal proposeProperties(String typeId, int limit) {
        String type = nullToEmpty(typeId);
        List<Property> properties = store.propertiesFor(type);
        if (limit > 0 && properties.size() > limit) {
            properties = properties.subList(0, limit);
        }
        return new PropertyProposal(Math.max(limit, 0), type, List.copyOf(properties));
    }

    public HealthStatus health() {
        return healthChecks.checkAll();
    }

    public EntityStore getStore() {
        return store;
    }

    @Override
    public void close() {
        store.close();
    }

    private Manifest buildManifest() {
        String serviceUrl = options.getServiceUrl();
        String view = UrlTemplate.normalize(store.viewUrlTemplate());
        return new Manifest(
                Manifest.VERSIONS,
                store.name(),
                store.identifierNamespace(),
                store.schemaNamespace(),
                List.copyOf(store.types()),
                view.isEmpty() ? null : new Manifest.View(view),
                new Manifest.Suggest(
                        new Manifest.ServiceDefinition(serviceUrl, "/auto/entities"),
                        new Manifest.ServiceDefinition(serviceUrl, "/auto/types"),
                        new Manifest.ServiceDefinition(serviceUrl, "/auto/properties")),
                new Manifest.Extend(new Manifest.ServiceDefinition(serviceUrl, "/properties")));
    }

    private List<Property> allProperties() {
        Map<String, Property> byId = new LinkedHashMap<>();
        for (EntityType type : store.types()) {
            for (Property property : store.propertiesFor(type.id())) {
                byId.putIfAbsent(property.id(), property);
            }
        }
        return new ArrayList<>(byId.values());
    }

    private Property findProperty(String propertyId) {
        if (propertyId == null || propertyId.isEmpty()) {
            throw new IllegalArgumentException("Requested property without an id");
        }
        return allProperties().stream()
                .filter(p -> p.id().equals(propertyId))
                .findFirst()
                .orElse(Property.of(propertyId, propertyId));
    }

    private static <T> List<T> matchNames(List<T> items, Function<T, String> name, String prefix) {
        String low = nullToEmpty(prefix).toLowerCase(Locale.ROOT);
        List<T> hits = filter(items, t -> name.apply(t).toLowerCase(Locale.ROOT).startsWith(low));
        if (hits.isEmpty()) {
            hits = filter(items, t -> name.apply(t).toLowerCase(Locale.ROOT).contains(low));
        }
        return hits;
    }

    private static <T> List<T> filter(List<T> items, Predicate<T> predicate) {
        List<T> result = new ArrayList<>();
        for (T item : items) {
            if (predicate.test(item)) {
                result.add(item);
            }
        }
        return result;
    }

    private static Map<String, Object> cell(PropertyValue value) {
        Object raw = value.rawValue();
        if (raw instanceof PropertyValue.Reference ref) {
            Map<String, Object> cell = new LinkedHashMap<>();
            cell.put("id", ref.id());
            cell.put("name", ref.name());
            return cell;
        }
        if (raw instanceof Boolean b) {
            return Map.of("bool", b);
        }
        if (raw instanceof Long l) {
            return Map.of("int", l);
        }
        if (raw instanceof Double d) {
            return Map.of("float", d);
        }
        return Map.of("str", value.asString());
    }

    private static String nullToEmpty(String s) {
        return s != null ? s : "";
    }
}
