package com.entity.reconciliation.store;

import com.entity.reconciliation.core.model.Entity;
import com.entity.reconciliation.core.model.EntityType;
import com.entity.reconciliation.core.model.Property;
import com.entity.reconciliation.core.model.QueryRequest;
import com.entity.reconciliation.core.model.QueryResponse;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A searchable, read-only collection of typed entities and their properties.
 *
 * <p>Implementations are fully populated when constructed and never modified
 * afterwards, so a single instance is shared by all request threads without locking.
 * Both implementations must produce the same observable results for the same data;
 * the choice of backend only affects storage and performance.</p>
 *
 * @see MatchScoring
 */
public interface EntityStore extends AutoCloseable {

    /**
     * Name of the data source.
     */
    String name();

    /**
     * Universal namespace of entity identifiers.
     */
    String identifierNamespace();

    /**
     * Universal namespace of type identifiers.
     */
    String schemaNamespace();

    /**
     * Template turning an entity id into a view URL, blank when the source has none.
     */
    String viewUrlTemplate();

    /**
     * Returns all known types.
     */
    Set<EntityType> types();

    /**
     * Returns the properties declared for a type, in declaration order.
     *
     * @param typeId the type id
     * @return the properties, empty for an unknown type
     */
    List<Property> propertiesFor(String typeId);

    /**
     * Looks up an entity by composite id and attaches its property values.
     *
     * @param id composite id ({@code primaryType:rawKey})
     * @return the entity, or empty when no entity with that raw key holds that type
     */
    Optional<Entity> getEntity(String id);

    /**
     * Runs a reconciliation query.
     *
     * @param request the query
     * @return the candidates, best first; empty when nothing matches
     * @throws MalformedQueryException    if a property constraint cannot be interpreted
     * @throws StoreUnavailableException  if the backing storage fails
     */
    QueryResponse query(QueryRequest request);

    /**
     * Finds entities whose name or raw id starts with the given text, ignoring case.
     *
     * @param text  the prefix
     * @param limit maximum number of entities to return
     * @return the entities, empty when nothing matches
     */
    List<Entity> queryPrefix(String text, int limit);

    @Override
    void close();
}
