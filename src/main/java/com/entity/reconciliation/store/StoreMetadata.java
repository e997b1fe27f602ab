package com.entity.reconciliation.store;

/**
 * Static metadata of a data source, set once when a store is constructed.
 *
 * @param name                human-readable name of the source
 * @param identifierNamespace namespace URI of entity identifiers
 * @param schemaNamespace     namespace URI of type identifiers
 * @param viewUrlTemplate     template turning an entity id into a view URL, may be blank
 * @param defaultTypeId       type assigned to records that declare none
 */
public record StoreMetadata(
        String name,
        String identifierNamespace,
        String schemaNamespace,
        String viewUrlTemplate,
        String defaultTypeId
) {
    /** Type id used when a source declares no types at all. */
    public static final String FALLBACK_TYPE_ID = "item";

    public StoreMetadata {
        name = name != null ? name : "";
        identifierNamespace = identifierNamespace != null ? identifierNamespace : "";
        schemaNamespace = schemaNamespace != null ? schemaNamespace : "";
        viewUrlTemplate = viewUrlTemplate != null ? viewUrlTemplate : "";
        defaultTypeId = defaultTypeId != null && !defaultTypeId.isEmpty() ? defaultTypeId : FALLBACK_TYPE_ID;
    }
}
