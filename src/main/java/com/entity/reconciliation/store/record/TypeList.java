package com.entity.reconciliation.store.record;

import java.util.ArrayList;
import java.util.List;

/**
 * Parsing of the comma-separated type id lists used by both the flat format and the
 * relational schema.
 */
public final class TypeList {

    /** Pseudo-type marking a row as a property definition. */
    public static final String PROPERTY_PSEUDO_TYPE = "property";

    private TypeList() {
        // utility class
    }

    /**
     * Splits a type list, dropping blank entries. An empty list becomes the default type.
     *
     * @param typeList    comma-separated type ids
     * @param defaultType type used when the list declares none
     * @return the type ids in declaration order, never empty
     */
    public static List<String> parse(String typeList, String defaultType) {
        List<String> ids = new ArrayList<>();
        if (typeList != null) {
            for (String part : typeList.split(",")) {
                String id = part.trim();
                if (!id.isEmpty()) {
                    ids.add(id);
                }
            }
        }
        if (ids.isEmpty()) {
            ids.add(defaultType);
        }
        return ids;
    }

    public static String join(List<String> typeIds) {
        return String.join(",", typeIds);
    }
}
