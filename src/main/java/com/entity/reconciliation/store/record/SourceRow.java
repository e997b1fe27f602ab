package com.entity.reconciliation.store.record;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A raw row of the intermediate format: id, name, comma-separated type ids and
 * a free-form attribute map (which may carry a {@code description}).
 */
public record SourceRow(String id, String name, String typeList, Map<String, Object> attributes) {
    public SourceRow {
        name = name != null ? name : "";
        typeList = typeList != null ? typeList : "";
        attributes = attributes != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes)) : Map.of();
    }
}
