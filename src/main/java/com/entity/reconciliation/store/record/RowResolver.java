package com.entity.reconciliation.store.record;

import com.entity.reconciliation.core.model.Property;
import com.entity.reconciliation.core.model.PropertyValue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns raw rows into store records.
 *
 * <p>Rows whose type list contains {@value TypeList#PROPERTY_PSEUDO_TYPE} define a property
 * for the remaining types; every other row describes an entity. Rows without types get
 * the store's default type. A {@code description} attribute becomes the record's
 * description rather than a property value.</p>
 */
public class RowResolver {

    static final String DESCRIPTION = "description";
    static final String VALUE_TYPE = "value_type";

    private final String defaultTypeId;

    public RowResolver(String defaultTypeId) {
        this.defaultTypeId = defaultTypeId;
    }

    public StoreRecord resolve(SourceRow row) {
        if (row.id() == null || row.id().isEmpty()) {
            throw new IllegalArgumentException("Row id must not be empty");
        }
        List<String> typeIds = TypeList.parse(row.typeList(), defaultTypeId);
        String description = stringAttribute(row.attributes(), DESCRIPTION);

        if (typeIds.contains(TypeList.PROPERTY_PSEUDO_TYPE)) {
            List<String> appliesTo = new ArrayList<>(typeIds);
            appliesTo.removeIf(TypeList.PROPERTY_PSEUDO_TYPE::equals);
            if (appliesTo.isEmpty()) {
                appliesTo.add(defaultTypeId);
            }
            Property property = new Property(row.id(), row.name(), description,
                    stringAttribute(row.attributes(), VALUE_TYPE));
            return new PropertyRecord(property, appliesTo);
        }

        Map<String, PropertyValue> values = new LinkedHashMap<>();
        for (Map.Entry<String, Object> attr : row.attributes().entrySet()) {
            if (DESCRIPTION.equals(attr.getKey()) || attr.getValue() == null) {
                continue;
            }
            values.put(attr.getKey(), PropertyValue.fromJson(attr.getValue()));
        }
        return new EntityRecord(row.id(), row.name(), description, typeIds, values);
    }

    public String getDefaultTypeId() {
        return defaultTypeId;
    }

    private static String stringAttribute(Map<String, Object> attributes, String key) {
        Object value = attributes.get(key);
        return value != null ? value.toString() : "";
    }
}
