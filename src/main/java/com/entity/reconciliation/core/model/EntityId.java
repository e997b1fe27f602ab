package com.entity.reconciliation.core.model;

/**
 * Codec for composite entity identifiers.
 *
 * <p>An entity loaded under several types is exposed as {@code primaryType:rawKey},
 * where the primary type is the first type declared for the record. This keeps the
 * same raw key apart when it is loaded independently under different types.</p>
 */
public final class EntityId {

    /** Separator between the primary type id and the raw record key. */
    public static final char SEPARATOR = ':';

    private EntityId() {
        // utility class
    }

    /**
     * Composes the externally visible id of a record.
     *
     * @param primaryType the first type id declared for the record
     * @param rawKey      the record key as loaded
     * @return {@code primaryType:rawKey}
     * @throws IllegalArgumentException if the type contains the separator
     */
    public static String compose(String primaryType, String rawKey) {
        if (primaryType == null || rawKey == null) {
            throw new IllegalArgumentException("primaryType and rawKey are required");
        }
        if (primaryType.indexOf(SEPARATOR) >= 0) {
            throw new IllegalArgumentException(
                    "Type id must not contain '" + SEPARATOR + "', got: '" + primaryType + "'");
        }
        return primaryType + SEPARATOR + rawKey;
    }

    /**
     * Returns the raw record key of a composite id, or the whole id when it has no separator.
     */
    public static String rawKey(String id) {
        int idx = id.indexOf(SEPARATOR);
        return idx < 0 ? id : id.substring(idx + 1);
    }

    /**
     * Returns the primary type of a composite id, or an empty string when it has no separator.
     */
    public static String primaryType(String id) {
        int idx = id.indexOf(SEPARATOR);
        return idx < 0 ? "" : id.substring(0, idx);
    }
}
