package com.entity.reconciliation.loader;

import com.entity.reconciliation.store.StoreMetadata;
import com.entity.reconciliation.store.record.StoreRecord;

import java.util.List;

/**
 * Contents of a flat source file: the header metadata and the records that follow it,
 * header types first.
 */
public record FlatFile(StoreMetadata metadata, List<StoreRecord> records) {
    public FlatFile {
        records = List.copyOf(records);
    }
}
