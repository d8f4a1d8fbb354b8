package com.datalab.model;

/**
 * A schema-free dataset row. {@code data} holds the stored JSON text exactly as persisted.
 */
public record DatasetItem(long id, long datasetId, String data, String sourceRef) {

    public DatasetItem {
        data = data == null ? "null" : data;
        sourceRef = sourceRef == null ? "" : sourceRef;
    }
}
