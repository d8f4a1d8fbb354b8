package com.datalab.export;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonRawValue;

/**
 * Item wrapped with its identifiers, as written by the {@code items_with_meta} export. {@code data} is
 * already-compacted JSON text.
 */
@JsonPropertyOrder({ "data", "dataset_id", "id", "source_ref" })
record ItemWithMetaLine(
        @JsonRawValue String data,
        @JsonProperty("dataset_id") long datasetId,
        long id,
        @JsonProperty("source_ref") String sourceRef) {
}
