package com.datalab.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A dialogue with its messages already ordered by their per-conversation index.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Conversation(
        long id,
        @JsonProperty("dataset_id") long datasetId,
        String split,
        String status,
        List<String> tags,
        String source,
        String notes,
        List<Message> messages) {

    public Conversation {
        split = split == null ? "" : split;
        status = status == null ? "" : status;
        tags = tags == null ? List.of() : List.copyOf(tags);
        source = source == null ? "" : source;
        notes = notes == null ? "" : notes;
        messages = messages == null ? List.of() : List.copyOf(messages);
    }
}
