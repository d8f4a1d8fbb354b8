package com.datalab.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum DatasetKind {
    ITEMS("items"),
    CONVERSATIONS("conversations");

    private final String value;

    DatasetKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Unset kinds default to items; any other stored value that is not {@code items} is treated as a
     * conversations dataset.
     */
    @JsonCreator
    public static DatasetKind fromValue(String value) {
        if (value == null || ITEMS.value.equalsIgnoreCase(value)) {
            return ITEMS;
        }
        return CONVERSATIONS;
    }
}
