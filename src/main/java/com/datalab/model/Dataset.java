package com.datalab.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Dataset(long id, String name, String description, DatasetKind kind) {

    public Dataset {
        name = name == null ? "" : name;
        description = description == null ? "" : description;
        kind = kind == null ? DatasetKind.ITEMS : kind;
    }
}
