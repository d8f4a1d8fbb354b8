package com.datalab.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * One message of a dialogue. {@code role} is kept exactly as stored so verbatim exports round-trip;
 * {@link #kind()} classifies it for pairing and labelling.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({ "role", "content", "name", "meta" })
public record Message(
        String role,
        String content,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) String name,
        @JsonInclude(JsonInclude.Include.NON_NULL) JsonNode meta) {

    public Message {
        role = role == null ? "" : role;
        content = content == null ? "" : content;
        name = name == null ? "" : name;
        meta = meta == null || meta.isNull() || meta.isMissingNode() ? null : meta;
    }

    public static Message of(Role role, String content) {
        return new Message(role.value(), content, "", null);
    }

    @JsonIgnore
    public Role kind() {
        return Role.fromValue(role);
    }

    @JsonIgnore
    public boolean isBlank() {
        return content.isBlank();
    }

    public String trimmedContent() {
        return content.strip();
    }
}
