package com.datalab.model;

/**
 * Speaker classification of a message. Stored roles outside the three known ones read as {@link #OTHER}:
 * never paired, labelled like a user turn.
 */
public enum Role {
    SYSTEM("system", "System: "),
    USER("user", "User: "),
    ASSISTANT("assistant", "Assistant: "),
    OTHER("other", "User: ");

    private final String value;
    private final String label;

    Role(String value, String label) {
        this.value = value;
        this.label = label;
    }

    public String value() {
        return value;
    }

    public String label() {
        return label;
    }

    public static Role fromValue(String value) {
        if (value == null) {
            return OTHER;
        }
        for (Role role : values()) {
            if (role != OTHER && role.value.equals(value)) {
                return role;
            }
        }
        return OTHER;
    }
}
