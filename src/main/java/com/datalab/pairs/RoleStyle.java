package com.datalab.pairs;

import java.util.Locale;

public enum RoleStyle {
    LABELS,
    PLAIN;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static RoleStyle fromValue(String value) {
        if (value != null && PLAIN.value().equals(value.strip())) {
            return PLAIN;
        }
        return LABELS;
    }
}
