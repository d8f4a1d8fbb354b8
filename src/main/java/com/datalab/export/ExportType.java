package com.datalab.export;

import java.util.Locale;

public enum ExportType {
    PAIRS,
    CONVERSATIONS,
    ITEMS,
    ITEMS_WITH_META;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Blank selects {@link #PAIRS}; anything else must name a known type.
     */
    public static ExportType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return PAIRS;
        }
        String trimmed = value.strip();
        for (ExportType type : values()) {
            if (type.value().equals(trimmed)) {
                return type;
            }
        }
        throw new ExportConfigurationException("unknown export type: " + trimmed);
    }
}
