package com.datalab.pairs;

import java.util.Locale;

public enum ContextMode {
    /** Prompt is the single user turn being answered. */
    NONE,
    /** Prompt is the rendered history limited to the last N user turns. */
    WINDOW,
    /** Prompt is the rendered history from the first message. */
    FULL;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Blank or unrecognized values fall back to {@link #NONE}.
     */
    public static ContextMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        for (ContextMode mode : values()) {
            if (mode.value().equals(value.strip())) {
                return mode;
            }
        }
        return NONE;
    }
}
