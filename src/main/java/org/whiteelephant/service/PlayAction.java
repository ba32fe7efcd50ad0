package org.whiteelephant.service;

import java.util.Locale;

public enum PlayAction {
    START, RESET, ROLL, PICK, KEEP, STEAL;

    /** pick et steal désignent un cadeau. */
    public boolean needsPresent() {
        return this == PICK || this == STEAL;
    }

    public static PlayAction parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Missing action");
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown action: " + raw);
        }
    }
}
