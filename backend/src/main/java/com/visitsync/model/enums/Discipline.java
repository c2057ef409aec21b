package com.visitsync.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Clinical discipline qualifying a visit type.
 */
public enum Discipline {
    PT("pt"),
    OT("ot"),
    ST("st");

    private final String value;

    Discipline(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Lenient lookup used at the adapter boundary. Blank or unknown values
     * mean "no discipline" rather than an error, since System B leaves the
     * attribute empty on some schedule items.
     */
    public static Discipline fromValue(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        for (Discipline discipline : values()) {
            if (discipline.value.equalsIgnoreCase(trimmed)) {
                return discipline;
            }
        }
        return null;
    }
}
