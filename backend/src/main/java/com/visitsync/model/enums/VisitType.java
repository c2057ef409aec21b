package com.visitsync.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Visit category shared by both systems after classification.
 * Only STANDARD visits are eligible for document attachment.
 */
public enum VisitType {
    STANDARD("Standard"),
    EVALUATION("Evaluation"),
    REASSESSMENT("Reassessment"),
    RECERTIFICATION("Recertification"),
    DISCHARGE("Discharge"),
    SOC("SOC"),
    OTHER("Other");

    private final String value;

    VisitType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static VisitType fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (VisitType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown VisitType: " + value);
    }
}
