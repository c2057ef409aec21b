package com.visitsync.model.enums;

/**
 * System a {@link com.visitsync.model.visit.VisitRecord} was read from.
 */
public enum RecordSource {
    SITE_A,
    SITE_B
}
