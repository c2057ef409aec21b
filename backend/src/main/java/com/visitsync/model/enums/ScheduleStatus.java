package com.visitsync.model.enums;

/**
 * Semantic state of a System B schedule item.
 * Derived from raw status text every time it is read, never stored.
 */
public enum ScheduleStatus {
    SCHEDULED,
    INCOMPLETE,
    VIEW_DOCUMENT,
    MISSED,
    NOT_FOUND
}
