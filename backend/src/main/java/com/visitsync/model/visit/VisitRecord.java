package com.visitsync.model.visit;

import com.visitsync.model.enums.Discipline;
import com.visitsync.model.enums.RecordSource;
import com.visitsync.model.enums.VisitType;
import lombok.Builder;
import lombok.Value;

/**
 * Canonical visit record produced by either adapter.
 *
 * Never mutated once returned; derived views (dedup key, mapped label)
 * are computed from it instead.
 */
@Value
@Builder(toBuilder = true)
public class VisitRecord {

    RecordSource source;

    /**
     * System A task label (e.g. "PTA Visit") or raw System B type text (e.g. "STANDARD").
     */
    String taskName;

    String therapist;

    /** M/D/YYYY or MM/DD/YYYY; empty when only a target date is assigned. */
    String visitDate;

    String targetDate;

    VisitType systemType;

    /** Null means the source did not qualify the visit with a discipline. */
    Discipline discipline;

    boolean needsAction;

    String rawStatus;

    /** System B time slot label, e.g. "1:30 PM" or "No Scheduled Time". Null for System A rows. */
    String timeSlot;

    /**
     * Visit date when present, otherwise the target date.
     */
    public String effectiveDate() {
        if (visitDate != null && !visitDate.isBlank()) {
            return visitDate.trim();
        }
        return targetDate != null ? targetDate.trim() : "";
    }

    public boolean hasDate() {
        return !effectiveDate().isEmpty();
    }

    public String describe() {
        return String.format("\"%s\" on %s", taskName, effectiveDate());
    }
}
