package com.visitsync.model.visit;

import com.visitsync.model.enums.Discipline;

/**
 * What the visit matcher looks for among schedule items.
 *
 * @param expectedType       System B type text
 * @param expectedDiscipline null to accept any discipline
 * @param expectedDate       ISO or M/D/YYYY date
 * @param therapist          optional corroborating therapist hint
 */
public record VisitTarget(
        String expectedType,
        Discipline expectedDiscipline,
        String expectedDate,
        String therapist) {

    public static VisitTarget of(TypeMapping mapping, String date, String therapist) {
        return new VisitTarget(mapping.siteBType(), mapping.discipline(), date, therapist);
    }

    public String describe() {
        return String.format("%s/%s on %s", expectedType,
            expectedDiscipline != null ? expectedDiscipline.getValue() : "any", expectedDate);
    }
}
