package com.visitsync.model.visit;

import com.visitsync.util.TextNormalizer;

/**
 * One System A therapist option in "Last, First" form, pre-split for scoring.
 */
public record TherapistCandidate(String displayLabel, String normalizedLast, String normalizedFirst) {

    public static TherapistCandidate of(String displayLabel) {
        String text = TextNormalizer.normalizeText(displayLabel);
        int comma = text.indexOf(',');
        if (comma < 0) {
            return new TherapistCandidate(displayLabel, text, "");
        }
        return new TherapistCandidate(
            displayLabel,
            text.substring(0, comma).trim(),
            text.substring(comma + 1).trim());
    }

    /** Lower-cased, whitespace-collapsed display label. */
    public String normalizedText() {
        return normalizedFirst.isEmpty()
            ? normalizedLast
            : normalizedLast + ", " + normalizedFirst;
    }
}
