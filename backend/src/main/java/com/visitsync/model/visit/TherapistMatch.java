package com.visitsync.model.visit;

/**
 * Winning therapist option and its score (2 = surname, 3 = surname and given name).
 */
public record TherapistMatch(TherapistCandidate candidate, int score) {

    public String label() {
        return candidate.displayLabel();
    }
}
