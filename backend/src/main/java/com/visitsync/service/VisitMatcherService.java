package com.visitsync.service;

import com.visitsync.exception.NoScheduledTimeException;
import com.visitsync.exception.VisitNotFoundException;
import com.visitsync.model.visit.VisitRecord;
import com.visitsync.model.visit.VisitTarget;
import com.visitsync.util.TextNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Visit Matcher Service
 *
 * Finds the System B schedule item for a target (type, discipline, date).
 *
 * First match wins, in list order: a patient's schedule holds at most one item
 * per (type, discipline, date), so no global scoring is done.
 * Predicates, checked in order:
 * 1. Type: normalized exact match
 * 2. Date: both sides normalized to ISO, exact match
 * 3. Discipline: skipped when the target has none
 *
 * A therapist hint never excludes a candidate; a mismatch is only logged.
 */
@Slf4j
@Service
public class VisitMatcherService {

    static final String NO_SCHEDULED_TIME = "no scheduled";

    public VisitRecord match(List<VisitRecord> candidates, VisitTarget target) {
        String expectedType = TextNormalizer.normalizeText(target.expectedType());
        String expectedDate = TextNormalizer.normalizeDateToIso(target.expectedDate());

        for (VisitRecord candidate : candidates) {
            if (!TextNormalizer.normalizeText(candidate.getTaskName()).equals(expectedType)) {
                continue;
            }
            if (!TextNormalizer.normalizeDateToIso(candidate.effectiveDate()).equals(expectedDate)) {
                continue;
            }
            if (target.expectedDiscipline() != null && candidate.getDiscipline() != target.expectedDiscipline()) {
                continue;
            }

            checkTherapist(candidate, target);

            if (TextNormalizer.normalizeText(candidate.getTimeSlot()).contains(NO_SCHEDULED_TIME)) {
                throw new NoScheduledTimeException("No scheduled time yet for " + target.describe());
            }
            log.debug("Matched {} to {}", target.describe(), candidate.describe());
            return candidate;
        }

        throw new VisitNotFoundException("Visit not found: " + target.describe());
    }

    private void checkTherapist(VisitRecord candidate, VisitTarget target) {
        String hint = TextNormalizer.normalizeText(target.therapist());
        if (hint.isEmpty()) {
            return;
        }
        String actual = TextNormalizer.normalizeText(candidate.getTherapist());
        if (!actual.contains(hint) && !hint.contains(actual)) {
            log.warn("Therapist differs for {}: expected \"{}\", schedule shows \"{}\"",
                target.describe(), target.therapist(), candidate.getTherapist());
        }
    }
}
