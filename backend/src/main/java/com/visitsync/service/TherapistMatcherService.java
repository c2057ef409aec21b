package com.visitsync.service;

import com.visitsync.exception.TherapistUnmatchedException;
import com.visitsync.model.visit.TherapistCandidate;
import com.visitsync.model.visit.TherapistMatch;
import com.visitsync.util.TextNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Therapist Matcher Service
 *
 * Matches a System B therapist ("FIRST LAST (ROLE)") against System A options
 * ("Last, First").
 *
 * Score = surname(2) + given name(1)
 *   Surname:    option starts with "surname," or its pre-comma part equals the surname
 *   Given name: given name is a substring of the post-comma part
 *
 * A surname match is mandatory (minimum score 2). Ties keep the first option seen.
 */
@Slf4j
@Service
public class TherapistMatcherService {

    static final int SURNAME_POINTS = 2;
    static final int GIVEN_NAME_POINTS = 1;
    static final int MINIMUM_SCORE = SURNAME_POINTS;

    public Optional<TherapistMatch> match(String therapist, List<String> options) {
        String cleaned = TextNormalizer.normalizeText(therapist == null ? "" : therapist.replaceAll("\\(.*\\)", ""));
        if (cleaned.isEmpty()) {
            return Optional.empty();
        }
        String[] words = cleaned.split(" ");
        String surname = words[words.length - 1];
        String givenName = String.join(" ", Arrays.copyOf(words, words.length - 1));

        TherapistCandidate best = null;
        int bestScore = 0;

        for (String option : options) {
            if (option == null || option.isBlank()) {
                continue;
            }
            TherapistCandidate candidate = TherapistCandidate.of(option);
            int score = score(candidate, surname, givenName);
            if (score > bestScore) {
                bestScore = score;
                best = candidate;
            }
        }

        if (best == null || bestScore < MINIMUM_SCORE) {
            log.debug("No therapist option for \"{}\" (surname \"{}\", given \"{}\")", therapist, surname, givenName);
            return Optional.empty();
        }
        return Optional.of(new TherapistMatch(best, bestScore));
    }

    /**
     * Like {@link #match} but raises when no option qualifies.
     */
    public TherapistMatch requireMatch(String therapist, List<String> options) {
        return match(therapist, options).orElseThrow(() ->
            new TherapistUnmatchedException("Therapist \"" + therapist + "\" not found among System A options"));
    }

    int score(TherapistCandidate candidate, String surname, String givenName) {
        int score = 0;
        if (candidate.normalizedText().startsWith(surname + ",") || candidate.normalizedLast().equals(surname)) {
            score += SURNAME_POINTS;
        }
        if (!givenName.isEmpty() && candidate.normalizedFirst().contains(givenName)) {
            score += GIVEN_NAME_POINTS;
        }
        return score;
    }
}
