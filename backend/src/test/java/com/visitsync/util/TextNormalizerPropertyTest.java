package com.visitsync.util;

import com.visitsync.service.VisitKeyService;
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for text and key normalization.
 */
class TextNormalizerPropertyTest {

    private final VisitKeyService keyService = new VisitKeyService();

    // ==================== Idempotence ====================

    @Property(tries = 200)
    void normalizeText_isIdempotent(@ForAll("labels") String label) {
        String once = TextNormalizer.normalizeText(label);

        assertThat(TextNormalizer.normalizeText(once)).isEqualTo(once);
    }

    @Property(tries = 200)
    void normalizeText_hasNoUpperCaseOrDoubleSpaces(@ForAll("labels") String label) {
        String normalized = TextNormalizer.normalizeText(label);

        assertThat(normalized).doesNotContain("  ");
        assertThat(normalized).isEqualTo(normalized.trim());
        assertThat(normalized.chars().noneMatch(Character::isUpperCase)).isTrue();
    }

    @Property(tries = 200)
    void normalizeDateToIso_isIdempotent(
            @ForAll @IntRange(min = 1, max = 12) int month,
            @ForAll @IntRange(min = 1, max = 28) int day,
            @ForAll @IntRange(min = 2000, max = 2099) int year) {
        String iso = TextNormalizer.normalizeDateToIso(month + "/" + day + "/" + year);

        assertThat(TextNormalizer.normalizeDateToIso(iso)).isEqualTo(iso);
        assertThat(iso).matches("\\d{4}-\\d{2}-\\d{2}");
    }

    // ==================== Key invariance ====================

    @Property(tries = 200)
    void key_ignoresCaseSpacingAndZeroPadding(
            @ForAll("words") String label,
            @ForAll @IntRange(min = 1, max = 12) int month,
            @ForAll @IntRange(min = 1, max = 28) int day,
            @ForAll @IntRange(min = 2000, max = 2099) int year) {
        String messyLabel = "  " + label.toUpperCase().replace(" ", "   ") + "\t";
        String padded = String.format("%02d/%02d/%d", month, day, year);
        String plain = month + "/" + day + "/" + year;

        assertThat(keyService.key(messyLabel, padded)).isEqualTo(keyService.key(label, plain));
    }

    @Provide
    Arbitrary<String> labels() {
        return Arbitraries.strings()
            .withChars("abcXYZ019 /-,()\t é")
            .ofMaxLength(40);
    }

    @Provide
    Arbitrary<String> words() {
        return Arbitraries.strings().alpha().ofMinLength(1).ofMaxLength(8)
            .list().ofMinSize(1).ofMaxSize(3)
            .map(parts -> String.join(" ", parts).toLowerCase());
    }
}
