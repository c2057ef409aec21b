package com.visitsync.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DocumentNamingServiceTest {

    private final DocumentNamingService naming = new DocumentNamingService();

    private static final String IDENTIFIER = "PT Visit-2-17-2026-DOE JANE";

    @Test
    void sanitizeDropsCommasAndDisallowedCharacters() {
        assertThat(naming.sanitize("Doe,  Jane #1")).isEqualTo("Doe Jane 1");
        assertThat(naming.sanitize("PT Re-Eval (v2).")).isEqualTo("PT Re-Eval (v2).");
        assertThat(naming.sanitize(null)).isEmpty();
    }

    @Test
    void identifierIsDeterministic() {
        assertThat(naming.identifier("PT Visit", "2/17/2026", "DOE, JANE")).isEqualTo(IDENTIFIER);
        assertThat(naming.identifier("PT Visit", "2/17/2026", "DOE, JANE"))
            .isEqualTo(naming.identifier("PT Visit", "2/17/2026", "DOE, JANE"));
    }

    @Test
    void recognizesFilesProducedForIdentifier() {
        assertThat(naming.belongsTo(IDENTIFIER + ".pdf", IDENTIFIER)).isTrue();
        assertThat(naming.belongsTo(IDENTIFIER + "-1.pdf", IDENTIFIER)).isTrue();
        assertThat(naming.belongsTo("pt-visit-2-17-2026-doe-jane-2.pdf", IDENTIFIER)).isTrue();
    }

    @Test
    void rejectsFilesOfOtherPatientsOrVisits() {
        assertThat(naming.belongsTo("PT Visit-2-17-2026-DOE JANET-1.pdf", IDENTIFIER)).isFalse();
        assertThat(naming.belongsTo(IDENTIFIER + "-copy.pdf", IDENTIFIER)).isFalse();
        assertThat(naming.belongsTo("OT Visit-2-17-2026-DOE JANE-1.pdf", IDENTIFIER)).isFalse();
    }

    @Test
    void attachmentKeyMatchesUploadedFileNames() {
        String key = naming.attachmentKey("PT Visit", "2/17/2026");

        assertThat(key).isEqualTo("pt-visit-2-17-2026");
        assertThat(naming.isAlreadyAttached(IDENTIFIER + "-1.pdf", key)).isTrue();
        assertThat(naming.isAlreadyAttached("OT Visit-2-17-2026-DOE JANE-1.pdf", key)).isFalse();
    }
}
