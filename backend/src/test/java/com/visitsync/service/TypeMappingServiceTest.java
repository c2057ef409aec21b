package com.visitsync.service;

import com.visitsync.model.enums.Discipline;
import com.visitsync.model.enums.RecordSource;
import com.visitsync.model.enums.VisitType;
import com.visitsync.model.visit.TypeMapping;
import com.visitsync.model.visit.VisitRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class TypeMappingServiceTest {

    private final TypeMappingService service = new TypeMappingService();

    private static VisitRecord siteB(String type, Discipline discipline, String therapist) {
        return VisitRecord.builder()
            .source(RecordSource.SITE_B)
            .taskName(type)
            .discipline(discipline)
            .therapist(therapist)
            .visitDate("2/17/2026")
            .build();
    }

    @Nested
    @DisplayName("toSiteB()")
    class ToSiteB {

        @Test
        void mapsTableEntries() {
            assertThat(service.toSiteB("PT Evaluation")).isEqualTo(new TypeMapping("initial eval", Discipline.PT));
            assertThat(service.toSiteB("OT Re-Evaluation")).isEqualTo(new TypeMapping("reassessment", Discipline.OT));
            assertThat(service.toSiteB("ST  Visit")).isEqualTo(new TypeMapping("standard", Discipline.ST));
        }

        @Test
        void assistantLabelsTakeDisciplineFromRole() {
            assertThat(service.toSiteB("PTA Visit")).isEqualTo(new TypeMapping("standard", Discipline.PT));
            assertThat(service.toSiteB("COTA Visit")).isEqualTo(new TypeMapping("standard", Discipline.OT));
        }

        @Test
        void unknownLabelFallsBackToItself() {
            assertThat(service.toSiteB("Mystery Task")).isEqualTo(new TypeMapping("mystery task", null));
        }
    }

    @Nested
    @DisplayName("toSiteALabel()")
    class ToSiteALabel {

        @Test
        void standardVisitUsesTherapistRole() {
            assertThat(service.toSiteALabel(siteB("STANDARD", Discipline.PT, "JESSICA DIAZ (PTA)"))).isEqualTo("PTA Visit");
            assertThat(service.toSiteALabel(siteB("STANDARD", Discipline.OT, "ANN LEE (COTA)"))).isEqualTo("COTA Visit");
            assertThat(service.toSiteALabel(siteB("STANDARD", Discipline.OT, "ANN LEE (OT)"))).isEqualTo("OT Visit");
        }

        @Test
        void cotaInTypeWins() {
            assertThat(service.toSiteALabel(siteB("COTA STANDARD", Discipline.OT, null))).isEqualTo("COTA Visit");
        }

        @Test
        void evaluationsCarryDiscipline() {
            assertThat(service.toSiteALabel(siteB("INITIAL EVAL", Discipline.ST, null))).isEqualTo("ST Evaluation");
            assertThat(service.toSiteALabel(siteB("REASSESSMENT", Discipline.PT, null))).isEqualTo("PT Re-Evaluation");
            assertThat(service.toSiteALabel(siteB("RECERT", Discipline.OT, null))).isEqualTo("OT Recertification");
        }

        @Test
        void fallsBackToRawLabel() {
            assertThat(service.toSiteALabel(siteB("STANDARD", null, null))).isEqualTo("STANDARD");
            assertThat(service.toSiteALabel(siteB("Supervisory  Visit", Discipline.PT, null))).isEqualTo("Supervisory Visit");
        }

        @Test
        void readsRoleFromParentheses() {
            assertThat(service.therapistRole("JESSICA DIAZ (PTA)")).isEqualTo("pta");
            assertThat(service.therapistRole("JESSICA DIAZ")).isEmpty();
            assertThat(service.therapistRole(null)).isEmpty();
        }
    }

    @Nested
    @DisplayName("classify()")
    class Classify {

        @ParameterizedTest
        @CsvSource({
            "PT Visit, STANDARD",
            "PTA Visit, STANDARD",
            "COTA Visit, STANDARD",
            "STANDARD, STANDARD",
            "PT Evaluation, EVALUATION",
            "Initial Eval, EVALUATION",
            "PT Re-Evaluation, REASSESSMENT",
            "Reassessment, REASSESSMENT",
            "OT Recert, RECERTIFICATION",
            "SOC OASIS, SOC",
            "OASIS-E1 Discharge, DISCHARGE",
            "Supervisory Note, OTHER",
            "Associate Note, OTHER"
        })
        void classifiesByKeywordPrecedence(String label, VisitType expected) {
            assertThat(service.classify(label)).isEqualTo(expected);
        }

        @ParameterizedTest
        @ValueSource(strings = {"SOC", "soc oasis", "Start of Care", "OASIS-E1 Start", "DC OASIS", "Discharge", "Del PT Visit"})
        void excludesStartOfCareDischargeAndDeleted(String label) {
            assertThat(service.isExcluded(label)).isTrue();
        }

        @Test
        void socMustBeAWholeWord() {
            assertThat(service.isStartOfCare("Associate Visit")).isFalse();
            assertThat(service.isExcluded("PT Visit")).isFalse();
        }
    }
}
