package com.visitsync.service;

import com.visitsync.model.enums.ScheduleStatus;
import com.visitsync.model.visit.VisitRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class ScheduleStatusResolverTest {

    private final ScheduleStatusResolver resolver = new ScheduleStatusResolver(new TypeMappingService());

    @ParameterizedTest
    @CsvSource({
        "Scheduled, SCHEDULED",
        "Scheduled (view), SCHEDULED",
        "INCOMPLETE, INCOMPLETE",
        "View Document, VIEW_DOCUMENT",
        "Missed Visit, MISSED",
        "Completed, NOT_FOUND"
    })
    void firstKeywordInPrecedenceOrderWins(String raw, ScheduleStatus expected) {
        assertThat(resolver.resolve(raw)).isEqualTo(expected);
    }

    @Test
    void blankStatusIsNotFound() {
        assertThat(resolver.resolve("")).isEqualTo(ScheduleStatus.NOT_FOUND);
        assertThat(resolver.resolve((String) null)).isEqualTo(ScheduleStatus.NOT_FOUND);
    }

    @Test
    void dischargeVisitIsAlwaysNotFound() {
        VisitRecord discharge = VisitRecord.builder().taskName("DISCHARGE").visitDate("2/17/2026").build();

        assertThat(resolver.resolve(discharge, Optional.of("Scheduled"))).isEqualTo(ScheduleStatus.NOT_FOUND);
    }

    @Test
    void missingLiveStatusIsNotFound() {
        VisitRecord visit = VisitRecord.builder().taskName("STANDARD").visitDate("2/17/2026").build();

        assertThat(resolver.resolve(visit, Optional.empty())).isEqualTo(ScheduleStatus.NOT_FOUND);
        assertThat(resolver.resolve(visit, Optional.of("scheduled"))).isEqualTo(ScheduleStatus.SCHEDULED);
    }
}
