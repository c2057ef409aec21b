package com.visitsync.service;

import com.visitsync.model.visit.VisitRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class VisitIntakeServiceTest {

    private final VisitIntakeService service =
        new VisitIntakeService(new TypeMappingService(), new VisitKeyService());

    private static VisitRecord row(String task, String visitDate, String targetDate, boolean needsAction) {
        return VisitRecord.builder()
            .taskName(task)
            .visitDate(visitDate)
            .targetDate(targetDate)
            .needsAction(needsAction)
            .build();
    }

    @Test
    void keepsOnlyEligibleOutstandingRows() {
        VisitRecord pt = row("PT Visit", "2/17/2026", null, true);
        VisitRecord ptAgain = row("PT  Visit", "02/17/2026", null, true);
        VisitRecord targetOnly = row("OT Visit", "", "2/18/2026", true);

        List<VisitRecord> result = service.prepareOutstanding(List.of(
            pt,
            row("SOC OASIS", "2/10/2026", null, true),
            row("Del ST Visit", "2/11/2026", null, true),
            row("OASIS-E1 DC", "2/12/2026", null, true),
            row("  ", "2/13/2026", null, true),
            row("OT Visit", "", "", true),
            row("ST Visit", "2/14/2026", null, false),
            targetOnly,
            ptAgain));

        assertThat(result).containsExactly(ptAgain, targetOnly);
    }

    @Test
    void siteBItemsAreFilteredButNotDeduplicated() {
        VisitRecord standard = row("STANDARD", "2/17/2026", "2/17/2026", true);
        VisitRecord sameAgain = row("STANDARD", "2/17/2026", "2/17/2026", true);

        List<VisitRecord> result = service.prepareSiteB(List.of(
            standard,
            row("DISCHARGE", "2/20/2026", "2/20/2026", true),
            sameAgain));

        assertThat(result).hasSize(2);
    }
}
