package com.visitsync;

import com.visitsync.adapter.SiteAAdapter;
import com.visitsync.adapter.snapshot.SnapshotFixtures;
import com.visitsync.model.visit.RunSummary;
import com.visitsync.model.visit.VisitRecord;
import com.visitsync.service.ReconciliationEngine;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Full run over the JSON snapshots with the command-line runner disabled.
 */
@SpringBootTest(properties = "visitsync.runner.enabled=false")
class VisitSyncApplicationTests {

    private static final Path WORK_DIR = createWorkDir();

    @Autowired private ReconciliationEngine engine;
    @Autowired private SiteAAdapter siteA;

    private static Path createWorkDir() {
        try {
            return SnapshotFixtures.copyTo(Files.createTempDirectory("visitsync-it"));
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }

    @DynamicPropertySource
    static void snapshotProperties(DynamicPropertyRegistry registry) {
        registry.add("visitsync.snapshot.site-a", () -> WORK_DIR.resolve("site-a.json").toString());
        registry.add("visitsync.snapshot.site-b", () -> WORK_DIR.resolve("site-b.json").toString());
        registry.add("visitsync.documents.directory", () -> WORK_DIR.resolve("patient-files").toString());
        registry.add("visitsync.change-log.file", () -> WORK_DIR.resolve("changes-log.txt").toString());
    }

    @Test
    void reconcilesSnapshotsEndToEnd() throws IOException {
        RunSummary summary = engine.run();

        assertThat(summary.getPatientsProcessed()).isEqualTo(1);
        assertThat(summary.getPatientsSkipped()).isEqualTo(1);
        assertThat(summary.getVisitsCompleted()).isEqualTo(1);
        assertThat(summary.getVisitsFailed()).isZero();
        assertThat(summary.getVisitsInserted()).isEqualTo(1);

        assertThat(WORK_DIR.resolve("patient-files/PT Visit-2-17-2026-DOE JANE-1.pdf")).exists();

        List<VisitRecord> rows = siteA.listOutstandingVisits("DOE, JANE");
        assertThat(rows.get(0).isNeedsAction()).isFalse();
        assertThat(rows).extracting(VisitRecord::getTaskName).contains("PTA Visit");

        String log = Files.readString(WORK_DIR.resolve("changes-log.txt"));
        assertThat(log).containsPattern("Run \\d{2}/\\d{2}/\\d{4} - \\d{2}:\\d{2}:");
        assertThat(log).contains(
            "  [DOE, JANE] Filled time in/out for \"PT Visit\" on 2/17/2026 - In: 1:30 PM, Out: 2:15 PM - Approved",
            "  [DOE, JANE] Fetched and attached 1 document(s) for \"PT Visit\" on 2/17/2026: PT Visit-2-17-2026-DOE JANE-1.pdf",
            "  [DOE, JANE] Added new visit: \"PTA Visit\" on 2/19/2026 (therapist: JESSICA DIAZ (PTA))");
        assertThat(log).doesNotContain("OT Visit");
    }
}
