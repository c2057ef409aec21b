package com.visitsync.service;

import com.visitsync.adapter.SiteBAdapter;
import com.visitsync.changelog.ChangeLogSink;
import com.visitsync.model.visit.RunSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReconciliationEngineTest {

    @Mock private SiteBAdapter siteB;
    @Mock private PatientReconciliationService patientService;
    @Mock private ChangeLogSink changeLog;

    private ReconciliationEngine engine;

    @BeforeEach
    void setUp() {
        engine = new ReconciliationEngine(siteB, patientService, changeLog);
    }

    private static RunSummary processed(int completed) {
        RunSummary summary = new RunSummary();
        summary.setPatientsProcessed(1);
        summary.setVisitsCompleted(completed);
        return summary;
    }

    @Test
    void processesPatientsInListingOrderAndFlushesOnce() {
        when(siteB.listPatients()).thenReturn(List.of("DOE, JANE", "ROE, JOHN"));
        when(patientService.reconcile("DOE, JANE")).thenReturn(processed(2));
        when(patientService.reconcile("ROE, JOHN")).thenReturn(processed(1));

        RunSummary summary = engine.run();

        InOrder order = inOrder(changeLog, patientService);
        order.verify(changeLog).startRun();
        order.verify(patientService).reconcile("DOE, JANE");
        order.verify(patientService).reconcile("ROE, JOHN");
        order.verify(changeLog).flush();
        assertThat(summary.getPatientsProcessed()).isEqualTo(2);
        assertThat(summary.getVisitsCompleted()).isEqualTo(3);
    }

    @Test
    void failingPatientDoesNotStopTheRun() {
        when(siteB.listPatients()).thenReturn(List.of("DOE, JANE", "ROE, JOHN"));
        when(patientService.reconcile("DOE, JANE")).thenThrow(new IllegalStateException("session lost"));
        when(patientService.reconcile("ROE, JOHN")).thenReturn(processed(1));

        RunSummary summary = engine.run();

        assertThat(summary.getPatientsSkipped()).isEqualTo(1);
        assertThat(summary.getPatientsProcessed()).isEqualTo(1);
        verify(changeLog, times(1)).flush();
    }

    @Test
    void fatalErrorStillFlushesChangeLog() {
        when(siteB.listPatients()).thenThrow(new IllegalStateException("login failed"));

        assertThatThrownBy(engine::run).hasMessage("login failed");

        verify(changeLog).startRun();
        verify(changeLog).flush();
        verifyNoInteractions(patientService);
    }
}
