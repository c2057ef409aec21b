package com.visitsync.service;

import com.visitsync.adapter.SiteBAdapter;
import com.visitsync.changelog.ChangeLogSink;
import com.visitsync.model.visit.RunSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Runs one reconciliation pass over every System B patient, in listing order.
 *
 * A failure inside one patient ends that patient only. Anything escaping the
 * patient loop is fatal and propagates to the caller; the change log is
 * flushed either way.
 */
@Slf4j
@Service
public class ReconciliationEngine {

    private final SiteBAdapter siteB;
    private final PatientReconciliationService patientReconciliationService;
    private final ChangeLogSink changeLog;

    public ReconciliationEngine(SiteBAdapter siteB,
                                PatientReconciliationService patientReconciliationService,
                                ChangeLogSink changeLog) {
        this.siteB = siteB;
        this.patientReconciliationService = patientReconciliationService;
        this.changeLog = changeLog;
    }

    public RunSummary run() {
        changeLog.startRun();
        RunSummary summary = new RunSummary();
        try {
            List<String> patients = siteB.listPatients();
            log.info("Total patients in System B: {}", patients.size());

            for (int i = 0; i < patients.size(); i++) {
                String patientName = patients.get(i);
                log.info("Processing patient [{}/{}]: {}", i + 1, patients.size(), patientName);
                try {
                    summary.merge(patientReconciliationService.reconcile(patientName));
                } catch (RuntimeException e) {
                    log.warn("Patient \"{}\" aborted", patientName, e);
                    summary.setPatientsSkipped(summary.getPatientsSkipped() + 1);
                }
            }

            log.info("All System B patients processed: {} patient(s), {} skipped; visits {} completed, "
                    + "{} skipped, {} failed, {} inserted",
                summary.getPatientsProcessed(), summary.getPatientsSkipped(),
                summary.getVisitsCompleted(), summary.getVisitsSkipped(),
                summary.getVisitsFailed(), summary.getVisitsInserted());
            return summary;
        } finally {
            changeLog.flush();
        }
    }
}
