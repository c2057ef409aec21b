package com.visitsync.service;

import com.visitsync.adapter.SiteAAdapter;
import com.visitsync.adapter.SiteBAdapter;
import com.visitsync.exception.NavigationStaleException;
import com.visitsync.model.visit.MissingVisitCandidate;
import com.visitsync.model.visit.RunSummary;
import com.visitsync.model.visit.VisitOutcome;
import com.visitsync.model.visit.VisitRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;

/**
 * Patient Reconciliation Service
 *
 * Reconciles one patient across both systems.
 *
 * Steps:
 * 1. Open the patient in System A and collect outstanding visits (filtered, deduplicated)
 * 2. Open the patient in System B
 * 3. Drive each outstanding visit through {@link VisitReconciliationService}, in listing order
 * 4. Insert System B visits that are SCHEDULED but absent from System A
 *
 * A patient with no outstanding visits is left untouched in both systems.
 */
@Slf4j
@Service
public class PatientReconciliationService {

    private final SiteAAdapter siteA;
    private final SiteBAdapter siteB;
    private final VisitIntakeService intakeService;
    private final VisitKeyService visitKeyService;
    private final VisitReconciliationService visitReconciliationService;
    private final MissingVisitDetector missingVisitDetector;
    private final ScheduleStatusResolver statusResolver;
    private final ScheduleListGuard scheduleListGuard;
    private final VisitInsertionService insertionService;

    public PatientReconciliationService(
            SiteAAdapter siteA,
            SiteBAdapter siteB,
            VisitIntakeService intakeService,
            VisitKeyService visitKeyService,
            VisitReconciliationService visitReconciliationService,
            MissingVisitDetector missingVisitDetector,
            ScheduleStatusResolver statusResolver,
            ScheduleListGuard scheduleListGuard,
            VisitInsertionService insertionService) {
        this.siteA = siteA;
        this.siteB = siteB;
        this.intakeService = intakeService;
        this.visitKeyService = visitKeyService;
        this.visitReconciliationService = visitReconciliationService;
        this.missingVisitDetector = missingVisitDetector;
        this.statusResolver = statusResolver;
        this.scheduleListGuard = scheduleListGuard;
        this.insertionService = insertionService;
    }

    public RunSummary reconcile(String patientName) {
        RunSummary summary = new RunSummary();

        if (!siteA.openPatient(patientName)) {
            log.warn("Patient \"{}\" not found in System A, skipping", patientName);
            summary.setPatientsSkipped(1);
            return summary;
        }

        List<VisitRecord> outstanding = intakeService.prepareOutstanding(siteA.listOutstandingVisits(patientName));
        if (outstanding.isEmpty()) {
            log.info("No actionable visits for patient \"{}\"", patientName);
            summary.setPatientsProcessed(1);
            return summary;
        }
        log.info("Found {} unique outstanding visit(s) for patient \"{}\"", outstanding.size(), patientName);

        if (!siteB.openPatient(patientName)) {
            log.warn("Could not open patient \"{}\" in System B, skipping visits", patientName);
            summary.setPatientsSkipped(1);
            return summary;
        }

        for (VisitRecord visit : outstanding) {
            VisitOutcome outcome = visitReconciliationService.process(patientName, visit);
            summary.record(outcome);
        }

        summary.setVisitsInserted(addMissingVisits(patientName, outstanding));
        summary.setPatientsProcessed(1);
        return summary;
    }

    // ========================================================================
    // Missing visits
    // ========================================================================

    private int addMissingVisits(String patientName, List<VisitRecord> outstanding) {
        try {
            scheduleListGuard.ensureReady();
        } catch (NavigationStaleException e) {
            log.warn("Could not load schedule list for \"{}\", skipping missing-visit check", patientName);
            return 0;
        }

        List<VisitRecord> siteBVisits = intakeService.prepareSiteB(siteB.listVisitsForPatient(patientName));
        Set<String> siteAKeys = visitKeyService.keySet(outstanding);

        List<MissingVisitCandidate> candidates = missingVisitDetector.detect(siteAKeys, siteBVisits,
            visit -> statusResolver.resolve(visit, siteB.resolveStatus(patientName, visit)));

        int inserted = 0;
        for (MissingVisitCandidate candidate : candidates) {
            if (insertionService.insert(patientName, candidate)) {
                inserted++;
            }
        }
        return inserted;
    }
}
