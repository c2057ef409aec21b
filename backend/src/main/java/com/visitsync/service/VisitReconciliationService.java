package com.visitsync.service;

import com.visitsync.adapter.SiteAAdapter;
import com.visitsync.adapter.SiteBAdapter;
import com.visitsync.changelog.ChangeLogSink;
import com.visitsync.exception.ReconciliationException;
import com.visitsync.model.enums.ReconciliationError;
import com.visitsync.model.enums.ScheduleStatus;
import com.visitsync.model.enums.VisitState;
import com.visitsync.model.enums.VisitType;
import com.visitsync.model.visit.DocumentRequest;
import com.visitsync.model.visit.TimesStatus;
import com.visitsync.model.visit.TypeMapping;
import com.visitsync.model.visit.VisitDetail;
import com.visitsync.model.visit.VisitHandle;
import com.visitsync.model.visit.VisitOutcome;
import com.visitsync.model.visit.VisitRecord;
import com.visitsync.model.visit.VisitTarget;
import com.visitsync.util.TextNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Visit Reconciliation Service
 *
 * Drives one outstanding System A visit through
 * LOCATED -> TIMES_VERIFIED -> (TIMES_FILLED_AND_APPROVED | ALREADY_FILLED)
 * -> DOCUMENTS_FETCHED -> (DOCUMENTS_ATTACHED | NOT_APPLICABLE) -> COMPLETED.
 *
 * Any failure ends in FAILED. Failures never escape {@link #process}; both
 * sessions are returned to their lists after every visit.
 */
@Slf4j
@Service
public class VisitReconciliationService {

    private final SiteAAdapter siteA;
    private final SiteBAdapter siteB;
    private final ScheduleListGuard scheduleListGuard;
    private final TypeMappingService typeMappingService;
    private final VisitMatcherService visitMatcherService;
    private final ScheduleStatusResolver statusResolver;
    private final DocumentNamingService namingService;
    private final DocumentStore documentStore;
    private final ChangeLogSink changeLog;

    public VisitReconciliationService(
            SiteAAdapter siteA,
            SiteBAdapter siteB,
            ScheduleListGuard scheduleListGuard,
            TypeMappingService typeMappingService,
            VisitMatcherService visitMatcherService,
            ScheduleStatusResolver statusResolver,
            DocumentNamingService namingService,
            DocumentStore documentStore,
            ChangeLogSink changeLog) {
        this.siteA = siteA;
        this.siteB = siteB;
        this.scheduleListGuard = scheduleListGuard;
        this.typeMappingService = typeMappingService;
        this.visitMatcherService = visitMatcherService;
        this.statusResolver = statusResolver;
        this.namingService = namingService;
        this.documentStore = documentStore;
        this.changeLog = changeLog;
    }

    public VisitOutcome process(String patientName, VisitRecord visit) {
        List<VisitState> path = new ArrayList<>();
        String taskName = TextNormalizer.collapseWhitespace(visit.getTaskName());
        String date = visit.effectiveDate();
        log.info("Processing visit {} with {}", visit.describe(),
            visit.getTherapist() != null ? visit.getTherapist() : "unknown therapist");

        try {
            // Located
            scheduleListGuard.ensureReady();
            TypeMapping mapping = typeMappingService.toSiteB(taskName);
            VisitRecord scheduleItem = visitMatcherService.match(
                siteB.listVisitsForPatient(patientName),
                VisitTarget.of(mapping, date, visit.getTherapist()));
            VisitDetail detail = siteB.openVisit(patientName, scheduleItem);
            String rawStatus = detail.rawStatus() != null ? detail.rawStatus() : scheduleItem.getRawStatus();
            ScheduleStatus status = statusResolver.resolve(scheduleItem, Optional.ofNullable(rawStatus));
            path.add(VisitState.LOCATED);

            // Times
            VisitHandle handle = siteA.locateVisit(patientName, taskName, date, visit.getTherapist());
            TimesStatus times = siteA.areTimesFilled(handle);
            path.add(VisitState.TIMES_VERIFIED);
            if (times.allFilled()) {
                log.info("Date and times already filled for {}", visit.describe());
                path.add(VisitState.ALREADY_FILLED);
            } else {
                fillTimes(patientName, taskName, date, handle, detail);
                path.add(VisitState.TIMES_FILLED_AND_APPROVED);
            }

            // Documents
            String identifier = namingService.identifier(taskName, date, patientName);
            List<Path> files = fetchDocuments(patientName, scheduleItem, identifier);
            path.add(VisitState.DOCUMENTS_FETCHED);

            boolean missed = status == ScheduleStatus.MISSED
                || TextNormalizer.normalizeText(rawStatus).contains("missed");
            path.add(attachDocuments(patientName, visit, taskName, date, handle, files, missed));
            path.add(VisitState.COMPLETED);
            log.info("Visit processed: {}", visit.describe());
            return VisitOutcome.completed(visit, path);

        } catch (ReconciliationException e) {
            path.add(VisitState.FAILED);
            if (e.getError().isBenign()) {
                log.info("[{}] Skipping {}: {}", patientName, visit.describe(), e.getMessage());
            } else {
                log.warn("[{}] Visit failed ({}): {} - {}", patientName, e.getError().getLabel(),
                    visit.describe(), e.getMessage());
            }
            return VisitOutcome.failed(visit, path, e.getError(), e.getMessage());

        } catch (RuntimeException e) {
            path.add(VisitState.FAILED);
            log.warn("[{}] Visit failed unexpectedly: {}", patientName, visit.describe(), e);
            return VisitOutcome.failed(visit, path, ReconciliationError.UNEXPECTED, e.toString());

        } finally {
            returnToLists(patientName);
        }
    }

    // ========================================================================
    // Steps
    // ========================================================================

    private void fillTimes(String patientName, String taskName, String date,
                           VisitHandle handle, VisitDetail detail) {
        String visitDate = detail.visitDate() != null && !detail.visitDate().isBlank()
            ? detail.visitDate().trim()
            : date;
        String timeIn = TextNormalizer.convertTo24h(detail.timeIn());
        String timeOut = TextNormalizer.convertTo24h(detail.timeOut());

        siteA.fillTimesAndApprove(handle, visitDate, timeIn, timeOut);
        changeLog.record(patientName, String.format(
            "Filled time in/out for \"%s\" on %s - In: %s, Out: %s - Approved",
            taskName, date, detail.timeIn(), detail.timeOut()));
    }

    /**
     * Files already produced for the identifier are reused; System B is only
     * asked when none exist.
     */
    private List<Path> fetchDocuments(String patientName, VisitRecord scheduleItem, String identifier) {
        List<Path> existing = documentStore.findExisting(identifier);
        if (!existing.isEmpty()) {
            log.info("Reusing {} document(s) for {}", existing.size(), identifier);
            return existing;
        }
        Path directory = documentStore.ensureDirectory();
        List<Path> fetched = siteB.fetchDocuments(new DocumentRequest(patientName, scheduleItem, identifier, directory));
        log.info("Fetched {} document(s) for {}", fetched.size(), identifier);
        return fetched;
    }

    private VisitState attachDocuments(String patientName, VisitRecord visit, String taskName, String date,
                                       VisitHandle handle, List<Path> files, boolean missed) {
        boolean standard = typeMappingService.classify(taskName) == VisitType.STANDARD;

        // A missed visit is detected on the raw status text, whatever status the resolver settled on.
        if (missed || !standard) {
            String reason = missed ? "missed visit" : "non-standard visit";
            if (!files.isEmpty()) {
                changeLog.record(patientName, String.format(
                    "Fetched %d document(s) for \"%s\" on %s (not attached - %s): %s",
                    files.size(), taskName, date, reason, fileNames(files)));
            }
            log.info("{} - documents fetched only for {}", reason, visit.describe());
            return VisitState.NOT_APPLICABLE;
        }
        if (files.isEmpty()) {
            log.info("No documents to attach for {}", visit.describe());
            return VisitState.NOT_APPLICABLE;
        }

        String key = namingService.attachmentKey(taskName, date);
        boolean attached = siteA.listAttachments(handle).stream()
            .anyMatch(name -> namingService.isAlreadyAttached(name, key));
        if (attached) {
            log.info("Documents already attached for {}", visit.describe());
            return VisitState.DOCUMENTS_ATTACHED;
        }

        siteA.attachDocuments(handle, files);
        changeLog.record(patientName, String.format(
            "Fetched and attached %d document(s) for \"%s\" on %s: %s",
            files.size(), taskName, date, fileNames(files)));
        return VisitState.DOCUMENTS_ATTACHED;
    }

    // ========================================================================
    // Recovery
    // ========================================================================

    private void returnToLists(String patientName) {
        try {
            siteB.returnToScheduleList(patientName);
        } catch (RuntimeException e) {
            log.warn("[{}] Could not return to the System B schedule list: {}", patientName, e.getMessage());
        }
        try {
            siteA.returnToVisitList(patientName);
        } catch (RuntimeException e) {
            log.warn("[{}] Could not return to the System A visit list: {}", patientName, e.getMessage());
        }
    }

    private static String fileNames(List<Path> files) {
        return files.stream()
            .map(file -> file.getFileName().toString())
            .collect(Collectors.joining(", "));
    }
}
