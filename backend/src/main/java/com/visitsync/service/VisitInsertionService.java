package com.visitsync.service;

import com.visitsync.adapter.SiteAAdapter;
import com.visitsync.changelog.ChangeLogSink;
import com.visitsync.exception.ReconciliationException;
import com.visitsync.model.visit.MissingVisitCandidate;
import com.visitsync.model.visit.TherapistMatch;
import com.visitsync.model.visit.VisitRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Creates a missing visit in System A. The System B therapist must match one
 * of System A's therapist options; otherwise only this candidate is skipped.
 */
@Slf4j
@Service
public class VisitInsertionService {

    private final SiteAAdapter siteA;
    private final TherapistMatcherService therapistMatcherService;
    private final ChangeLogSink changeLog;

    public VisitInsertionService(SiteAAdapter siteA,
                                 TherapistMatcherService therapistMatcherService,
                                 ChangeLogSink changeLog) {
        this.siteA = siteA;
        this.therapistMatcherService = therapistMatcherService;
        this.changeLog = changeLog;
    }

    /**
     * @return true when the visit was created
     */
    public boolean insert(String patientName, MissingVisitCandidate candidate) {
        VisitRecord visit = candidate.siteBVisit();
        String label = candidate.siteALabel();
        String date = visit.effectiveDate();
        log.info("Adding scheduled visit to System A: {} on {}", label, date);

        try {
            TherapistMatch therapist = therapistMatcherService.requireMatch(
                visit.getTherapist(), siteA.listTherapistOptions(patientName));
            log.debug("Therapist \"{}\" matched \"{}\" (score {})",
                visit.getTherapist(), therapist.label(), therapist.score());

            if (!siteA.insertVisit(patientName, label, date, therapist.label())) {
                log.warn("[{}] System A rejected visit \"{}\" on {}", patientName, label, date);
                return false;
            }
            changeLog.record(patientName, String.format(
                "Added new visit: \"%s\" on %s (therapist: %s)", label, date, visit.getTherapist()));
            return true;

        } catch (ReconciliationException e) {
            log.warn("[{}] Skipped adding \"{}\" on {} ({}): {}",
                patientName, label, date, e.getError().getLabel(), e.getMessage());
            return false;
        } catch (RuntimeException e) {
            log.warn("[{}] Skipped adding \"{}\" on {}", patientName, label, date, e);
            return false;
        } finally {
            try {
                siteA.returnToVisitList(patientName);
            } catch (RuntimeException e) {
                log.warn("[{}] Could not return to the System A visit list: {}", patientName, e.getMessage());
            }
        }
    }
}
