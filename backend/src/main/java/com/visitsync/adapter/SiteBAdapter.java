package com.visitsync.adapter;

import com.visitsync.model.visit.DocumentRequest;
import com.visitsync.model.visit.VisitDetail;
import com.visitsync.model.visit.VisitRecord;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Operations the reconciliation core needs from System B, the scheduling system.
 */
public interface SiteBAdapter {

    List<String> listPatients();

    /**
     * Open the patient's schedule.
     *
     * @return false when the patient cannot be opened
     */
    boolean openPatient(String patientName);

    /**
     * Wait up to {@code timeout} for the schedule list to show at least one item.
     *
     * @return false on timeout
     */
    boolean awaitScheduleList(Duration timeout);

    /**
     * One step of back-navigation, used by the readiness check's recovery attempt.
     */
    void navigateBack();

    /**
     * Schedule items of the open patient, in listing order. {@code taskName}
     * carries the raw System B type text.
     */
    List<VisitRecord> listVisitsForPatient(String patientName);

    /**
     * Live status text of a schedule item, or empty when the item is not shown.
     */
    Optional<String> resolveStatus(String patientName, VisitRecord scheduleItem);

    /**
     * Open a schedule item and read its times.
     *
     * @throws com.visitsync.exception.VisitNotFoundException when the item is gone
     */
    VisitDetail openVisit(String patientName, VisitRecord scheduleItem);

    /**
     * Save the opened visit's documents under the requested identifier.
     *
     * @return saved files, possibly empty
     */
    List<Path> fetchDocuments(DocumentRequest request);

    void returnToScheduleList(String patientName);
}
