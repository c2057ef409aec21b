package com.visitsync.adapter;

import com.visitsync.model.visit.TimesStatus;
import com.visitsync.model.visit.VisitHandle;
import com.visitsync.model.visit.VisitRecord;

import java.nio.file.Path;
import java.util.List;

/**
 * Operations the reconciliation core needs from System A, the patient/task manager.
 *
 * Implementations own all navigation; the core never assumes which view is
 * current after a call returns.
 */
public interface SiteAAdapter {

    /**
     * Open the patient's record.
     *
     * @return false when the patient does not exist in System A
     */
    boolean openPatient(String patientName);

    /**
     * Visit rows of the open patient, in listing order. Rows that are already
     * complete are returned with {@code needsAction == false}.
     */
    List<VisitRecord> listOutstandingVisits(String patientName);

    /**
     * Open the detail view of one visit.
     *
     * @param date      visit date, or target date when the visit date is not recorded
     * @param therapist optional; narrows the lookup when several rows share a date
     * @throws com.visitsync.exception.VisitNotFoundException when no row matches
     */
    VisitHandle locateVisit(String patientName, String taskName, String date, String therapist);

    TimesStatus areTimesFilled(VisitHandle handle);

    /**
     * Write date and 24-hour times, then approve the visit.
     */
    void fillTimesAndApprove(VisitHandle handle, String date, String timeIn, String timeOut);

    /**
     * Names of documents already attached to the visit.
     */
    List<String> listAttachments(VisitHandle handle);

    void attachDocuments(VisitHandle handle, List<Path> files);

    /**
     * Therapist options offered by the insertion form, "Last, First".
     */
    List<String> listTherapistOptions(String patientName);

    /**
     * Create a visit task.
     *
     * @return false on a soft failure such as an unknown task label
     */
    boolean insertVisit(String patientName, String taskLabel, String date, String therapistLabel);

    /**
     * Bring the session back to the patient's visit list.
     */
    void returnToVisitList(String patientName);
}
