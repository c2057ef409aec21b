package com.visitsync.model.visit;

import lombok.Data;

/**
 * Counters accumulated over one run, logged when the run ends.
 */
@Data
public class RunSummary {

    private int patientsProcessed;
    private int patientsSkipped;
    private int visitsCompleted;
    private int visitsSkipped;
    private int visitsFailed;
    private int visitsInserted;

    public void record(VisitOutcome outcome) {
        if (outcome.isCompleted()) {
            visitsCompleted++;
        } else if (outcome.error().isBenign()) {
            visitsSkipped++;
        } else {
            visitsFailed++;
        }
    }

    public void merge(RunSummary other) {
        patientsProcessed += other.patientsProcessed;
        patientsSkipped += other.patientsSkipped;
        visitsCompleted += other.visitsCompleted;
        visitsSkipped += other.visitsSkipped;
        visitsFailed += other.visitsFailed;
        visitsInserted += other.visitsInserted;
    }
}
