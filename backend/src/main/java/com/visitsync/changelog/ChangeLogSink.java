package com.visitsync.changelog;

/**
 * Append-only record of the changes a run made to System A.
 * One block per run: a header line, then one line per recorded change.
 */
public interface ChangeLogSink {

    /**
     * Begin a new block stamped with the current time. Discards anything
     * recorded but not flushed.
     */
    void startRun();

    void record(String patientName, String message);

    /**
     * Append the current block to the log. A block with no changes still
     * gets a placeholder line.
     */
    void flush();
}
