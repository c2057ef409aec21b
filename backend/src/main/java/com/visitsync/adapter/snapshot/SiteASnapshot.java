package com.visitsync.adapter.snapshot;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON export of System A: patients with their visit rows, plus the option
 * lists of the visit insertion form.
 */
@Data
public class SiteASnapshot {

    private List<String> therapists = new ArrayList<>();

    /**
     * Task labels accepted by the insertion form. Empty means any label is accepted.
     */
    private List<String> taskTypes = new ArrayList<>();

    private List<Patient> patients = new ArrayList<>();

    @Data
    public static class Patient {
        private String name;
        private List<Row> visits = new ArrayList<>();
    }

    @Data
    public static class Row {
        private String taskName;
        private String therapist;
        private String visitDate = "";
        private String targetDate = "";
        private String timeIn = "";
        private String timeOut = "";
        private boolean approved;
        private List<String> attachments = new ArrayList<>();
    }
}
