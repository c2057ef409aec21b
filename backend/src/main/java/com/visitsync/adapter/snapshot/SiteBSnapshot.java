package com.visitsync.adapter.snapshot;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON export of System B: patients with their schedule items. Document paths
 * are resolved against the snapshot file's directory.
 */
@Data
public class SiteBSnapshot {

    private List<Patient> patients = new ArrayList<>();

    @Data
    public static class Patient {
        private String name;
        private List<Item> visits = new ArrayList<>();
    }

    @Data
    public static class Item {
        private String type;
        private String discipline;
        private String date;
        private String therapist;
        private String status;
        private String timeSlot;
        private String timeIn;
        private String timeOut;
        private List<String> documents = new ArrayList<>();
    }
}
