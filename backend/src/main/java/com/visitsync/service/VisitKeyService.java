package com.visitsync.service;

import com.visitsync.model.visit.VisitRecord;
import com.visitsync.util.TextNormalizer;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds dedup keys of the form {@code normalize(taskName) + "|" + isoDate}.
 *
 * Therapist is not part of the key: name spellings differ too much between
 * the two systems to join on.
 */
@Service
public class VisitKeyService {

    public String key(String taskName, String date) {
        return TextNormalizer.normalizeText(taskName) + "|" + TextNormalizer.normalizeDateToIso(date == null ? "" : date.trim());
    }

    public String key(VisitRecord visit) {
        return key(visit.getTaskName(), visit.effectiveDate());
    }

    /**
     * Keys of the given visits, in list order.
     */
    public Set<String> keySet(List<VisitRecord> visits) {
        Set<String> keys = new LinkedHashSet<>();
        for (VisitRecord visit : visits) {
            keys.add(key(visit));
        }
        return keys;
    }

    /**
     * Collapse duplicate rows onto one record per key. A later duplicate replaces
     * the earlier record's value but keeps the earlier record's position, so the
     * remaining list is never reordered.
     */
    public List<VisitRecord> dedupe(List<VisitRecord> visits) {
        Map<String, VisitRecord> byKey = new LinkedHashMap<>();
        for (VisitRecord visit : visits) {
            byKey.put(key(visit), visit);
        }
        return new ArrayList<>(byKey.values());
    }
}
