package com.visitsync.service;

import com.visitsync.model.visit.VisitRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates adapter output before it reaches the matchers.
 *
 * Rejected rows: blank task names, start-of-care, discharge and deleted visits,
 * and rows with neither a visit date nor a target date. System A rows that are
 * already complete are dropped as well.
 */
@Slf4j
@Service
public class VisitIntakeService {

    private final TypeMappingService typeMappingService;
    private final VisitKeyService visitKeyService;

    public VisitIntakeService(TypeMappingService typeMappingService, VisitKeyService visitKeyService) {
        this.typeMappingService = typeMappingService;
        this.visitKeyService = visitKeyService;
    }

    /**
     * Outstanding System A visits, deduplicated in listing order.
     */
    public List<VisitRecord> prepareOutstanding(List<VisitRecord> rows) {
        List<VisitRecord> accepted = new ArrayList<>();
        for (VisitRecord row : rows) {
            if (!isEligible(row)) {
                continue;
            }
            if (!row.isNeedsAction()) {
                log.debug("Already complete: {}", row.describe());
                continue;
            }
            accepted.add(row);
        }
        List<VisitRecord> unique = visitKeyService.dedupe(accepted);
        if (unique.size() < accepted.size()) {
            log.debug("Collapsed {} duplicate row(s)", accepted.size() - unique.size());
        }
        return unique;
    }

    /**
     * System B schedule items that may be compared against System A.
     */
    public List<VisitRecord> prepareSiteB(List<VisitRecord> items) {
        return items.stream().filter(this::isEligible).toList();
    }

    private boolean isEligible(VisitRecord row) {
        String name = row.getTaskName();
        if (name == null || name.isBlank()) {
            log.debug("Skipped blank row");
            return false;
        }
        if (typeMappingService.isExcluded(name)) {
            log.debug("Skipped SOC, discharge or deleted row: \"{}\"", name);
            return false;
        }
        if (!row.hasDate()) {
            log.debug("Skipped undated row: \"{}\"", name);
            return false;
        }
        return true;
    }
}
