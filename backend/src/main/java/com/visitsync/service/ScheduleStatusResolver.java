package com.visitsync.service;

import com.visitsync.model.enums.ScheduleStatus;
import com.visitsync.model.visit.VisitRecord;
import com.visitsync.util.TextNormalizer;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Schedule Status Resolver
 *
 * Classifies raw System B status text into a {@link ScheduleStatus}.
 *
 * Priority order (first keyword contained in the text wins):
 * 1. "scheduled"  -> SCHEDULED
 * 2. "incomplete" -> INCOMPLETE
 * 3. "view"       -> VIEW_DOCUMENT
 * 4. "missed"     -> MISSED
 * 5. Default: NOT_FOUND
 *
 * "Scheduled (view)" is therefore SCHEDULED, not VIEW_DOCUMENT.
 */
@Service
public class ScheduleStatusResolver {

    private static final List<Map.Entry<String, ScheduleStatus>> PRECEDENCE = List.of(
        Map.entry("scheduled", ScheduleStatus.SCHEDULED),
        Map.entry("incomplete", ScheduleStatus.INCOMPLETE),
        Map.entry("view", ScheduleStatus.VIEW_DOCUMENT),
        Map.entry("missed", ScheduleStatus.MISSED)
    );

    private final TypeMappingService typeMappingService;

    public ScheduleStatusResolver(TypeMappingService typeMappingService) {
        this.typeMappingService = typeMappingService;
    }

    public ScheduleStatus resolve(String rawStatus) {
        String text = TextNormalizer.normalizeText(rawStatus);
        if (text.isEmpty()) {
            return ScheduleStatus.NOT_FOUND;
        }
        for (Map.Entry<String, ScheduleStatus> rule : PRECEDENCE) {
            if (text.contains(rule.getKey())) {
                return rule.getValue();
            }
        }
        return ScheduleStatus.NOT_FOUND;
    }

    /**
     * Resolve the status of a schedule item. Discharge visits are excluded from
     * reconciliation and always resolve to NOT_FOUND.
     */
    public ScheduleStatus resolve(VisitRecord visit, Optional<String> rawStatus) {
        if (typeMappingService.isDischarge(visit.getTaskName())) {
            return ScheduleStatus.NOT_FOUND;
        }
        return rawStatus.map(this::resolve).orElse(ScheduleStatus.NOT_FOUND);
    }
}
