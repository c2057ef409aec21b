package com.visitsync.service;

import com.visitsync.model.enums.ScheduleStatus;
import com.visitsync.model.visit.MissingVisitCandidate;
import com.visitsync.model.visit.VisitRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Finds System B visits with no System A counterpart that may be created in System A.
 *
 * A System B visit is keyed by the System A label it maps to, so both sides share
 * one key vocabulary. Only visits whose live status resolves to SCHEDULED are
 * eligible; each key is emitted at most once.
 */
@Slf4j
@Service
public class MissingVisitDetector {

    private final TypeMappingService typeMappingService;
    private final VisitKeyService visitKeyService;

    public MissingVisitDetector(TypeMappingService typeMappingService, VisitKeyService visitKeyService) {
        this.typeMappingService = typeMappingService;
        this.visitKeyService = visitKeyService;
    }

    /**
     * @param siteAKeys    keys of the patient's outstanding System A visits
     * @param siteBVisits  the patient's System B visits, SOC and discharge already excluded
     * @param statusLookup resolves a visit's status against the live System B view
     * @return eligible visits, in System B order
     */
    public List<MissingVisitCandidate> detect(Set<String> siteAKeys,
                                              List<VisitRecord> siteBVisits,
                                              Function<VisitRecord, ScheduleStatus> statusLookup) {
        List<MissingVisitCandidate> eligible = new ArrayList<>();
        Set<String> emitted = new HashSet<>();

        for (VisitRecord visit : siteBVisits) {
            String label = typeMappingService.toSiteALabel(visit);
            String key = visitKeyService.key(label, visit.effectiveDate());

            if (siteAKeys.contains(key)) {
                log.debug("Already in System A: {} ({})", label, visit.effectiveDate());
                continue;
            }
            if (emitted.contains(key)) {
                continue;
            }

            ScheduleStatus status = statusLookup.apply(visit);
            if (status != ScheduleStatus.SCHEDULED) {
                log.info("Not adding {} ({}) - status: {}", label, visit.effectiveDate(), status);
                continue;
            }

            emitted.add(key);
            eligible.add(new MissingVisitCandidate(visit, label, key));
        }
        return eligible;
    }
}
