package com.visitsync.adapter.snapshot;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.visitsync.adapter.SiteAAdapter;
import com.visitsync.exception.VisitNotFoundException;
import com.visitsync.model.enums.RecordSource;
import com.visitsync.model.visit.TimesStatus;
import com.visitsync.model.visit.VisitHandle;
import com.visitsync.model.visit.VisitRecord;
import com.visitsync.service.TypeMappingService;
import com.visitsync.util.TextNormalizer;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link SiteAAdapter} over an in-memory {@link SiteASnapshot}. Mutations change
 * the snapshot held in memory; the file on disk is left untouched.
 */
@Slf4j
public class SnapshotSiteAAdapter implements SiteAAdapter {

    private final SiteASnapshot snapshot;
    private final TypeMappingService typeMappingService;

    public SnapshotSiteAAdapter(SiteASnapshot snapshot, TypeMappingService typeMappingService) {
        this.snapshot = snapshot;
        this.typeMappingService = typeMappingService;
    }

    public static SnapshotSiteAAdapter load(Path file, ObjectMapper objectMapper, TypeMappingService typeMappingService) {
        try {
            SiteASnapshot snapshot = objectMapper.readValue(file.toFile(), SiteASnapshot.class);
            log.info("Loaded System A snapshot {} ({} patients)", file, snapshot.getPatients().size());
            return new SnapshotSiteAAdapter(snapshot, typeMappingService);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read System A snapshot " + file, e);
        }
    }

    @Override
    public boolean openPatient(String patientName) {
        return findPatient(patientName).isPresent();
    }

    @Override
    public List<VisitRecord> listOutstandingVisits(String patientName) {
        List<VisitRecord> records = new ArrayList<>();
        for (SiteASnapshot.Row row : patient(patientName).getVisits()) {
            String taskName = TextNormalizer.collapseWhitespace(row.getTaskName());
            boolean complete = !blank(row.getVisitDate()) && !row.getAttachments().isEmpty();
            records.add(VisitRecord.builder()
                .source(RecordSource.SITE_A)
                .taskName(taskName)
                .therapist(row.getTherapist())
                .visitDate(row.getVisitDate())
                .targetDate(row.getTargetDate())
                .systemType(typeMappingService.classify(taskName))
                .needsAction(!complete)
                .build());
        }
        return records;
    }

    @Override
    public VisitHandle locateVisit(String patientName, String taskName, String date, String therapist) {
        List<SiteASnapshot.Row> rows = patient(patientName).getVisits();
        String expectedName = TextNormalizer.normalizeText(taskName);
        String expectedDate = TextNormalizer.normalizeDateMdy(date);
        List<String> names = List.of(
            expectedName,
            expectedName.replace("cota visit", "ota standard"),
            expectedName.replace("pta visit", "pta standard"),
            expectedName.replace("visit", "standard"));

        for (int i = 0; i < rows.size(); i++) {
            SiteASnapshot.Row row = rows.get(i);
            String rowName = TextNormalizer.normalizeText(row.getTaskName());
            if (names.stream().noneMatch(rowName::contains)) {
                continue;
            }
            String rowVisitDate = TextNormalizer.normalizeDateMdy(row.getVisitDate());
            String rowTargetDate = TextNormalizer.normalizeDateMdy(row.getTargetDate());
            if (!expectedDate.equals(rowVisitDate) && !expectedDate.equals(rowTargetDate)) {
                continue;
            }
            if (!blank(therapist)
                    && !TextNormalizer.normalizeText(row.getTherapist()).contains(TextNormalizer.normalizeText(therapist))) {
                continue;
            }
            return new VisitHandle(patientName, row.getTaskName(), date, String.valueOf(i));
        }
        throw new VisitNotFoundException("System A visit not found: " + taskName + " " + date);
    }

    @Override
    public TimesStatus areTimesFilled(VisitHandle handle) {
        SiteASnapshot.Row row = row(handle);
        return new TimesStatus(!blank(row.getVisitDate()), !blank(row.getTimeIn()), !blank(row.getTimeOut()));
    }

    @Override
    public void fillTimesAndApprove(VisitHandle handle, String date, String timeIn, String timeOut) {
        SiteASnapshot.Row row = row(handle);
        row.setVisitDate(date);
        row.setTimeIn(timeIn);
        row.setTimeOut(timeOut);
        row.setApproved(true);
        log.info("Approved {} on {} ({} - {})", row.getTaskName(), date, timeIn, timeOut);
    }

    @Override
    public List<String> listAttachments(VisitHandle handle) {
        return List.copyOf(row(handle).getAttachments());
    }

    @Override
    public void attachDocuments(VisitHandle handle, List<Path> files) {
        SiteASnapshot.Row row = row(handle);
        for (Path file : files) {
            row.getAttachments().add(file.getFileName().toString());
        }
    }

    @Override
    public List<String> listTherapistOptions(String patientName) {
        return List.copyOf(snapshot.getTherapists());
    }

    @Override
    public boolean insertVisit(String patientName, String taskLabel, String date, String therapistLabel) {
        Optional<SiteASnapshot.Patient> patient = findPatient(patientName);
        if (patient.isEmpty()) {
            return false;
        }
        List<String> taskTypes = snapshot.getTaskTypes();
        if (!taskTypes.isEmpty() && taskTypes.stream().noneMatch(t -> t.trim().equalsIgnoreCase(taskLabel.trim()))) {
            log.warn("Visit type \"{}\" is not offered by the insertion form", taskLabel);
            return false;
        }
        SiteASnapshot.Row row = new SiteASnapshot.Row();
        row.setTaskName(taskLabel);
        row.setTherapist(therapistLabel);
        row.setTargetDate(date);
        patient.get().getVisits().add(row);
        return true;
    }

    @Override
    public void returnToVisitList(String patientName) {
        log.debug("Returned to visit list of {}", patientName);
    }

    private Optional<SiteASnapshot.Patient> findPatient(String patientName) {
        String wanted = TextNormalizer.normalizeText(patientName);
        return snapshot.getPatients().stream()
            .filter(p -> TextNormalizer.normalizeText(p.getName()).equals(wanted))
            .findFirst();
    }

    private SiteASnapshot.Patient patient(String patientName) {
        return findPatient(patientName)
            .orElseThrow(() -> new VisitNotFoundException("Patient not found in System A: " + patientName));
    }

    private SiteASnapshot.Row row(VisitHandle handle) {
        List<SiteASnapshot.Row> rows = patient(handle.patientName()).getVisits();
        int index = Integer.parseInt(handle.reference());
        if (index < 0 || index >= rows.size()) {
            throw new VisitNotFoundException("Stale visit handle: " + handle);
        }
        return rows.get(index);
    }

    private static boolean blank(String s) {
        return s == null || s.isBlank();
    }
}
