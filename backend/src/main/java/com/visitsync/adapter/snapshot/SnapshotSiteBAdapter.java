package com.visitsync.adapter.snapshot;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.visitsync.adapter.SiteBAdapter;
import com.visitsync.exception.VisitNotFoundException;
import com.visitsync.model.enums.Discipline;
import com.visitsync.model.enums.RecordSource;
import com.visitsync.model.visit.DocumentRequest;
import com.visitsync.model.visit.VisitDetail;
import com.visitsync.model.visit.VisitRecord;
import com.visitsync.service.TypeMappingService;
import com.visitsync.util.TextNormalizer;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link SiteBAdapter} over a {@link SiteBSnapshot}. System B is only read,
 * so navigation calls have nothing to do.
 */
@Slf4j
public class SnapshotSiteBAdapter implements SiteBAdapter {

    private final SiteBSnapshot snapshot;
    private final Path baseDirectory;
    private final TypeMappingService typeMappingService;

    public SnapshotSiteBAdapter(SiteBSnapshot snapshot, Path baseDirectory, TypeMappingService typeMappingService) {
        this.snapshot = snapshot;
        this.baseDirectory = baseDirectory;
        this.typeMappingService = typeMappingService;
    }

    public static SnapshotSiteBAdapter load(Path file, ObjectMapper objectMapper, TypeMappingService typeMappingService) {
        try {
            SiteBSnapshot snapshot = objectMapper.readValue(file.toFile(), SiteBSnapshot.class);
            log.info("Loaded System B snapshot {} ({} patients)", file, snapshot.getPatients().size());
            Path parent = file.toAbsolutePath().getParent();
            return new SnapshotSiteBAdapter(snapshot, parent, typeMappingService);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read System B snapshot " + file, e);
        }
    }

    @Override
    public List<String> listPatients() {
        return snapshot.getPatients().stream()
            .map(SiteBSnapshot.Patient::getName)
            .toList();
    }

    @Override
    public boolean openPatient(String patientName) {
        return findPatient(patientName).isPresent();
    }

    @Override
    public boolean awaitScheduleList(Duration timeout) {
        return true;
    }

    @Override
    public void navigateBack() {
        log.debug("Navigate back");
    }

    @Override
    public List<VisitRecord> listVisitsForPatient(String patientName) {
        List<VisitRecord> records = new ArrayList<>();
        for (SiteBSnapshot.Item item : patient(patientName).getVisits()) {
            String type = TextNormalizer.collapseWhitespace(item.getType());
            records.add(VisitRecord.builder()
                .source(RecordSource.SITE_B)
                .taskName(type)
                .therapist(item.getTherapist())
                .visitDate(item.getDate())
                .targetDate(item.getDate())
                .systemType(typeMappingService.classify(type))
                .discipline(Discipline.fromValue(item.getDiscipline()))
                .needsAction(true)
                .rawStatus(item.getStatus())
                .timeSlot(item.getTimeSlot())
                .build());
        }
        return records;
    }

    @Override
    public Optional<String> resolveStatus(String patientName, VisitRecord scheduleItem) {
        return findItem(patientName, scheduleItem).map(SiteBSnapshot.Item::getStatus);
    }

    @Override
    public VisitDetail openVisit(String patientName, VisitRecord scheduleItem) {
        SiteBSnapshot.Item item = findItem(patientName, scheduleItem)
            .orElseThrow(() -> new VisitNotFoundException("Schedule item gone: " + scheduleItem.describe()));
        return new VisitDetail(item.getDate(), item.getTimeIn(), item.getTimeOut(), item.getStatus());
    }

    @Override
    public List<Path> fetchDocuments(DocumentRequest request) {
        SiteBSnapshot.Item item = findItem(request.patientName(), request.scheduleItem())
            .orElseThrow(() -> new VisitNotFoundException("Schedule item gone: " + request.scheduleItem().describe()));

        List<Path> saved = new ArrayList<>();
        int n = 1;
        for (String document : item.getDocuments()) {
            Path source = baseDirectory.resolve(document);
            Path target = request.directory().resolve(request.identifier() + "-" + n + ".pdf");
            try {
                Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot save document " + source, e);
            }
            saved.add(target);
            n++;
        }
        return saved;
    }

    @Override
    public void returnToScheduleList(String patientName) {
        log.debug("Returned to schedule list of {}", patientName);
    }

    private Optional<SiteBSnapshot.Item> findItem(String patientName, VisitRecord scheduleItem) {
        String type = TextNormalizer.normalizeText(scheduleItem.getTaskName());
        String date = TextNormalizer.normalizeDateToIso(scheduleItem.effectiveDate());
        Discipline discipline = scheduleItem.getDiscipline();
        return patient(patientName).getVisits().stream()
            .filter(item -> TextNormalizer.normalizeText(item.getType()).equals(type))
            .filter(item -> TextNormalizer.normalizeDateToIso(item.getDate()).equals(date))
            .filter(item -> discipline == null || Discipline.fromValue(item.getDiscipline()) == discipline)
            .findFirst();
    }

    private Optional<SiteBSnapshot.Patient> findPatient(String patientName) {
        String wanted = TextNormalizer.normalizeText(patientName);
        return snapshot.getPatients().stream()
            .filter(p -> TextNormalizer.normalizeText(p.getName()).equals(wanted))
            .findFirst();
    }

    private SiteBSnapshot.Patient patient(String patientName) {
        return findPatient(patientName)
            .orElseThrow(() -> new VisitNotFoundException("Patient not found in System B: " + patientName));
    }
}
