package com.visitsync.service;

import com.visitsync.model.enums.Discipline;
import com.visitsync.model.enums.VisitType;
import com.visitsync.model.visit.TypeMapping;
import com.visitsync.model.visit.VisitRecord;
import com.visitsync.util.TextNormalizer;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Type/Discipline Mapping Service
 *
 * Translates System A visit labels into System B (type, discipline) vocabulary
 * and back, and classifies labels into a {@link VisitType}.
 *
 * Forward lookup order:
 * 1. Static table keyed by normalized System A label
 * 2. Fallback: the normalized label itself as System B type, any discipline
 * 3. Role marker override: "cota" implies OT, "pta" implies PT. When a label
 *    carries both markers, "cota" is checked first and wins.
 */
@Service
public class TypeMappingService {

    static final String STANDARD = "standard";
    static final String INITIAL_EVAL = "initial eval";
    static final String REASSESSMENT = "reassessment";

    private static final Map<String, TypeMapping> SITE_A_TO_SITE_B = Map.ofEntries(
        Map.entry("pt evaluation", new TypeMapping(INITIAL_EVAL, Discipline.PT)),
        Map.entry("ot evaluation", new TypeMapping(INITIAL_EVAL, Discipline.OT)),
        Map.entry("st evaluation", new TypeMapping(INITIAL_EVAL, Discipline.ST)),
        Map.entry("pt re-evaluation", new TypeMapping(REASSESSMENT, Discipline.PT)),
        Map.entry("ot re-evaluation", new TypeMapping(REASSESSMENT, Discipline.OT)),
        Map.entry("st re-evaluation", new TypeMapping(REASSESSMENT, Discipline.ST)),
        Map.entry("pt visit", new TypeMapping(STANDARD, Discipline.PT)),
        Map.entry("ot visit", new TypeMapping(STANDARD, Discipline.OT)),
        Map.entry("st visit", new TypeMapping(STANDARD, Discipline.ST)),
        Map.entry("pta visit", new TypeMapping(STANDARD, null)),
        Map.entry("cota visit", new TypeMapping(STANDARD, null))
    );

    private static final List<String> SOC_MARKERS = List.of(
        "soc", "soc oasis", "start of care", "oasis-e1 start"
    );

    private static final List<String> DISCHARGE_MARKERS = List.of(
        "discharge", "dc oasis", "oasis-e1 discharge", "oasis-e1 dc"
    );

    private static final Set<String> STANDARD_LABELS = Set.of(
        "pta visit", "cota visit", "ot visit", "pt visit", "st visit"
    );

    private static final Pattern ROLE_SUFFIX = Pattern.compile("\\(([^)]*)\\)");

    // ========================================================================
    // System A -> System B
    // ========================================================================

    /**
     * Map a System A label to System B vocabulary. Never fails: unknown labels
     * fall back to looser matching on the label itself.
     */
    public TypeMapping toSiteB(String siteALabel) {
        String normalized = TextNormalizer.normalizeText(siteALabel);
        TypeMapping mapping = SITE_A_TO_SITE_B.getOrDefault(normalized, new TypeMapping(normalized, null));

        Discipline roleOverride = roleDiscipline(normalized);
        return roleOverride != null ? mapping.withDiscipline(roleOverride) : mapping;
    }

    /**
     * Discipline implied by an assistant role marker in the label, if any.
     */
    Discipline roleDiscipline(String normalizedLabel) {
        if (normalizedLabel.contains("cota")) {
            return Discipline.OT;
        }
        if (normalizedLabel.contains("pta")) {
            return Discipline.PT;
        }
        return null;
    }

    // ========================================================================
    // System B -> System A
    // ========================================================================

    /**
     * Derive the System A task label a System B schedule item would be inserted as.
     *
     * The therapist's role suffix ("JESSICA DIAZ (PTA)") distinguishes assistant
     * visits from therapist visits of the same discipline.
     */
    public String toSiteALabel(VisitRecord siteBVisit) {
        String rawLabel = TextNormalizer.collapseWhitespace(siteBVisit.getTaskName());
        String type = TextNormalizer.normalizeText(rawLabel);
        String role = therapistRole(siteBVisit.getTherapist());
        Discipline discipline = siteBVisit.getDiscipline();

        if (type.contains("cota")) {
            return "COTA Visit";
        }
        if (type.contains(STANDARD)) {
            if ("pta".equals(role)) {
                return "PTA Visit";
            }
            if ("cota".equals(role)) {
                return "COTA Visit";
            }
            if (discipline != null) {
                return disciplinePrefix(discipline) + " Visit";
            }
            return rawLabel;
        }
        if (discipline == null) {
            return rawLabel;
        }
        if (type.contains(INITIAL_EVAL)) {
            return disciplinePrefix(discipline) + " Evaluation";
        }
        if (type.contains(REASSESSMENT)) {
            return disciplinePrefix(discipline) + " Re-Evaluation";
        }
        if (type.contains("recert")) {
            return disciplinePrefix(discipline) + " Recertification";
        }
        return rawLabel;
    }

    /**
     * Lower-cased role inside the therapist's trailing parentheses, or empty.
     */
    String therapistRole(String therapist) {
        if (therapist == null) {
            return "";
        }
        Matcher m = ROLE_SUFFIX.matcher(therapist);
        return m.find() ? TextNormalizer.normalizeText(m.group(1)) : "";
    }

    private String disciplinePrefix(Discipline discipline) {
        return discipline.getValue().toUpperCase();
    }

    // ========================================================================
    // Classification
    // ========================================================================

    /**
     * Classify a visit label from either system.
     *
     * Priority order:
     * 1. Start-of-care markers
     * 2. Discharge markers
     * 3. Re-evaluation / reassessment (before evaluation, which it contains)
     * 4. Recertification
     * 5. Evaluation
     * 6. Standard visit labels
     * 7. Default: OTHER
     */
    public VisitType classify(String label) {
        String text = TextNormalizer.normalizeText(label);

        if (isStartOfCare(text)) return VisitType.SOC;
        if (isDischarge(text)) return VisitType.DISCHARGE;
        if (text.contains("re-eval") || text.contains("reeval") || text.contains(REASSESSMENT)) {
            return VisitType.REASSESSMENT;
        }
        if (text.contains("recert")) return VisitType.RECERTIFICATION;
        if (text.contains(INITIAL_EVAL) || text.contains("evaluation")) return VisitType.EVALUATION;
        if (text.contains(STANDARD) || STANDARD_LABELS.stream().anyMatch(text::contains)) {
            return VisitType.STANDARD;
        }
        return VisitType.OTHER;
    }

    public boolean isStartOfCare(String label) {
        String text = TextNormalizer.normalizeText(label);
        return SOC_MARKERS.stream().anyMatch(marker -> containsWord(text, marker));
    }

    public boolean isDischarge(String label) {
        String text = TextNormalizer.normalizeText(label);
        return DISCHARGE_MARKERS.stream().anyMatch(text::contains);
    }

    /**
     * Cancelled rows in System A are prefixed "Del ".
     */
    public boolean isDeleted(String label) {
        return TextNormalizer.normalizeText(label).startsWith("del ");
    }

    public boolean isExcluded(String label) {
        return isStartOfCare(label) || isDischarge(label) || isDeleted(label);
    }

    // "soc" must not match inside words such as "associate"
    private boolean containsWord(String text, String marker) {
        int from = 0;
        while (true) {
            int idx = text.indexOf(marker, from);
            if (idx < 0) {
                return false;
            }
            int end = idx + marker.length();
            boolean startOk = idx == 0 || !Character.isLetterOrDigit(text.charAt(idx - 1));
            boolean endOk = end == text.length() || !Character.isLetterOrDigit(text.charAt(end));
            if (startOk && endOk) {
                return true;
            }
            from = idx + 1;
        }
    }
}
