package com.visitsync.service;

import com.visitsync.util.TextNormalizer;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Derives deterministic document identifiers and the fingerprints used to
 * recognize documents fetched or attached by an earlier run.
 *
 * Identifier: sanitize(visitType) + "-" + dateWithDashes + "-" + sanitize(patientName)
 */
@Service
public class DocumentNamingService {

    private static final Pattern DISALLOWED = Pattern.compile("[^A-Za-z0-9 \\-_().]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern SEQUENCE = Pattern.compile("\\d+");

    /**
     * Keep letters, digits, space, dash, underscore, parentheses and period;
     * drop commas and everything else; collapse whitespace.
     */
    public String sanitize(String s) {
        if (s == null) {
            return "";
        }
        String kept = DISALLOWED.matcher(s.replace(",", "")).replaceAll("");
        return WHITESPACE.matcher(kept).replaceAll(" ").trim();
    }

    public String identifier(String visitType, String visitDate, String patientName) {
        return sanitize(visitType) + "-" + TextNormalizer.dateWithDashes(visitDate) + "-" + sanitize(patientName);
    }

    /**
     * Lower-case, dash-joined form of a name for fuzzy comparison.
     */
    public String safeName(String s) {
        return WHITESPACE.matcher(sanitize(s)).replaceAll("-").toLowerCase(Locale.ROOT);
    }

    /**
     * Visit-and-date fingerprint looked for among a visit's existing attachments.
     */
    public String attachmentKey(String taskName, String visitDate) {
        return safeName(taskName) + "-" + TextNormalizer.dateWithDashes(visitDate);
    }

    /**
     * True when a file name was produced for the identifier: {@code <identifier>.pdf}
     * or {@code <identifier>-<n>.pdf}, compared exactly or after normalizing case,
     * spacing and punctuation on both sides.
     */
    public boolean belongsTo(String fileName, String identifier) {
        String stem = stripExtension(fileName);
        return isNumbered(stem, identifier) || isNumbered(safeName(stem), safeName(identifier));
    }

    public boolean isAlreadyAttached(String existingAttachment, String attachmentKey) {
        return safeName(existingAttachment).contains(attachmentKey);
    }

    private boolean isNumbered(String stem, String identifier) {
        if (stem.equals(identifier)) {
            return true;
        }
        return stem.startsWith(identifier + "-")
            && SEQUENCE.matcher(stem.substring(identifier.length() + 1)).matches();
    }

    private String stripExtension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
