package com.visitsync.model.visit;

import java.nio.file.Path;

/**
 * Asks System B to save the documents of the currently opened visit as
 * {@code <directory>/<identifier>-<n>.pdf}.
 */
public record DocumentRequest(String patientName, VisitRecord scheduleItem, String identifier, Path directory) {
}
