package com.visitsync.model.visit;

/**
 * Opaque reference to a located System A visit. The reference string is
 * owned by the adapter that issued the handle.
 */
public record VisitHandle(String patientName, String taskName, String visitDate, String reference) {
}
