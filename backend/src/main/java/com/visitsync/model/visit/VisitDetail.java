package com.visitsync.model.visit;

/**
 * Times read from an opened System B visit. Times are in the 12-hour
 * form System B displays, e.g. "1:30 PM".
 */
public record VisitDetail(String visitDate, String timeIn, String timeOut, String rawStatus) {
}
