package com.visitsync.model.visit;

/**
 * A System B visit without a System A counterpart.
 *
 * @param siteBVisit  the schedule item as read from System B
 * @param siteALabel  System A task label the visit would be inserted as
 * @param key         dedup key built from the System A label and the visit date
 */
public record MissingVisitCandidate(VisitRecord siteBVisit, String siteALabel, String key) {
}
