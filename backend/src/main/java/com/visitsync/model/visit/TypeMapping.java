package com.visitsync.model.visit;

import com.visitsync.model.enums.Discipline;

/**
 * System B vocabulary for a System A visit label.
 *
 * @param siteBType  normalized System B type text, e.g. "standard" or "initial eval"
 * @param discipline required discipline, or null to match any discipline
 */
public record TypeMapping(String siteBType, Discipline discipline) {

    public TypeMapping withDiscipline(Discipline override) {
        return new TypeMapping(siteBType, override);
    }
}
