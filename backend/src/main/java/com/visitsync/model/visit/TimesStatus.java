package com.visitsync.model.visit;

/**
 * Which timing fields are already populated on a System A visit.
 */
public record TimesStatus(boolean dateFilled, boolean timeInFilled, boolean timeOutFilled) {

    public boolean allFilled() {
        return dateFilled && timeInFilled && timeOutFilled;
    }
}
