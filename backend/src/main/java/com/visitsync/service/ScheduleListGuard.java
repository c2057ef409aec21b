package com.visitsync.service;

import com.visitsync.adapter.SiteBAdapter;
import com.visitsync.config.VisitSyncProperties;
import com.visitsync.exception.NavigationStaleException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Verifies that System B shows a patient's schedule list before the core reads it.
 * The only automatic retry in a run: one back-navigation, then one more wait.
 */
@Slf4j
@Service
public class ScheduleListGuard {

    static final int MAX_ATTEMPTS = 2;

    private final SiteBAdapter siteB;
    private final Duration timeout;

    public ScheduleListGuard(SiteBAdapter siteB, VisitSyncProperties properties) {
        this.siteB = siteB;
        this.timeout = properties.getSchedule().getReadyTimeout();
    }

    public void ensureReady() {
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            if (siteB.awaitScheduleList(timeout)) {
                return;
            }
            if (attempt < MAX_ATTEMPTS) {
                log.warn("Schedule list not ready after {}, navigating back", timeout);
                siteB.navigateBack();
            }
        }
        throw new NavigationStaleException("Schedule list not visible after " + MAX_ATTEMPTS + " attempts");
    }
}
