package com.visitsync.runner;

import com.visitsync.service.ReconciliationEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs a single reconciliation pass at startup. A fatal error yields exit code 1.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "visitsync.runner", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ReconciliationRunner implements CommandLineRunner, ExitCodeGenerator {

    private final ReconciliationEngine engine;
    private int exitCode;

    public ReconciliationRunner(ReconciliationEngine engine) {
        this.engine = engine;
    }

    @Override
    public void run(String... args) {
        try {
            engine.run();
            exitCode = 0;
        } catch (RuntimeException e) {
            log.error("Fatal error, run aborted", e);
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
