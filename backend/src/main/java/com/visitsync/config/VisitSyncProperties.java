package com.visitsync.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Settings bound from {@code visitsync.*}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "visitsync")
public class VisitSyncProperties {

    @Valid
    private ChangeLog changeLog = new ChangeLog();

    @Valid
    private Documents documents = new Documents();

    @Valid
    private Schedule schedule = new Schedule();

    private Snapshot snapshot = new Snapshot();

    @Data
    public static class ChangeLog {
        @NotBlank
        private String file = "changes-log.txt";
    }

    @Data
    public static class Documents {
        @NotBlank
        private String directory = "patient-files";
    }

    @Data
    public static class Schedule {
        /**
         * Bound for each wait on the System B schedule list.
         */
        @NotNull
        private Duration readyTimeout = Duration.ofSeconds(15);
    }

    @Data
    public static class Snapshot {
        private String siteA;
        private String siteB;
    }
}
