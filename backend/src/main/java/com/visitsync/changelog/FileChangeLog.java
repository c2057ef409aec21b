package com.visitsync.changelog;

import com.visitsync.config.VisitSyncProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link ChangeLogSink} appending to a single text file:
 *
 * <pre>
 * Run 02/17/2026 - 14:05:
 *   [DOE, JANE] Added new visit: "PT Visit" on 2/17/2026 (therapist: Diaz, Jessica)
 * </pre>
 */
@Slf4j
@Component
public class FileChangeLog implements ChangeLogSink {

    static final String NO_CHANGES = "  (no changes this run)";

    private static final DateTimeFormatter HEADER_FORMAT = DateTimeFormatter.ofPattern("MM/dd/yyyy - HH:mm");

    private final Path file;
    private final Clock clock;
    private final List<String> entries = new ArrayList<>();
    private String header;

    public FileChangeLog(VisitSyncProperties properties, Clock clock) {
        this.file = Path.of(properties.getChangeLog().getFile());
        this.clock = clock;
    }

    @Override
    public void startRun() {
        entries.clear();
        header = "Run " + LocalDateTime.now(clock).format(HEADER_FORMAT) + ":";
    }

    @Override
    public void record(String patientName, String message) {
        log.info("[{}] {}", patientName, message);
        entries.add("  [" + patientName + "] " + message);
    }

    @Override
    public void flush() {
        if (header == null) {
            log.debug("Change log flush skipped, no run started");
            return;
        }
        String body = entries.isEmpty() ? NO_CHANGES : String.join("\n", entries);
        String block = "\n" + header + "\n" + body + "\n";
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, block, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write change log " + file, e);
        }
        log.info("Change log updated: {} ({} change(s))", file, entries.size());
        entries.clear();
        header = null;
    }
}
