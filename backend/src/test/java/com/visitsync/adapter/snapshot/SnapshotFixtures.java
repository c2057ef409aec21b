package com.visitsync.adapter.snapshot;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Copies the snapshot fixtures from the test classpath into a directory.
 */
public final class SnapshotFixtures {

    private static final List<String> FILES = List.of("site-a.json", "site-b.json", "docs/pt-note.pdf");

    private SnapshotFixtures() {
    }

    public static Path copyTo(Path directory) {
        try {
            for (String name : FILES) {
                Path target = directory.resolve(name);
                Files.createDirectories(target.getParent());
                try (InputStream in = SnapshotFixtures.class.getResourceAsStream("/snapshots/" + name)) {
                    if (in == null) {
                        throw new IllegalStateException("Missing fixture " + name);
                    }
                    Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
                }
            }
            return directory;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
