package com.visitsync.service;

import com.visitsync.config.VisitSyncProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

/**
 * Local directory of documents fetched from System B. Lets re-runs reuse
 * earlier downloads instead of fetching them again.
 */
@Slf4j
@Service
public class DocumentStore {

    private final Path directory;
    private final DocumentNamingService namingService;

    public DocumentStore(VisitSyncProperties properties, DocumentNamingService namingService) {
        this.directory = Path.of(properties.getDocuments().getDirectory());
        this.namingService = namingService;
    }

    public Path getDirectory() {
        return directory;
    }

    /**
     * Create the directory if missing and return it.
     */
    public Path ensureDirectory() {
        try {
            return Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create document directory " + directory, e);
        }
    }

    /**
     * Files previously produced for the identifier, sorted by name.
     */
    public List<Path> findExisting(String identifier) {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files
                .filter(Files::isRegularFile)
                .filter(file -> namingService.belongsTo(file.getFileName().toString(), identifier))
                .sorted()
                .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list document directory " + directory, e);
        }
    }
}
