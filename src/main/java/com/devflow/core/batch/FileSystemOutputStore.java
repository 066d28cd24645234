package com.devflow.core.batch;

import com.devflow.core.model.OutputType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * {@link OutputFileStore} backed by a directory on the local file system.
 * Backups land in {@code <backupDirectory>/backup-<label>-<timestamp>/}.
 */
public class FileSystemOutputStore implements OutputFileStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemOutputStore.class);

    static final String METADATA_FILE = "backup-metadata.json";

    private final Path outputDirectory;
    private final Path backupDirectory;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public FileSystemOutputStore(Path outputDirectory, Path backupDirectory,
                                 ObjectMapper objectMapper, Clock clock) {
        this.outputDirectory = outputDirectory.toAbsolutePath().normalize();
        this.backupDirectory = backupDirectory.toAbsolutePath().normalize();
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public Path pathFor(OutputType type) {
        return outputDirectory.resolve(type.fileName());
    }

    @Override
    public Path ensureOutputDirectory() throws IOException {
        return Files.createDirectories(outputDirectory);
    }

    @Override
    public Path write(OutputType type, String content) throws IOException {
        ensureOutputDirectory();
        Path target = pathFor(type);
        Files.writeString(target, content, StandardCharsets.UTF_8);
        log.debug("Wrote {} ({} chars) to {}", type.id(), content.length(), target);
        return target;
    }

    @Override
    public Optional<String> read(OutputType type) throws IOException {
        Path file = pathFor(type);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
    }

    @Override
    public boolean exists(OutputType type) {
        return Files.isRegularFile(pathFor(type));
    }

    @Override
    public Path createBackup(String label) throws IOException {
        Instant now = clock.instant();
        String backupLabel = label == null || label.isBlank() ? "manual" : label;
        String stamp = now.toString().replace(':', '-').replace('.', '-');
        Path target = Files.createDirectories(backupDirectory.resolve("backup-" + backupLabel + "-" + stamp));

        int copied = 0;
        for (OutputType type : OutputType.values()) {
            Path source = pathFor(type);
            if (!Files.isRegularFile(source)) {
                continue;
            }
            try {
                Files.copy(source, target.resolve(source.getFileName()), StandardCopyOption.REPLACE_EXISTING);
                copied++;
            } catch (IOException e) {
                log.warn("Failed to back up {}: {}", source, e.getMessage());
            }
        }

        var metadata = new BackupMetadata(now.toString(), backupLabel, copied, outputDirectory.toString());
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.resolve(METADATA_FILE).toFile(), metadata);
        log.info("Backup created with {} files: {}", copied, target.getFileName());
        return target;
    }

    @Override
    public FileStats stats(Path file) {
        try {
            long size = Files.size(file);
            String content = Files.readString(file, StandardCharsets.UTF_8);
            return new FileStats(size, content.split("\n", -1).length);
        } catch (IOException e) {
            log.debug("Cannot stat {}: {}", file, e.getMessage());
            return FileStats.EMPTY;
        }
    }

    public Path getOutputDirectory() {
        return outputDirectory;
    }

    /** Contents of {@value #METADATA_FILE}. */
    public record BackupMetadata(String timestamp, String label, int files, String originalPath) {}
}
