package com.devflow.core.batch;

import com.devflow.core.model.OutputType;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * File-write and read primitive for generated output files, one file per {@link OutputType}.
 */
public interface OutputFileStore {

    /** Where the file for a type lives, whether or not it exists yet. */
    Path pathFor(OutputType type);

    /** Creates the output directory if needed and returns it. */
    Path ensureOutputDirectory() throws IOException;

    /** Creates or overwrites the file for a type. */
    Path write(OutputType type, String content) throws IOException;

    /** Contents of the file for a type, or empty if it does not exist. */
    Optional<String> read(OutputType type) throws IOException;

    boolean exists(OutputType type);

    /**
     * Copies every existing output file into a fresh labelled backup directory, alongside a
     * metadata file, and returns that directory.
     */
    Path createBackup(String label) throws IOException;

    /** Size and line count of a file; zeros when it cannot be read. */
    FileStats stats(Path file);

    record FileStats(long sizeBytes, int lines) {

        public static final FileStats EMPTY = new FileStats(0, 0);

        /** Size rounded to whole kilobytes, e.g. {@code 3KB}. */
        public String sizeKb() {
            return Math.round(sizeBytes / 1024.0) + "KB";
        }
    }
}
