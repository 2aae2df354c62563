package io.taintscan.report;

import io.taintscan.model.ClassificationReport;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Interface for report output formatters.
 */
public interface Reporter {

    /**
     * Returns the format name (e.g., "console", "json").
     */
    String format();

    /**
     * Writes the report to the given writer.
     */
    void write(ClassificationReport report, Writer writer) throws IOException;

    /**
     * Writes the report to the given file path.
     */
    default void write(ClassificationReport report, Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path)) {
            write(report, writer);
        }
    }

    /**
     * Returns the report as a string.
     */
    default String toString(ClassificationReport report) {
        try {
            StringWriter writer = new StringWriter();
            write(report, writer);
            return writer.toString();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to generate report", e);
        }
    }
}
