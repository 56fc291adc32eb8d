package org.leakscope.report;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * File helpers shared by the report writers.
 */
final class ReportFiles {

    private ReportFiles() {}

    static void prepareParent(Path output) throws ReportException {
        Path parent = output.toAbsolutePath().getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new ReportException("Cannot create output directory " + parent + ": " + e.getMessage(), e);
        }
    }

    static ReportException wrap(Path output, IOException e) {
        if (e instanceof AccessDeniedException) {
            return new ReportException("Permission denied when saving to '" + output
                    + "'. Make sure the file is not open in another application.", e);
        }
        return new ReportException("Failed to write report to '" + output + "': " + e.getMessage(), e);
    }
}
