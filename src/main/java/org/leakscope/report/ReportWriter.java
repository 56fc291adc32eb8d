package org.leakscope.report;

import java.nio.file.Path;

/**
 * Renders an {@link AnalysisReport} to a file.
 */
public interface ReportWriter {

    /**
     * @param report The data to render.
     * @param output The target file; parent directories are created as needed.
     * @throws ReportException if the medium cannot be created or written.
     */
    void write(AnalysisReport report, Path output) throws ReportException;

    /**
     * @return the medium this writer produces.
     */
    ReportFormat format();
}
