package org.leakscope.report;

import org.leakscope.parser.api.IssueRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes one row per issue, most severe first. Used on its own or as the fallback when the
 * primary report cannot be written.
 */
public class CsvReportWriter implements ReportWriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(CsvReportWriter.class);

    static final List<String> COLUMNS = List.of(
            "Issue Type", "Severity", "Bytes", "Blocks", "Loss Record", "Primary Function", "Source Location");

    @Override
    public ReportFormat format() {
        return ReportFormat.CSV;
    }

    @Override
    public void write(AnalysisReport report, Path output) throws ReportException {
        ReportFiles.prepareParent(output);
        try (BufferedWriter writer = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
            writeRow(writer, COLUMNS);
            for (IssueRecord record : report.classified().prioritized()) {
                writeRow(writer, row(record));
            }
        } catch (IOException e) {
            throw ReportFiles.wrap(output, e);
        }
        LOGGER.info("CSV report saved to: {}", output);
    }

    static List<String> row(IssueRecord record) {
        return List.of(
                record.issueType().displayName(),
                record.severityLevel().name(),
                Long.toString(record.bytesCount()),
                Long.toString(record.blocksCount()),
                record.lossRecordId().isEmpty() ? "N/A" : record.lossRecordId(),
                record.primaryFunction().orElse("Unknown"),
                record.location().map(Object::toString).orElse("Unknown"));
    }

    private static void writeRow(BufferedWriter writer, List<String> cells) throws IOException {
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) {
                writer.write(',');
            }
            writer.write(quote(cells.get(i)));
        }
        writer.write("\r\n");
    }

    /**
     * Quotes a cell when it contains a comma, a quote or a line break; embedded quotes are doubled.
     */
    static String quote(String cell) {
        if (cell.indexOf(',') < 0 && cell.indexOf('"') < 0 && cell.indexOf('\n') < 0 && cell.indexOf('\r') < 0) {
            return cell;
        }
        return '"' + cell.replace("\"", "\"\"") + '"';
    }
}
