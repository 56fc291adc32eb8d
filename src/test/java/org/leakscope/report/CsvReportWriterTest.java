package org.leakscope.report;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link CsvReportWriter}.
 */
@Tag("unit")
class CsvReportWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void write_emitsHeaderAndOneRowPerIssueMostSevereFirst() throws Exception {
        // Arrange
        Path output = tempDir.resolve("report.csv");

        // Act
        new CsvReportWriter().write(ReportFixtures.sampleReport(), output);

        // Assert
        List<String> lines = Files.readAllLines(output, StandardCharsets.UTF_8);
        assertThat(lines).containsExactly(
                "Issue Type,Severity,Bytes,Blocks,Loss Record,Primary Function,Source Location",
                "Definitely Lost,CRITICAL,72,1,2 of 4,level0,deep.c:100",
                "Invalid Write,CRITICAL,4,1,N/A,fill,sample.c:21",
                "Other,MEDIUM,0,0,N/A,Unknown,Unknown");
    }

    @Test
    void quote_escapesSeparatorsAndQuotes() {
        assertThat(CsvReportWriter.quote("plain")).isEqualTo("plain");
        assertThat(CsvReportWriter.quote("operator new(unsigned long, std::nothrow_t const&)"))
                .isEqualTo("\"operator new(unsigned long, std::nothrow_t const&)\"");
        assertThat(CsvReportWriter.quote("say \"hi\"")).isEqualTo("\"say \"\"hi\"\"\"");
    }

    @Test
    void format_isCsv() {
        assertThat(new CsvReportWriter().format()).isEqualTo(ReportFormat.CSV);
        assertThat(ReportFormat.CSV.applyTo(Path.of("out/report.json"))).isEqualTo(Path.of("out/report.csv"));
        assertThat(ReportFormat.JSON.applyTo(Path.of("report"))).isEqualTo(Path.of("report.json"));
    }
}
