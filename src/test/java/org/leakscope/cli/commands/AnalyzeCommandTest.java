package org.leakscope.cli.commands;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.leakscope.cli.CommandLineInterface;
import org.leakscope.report.CsvReportWriter;
import org.leakscope.report.ReportException;
import org.leakscope.report.ReportFormat;
import org.leakscope.report.ReportSettings;
import org.leakscope.report.ReportWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import picocli.CommandLine;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.BiFunction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;

/**
 * End-to-end tests of the {@code analyze} subcommand through picocli.
 */
@Tag("integration")
@ExtendWith(MockitoExtension.class)
class AnalyzeCommandTest {

    @TempDir
    Path tempDir;

    @Mock
    ReportWriter failingWriter;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private Path log;

    @BeforeEach
    void setUp() throws IOException {
        log = tempDir.resolve("sample_memcheck.log");
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("logs/sample_memcheck.log")) {
            assertThat(in).isNotNull();
            Files.copy(in, log);
        }
    }

    @Test
    void analyze_writesJsonReport() throws Exception {
        // Given
        Path report = tempDir.resolve("out/report.json");

        // When
        int exitCode = run(AnalyzeCommand::createWriter, "analyze", log.toString(), "-o", report.toString());

        // Then
        assertThat(exitCode).isZero();
        assertThat(err.toString()).isEmpty();
        assertThat(out.toString())
                .contains("Analyzing Valgrind log")
                .contains("Found 7 memory issues")
                .contains("Report generated successfully");
        JsonNode root = new ObjectMapper().readTree(report.toFile());
        assertThat(root.path("summary").path("totalIssues").asInt()).isEqualTo(7);
        assertThat(root.path("issuesByType").path("DEFINITELY_LOST").path("count").asInt()).isEqualTo(2);
        assertThat(root.path("diagnostics")).hasSize(2);
    }

    @Test
    void analyze_writesCsvWhenRequested() throws Exception {
        Path report = tempDir.resolve("report.csv");

        int exitCode = run(AnalyzeCommand::createWriter, "analyze", log.toString(), "-o", report.toString(), "-f", "csv");

        assertThat(exitCode).isZero();
        assertThat(Files.readAllLines(report)).hasSize(8);
    }

    @Test
    void analyze_fallsBackToCsvWhenPrimaryReportFails() throws Exception {
        // Given
        doThrow(new ReportException("disk full")).when(failingWriter).write(any(), any());
        Path report = tempDir.resolve("report.json");

        // When
        int exitCode = run(failingJson(), "analyze", log.toString(), "-o", report.toString(), "--csv-fallback");

        // Then
        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("Attempting CSV fallback");
        assertThat(report).doesNotExist();
        assertThat(tempDir.resolve("report.csv")).exists();
    }

    @Test
    void analyze_withoutFallback_failsOnReportError() throws Exception {
        doThrow(new ReportException("disk full")).when(failingWriter).write(any(), any());

        int exitCode = run(failingJson(), "analyze", log.toString(), "-o", tempDir.resolve("r.json").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("disk full").contains("--csv-fallback");
    }

    @Test
    void analyze_missingInputFails() {
        int exitCode = run(AnalyzeCommand::createWriter, "analyze", tempDir.resolve("nope.log").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("not found");
    }

    @Test
    void analyze_nonMemcheckInputFails() throws IOException {
        Path text = Files.writeString(tempDir.resolve("notes.txt"), "hello\n");

        int exitCode = run(AnalyzeCommand::createWriter, "analyze", text.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Error parsing log file");
    }

    @Test
    void analyze_cleanLogReportsNoIssues() throws IOException {
        Path clean = Files.writeString(tempDir.resolve("clean.log"), String.join("\n",
                "==5== Memcheck, a memory error detector",
                "==5== All heap blocks were freed -- no leaks are possible",
                ""));

        int exitCode = run(AnalyzeCommand::createWriter, "analyze", clean.toString(), "-o", tempDir.resolve("r.json").toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("No memory issues found");
        assertThat(tempDir.resolve("r.json")).doesNotExist();
    }

    @Test
    void analyze_unknownFormatFails() {
        int exitCode = run(AnalyzeCommand::createWriter, "analyze", log.toString(), "-f", "xlsx");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Unknown report format");
    }

    @Test
    void analyze_missingInputArgumentIsUsageError() {
        int exitCode = run(AnalyzeCommand::createWriter, "analyze");

        assertThat(exitCode).isEqualTo(2);
    }

    private BiFunction<ReportFormat, ReportSettings, ReportWriter> failingJson() {
        return (format, settings) -> format == ReportFormat.CSV ? new CsvReportWriter() : failingWriter;
    }

    private int run(BiFunction<ReportFormat, ReportSettings, ReportWriter> writers, String... args) {
        CommandLine.IFactory factory = new CommandLine.IFactory() {
            @Override
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == AnalyzeCommand.class) {
                    return cls.cast(new AnalyzeCommand(writers));
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
        CommandLine commandLine = new CommandLine(new CommandLineInterface(), factory);
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }
}
