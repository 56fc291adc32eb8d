package org.leakscope.cli.commands;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.leakscope.analysis.ClassifiedIssues;
import org.leakscope.analysis.IssueClassifier;
import org.leakscope.analysis.Statistics;
import org.leakscope.cli.CommandLineInterface;
import org.leakscope.cli.config.LoggingConfigurator;
import org.leakscope.parser.LogParser;
import org.leakscope.parser.ParserOptions;
import org.leakscope.parser.api.ILogParser;
import org.leakscope.parser.api.LogParseException;
import org.leakscope.parser.api.ParseResult;
import org.leakscope.parser.diagnostics.ParseWarning;
import org.leakscope.report.AnalysisReport;
import org.leakscope.report.CsvReportWriter;
import org.leakscope.report.JsonReportWriter;
import org.leakscope.report.ReportException;
import org.leakscope.report.ReportFormat;
import org.leakscope.report.ReportSettings;
import org.leakscope.report.ReportWriter;
import org.leakscope.report.SummaryPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.function.BiFunction;

@Command(name = "analyze",
        mixinStandardHelpOptions = true,
        description = "Parses a Valgrind Memcheck log, classifies its issues and writes a report.")
public class AnalyzeCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(AnalyzeCommand.class);
    private static final String DEFAULT_OUTPUT_BASE = "leakscope_report";

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Parameters(index = "0", description = "The Valgrind log file to analyze.")
    private File inputFile;

    @Option(names = {"-o", "--output"}, description = "Report file (default: leakscope_report.<format>).")
    private Path output;

    @Option(names = {"-f", "--format"}, description = "Report format: json or csv (default: report.format).")
    private String format;

    @Option(names = "--csv-fallback", description = "Write a CSV report if the primary report cannot be written.")
    private boolean csvFallback;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose logging.")
    private boolean verbose;

    private final BiFunction<ReportFormat, ReportSettings, ReportWriter> writerFactory;

    public AnalyzeCommand() {
        this(AnalyzeCommand::createWriter);
    }

    /**
     * @param writerFactory Creates the report writer for a format.
     */
    public AnalyzeCommand(BiFunction<ReportFormat, ReportSettings, ReportWriter> writerFactory) {
        this.writerFactory = writerFactory;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        final Config config;
        try {
            config = parent.getConfig();
        } catch (ConfigException e) {
            err.println("Failed to load or parse configuration: " + e.getMessage());
            return 1;
        }
        if (verbose) {
            LoggingConfigurator.enableVerbose();
        }

        if (!inputFile.exists()) {
            err.println("Error: Input file '" + inputFile + "' not found");
            return 1;
        }

        final ReportSettings settings;
        final ReportFormat reportFormat;
        try {
            settings = ReportSettings.fromConfig(config.getConfig("report"));
            reportFormat = format != null ? ReportFormat.fromName(format) : settings.format();
        } catch (IllegalArgumentException | ConfigException e) {
            err.println(e.getMessage());
            return 1;
        }

        out.println("Analyzing Valgrind log: " + inputFile);
        ILogParser parser = new LogParser(ParserOptions.fromConfig(config.getConfig("parser")));
        final ParseResult result;
        try {
            result = parser.parseFile(inputFile.toPath());
        } catch (LogParseException e) {
            err.println("Error parsing log file: " + e.getMessage());
            return 1;
        }
        logDiagnostics(result);

        if (result.isEmpty()) {
            out.println("No memory issues found in the log file.");
            return 0;
        }

        IssueClassifier classifier = IssueClassifier.fromConfig(config.getConfig("analysis"));
        ClassifiedIssues classified = classifier.classify(result.records());
        Statistics statistics = classifier.computeStatistics(classified);
        AnalysisReport report = new AnalysisReport(
                result.sourceName(),
                classified,
                statistics,
                classifier.leakSummary(statistics),
                classifier.sourceAnalysis(classified),
                result.warnings());
        SummaryPrinter.print(report, out);

        Path target = output != null ? output : reportFormat.applyTo(Path.of(DEFAULT_OUTPUT_BASE));
        try {
            writerFactory.apply(reportFormat, settings).write(report, target);
            out.println("Report generated successfully: " + target);
            return 0;
        } catch (ReportException e) {
            if (!csvFallback || reportFormat == ReportFormat.CSV) {
                err.println("Error generating report: " + e.getMessage());
                if (!csvFallback) {
                    err.println("Use --csv-fallback option to generate CSV output instead");
                }
                return 1;
            }
            LOGGER.warn("Report generation failed, attempting CSV fallback: {}", e.getMessage());
            out.println("Report generation failed: " + e.getMessage());
            out.println("Attempting CSV fallback...");
        }

        Path csvTarget = ReportFormat.CSV.applyTo(target);
        try {
            writerFactory.apply(ReportFormat.CSV, settings).write(report, csvTarget);
            out.println("CSV report generated: " + csvTarget);
            return 0;
        } catch (ReportException e) {
            err.println("Error generating report: " + e.getMessage());
            return 1;
        }
    }

    private static void logDiagnostics(ParseResult result) {
        for (ParseWarning warning : result.warnings()) {
            if (warning.level() == ParseWarning.Level.WARNING) {
                LOGGER.warn("{}", warning);
            } else {
                LOGGER.info("{}", warning);
            }
        }
    }

    static ReportWriter createWriter(ReportFormat format, ReportSettings settings) {
        switch (format) {
            case CSV:
                return new CsvReportWriter();
            case JSON:
            default:
                return new JsonReportWriter(settings);
        }
    }
}
