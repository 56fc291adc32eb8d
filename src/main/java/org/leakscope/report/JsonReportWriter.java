package org.leakscope.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.leakscope.analysis.ClassifiedIssues;
import org.leakscope.analysis.LeakSummary;
import org.leakscope.analysis.SourceAnalysis;
import org.leakscope.analysis.SourceCount;
import org.leakscope.analysis.Statistics;
import org.leakscope.parser.api.IssueRecord;
import org.leakscope.parser.api.IssueType;
import org.leakscope.parser.api.StackFrame;
import org.leakscope.parser.diagnostics.ParseWarning;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Writes the analysis as one JSON document with a {@code summary}, an {@code issuesByType} and a
 * {@code statistics} section, followed by the parser {@code diagnostics}.
 */
public class JsonReportWriter implements ReportWriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonReportWriter.class);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ReportSettings settings;

    public JsonReportWriter(ReportSettings settings) {
        this.settings = settings;
    }

    @Override
    public ReportFormat format() {
        return ReportFormat.JSON;
    }

    @Override
    public void write(AnalysisReport report, Path output) throws ReportException {
        ReportFiles.prepareParent(output);
        ObjectNode root = toJson(report);
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(output.toFile(), root);
        } catch (IOException e) {
            throw ReportFiles.wrap(output, e);
        }
        LOGGER.info("JSON report saved to: {}", output);
    }

    /**
     * Builds the document tree. Visible for callers that want to embed or print the report.
     *
     * @param report The data to render.
     * @return The document root.
     */
    public ObjectNode toJson(AnalysisReport report) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("source", report.sourceName());
        root.set("summary", summary(report));
        root.set("issuesByType", issuesByType(report.classified()));
        root.set("statistics", statistics(report.statistics(), report.sources()));
        root.set("diagnostics", diagnostics(report.diagnostics()));
        return root;
    }

    private ObjectNode summary(AnalysisReport report) {
        Statistics stats = report.statistics();
        ObjectNode summary = objectMapper.createObjectNode();
        summary.put("totalIssues", stats.totalIssues());
        summary.put("totalBytes", stats.totalBytes());
        summary.put("totalBlocks", stats.totalBlocks());
        summary.put("criticalIssues", report.classified().criticalIssues().size());

        LeakSummary leaks = report.leakSummary();
        ObjectNode leakNode = summary.putObject("leakSummary");
        leakNode.put("totalLeakedBytes", leaks.totalLeakedBytes());
        leakNode.put("totalLeakedBlocks", leaks.totalLeakedBlocks());
        leakNode.put("totalLeakIssues", leaks.totalLeakIssues());
        leakNode.put("leakShareOfTotalBytes", leaks.leakShareOfTotalBytes());
        ObjectNode leakBytes = leakNode.putObject("bytesByLeakType");
        leaks.bytesByLeakType().forEach((type, bytes) -> leakBytes.put(type.name(), bytes));

        ObjectNode severities = summary.putObject("severityDistribution");
        stats.severityDistribution().forEach((level, count) -> severities.put(level.name(), count));
        return summary;
    }

    private ObjectNode issuesByType(ClassifiedIssues classified) {
        ObjectNode byType = objectMapper.createObjectNode();
        for (IssueType type : IssueType.values()) {
            List<IssueRecord> records = classified.prioritized(type);
            if (records.isEmpty()) {
                continue;
            }
            ObjectNode section = byType.putObject(type.name());
            section.put("displayName", type.displayName());
            section.put("count", records.size());
            ArrayNode issues = section.putArray("issues");
            records.forEach(r -> issues.add(issue(r)));
        }
        return byType;
    }

    private ObjectNode issue(IssueRecord record) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("sequence", record.sequence());
        node.put("lineNumber", record.lineNumber());
        node.put("type", record.issueType().name());
        node.put("severity", record.severity());
        node.put("severityLevel", record.severityLevel().name());
        node.put("bytes", record.bytesCount());
        node.put("blocks", record.blocksCount());
        record.breakdown().ifPresent(b -> node.put("byteBreakdown", b));
        node.put("lossRecord", record.lossRecordId().isEmpty() ? "N/A" : record.lossRecordId());
        record.location().ifPresent(loc -> node.put("sourceLocation", loc.toString()));
        record.primaryFunction().ifPresent(f -> node.put("primaryFunction", f));
        if (record.addressDescription() != null) {
            node.put("addressDescription", record.addressDescription());
        }
        node.set("stackTrace", frames(record.stackTrace()));
        if (!record.auxiliaryTrace().isEmpty()) {
            node.set("auxiliaryTrace", frames(record.auxiliaryTrace()));
        }
        return node;
    }

    private ArrayNode frames(List<StackFrame> trace) {
        ArrayNode array = objectMapper.createArrayNode();
        int limit = settings.maxFrames() == 0 ? trace.size() : Math.min(settings.maxFrames(), trace.size());
        for (StackFrame frame : trace.subList(0, limit)) {
            ObjectNode node = array.addObject();
            if (frame.address() != null) {
                node.put("address", frame.address());
            }
            frame.function().ifPresent(f -> node.put("function", f));
            frame.libraryName().ifPresent(l -> node.put("library", l));
            if (frame.sourceFile() != null) {
                node.put("file", frame.sourceFile());
            }
            if (frame.lineNumber() != null) {
                node.put("line", frame.lineNumber());
            }
        }
        if (limit < trace.size()) {
            array.addObject().put("omittedFrames", trace.size() - limit);
        }
        return array;
    }

    private ObjectNode statistics(Statistics stats, List<SourceAnalysis> sources) {
        ObjectNode node = objectMapper.createObjectNode();
        putLongs(node.putObject("issuesByType"), stats.issuesByType());
        putLongs(node.putObject("bytesByType"), stats.bytesByType());
        putLongs(node.putObject("blocksByType"), stats.blocksByType());
        ObjectNode percentages = node.putObject("percentageByType");
        stats.percentageByType().forEach((type, share) -> percentages.put(type.name(), share));
        ObjectNode bytePercentages = node.putObject("bytePercentageByType");
        stats.bytePercentageByType().forEach((type, share) -> bytePercentages.put(type.name(), share));

        ArrayNode top = node.putArray("topSources");
        for (SourceCount source : stats.topSources()) {
            top.addObject().put("source", source.source()).put("count", source.count());
        }

        ArrayNode analysis = node.putArray("sourceAnalysis");
        for (SourceAnalysis source : sources) {
            ObjectNode entry = analysis.addObject();
            entry.put("source", source.source());
            entry.put("count", source.count());
            entry.put("totalBytes", source.totalBytes());
            entry.put("totalBlocks", source.totalBlocks());
            ArrayNode types = entry.putArray("issueTypes");
            source.issueTypes().forEach(t -> types.add(t.name()));
            ArrayNode levels = entry.putArray("severities");
            source.severities().forEach(l -> levels.add(l.name()));
        }
        return node;
    }

    private ArrayNode diagnostics(List<ParseWarning> warnings) {
        ArrayNode array = objectMapper.createArrayNode();
        for (ParseWarning warning : warnings) {
            array.addObject()
                    .put("level", warning.level().name())
                    .put("reasonCode", warning.reasonCode().name())
                    .put("lineNumber", warning.lineNumber())
                    .put("message", warning.message())
                    .put("rawText", warning.rawText());
        }
        return array;
    }

    private static void putLongs(ObjectNode node, Map<IssueType, ? extends Number> values) {
        values.forEach((type, value) -> node.put(type.name(), value.longValue()));
    }
}
