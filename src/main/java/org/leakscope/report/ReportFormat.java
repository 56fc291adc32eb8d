package org.leakscope.report;

import java.nio.file.Path;
import java.util.Locale;

/**
 * The supported report media.
 */
public enum ReportFormat {
    /** Structured document with summary, per-type and statistics sections. */
    JSON("json"),
    /** One row per issue. */
    CSV("csv");

    private final String extension;

    ReportFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    /**
     * Replaces the extension of a file name with this format's, or appends it if the name has none.
     *
     * @param output The requested output path.
     * @return The path with this format's extension.
     */
    public Path applyTo(Path output) {
        String name = output.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return output.resolveSibling(base + "." + extension);
    }

    /**
     * @param name A format name, case-insensitive.
     * @return The format.
     * @throws IllegalArgumentException for unknown names.
     */
    public static ReportFormat fromName(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown report format: " + name + ". Supported formats: json, csv", e);
        }
    }
}
