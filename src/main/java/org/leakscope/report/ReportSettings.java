package org.leakscope.report;

import com.typesafe.config.Config;

/**
 * Rendering options, read from the {@code report} configuration block.
 *
 * @param format The default report medium.
 * @param maxFrames How many frames of each trace are rendered; 0 renders all.
 */
public record ReportSettings(ReportFormat format, int maxFrames) {

    public static final int DEFAULT_MAX_FRAMES = 10;

    public ReportSettings {
        if (maxFrames < 0) {
            throw new IllegalArgumentException("max-frames must not be negative, was " + maxFrames);
        }
    }

    public static ReportSettings defaults() {
        return new ReportSettings(ReportFormat.JSON, DEFAULT_MAX_FRAMES);
    }

    /**
     * @param reportConfig The {@code report} configuration block; missing keys fall back to defaults.
     * @return The settings.
     */
    public static ReportSettings fromConfig(Config reportConfig) {
        return new ReportSettings(
                reportConfig.hasPath("format") ? ReportFormat.fromName(reportConfig.getString("format")) : ReportFormat.JSON,
                reportConfig.hasPath("max-frames") ? reportConfig.getInt("max-frames") : DEFAULT_MAX_FRAMES);
    }
}
