package org.leakscope.parser.api;

import java.util.Objects;

/**
 * A source file position emitted by the tool when debug symbols were available.
 *
 * @param file The source file name or path as printed in the log.
 * @param lineNumber The line number, or {@code null} when only the file is known.
 */
public record SourceLocation(String file, Integer lineNumber) {

    public SourceLocation {
        Objects.requireNonNull(file, "file");
        if (file.isBlank()) {
            throw new IllegalArgumentException("Source file must not be blank");
        }
    }

    public boolean hasLineNumber() {
        return lineNumber != null;
    }

    @Override
    public String toString() {
        return lineNumber != null ? file + ":" + lineNumber : file;
    }
}
