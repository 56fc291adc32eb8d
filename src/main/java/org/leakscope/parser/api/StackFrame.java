package org.leakscope.parser.api;

import java.util.Optional;

/**
 * One call-site entry of a stack trace.
 *
 * @param address The hexadecimal instruction pointer, e.g. {@code 0x4C2FB0F}.
 * @param functionName The resolved symbol, or {@code null} when unresolved.
 * @param library The originating binary or shared object, or {@code null}.
 * @param sourceFile The source file, or {@code null} without debug symbols.
 * @param lineNumber The source line, or {@code null}.
 */
public record StackFrame(
        String address,
        String functionName,
        String library,
        String sourceFile,
        Integer lineNumber
) {

    public StackFrame {
        address = blankToNull(address);
        functionName = blankToNull(functionName);
        library = blankToNull(library);
        sourceFile = blankToNull(sourceFile);
        if (address == null && functionName == null) {
            throw new IllegalArgumentException("A stack frame needs an address or a function name");
        }
        if (sourceFile == null) {
            lineNumber = null;
        }
    }

    /**
     * Creates a frame that only carries an instruction pointer.
     * @param address The hexadecimal address.
     * @return A frame with all optional fields empty.
     */
    public static StackFrame addressOnly(String address) {
        return new StackFrame(address, null, null, null, null);
    }

    public Optional<String> function() {
        return Optional.ofNullable(functionName);
    }

    public Optional<String> libraryName() {
        return Optional.ofNullable(library);
    }

    /**
     * @return the source location of this frame, if the log carried one.
     */
    public Optional<SourceLocation> sourceLocation() {
        return sourceFile == null ? Optional.empty() : Optional.of(new SourceLocation(sourceFile, lineNumber));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(functionName != null ? functionName : "???");
        if (library != null) {
            sb.append(" [").append(library).append(']');
        }
        sourceLocation().ifPresent(loc -> sb.append(" (").append(loc).append(')'));
        if (address != null) {
            sb.append(" @ ").append(address);
        }
        return sb.toString();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.strip();
    }
}
