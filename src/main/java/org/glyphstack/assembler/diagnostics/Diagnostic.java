package org.glyphstack.assembler.diagnostics;

/**
 * A single message produced while loading a listing.
 *
 * @param type The severity.
 * @param message The diagnostic message.
 * @param fileName The name of the listing.
 * @param lineNumber The line number of the issue.
 */
public record Diagnostic(
        Type type,
        String message,
        String fileName,
        int lineNumber
) {
    /**
     * The severity of a diagnostic message.
     */
    public enum Type {
        /** Prevents the listing from being assembled. */
        ERROR,
        WARNING
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%d: %s", type, fileName, lineNumber, message);
    }
}
