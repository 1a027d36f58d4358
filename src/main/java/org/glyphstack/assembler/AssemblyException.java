package org.glyphstack.assembler;

import org.glyphstack.assembler.diagnostics.Diagnostic;

import java.util.List;

/**
 * Thrown when a listing cannot be assembled. Carries every error found, not just the first.
 */
public class AssemblyException extends Exception {

    private final transient List<Diagnostic> diagnostics;

    /**
     * @param message The detail message, usually the formatted diagnostics summary.
     * @param diagnostics The collected diagnostics.
     */
    public AssemblyException(String message, List<Diagnostic> diagnostics) {
        super(message);
        this.diagnostics = List.copyOf(diagnostics);
    }

    public AssemblyException(String message, Throwable cause) {
        super(message, cause);
        this.diagnostics = List.of();
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
