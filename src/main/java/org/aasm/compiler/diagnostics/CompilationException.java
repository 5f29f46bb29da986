package org.aasm.compiler.diagnostics;

/**
 * Thrown when a program cannot be compiled. Compilation stops at the first error,
 * so the exception carries exactly one {@link Diagnostic}.
 */
public class CompilationException extends Exception {

    private final Diagnostic diagnostic;

    public CompilationException(Diagnostic diagnostic) {
        super(diagnostic.format());
        this.diagnostic = diagnostic;
    }

    public Diagnostic getDiagnostic() {
        return diagnostic;
    }
}
