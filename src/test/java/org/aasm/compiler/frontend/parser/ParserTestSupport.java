package org.aasm.compiler.frontend.parser;

import org.aasm.compiler.Compiler;
import org.aasm.compiler.config.CompilerOptions;
import org.aasm.compiler.diagnostics.CompilationException;
import org.aasm.compiler.diagnostics.Diagnostic;
import org.aasm.compiler.ir.Program;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Runs the front end on inline programs.
 */
public final class ParserTestSupport {

    private static final Compiler COMPILER = new Compiler(new CompilerOptions(4, 100000, 8, false));

    private ParserTestSupport() {
    }

    public static Program parse(String... lines) throws CompilationException {
        return COMPILER.parse(List.of(lines));
    }

    /**
     * Parses a program that must be rejected.
     * @param lines The program.
     * @return The single diagnostic.
     */
    public static Diagnostic failure(String... lines) {
        CompilationException e = catchThrowableOfType(() -> parse(lines), CompilationException.class);
        assertThat(e).as("expected a compilation error").isNotNull();
        return e.getDiagnostic();
    }
}
