package org.aasm.compiler.diagnostics;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class DiagnosticTest {

    private static final String NL = System.lineSeparator();

    @Test
    void formatsSourceLineWithSuggestion() {
        Diagnostic diagnostic = new Diagnostic(7, "", "  AGENT  ", "Expected agent name", "AGENT name");

        assertThat(diagnostic.isFromDirective()).isFalse();
        assertThat(diagnostic.format())
                .isEqualTo("Error in line 7: AGENT" + NL + "Expected agent name" + NL + "Suggestion: AGENT name");
    }

    @Test
    void formatsGeneratedLineWithoutSuggestion() {
        Diagnostic diagnostic = new Diagnostic(3, "macro INC", "ADD x 1", "Unknown argument: x", null);

        assertThat(diagnostic.isFromDirective()).isTrue();
        assertThat(diagnostic.format()).isEqualTo(
                "Error in preprocessor directive: macro INC, declared at line 3" + NL + "Unknown argument: x");
    }

    @Test
    void exceptionMessageIsTheFormattedReport() {
        Diagnostic diagnostic = new Diagnostic(1, null, "EAGENT", "EAGENT without matching AGENT", "");

        CompilationException e = new CompilationException(diagnostic);

        assertThat(e.getMessage()).isEqualTo(diagnostic.format());
        assertThat(e.getDiagnostic().directive()).isEmpty();
    }
}
