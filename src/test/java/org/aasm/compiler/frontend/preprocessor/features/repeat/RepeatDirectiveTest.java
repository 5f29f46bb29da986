package org.aasm.compiler.frontend.preprocessor.features.repeat;

import org.aasm.compiler.diagnostics.CompilationException;
import org.aasm.compiler.diagnostics.Diagnostic;
import org.aasm.compiler.diagnostics.SourceMap;
import org.aasm.compiler.frontend.preprocessor.PreProcessedSource;
import org.aasm.compiler.frontend.preprocessor.PreProcessor;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Tests the preprocessor's handling of the .REPEAT directive.
 */
public class RepeatDirectiveTest {

    private static PreProcessedSource expand(String... lines) throws CompilationException {
        return new PreProcessor(List.of(lines), 8).expand();
    }

    /**
     * The body is emitted once per iteration, and every copy points back at the directive.
     */
    @Test
    @Tag("unit")
    void testRepeatExpandsBody() throws CompilationException {
        // Arrange / Act
        PreProcessedSource source = expand(".REPEAT 3", "ADD x, 1", ".ENDR");

        // Assert
        assertThat(source.lines()).containsExactly("ADD x, 1", "ADD x, 1", "ADD x, 1");
        assertThat(source.sourceMap().originOf(2))
                .isEqualTo(new SourceMap.LineOrigin(1, ".REPEAT 3, iteration 2, body line 2"));
    }

    @Test
    @Tag("unit")
    void testRepeatZeroRemovesBlock() throws CompilationException {
        PreProcessedSource source = expand("AGENT A", ".REPEAT 0", "ADD x, 1", ".ENDR", "EAGENT");

        assertThat(source.lines()).containsExactly("AGENT A", "EAGENT");
        assertThat(source.sourceMap().originOf(2)).isEqualTo(SourceMap.LineOrigin.source(5));
    }

    @Test
    @Tag("unit")
    void testNestedRepeat() throws CompilationException {
        PreProcessedSource source = expand(".REPEAT 2", "ADD x, 1", ".REPEAT 2", "ADD y, 1", ".ENDR", ".ENDR");

        assertThat(source.lines()).containsExactly(
                "ADD x, 1", "ADD y, 1", "ADD y, 1",
                "ADD x, 1", "ADD y, 1", "ADD y, 1");
        assertThat(source.sourceMap().originOf(3).line()).isEqualTo(1);
    }

    @Test
    @Tag("unit")
    void testRepeatOfMacroInvocation() throws CompilationException {
        PreProcessedSource source = expand(".MACRO INC v", "ADD v, 1", ".ENDM", ".REPEAT 2", "INC z", ".ENDR");

        assertThat(source.lines()).containsExactly("ADD z 1", "ADD z 1");
    }

    @Test
    @Tag("unit")
    void testMissingEndr() {
        CompilationException e = catchThrowableOfType(() -> expand(".REPEAT 2", "ADD x, 1"), CompilationException.class);

        assertThat(e).isNotNull();
        assertThat(e.getDiagnostic().reason()).isEqualTo("Missing .ENDR");
        assertThat(e.getDiagnostic().line()).isEqualTo(1);
    }

    @Test
    @Tag("unit")
    void testInvalidCount() {
        CompilationException e = catchThrowableOfType(() -> expand(".REPEAT many", ".ENDR"), CompilationException.class);

        assertThat(e).isNotNull();
        Diagnostic diagnostic = e.getDiagnostic();
        assertThat(diagnostic.reason()).isEqualTo("Repeat count must be an integer, got: many");
    }

    @Test
    @Tag("unit")
    void testNegativeCount() {
        CompilationException e = catchThrowableOfType(() -> expand(".REPEAT -1", ".ENDR"), CompilationException.class);

        assertThat(e).isNotNull();
        assertThat(e.getDiagnostic().reason()).isEqualTo("Repeat count must be non-negative, got: -1");
    }
}
