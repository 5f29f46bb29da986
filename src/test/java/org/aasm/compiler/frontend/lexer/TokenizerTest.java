package org.aasm.compiler.frontend.lexer;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class TokenizerTest {

    private final Tokenizer tokenizer = new Tokenizer();

    @Test
    void commasAreWhitespaceAndOpcodeIsUpperCased() {
        List<SourceLine> lines = tokenizer.tokenize(List.of("  add  money,1.5 # pay"));

        assertThat(lines).hasSize(1);
        SourceLine line = lines.get(0);
        assertThat(line.tokens()).containsExactly("ADD", "money", "1.5");
        assertThat(line.opcode()).isEqualTo("ADD");
        assertThat(line.arguments()).containsExactly("money", "1.5");
    }

    @Test
    void argumentsKeepTheirCase() {
        SourceLine line = tokenizer.tokenize(List.of("agent Trader")).get(0);

        assertThat(line.tokens()).containsExactly("AGENT", "Trader");
    }

    @Test
    void blankAndCommentLinesAreSkippedButCounted() {
        // Arrange
        List<String> source = List.of("# header", "", "   ", "AGENT A", ",,", "EAGENT");

        // Act
        List<SourceLine> lines = tokenizer.tokenize(source);

        // Assert
        assertThat(lines).extracting(SourceLine::number).containsExactly(4, 6);
        assertThat(lines.get(0).text()).isEqualTo("AGENT A");
    }

    @Test
    void identifiers() {
        assertThat(Tokenizer.isIdentifier("_agent1")).isTrue();
        assertThat(Tokenizer.isIdentifier("1agent")).isFalse();
        assertThat(Tokenizer.isIdentifier("rcv.sender")).isFalse();
    }
}
