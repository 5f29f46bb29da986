package org.aasm.compiler.frontend.lexer;

import java.util.List;

/**
 * The tokens of one non-blank processed line.
 *
 * @param number The 1-based index of the line in the processed source.
 * @param text   The processed line text.
 * @param tokens The tokens; the first one is the upper-cased opcode.
 */
public record SourceLine(int number, String text, List<String> tokens) {

    public SourceLine {
        tokens = List.copyOf(tokens);
    }

    /**
     * @return The opcode token.
     */
    public String opcode() {
        return tokens.get(0);
    }

    /**
     * @return The tokens following the opcode.
     */
    public List<String> arguments() {
        return tokens.subList(1, tokens.size());
    }
}
