package org.aasm.compiler.frontend.parser;

import java.util.List;

/**
 * A recognized line: an opcode with an accepted number of arguments.
 *
 * @param opcode    The opcode.
 * @param arguments The argument tokens.
 */
public record Statement(Opcode opcode, List<String> arguments) {

    public Statement {
        arguments = List.copyOf(arguments);
    }

    /**
     * @param index The 0-based argument index.
     * @return The argument token.
     */
    public String arg(int index) {
        return arguments.get(index);
    }

    /**
     * @return The number of arguments.
     */
    public int arity() {
        return arguments.size();
    }
}
