package org.aasm.compiler.frontend.parser;

import org.aasm.compiler.diagnostics.CompilationException;

/**
 * Handler interface for one opcode or a family of opcodes.
 * A handler validates its statement and then updates exactly one entity of the
 * parser state: the one implied by the current nesting.
 */
public interface IOpcodeHandler {

    /**
     * Handles a statement.
     *
     * @param statement The statement, already checked for arity.
     * @param context   The parsing context providing the state and error reporting.
     * @throws CompilationException if the statement violates a structural or referential rule.
     */
    void handle(Statement statement, ParsingContext context) throws CompilationException;
}
