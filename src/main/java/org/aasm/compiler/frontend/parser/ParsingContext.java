package org.aasm.compiler.frontend.parser;

import org.aasm.compiler.diagnostics.CompilationException;
import org.aasm.compiler.frontend.parser.context.ContextFrame;
import org.aasm.compiler.frontend.parser.context.ParserState;
import org.aasm.compiler.ir.Argument;

/**
 * Provides opcode handlers with access to the parser state and to diagnostics.
 * This interface decouples handlers from the concrete {@link Parser} implementation.
 */
public interface ParsingContext {

    /**
     * Gets the state being built.
     * @return The parser state.
     */
    ParserState state();

    /**
     * Builds a diagnostic for the line being parsed. The caller throws it.
     * @param reason     What is wrong.
     * @param suggestion How to fix it, or an empty string.
     * @return The exception to throw.
     */
    CompilationException error(String reason, String suggestion);

    /**
     * Builds a diagnostic without a suggestion.
     * @param reason What is wrong.
     * @return The exception to throw.
     */
    default CompilationException error(String reason) {
        return error(reason, "");
    }

    /**
     * Fails unless the condition holds.
     * @param condition  The condition.
     * @param reason     What is wrong if it does not hold.
     * @param suggestion How to fix it, or an empty string.
     * @throws CompilationException if the condition is false.
     */
    default void require(boolean condition, String reason, String suggestion) throws CompilationException {
        if (!condition) {
            throw error(reason, suggestion);
        }
    }

    /**
     * Resolves an operand token against the current agent, behaviour and action.
     * @param token The token.
     * @return The resolved argument.
     * @throws CompilationException if the token names nothing visible here.
     */
    Argument resolveArgument(String token) throws CompilationException;

    /**
     * Returns the innermost open construct of a kind, failing with a positioned
     * diagnostic when the statement appears outside of it.
     * @param kind     The frame type.
     * @param opcode   The opcode being handled, for the message.
     * @param <T>      The frame type.
     * @return The frame.
     * @throws CompilationException if no such frame is open.
     */
    <T extends ContextFrame> T expect(Class<T> kind, Opcode opcode) throws CompilationException;

    /**
     * Closes the innermost construct, which must be of the given kind.
     * @param kind   The frame type.
     * @param opcode The closing opcode, for the message.
     * @param <T>    The frame type.
     * @return The closed frame.
     * @throws CompilationException if another construct is still open or none of this kind is.
     */
    <T extends ContextFrame> T close(Class<T> kind, Opcode opcode) throws CompilationException;

    /**
     * Fails unless no construct is open.
     * @param opcode The opcode being handled, for the message.
     * @throws CompilationException if a construct is open.
     */
    void requireTopLevel(Opcode opcode) throws CompilationException;
}
