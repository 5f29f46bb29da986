package org.aasm.compiler.ir.instruction;

import org.aasm.compiler.ir.Argument;

/**
 * {@code ADD}, {@code SUBT}, {@code MULT} and {@code DIV}: updates a float target in place.
 * Division by a zero divisor ends the enclosing action without touching the target.
 *
 * @param operator The operation.
 * @param target   The mutable float operand that receives the result.
 * @param value    The second operand.
 */
public record Arithmetic(Operator operator, Argument target, Argument value) implements Instruction {

    public enum Operator {
        ADD,
        SUBTRACT,
        MULTIPLY,
        DIVIDE
    }

    @Override
    public <R> R accept(InstructionVisitor<R> visitor) {
        return visitor.visitArithmetic(this);
    }
}
