package org.aasm.compiler.ir.instruction;

import org.aasm.compiler.ir.Argument;

/**
 * {@code SET}: assigns an operand to a mutable target.
 */
public record Assignment(Argument target, Argument value) implements Instruction {

    @Override
    public <R> R accept(InstructionVisitor<R> visitor) {
        return visitor.visitAssignment(this);
    }
}
