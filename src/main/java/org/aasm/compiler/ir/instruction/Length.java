package org.aasm.compiler.ir.instruction;

import org.aasm.compiler.ir.Argument;

/**
 * {@code LEN}: stores the length of a list.
 */
public record Length(Argument result, Argument list) implements Instruction {

    @Override
    public <R> R accept(InstructionVisitor<R> visitor) {
        return visitor.visitLength(this);
    }
}
