package org.aasm.compiler.ir.instruction;

import org.aasm.compiler.ir.Argument;

/**
 * {@code CLR}: empties a list.
 */
public record Clear(Argument list) implements Instruction {

    @Override
    public <R> R accept(InstructionVisitor<R> visitor) {
        return visitor.visitClear(this);
    }
}
