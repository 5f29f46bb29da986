package org.aasm.compiler.ir.instruction;

import org.aasm.compiler.ir.Argument;

/**
 * {@code REMEN}: removes a number of random elements from a list.
 * A count rounding to zero or less is a no-op; a count reaching the list length empties it.
 */
public record RemoveRandomElements(Argument list, Argument count) implements Instruction {

    @Override
    public <R> R accept(InstructionVisitor<R> visitor) {
        return visitor.visitRemoveRandomElements(this);
    }
}
