package org.aasm.compiler.ir.instruction;

import org.aasm.compiler.ir.Argument;

/**
 * {@code ADDE} / {@code REME}: adds an element if absent or removes it if present.
 *
 * @param operation The modification.
 * @param list      The mutable list operand.
 * @param element   The element.
 */
public record ListModification(Operation operation, Argument list, Argument element) implements Instruction {

    public enum Operation {
        ADD_IF_ABSENT,
        REMOVE_IF_PRESENT
    }

    @Override
    public <R> R accept(InstructionVisitor<R> visitor) {
        return visitor.visitListModification(this);
    }
}
