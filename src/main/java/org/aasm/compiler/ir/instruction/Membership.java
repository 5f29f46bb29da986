package org.aasm.compiler.ir.instruction;

import org.aasm.compiler.ir.Argument;

/**
 * {@code IN} / {@code NIN}: a block guarded by a list membership test.
 *
 * @param negated true for {@code NIN}.
 * @param list    The list operand.
 * @param element The element looked up.
 * @param body    The guarded instructions.
 */
public record Membership(boolean negated, Argument list, Argument element, Block body) implements Instruction {

    @Override
    public <R> R accept(InstructionVisitor<R> visitor) {
        return visitor.visitMembership(this);
    }
}
