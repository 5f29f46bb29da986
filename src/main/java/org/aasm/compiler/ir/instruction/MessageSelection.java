package org.aasm.compiler.ir.instruction;

import org.aasm.compiler.ir.Argument;

/**
 * {@code SET send, list}: replaces the outgoing message with a copy of a random buffered
 * message of the same type and performative. The action returns early when none matches.
 */
public record MessageSelection(Argument target, Argument messageList) implements Instruction {

    @Override
    public <R> R accept(InstructionVisitor<R> visitor) {
        return visitor.visitMessageSelection(this);
    }
}
