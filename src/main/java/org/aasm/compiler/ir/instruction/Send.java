package org.aasm.compiler.ir.instruction;

import org.aasm.compiler.ir.Argument;

/**
 * {@code SEND}: transmits the outgoing message to a connection or to every element
 * of a connection list.
 */
public record Send(Argument receiver) implements Instruction {

    @Override
    public <R> R accept(InstructionVisitor<R> visitor) {
        return visitor.visitSend(this);
    }
}
