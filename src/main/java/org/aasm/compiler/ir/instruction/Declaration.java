package org.aasm.compiler.ir.instruction;

import org.aasm.compiler.ir.Argument;

/**
 * {@code DECL}: binds a new local to the value of an operand.
 */
public record Declaration(String name, Argument value) implements Instruction {

    @Override
    public <R> R accept(InstructionVisitor<R> visitor) {
        return visitor.visitDeclaration(this);
    }
}
