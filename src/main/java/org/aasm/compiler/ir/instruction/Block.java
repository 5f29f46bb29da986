package org.aasm.compiler.ir.instruction;

import java.util.List;

/**
 * A nested instruction sequence: an action body or the body of a conditional or loop.
 *
 * @param instructions The instructions in source order.
 */
public record Block(List<Instruction> instructions) implements Instruction {

    public Block {
        instructions = List.copyOf(instructions);
    }

    /**
     * @return true if the block contains no instructions.
     */
    public boolean isEmpty() {
        return instructions.isEmpty();
    }

    @Override
    public <R> R accept(InstructionVisitor<R> visitor) {
        return visitor.visitBlock(this);
    }
}
