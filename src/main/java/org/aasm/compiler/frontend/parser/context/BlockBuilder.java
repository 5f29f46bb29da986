package org.aasm.compiler.frontend.parser.context;

import org.aasm.compiler.ir.instruction.Block;
import org.aasm.compiler.ir.instruction.Instruction;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Collects the body of a conditional, loop or membership block until {@code EBLOCK}.
 * The header instruction is created when the block closes, from the finished body.
 */
public final class BlockBuilder implements InstructionSink {

    private final String header;
    private final Function<Block, Instruction> enclosing;
    private final List<Instruction> instructions = new ArrayList<>();

    /**
     * @param header    The opening opcode, for diagnostics.
     * @param enclosing Creates the block instruction from its body.
     */
    public BlockBuilder(String header, Function<Block, Instruction> enclosing) {
        this.header = header;
        this.enclosing = enclosing;
    }

    @Override
    public void add(Instruction instruction) {
        instructions.add(instruction);
    }

    public Instruction build() {
        return enclosing.apply(new Block(instructions));
    }

    @Override
    public String closingOpcode() {
        return "EBLOCK";
    }

    @Override
    public String description() {
        return "block '" + header + "'";
    }
}
