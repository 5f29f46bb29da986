package org.aasm.compiler.frontend.parser.context;

import org.aasm.compiler.ir.instruction.Instruction;

/**
 * A frame that collects instructions: an action body or a nested block.
 */
public sealed interface InstructionSink extends ContextFrame permits ActionBuilder, BlockBuilder {

    /**
     * Appends an instruction.
     * @param instruction The instruction.
     */
    void add(Instruction instruction);
}
