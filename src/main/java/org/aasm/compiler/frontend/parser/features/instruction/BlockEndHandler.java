package org.aasm.compiler.frontend.parser.features.instruction;

import org.aasm.compiler.diagnostics.CompilationException;
import org.aasm.compiler.frontend.parser.IOpcodeHandler;
import org.aasm.compiler.frontend.parser.Opcode;
import org.aasm.compiler.frontend.parser.ParsingContext;
import org.aasm.compiler.frontend.parser.Statement;
import org.aasm.compiler.frontend.parser.context.BlockBuilder;

/**
 * Handler for {@code EBLOCK}: closes the innermost block and appends it to its parent.
 */
public class BlockEndHandler implements IOpcodeHandler {

    @Override
    public void handle(Statement statement, ParsingContext context) throws CompilationException {
        BlockBuilder block = context.close(BlockBuilder.class, Opcode.EBLOCK);
        Operands.sink(context, Opcode.EBLOCK).add(block.build());
    }
}
