package org.aasm.compiler.frontend.parser.features.instruction;

import org.aasm.compiler.diagnostics.CompilationException;
import org.aasm.compiler.frontend.parser.IOpcodeHandler;
import org.aasm.compiler.frontend.parser.Opcode;
import org.aasm.compiler.frontend.parser.ParsingContext;
import org.aasm.compiler.frontend.parser.Statement;
import org.aasm.compiler.frontend.parser.context.BlockBuilder;
import org.aasm.compiler.ir.Argument;
import org.aasm.compiler.ir.instruction.Membership;

/**
 * Handler for {@code IN list, element} and {@code NIN list, element}, which open a block
 * closed by {@code EBLOCK}.
 */
public class MembershipHandler implements IOpcodeHandler {

    @Override
    public void handle(Statement statement, ParsingContext context) throws CompilationException {
        Operands.sink(context, statement.opcode());
        boolean negated = statement.opcode() == Opcode.NIN;
        Argument list = Operands.list(context, statement.arg(0), false);
        Argument element = Operands.element(context, list, statement.arg(1));
        context.state().push(new BlockBuilder(statement.opcode().name(),
                body -> new Membership(negated, list, element, body)));
    }
}
