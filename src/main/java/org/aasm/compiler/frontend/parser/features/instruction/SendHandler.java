package org.aasm.compiler.frontend.parser.features.instruction;

import org.aasm.compiler.diagnostics.CompilationException;
import org.aasm.compiler.frontend.parser.IOpcodeHandler;
import org.aasm.compiler.frontend.parser.Opcode;
import org.aasm.compiler.frontend.parser.ParsingContext;
import org.aasm.compiler.frontend.parser.Statement;
import org.aasm.compiler.frontend.parser.context.InstructionSink;
import org.aasm.compiler.ir.Argument.ValueType;
import org.aasm.compiler.ir.instruction.Send;

/**
 * Handler for {@code SEND receiver}, where the receiver is a connection or a connection list.
 * Only send actions transmit messages.
 */
public class SendHandler implements IOpcodeHandler {

    @Override
    public void handle(Statement statement, ParsingContext context) throws CompilationException {
        InstructionSink sink = Operands.sink(context, Opcode.SEND);
        context.require(Operands.action(context, Opcode.SEND).sendMessage().isPresent(),
                "SEND is only allowed in send_msg actions",
                "Declare the action as: ACTION name, send_msg, type, performative");
        sink.add(new Send(Operands.operand(context, statement.arg(0),
                ValueType.CONNECTION, ValueType.CONNECTION_LIST)));
    }
}
