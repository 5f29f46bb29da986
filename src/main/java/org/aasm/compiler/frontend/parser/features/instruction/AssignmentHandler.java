package org.aasm.compiler.frontend.parser.features.instruction;

import org.aasm.compiler.diagnostics.CompilationException;
import org.aasm.compiler.frontend.parser.IOpcodeHandler;
import org.aasm.compiler.frontend.parser.Opcode;
import org.aasm.compiler.frontend.parser.ParsingContext;
import org.aasm.compiler.frontend.parser.Statement;
import org.aasm.compiler.frontend.parser.context.InstructionSink;
import org.aasm.compiler.ir.Argument;
import org.aasm.compiler.ir.Argument.Origin;
import org.aasm.compiler.ir.Argument.ValueType;
import org.aasm.compiler.ir.instruction.Assignment;
import org.aasm.compiler.ir.instruction.MessageSelection;

/**
 * Handler for {@code SET target, value}.
 * {@code SET send, list} selects a buffered message matching the outgoing message instead.
 */
public class AssignmentHandler implements IOpcodeHandler {

    @Override
    public void handle(Statement statement, ParsingContext context) throws CompilationException {
        InstructionSink sink = Operands.sink(context, Opcode.SET);
        Argument target = context.resolveArgument(statement.arg(0));
        if (target.origin() == Origin.SEND_MESSAGE) {
            Argument messages = Operands.operand(context, statement.arg(1), ValueType.MESSAGE_LIST);
            sink.add(new MessageSelection(target, messages));
            return;
        }
        target = Operands.target(context, statement.arg(0), ValueType.FLOAT, ValueType.ENUM, ValueType.CONNECTION);
        Argument value = context.resolveArgument(statement.arg(1));
        Operands.requireCompatible(context, target, value);
        sink.add(new Assignment(target, value));
    }
}
