package org.aasm.compiler.frontend.parser.features.instruction;

import org.aasm.compiler.diagnostics.CompilationException;
import org.aasm.compiler.frontend.parser.IOpcodeHandler;
import org.aasm.compiler.frontend.parser.Opcode;
import org.aasm.compiler.frontend.parser.ParsingContext;
import org.aasm.compiler.frontend.parser.Statement;
import org.aasm.compiler.frontend.parser.context.InstructionSink;
import org.aasm.compiler.ir.Argument;
import org.aasm.compiler.ir.Argument.ValueType;
import org.aasm.compiler.ir.instruction.Clear;
import org.aasm.compiler.ir.instruction.Length;
import org.aasm.compiler.ir.instruction.ListModification;
import org.aasm.compiler.ir.instruction.RemoveRandomElements;
import org.aasm.compiler.ir.instruction.Subset;

/**
 * Handler for the list algebra opcodes:
 * <pre>
 * ADDE list, element     REME list, element
 * LEN result, list       CLR list
 * SUBS target, source, n REMEN list, n
 * </pre>
 */
public class ListHandler implements IOpcodeHandler {

    @Override
    public void handle(Statement statement, ParsingContext context) throws CompilationException {
        InstructionSink sink = Operands.sink(context, statement.opcode());
        switch (statement.opcode()) {
            case ADDE, REME -> {
                Argument list = Operands.list(context, statement.arg(0), true);
                Argument element = Operands.element(context, list, statement.arg(1));
                ListModification.Operation operation = statement.opcode() == Opcode.ADDE
                        ? ListModification.Operation.ADD_IF_ABSENT
                        : ListModification.Operation.REMOVE_IF_PRESENT;
                sink.add(new ListModification(operation, list, element));
            }
            case LEN -> sink.add(new Length(
                    Operands.target(context, statement.arg(0), ValueType.FLOAT),
                    Operands.list(context, statement.arg(1), false)));
            case CLR -> sink.add(new Clear(Operands.list(context, statement.arg(0), true)));
            case SUBS -> {
                Argument target = Operands.list(context, statement.arg(0), true);
                Argument source = Operands.operand(context, statement.arg(1), target.type());
                Argument count = Operands.operand(context, statement.arg(2), ValueType.FLOAT);
                sink.add(new Subset(target, source, count));
            }
            case REMEN -> sink.add(new RemoveRandomElements(
                    Operands.list(context, statement.arg(0), true),
                    Operands.operand(context, statement.arg(1), ValueType.FLOAT)));
            default -> throw new IllegalStateException("Not a list opcode: " + statement.opcode());
        }
    }
}
