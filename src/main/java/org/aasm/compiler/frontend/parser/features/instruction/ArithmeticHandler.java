package org.aasm.compiler.frontend.parser.features.instruction;

import org.aasm.compiler.diagnostics.CompilationException;
import org.aasm.compiler.frontend.parser.IOpcodeHandler;
import org.aasm.compiler.frontend.parser.ParsingContext;
import org.aasm.compiler.frontend.parser.Statement;
import org.aasm.compiler.ir.Argument.ValueType;
import org.aasm.compiler.ir.instruction.Arithmetic;

/**
 * Handler for {@code ADD}, {@code SUBT}, {@code MULT} and {@code DIV}.
 */
public class ArithmeticHandler implements IOpcodeHandler {

    @Override
    public void handle(Statement statement, ParsingContext context) throws CompilationException {
        Arithmetic.Operator operator = switch (statement.opcode()) {
            case ADD -> Arithmetic.Operator.ADD;
            case SUBT -> Arithmetic.Operator.SUBTRACT;
            case MULT -> Arithmetic.Operator.MULTIPLY;
            case DIV -> Arithmetic.Operator.DIVIDE;
            default -> throw new IllegalStateException("Not an arithmetic opcode: " + statement.opcode());
        };
        Operands.sink(context, statement.opcode()).add(new Arithmetic(operator,
                Operands.target(context, statement.arg(0), ValueType.FLOAT),
                Operands.operand(context, statement.arg(1), ValueType.FLOAT)));
    }
}
