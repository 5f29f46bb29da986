package org.aasm.compiler.frontend.parser.features.instruction;

import org.aasm.compiler.diagnostics.CompilationException;
import org.aasm.compiler.frontend.parser.IOpcodeHandler;
import org.aasm.compiler.frontend.parser.ParsingContext;
import org.aasm.compiler.frontend.parser.Statement;
import org.aasm.compiler.frontend.parser.context.BlockBuilder;
import org.aasm.compiler.ir.Argument;
import org.aasm.compiler.ir.Argument.ValueType;
import org.aasm.compiler.ir.instruction.Conditional;
import org.aasm.compiler.ir.instruction.Conditional.Comparison;

/**
 * Handler for the conditional opcodes ({@code IEQ} ... {@code ILTEQ}) and the loop
 * opcodes ({@code WEQ} ... {@code WLTEQ}). Each opens a block closed by {@code EBLOCK}.
 * Ordered comparisons take floats; equality also applies to enums and connections.
 */
public class ConditionalHandler implements IOpcodeHandler {

    @Override
    public void handle(Statement statement, ParsingContext context) throws CompilationException {
        Operands.sink(context, statement.opcode());
        String name = statement.opcode().name();
        boolean loop = name.startsWith("W");
        Comparison comparison = comparisonOf(name.substring(1));

        Argument left;
        Argument right;
        if (comparison.isOrdered()) {
            left = Operands.operand(context, statement.arg(0), ValueType.FLOAT);
            right = Operands.operand(context, statement.arg(1), ValueType.FLOAT);
        } else {
            left = Operands.operand(context, statement.arg(0), ValueType.FLOAT, ValueType.ENUM, ValueType.CONNECTION);
            right = Operands.operand(context, statement.arg(1), ValueType.FLOAT, ValueType.ENUM, ValueType.CONNECTION);
            Operands.requireCompatible(context, left, right);
        }
        context.state().push(new BlockBuilder(name, body -> new Conditional(comparison, loop, left, right, body)));
    }

    private static Comparison comparisonOf(String suffix) {
        return switch (suffix) {
            case "EQ" -> Comparison.EQUAL;
            case "NEQ" -> Comparison.NOT_EQUAL;
            case "GT" -> Comparison.GREATER;
            case "GTEQ" -> Comparison.GREATER_OR_EQUAL;
            case "LT" -> Comparison.LESS;
            case "LTEQ" -> Comparison.LESS_OR_EQUAL;
            default -> throw new IllegalStateException("Not a comparison opcode suffix: " + suffix);
        };
    }
}
