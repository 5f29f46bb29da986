package org.aasm.compiler.frontend.parser.features.instruction;

import org.aasm.compiler.diagnostics.CompilationException;
import org.aasm.compiler.frontend.parser.IOpcodeHandler;
import org.aasm.compiler.frontend.parser.Opcode;
import org.aasm.compiler.frontend.parser.ParsingContext;
import org.aasm.compiler.frontend.parser.Statement;
import org.aasm.compiler.frontend.parser.context.InstructionSink;
import org.aasm.compiler.ir.Argument;
import org.aasm.compiler.ir.Argument.ValueType;
import org.aasm.compiler.ir.instruction.RandomDraw;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Handler for {@code RAND result, float|int, uniform|normal|exp, params...}.
 */
public class RandomHandler implements IOpcodeHandler {

    @Override
    public void handle(Statement statement, ParsingContext context) throws CompilationException {
        InstructionSink sink = Operands.sink(context, Opcode.RAND);
        Argument target = Operands.target(context, statement.arg(0), ValueType.FLOAT);

        String cast = statement.arg(1);
        context.require(cast.equals("float") || cast.equals("int"), "Unknown cast: " + cast, "Use float or int");

        String keyword = statement.arg(2);
        RandomDraw.Distribution distribution = Arrays.stream(RandomDraw.Distribution.values())
                .filter(d -> d.keyword().equals(keyword))
                .findFirst()
                .orElseThrow(() -> context.error("Unknown distribution: " + keyword, "Use uniform, normal or exp"));
        int given = statement.arity() - 3;
        context.require(given == distribution.parameterCount(),
                "Distribution " + keyword + " expects " + distribution.parameterCount() + " parameters, got " + given,
                "Use: RAND result, float|int, uniform, a, b | normal, mean, std_dev | exp, lambda");

        List<Argument> parameters = new ArrayList<>();
        for (String token : statement.arguments().subList(3, statement.arity())) {
            parameters.add(Operands.operand(context, token, ValueType.FLOAT));
        }
        sink.add(new RandomDraw(distribution, target, cast.equals("int"), parameters));
    }
}
