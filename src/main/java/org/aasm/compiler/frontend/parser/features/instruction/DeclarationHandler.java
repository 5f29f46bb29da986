package org.aasm.compiler.frontend.parser.features.instruction;

import org.aasm.compiler.diagnostics.CompilationException;
import org.aasm.compiler.frontend.lexer.Tokenizer;
import org.aasm.compiler.frontend.parser.IOpcodeHandler;
import org.aasm.compiler.frontend.parser.Opcode;
import org.aasm.compiler.frontend.parser.ParsingContext;
import org.aasm.compiler.frontend.parser.ReservedNames;
import org.aasm.compiler.frontend.parser.Statement;
import org.aasm.compiler.frontend.parser.context.ActionBuilder;
import org.aasm.compiler.frontend.parser.context.AgentBuilder;
import org.aasm.compiler.frontend.parser.context.InstructionSink;
import org.aasm.compiler.ir.Argument;
import org.aasm.compiler.ir.Argument.ValueType;
import org.aasm.compiler.ir.instruction.Declaration;

/**
 * Handler for {@code DECL name, value}: binds a new local of the enclosing action.
 * Locals stay visible until the end of the action, also after the block that declared them.
 */
public class DeclarationHandler implements IOpcodeHandler {

    @Override
    public void handle(Statement statement, ParsingContext context) throws CompilationException {
        InstructionSink sink = Operands.sink(context, Opcode.DECL);
        ActionBuilder action = Operands.action(context, Opcode.DECL);
        String name = statement.arg(0);
        context.require(Tokenizer.isIdentifier(name), "Invalid local name: " + name, "");
        ReservedNames.require(name, ReservedNames.Namespace.LOCAL, context);
        context.require(action.local(name).isEmpty(), "Local already declared: " + name, "");
        AgentBuilder agent = context.state().innermost(AgentBuilder.class).orElseThrow();
        context.require(!agent.hasParameter(name) && !agent.isEnumValue(name),
                "Name already used by the agent: " + name, "Choose another name");

        Argument value = Operands.operand(context, statement.arg(1),
                ValueType.FLOAT, ValueType.ENUM, ValueType.CONNECTION);
        action.declareLocal(name, value.type());
        sink.add(new Declaration(name, value));
    }
}
