package org.aasm.compiler.frontend.parser.features.instruction;

import org.aasm.compiler.diagnostics.CompilationException;
import org.aasm.compiler.frontend.parser.Opcode;
import org.aasm.compiler.frontend.parser.ParsingContext;
import org.aasm.compiler.frontend.parser.context.ActionBuilder;
import org.aasm.compiler.frontend.parser.context.AgentBuilder;
import org.aasm.compiler.frontend.parser.context.InstructionSink;
import org.aasm.compiler.ir.AgentParameter;
import org.aasm.compiler.ir.Argument;
import org.aasm.compiler.ir.Argument.Origin;
import org.aasm.compiler.ir.Argument.ValueType;

import java.util.Arrays;
import java.util.Locale;

/**
 * Operand checks shared by the instruction handlers.
 */
final class Operands {

    private Operands() {
    }

    /**
     * @return The block or action body that receives the next instruction.
     */
    static InstructionSink sink(ParsingContext context, Opcode opcode) throws CompilationException {
        return context.expect(InstructionSink.class, opcode);
    }

    static ActionBuilder action(ParsingContext context, Opcode opcode) throws CompilationException {
        return context.state().innermost(ActionBuilder.class)
                .orElseThrow(() -> context.error(opcode + " is only allowed inside an action"));
    }

    /**
     * Resolves an operand and checks its type.
     */
    static Argument operand(ParsingContext context, String token, ValueType... allowed) throws CompilationException {
        Argument argument = context.resolveArgument(token);
        if (Arrays.stream(allowed).noneMatch(type -> type == argument.type())) {
            throw context.error("Invalid argument '" + token + "': expected " + describe(allowed)
                    + ", got " + describe(argument.type()));
        }
        return argument;
    }

    /**
     * Resolves an operand that an instruction writes to.
     */
    static Argument target(ParsingContext context, String token, ValueType... allowed) throws CompilationException {
        Argument argument = operand(context, token, allowed);
        context.require(argument.mutable(), "Cannot modify '" + token + "'",
                "Only agent fields, locals and fields of the outgoing message can be modified");
        return argument;
    }

    /**
     * Resolves a list operand.
     */
    static Argument list(ParsingContext context, String token, boolean modified) throws CompilationException {
        return modified
                ? target(context, token, ValueType.CONNECTION_LIST, ValueType.MESSAGE_LIST)
                : operand(context, token, ValueType.CONNECTION_LIST, ValueType.MESSAGE_LIST);
    }

    /**
     * Resolves an element operand that must match the element type of a list.
     */
    static Argument element(ParsingContext context, Argument list, String token) throws CompilationException {
        return operand(context, token, list.type().elementType());
    }

    /**
     * Checks that two operands can be compared or assigned to each other.
     * An enum value compared with an enum field must be one of that field's values.
     */
    static void requireCompatible(ParsingContext context, Argument left, Argument right) throws CompilationException {
        context.require(left.type() == right.type(), "Mismatched arguments '" + left.expr() + "' ("
                + describe(left.type()) + ") and '" + right.expr() + "' (" + describe(right.type()) + ")", "");
        if (left.type() == ValueType.ENUM) {
            requireEnumValue(context, left, right);
            requireEnumValue(context, right, left);
        }
    }

    private static void requireEnumValue(ParsingContext context, Argument field, Argument value)
            throws CompilationException {
        if (field.origin() != Origin.AGENT_PARAM || value.origin() != Origin.ENUM_VALUE) {
            return;
        }
        AgentBuilder agent = context.state().innermost(AgentBuilder.class)
                .orElseThrow(() -> new IllegalStateException("Agent field resolved outside of an agent"));
        AgentParameter parameter = agent.parameter(field.expr())
                .orElseThrow(() -> new IllegalStateException("Unresolved agent field " + field.expr()));
        context.require(((AgentParameter.EnumField) parameter).hasValue(value.expr()),
                "'" + value.expr() + "' is not a value of enum '" + field.expr() + "'", "");
    }

    private static String describe(ValueType... types) {
        return String.join(" or ", Arrays.stream(types)
                .map(type -> type.name().toLowerCase(Locale.ROOT).replace('_', ' '))
                .toArray(String[]::new));
    }
}
