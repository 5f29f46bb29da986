package org.aasm.compiler.frontend.parser;

import org.aasm.compiler.diagnostics.CompilationException;
import org.aasm.compiler.frontend.parser.context.ActionBuilder;
import org.aasm.compiler.frontend.parser.context.AgentBuilder;
import org.aasm.compiler.frontend.parser.context.BehaviourBuilder;
import org.aasm.compiler.frontend.parser.context.ParserState;
import org.aasm.compiler.ir.AgentParameter;
import org.aasm.compiler.ir.Argument;
import org.aasm.compiler.ir.Argument.Origin;
import org.aasm.compiler.ir.Argument.ValueType;
import org.aasm.compiler.ir.Message;

import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Resolves instruction operands against the innermost open agent, behaviour and action.
 * <p>
 * Lookup order: the received message ({@code rcv}), the outgoing message ({@code send}),
 * action locals, built-in agent fields, declared agent fields, numeric literals and
 * finally enum values of the agent.
 */
public final class ArgumentResolver {

    public static final String RECEIVED = "rcv";
    public static final String SEND = "send";
    public static final String SENDER_FIELD = "sender";

    /** Built-in fields every generated agent carries. {@code connCount} is derived and read-only. */
    private static final Map<String, Argument> BUILT_INS = Map.of(
            "connections", new Argument("connections", Origin.AGENT_PARAM, ValueType.CONNECTION_LIST, true),
            "msgRCount", new Argument("msgRCount", Origin.AGENT_PARAM, ValueType.FLOAT, true),
            "msgSCount", new Argument("msgSCount", Origin.AGENT_PARAM, ValueType.FLOAT, true),
            "connCount", new Argument("connCount", Origin.AGENT_PARAM, ValueType.FLOAT, false));

    private static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?([eE][+-]?\\d+)?");

    private ArgumentResolver() {
    }

    /**
     * @param token A token.
     * @return true if the token is a numeric literal.
     */
    public static boolean isNumber(String token) {
        return NUMBER.matcher(token).matches();
    }

    /**
     * Resolves an operand.
     * @param token   The operand token.
     * @param context The parsing context, used for state lookup and errors.
     * @return The resolved argument.
     * @throws CompilationException if the operand is not visible at this point.
     */
    public static Argument resolve(String token, ParsingContext context) throws CompilationException {
        ParserState state = context.state();
        Optional<AgentBuilder> agent = state.innermost(AgentBuilder.class);
        Optional<BehaviourBuilder> behaviour = state.innermost(BehaviourBuilder.class);
        Optional<ActionBuilder> action = state.innermost(ActionBuilder.class);

        if (token.equals(RECEIVED) || token.startsWith(RECEIVED + ".")) {
            Message received = behaviour.flatMap(BehaviourBuilder::receivedMessage).orElseThrow(() -> context.error(
                    "'" + token + "' is only available in msg_rcv behaviours",
                    "Declare the behaviour as: BEHAV name, msg_rcv, type, performative"));
            return resolveReceived(token, received, context);
        }
        if (token.equals(SEND) || token.startsWith(SEND + ".")) {
            Message outgoing = action.flatMap(ActionBuilder::sendMessage).orElseThrow(() -> context.error(
                    "'" + token + "' is only available in send_msg actions",
                    "Declare the action as: ACTION name, send_msg, type, performative"));
            return resolveSend(token, outgoing, context);
        }
        if (action.isPresent()) {
            Optional<ValueType> local = action.get().local(token);
            if (local.isPresent()) {
                return new Argument(token, Origin.LOCAL, local.get(), true);
            }
        }
        Argument builtIn = BUILT_INS.get(token);
        if (builtIn != null) {
            return builtIn;
        }
        if (agent.isPresent()) {
            Optional<AgentParameter> parameter = agent.get().parameter(token);
            if (parameter.isPresent()) {
                return new Argument(token, Origin.AGENT_PARAM, typeOf(parameter.get()), true);
            }
        }
        if (isNumber(token)) {
            return new Argument(token, Origin.LITERAL, ValueType.FLOAT, false);
        }
        if (agent.isPresent() && agent.get().isEnumValue(token)) {
            return new Argument(token, Origin.ENUM_VALUE, ValueType.ENUM, false);
        }
        throw context.error("Unknown argument: " + token,
                "Use a number, a declared field or local, or an enum value of the agent");
    }

    /**
     * Returns the value type of an agent field.
     * @param parameter The field.
     * @return The type its references have.
     */
    public static ValueType typeOf(AgentParameter parameter) {
        if (parameter instanceof AgentParameter.EnumField) {
            return ValueType.ENUM;
        } else if (parameter instanceof AgentParameter.ConnectionList) {
            return ValueType.CONNECTION_LIST;
        } else if (parameter instanceof AgentParameter.MessageList) {
            return ValueType.MESSAGE_LIST;
        }
        return ValueType.FLOAT;
    }

    private static Argument resolveReceived(String token, Message received, ParsingContext context)
            throws CompilationException {
        if (token.equals(RECEIVED)) {
            return new Argument(token, Origin.RECEIVED_MESSAGE, ValueType.MESSAGE, false);
        }
        String field = token.substring(RECEIVED.length() + 1);
        if (field.equals(SENDER_FIELD)) {
            return new Argument(token, Origin.RECEIVED_MESSAGE_PARAM, ValueType.CONNECTION, false);
        }
        if (!received.hasFloatParam(field)) {
            throw context.error("Message " + received.key() + " has no field '" + field + "'",
                    "Available fields: " + received.floatParams() + " and " + SENDER_FIELD);
        }
        return new Argument(token, Origin.RECEIVED_MESSAGE_PARAM, ValueType.FLOAT, false);
    }

    private static Argument resolveSend(String token, Message outgoing, ParsingContext context)
            throws CompilationException {
        if (token.equals(SEND)) {
            return new Argument(token, Origin.SEND_MESSAGE, ValueType.MESSAGE, true);
        }
        String field = token.substring(SEND.length() + 1);
        if (!outgoing.hasFloatParam(field)) {
            throw context.error("Message " + outgoing.key() + " has no field '" + field + "'",
                    "Available fields: " + outgoing.floatParams());
        }
        return new Argument(token, Origin.SEND_MESSAGE_PARAM, ValueType.FLOAT, true);
    }
}
