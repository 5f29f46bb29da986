package org.aasm.compiler.frontend.parser.features.agent;

import org.aasm.compiler.diagnostics.CompilationException;
import org.aasm.compiler.frontend.lexer.Tokenizer;
import org.aasm.compiler.frontend.parser.ArgumentResolver;
import org.aasm.compiler.frontend.parser.IOpcodeHandler;
import org.aasm.compiler.frontend.parser.Opcode;
import org.aasm.compiler.frontend.parser.ParsingContext;
import org.aasm.compiler.frontend.parser.ReservedNames;
import org.aasm.compiler.frontend.parser.ReservedNames.Namespace;
import org.aasm.compiler.frontend.parser.Statement;
import org.aasm.compiler.frontend.parser.context.AgentBuilder;
import org.aasm.compiler.frontend.parser.context.ContextFrame;
import org.aasm.compiler.frontend.parser.context.MessageBuilder;
import org.aasm.compiler.ir.AgentParameter;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Handler for {@code PRM}. Inside a message it declares a float body field;
 * inside an agent (outside of any behaviour) it declares a state field of one of
 * the agent parameter categories:
 * <pre>
 * PRM name, float, init, value
 * PRM name, float, dist, normal, mean, std_dev
 * PRM name, float, dist, exp, lambda
 * PRM name, enum, v1, p1, v2, p2, ...
 * PRM name, list, conn
 * PRM name, list, msg
 * </pre>
 */
public class ParameterHandler implements IOpcodeHandler {

    @Override
    public void handle(Statement statement, ParsingContext context) throws CompilationException {
        Optional<ContextFrame> top = context.state().top();
        if (top.isPresent() && top.get() instanceof MessageBuilder message) {
            handleMessageParameter(statement, message, context);
        } else {
            handleAgentParameter(statement, context.expect(AgentBuilder.class, Opcode.PRM), context);
        }
    }

    private void handleMessageParameter(Statement statement, MessageBuilder message, ParsingContext context)
            throws CompilationException {
        context.require(statement.arity() == 2 && statement.arg(1).equals("float"),
                "Message fields are declared as: PRM name, float", "");
        String name = statement.arg(0);
        requireValidName(name, Namespace.MESSAGE_FIELD, context);
        context.require(!message.hasParam(name), "Message field already defined: " + name, "");
        message.addFloatParam(name);
    }

    private void handleAgentParameter(Statement statement, AgentBuilder agent, ParsingContext context)
            throws CompilationException {
        String name = statement.arg(0);
        requireValidName(name, Namespace.AGENT_FIELD, context);
        context.require(!agent.hasParameter(name), "Parameter already defined: " + name,
                "Field names are unique across all parameter categories of an agent");
        context.require(!agent.hasBehaviour(name), "Name already used by a behaviour: " + name,
                "Fields and behaviours share the agent's attributes");
        context.require(statement.arity() >= 3, "Missing parameter definition for " + name,
                "Use: PRM name, float|enum|list, ...");

        List<String> args = statement.arguments().subList(2, statement.arity());
        String category = statement.arg(1);
        switch (category) {
            case "float" -> agent.addParameter(floatParameter(name, args, context));
            case "enum" -> agent.addParameter(enumParameter(name, args, context));
            case "list" -> agent.addParameter(listParameter(name, args, context));
            default -> throw context.error("Unknown parameter category: " + category,
                    "Use float, enum or list");
        }
    }

    private AgentParameter floatParameter(String name, List<String> args, ParsingContext context)
            throws CompilationException {
        if (args.size() == 2 && args.get(0).equals("init")) {
            requireNumber(args.get(1), context);
            return new AgentParameter.InitFloat(name, args.get(1));
        }
        if (args.size() == 4 && args.get(0).equals("dist") && args.get(1).equals("normal")) {
            requireNumber(args.get(2), context);
            requireNumber(args.get(3), context);
            context.require(new BigDecimal(args.get(3)).signum() >= 0,
                    "Standard deviation must not be negative: " + args.get(3), "");
            return new AgentParameter.NormalFloat(name, args.get(2), args.get(3));
        }
        if (args.size() == 3 && args.get(0).equals("dist") && args.get(1).equals("exp")) {
            requireNumber(args.get(2), context);
            context.require(new BigDecimal(args.get(2)).signum() > 0,
                    "Lambda must be positive: " + args.get(2), "");
            return new AgentParameter.ExpFloat(name, args.get(2));
        }
        throw context.error("Invalid float parameter definition",
                "Use: PRM name, float, init, value | dist, normal, mean, std_dev | dist, exp, lambda");
    }

    private AgentParameter enumParameter(String name, List<String> args, ParsingContext context)
            throws CompilationException {
        context.require(!args.isEmpty() && args.size() % 2 == 0, "Enum values must come in (value, weight) pairs",
                "Use: PRM name, enum, value1, weight1, value2, weight2, ...");
        List<AgentParameter.EnumValue> values = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < args.size(); i += 2) {
            String value = args.get(i);
            String weight = args.get(i + 1);
            requireValidName(value, Namespace.ENUM_VALUE, context);
            context.require(seen.add(value), "Enum value already defined: " + value, "");
            requireNumber(weight, context);
            context.require(new BigDecimal(weight).signum() >= 0, "Enum weight must not be negative: " + weight, "");
            values.add(new AgentParameter.EnumValue(value, weight));
        }
        return new AgentParameter.EnumField(name, values);
    }

    private AgentParameter listParameter(String name, List<String> args, ParsingContext context)
            throws CompilationException {
        if (args.size() == 1 && args.get(0).equals("conn")) {
            return new AgentParameter.ConnectionList(name);
        }
        if (args.size() == 1 && args.get(0).equals("msg")) {
            return new AgentParameter.MessageList(name);
        }
        throw context.error("Invalid list parameter definition", "Use: PRM name, list, conn|msg");
    }

    private static void requireValidName(String name, Namespace namespace, ParsingContext context)
            throws CompilationException {
        context.require(Tokenizer.isIdentifier(name), "Invalid name: " + name,
                "Names start with a letter or underscore");
        ReservedNames.require(name, namespace, context);
    }

    private static void requireNumber(String token, ParsingContext context) throws CompilationException {
        context.require(ArgumentResolver.isNumber(token), "Expected a number, got: " + token, "");
    }
}
