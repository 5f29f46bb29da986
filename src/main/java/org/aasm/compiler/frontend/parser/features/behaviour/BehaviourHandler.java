package org.aasm.compiler.frontend.parser.features.behaviour;

import org.aasm.compiler.diagnostics.CompilationException;
import org.aasm.compiler.frontend.lexer.Tokenizer;
import org.aasm.compiler.frontend.parser.ArgumentResolver;
import org.aasm.compiler.frontend.parser.IOpcodeHandler;
import org.aasm.compiler.frontend.parser.Opcode;
import org.aasm.compiler.frontend.parser.ParsingContext;
import org.aasm.compiler.frontend.parser.ReservedNames;
import org.aasm.compiler.frontend.parser.Statement;
import org.aasm.compiler.frontend.parser.context.AgentBuilder;
import org.aasm.compiler.frontend.parser.context.BehaviourBuilder;
import org.aasm.compiler.ir.MessageKey;

import java.math.BigDecimal;

/**
 * Handler for {@code BEHAV} and {@code EBEHAV}:
 * <pre>
 * BEHAV name, setup
 * BEHAV name, one_time, delay
 * BEHAV name, cyclic, period
 * BEHAV name, msg_rcv, type, performative
 * </pre>
 * Behaviour names are unique within their agent across all four kinds.
 */
public class BehaviourHandler implements IOpcodeHandler {

    @Override
    public void handle(Statement statement, ParsingContext context) throws CompilationException {
        if (statement.opcode() == Opcode.EBEHAV) {
            BehaviourBuilder behaviour = context.close(BehaviourBuilder.class, Opcode.EBEHAV);
            context.expect(AgentBuilder.class, Opcode.EBEHAV).addBehaviour(behaviour.build());
            return;
        }
        AgentBuilder agent = context.expect(AgentBuilder.class, Opcode.BEHAV);
        String name = statement.arg(0);
        context.require(Tokenizer.isIdentifier(name), "Invalid behaviour name: " + name, "");
        ReservedNames.require(name, ReservedNames.Namespace.BEHAVIOUR, context);
        context.require(!agent.hasParameter(name), "Name already used by a field: " + name,
                "Fields and behaviours share the agent's attributes");
        context.require(!agent.hasBehaviour(name), "Behaviour already defined: " + name,
                "Behaviour names are unique within an agent");

        String keyword = statement.arg(1);
        BehaviourBuilder.Kind kind = BehaviourBuilder.Kind.fromKeyword(keyword).orElseThrow(() -> context.error(
                "Unknown behaviour category: " + keyword, "Use setup, one_time, cyclic or msg_rcv"));
        context.state().push(switch (kind) {
            case SETUP -> {
                requireArity(statement, 2, "BEHAV name, setup", context);
                yield BehaviourBuilder.setup(name);
            }
            case ONE_TIME -> {
                requireArity(statement, 3, "BEHAV name, one_time, delay", context);
                requireSeconds(statement.arg(2), false, context);
                yield BehaviourBuilder.oneTime(name, statement.arg(2));
            }
            case CYCLIC -> {
                requireArity(statement, 3, "BEHAV name, cyclic, period", context);
                requireSeconds(statement.arg(2), true, context);
                yield BehaviourBuilder.cyclic(name, statement.arg(2));
            }
            case MESSAGE_RECEIVED -> {
                requireArity(statement, 4, "BEHAV name, msg_rcv, type, performative", context);
                MessageKey key = new MessageKey(statement.arg(2), statement.arg(3));
                context.require(context.state().messageExists(key), "Message not defined: " + key,
                        "Declare the message before the agents that use it");
                yield BehaviourBuilder.messageReceived(name, context.state().getMessageInstance(key));
            }
        });
    }

    private static void requireArity(Statement statement, int arity, String usage, ParsingContext context)
            throws CompilationException {
        context.require(statement.arity() == arity, "Wrong number of arguments for BEHAV", "Use: " + usage);
    }

    private static void requireSeconds(String token, boolean positive, ParsingContext context)
            throws CompilationException {
        context.require(ArgumentResolver.isNumber(token), "Expected a number of seconds, got: " + token, "");
        int sign = new BigDecimal(token).signum();
        context.require(positive ? sign > 0 : sign >= 0,
                (positive ? "Period must be positive: " : "Delay must not be negative: ") + token, "");
    }
}
