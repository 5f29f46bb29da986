package org.aasm.compiler.frontend.parser.features.action;

import org.aasm.compiler.diagnostics.CompilationException;
import org.aasm.compiler.frontend.lexer.Tokenizer;
import org.aasm.compiler.frontend.parser.IOpcodeHandler;
import org.aasm.compiler.frontend.parser.Opcode;
import org.aasm.compiler.frontend.parser.ParsingContext;
import org.aasm.compiler.frontend.parser.ReservedNames;
import org.aasm.compiler.frontend.parser.Statement;
import org.aasm.compiler.frontend.parser.context.ActionBuilder;
import org.aasm.compiler.frontend.parser.context.BehaviourBuilder;
import org.aasm.compiler.ir.MessageKey;

/**
 * Handler for {@code ACTION name, modify_self}, {@code ACTION name, send_msg, type, performative}
 * and {@code EACTION}. A send action binds its own copy of the message template.
 */
public class ActionHandler implements IOpcodeHandler {

    @Override
    public void handle(Statement statement, ParsingContext context) throws CompilationException {
        if (statement.opcode() == Opcode.EACTION) {
            ActionBuilder action = context.close(ActionBuilder.class, Opcode.EACTION);
            context.expect(BehaviourBuilder.class, Opcode.EACTION).addAction(action.build());
            return;
        }
        BehaviourBuilder behaviour = context.expect(BehaviourBuilder.class, Opcode.ACTION);
        String name = statement.arg(0);
        context.require(Tokenizer.isIdentifier(name), "Invalid action name: " + name, "");
        ReservedNames.require(name, ReservedNames.Namespace.ACTION, context);
        context.require(!behaviour.hasAction(name), "Action already defined: " + name,
                "Action names are unique within a behaviour");

        String category = statement.arg(1);
        if (category.equals("modify_self") && statement.arity() == 2) {
            context.state().push(ActionBuilder.modifySelf(name));
        } else if (category.equals("send_msg") && statement.arity() == 4) {
            MessageKey key = new MessageKey(statement.arg(2), statement.arg(3));
            context.require(context.state().messageExists(key), "Message not defined: " + key,
                    "Declare the message before the agents that use it");
            context.state().push(ActionBuilder.sendMessage(name, context.state().getMessageInstance(key)));
        } else {
            throw context.error("Invalid action definition",
                    "Use: ACTION name, modify_self | ACTION name, send_msg, type, performative");
        }
    }
}
