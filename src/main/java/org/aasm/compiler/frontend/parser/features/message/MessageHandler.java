package org.aasm.compiler.frontend.parser.features.message;

import org.aasm.compiler.diagnostics.CompilationException;
import org.aasm.compiler.frontend.lexer.Tokenizer;
import org.aasm.compiler.frontend.parser.IOpcodeHandler;
import org.aasm.compiler.frontend.parser.Opcode;
import org.aasm.compiler.frontend.parser.ParsingContext;
import org.aasm.compiler.frontend.parser.Statement;
import org.aasm.compiler.frontend.parser.context.MessageBuilder;

/**
 * Handler for {@code MESSAGE type, performative} and {@code EMESSAGE}.
 * A message is identified by its (type, performative) pair. Declaring the pair again
 * replaces the template for every later use; behaviours and actions declared before keep
 * the copy they were bound to.
 */
public class MessageHandler implements IOpcodeHandler {

    @Override
    public void handle(Statement statement, ParsingContext context) throws CompilationException {
        if (statement.opcode() == Opcode.EMESSAGE) {
            MessageBuilder message = context.close(MessageBuilder.class, Opcode.EMESSAGE);
            context.state().addMessage(message.build());
            return;
        }
        context.requireTopLevel(Opcode.MESSAGE);
        String type = statement.arg(0);
        String performative = statement.arg(1);
        context.require(Tokenizer.isIdentifier(type), "Invalid message type: " + type, "");
        context.require(Tokenizer.isIdentifier(performative), "Invalid message performative: " + performative, "");
        context.state().push(new MessageBuilder(type, performative));
    }
}
