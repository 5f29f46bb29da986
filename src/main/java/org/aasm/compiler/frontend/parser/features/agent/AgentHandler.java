package org.aasm.compiler.frontend.parser.features.agent;

import org.aasm.compiler.diagnostics.CompilationException;
import org.aasm.compiler.frontend.lexer.Tokenizer;
import org.aasm.compiler.frontend.parser.IOpcodeHandler;
import org.aasm.compiler.frontend.parser.Opcode;
import org.aasm.compiler.frontend.parser.ParsingContext;
import org.aasm.compiler.frontend.parser.ReservedNames;
import org.aasm.compiler.frontend.parser.Statement;
import org.aasm.compiler.frontend.parser.context.AgentBuilder;

/**
 * Handler for {@code AGENT name} and {@code EAGENT}.
 * Agents are top-level constructs and their names are unique within the program.
 */
public class AgentHandler implements IOpcodeHandler {

    @Override
    public void handle(Statement statement, ParsingContext context) throws CompilationException {
        if (statement.opcode() == Opcode.EAGENT) {
            AgentBuilder agent = context.close(AgentBuilder.class, Opcode.EAGENT);
            context.state().addAgent(agent.build());
            return;
        }
        context.requireTopLevel(Opcode.AGENT);
        String name = statement.arg(0);
        context.require(Tokenizer.isIdentifier(name), "Invalid agent name: " + name,
                "Agent names start with a letter or underscore");
        ReservedNames.require(name, ReservedNames.Namespace.AGENT, context);
        context.require(!context.state().agentExists(name), "Agent already defined: " + name,
                "Rename one of the agents");
        context.state().push(new AgentBuilder(name));
    }
}
