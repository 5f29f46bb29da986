package org.aasm.compiler.ir;

import org.aasm.compiler.ir.graph.Graph;

import java.util.List;
import java.util.Optional;

/**
 * The parsed program handed from the parser to the code generators.
 *
 * @param agents   The agents in declaration order.
 * @param messages The message templates in declaration order.
 * @param graph    The connection graph, if one was declared.
 */
public record Program(List<Agent> agents, List<Message> messages, Optional<Graph> graph) {

    public Program {
        agents = List.copyOf(agents);
        messages = List.copyOf(messages);
    }

    /**
     * @return A program with no agents, no messages and no graph.
     */
    public static Program empty() {
        return new Program(List.of(), List.of(), Optional.empty());
    }
}
