package org.aasm.compiler.frontend.parser.context;

import org.aasm.compiler.ir.graph.Graph;

/**
 * Collects the graph declaration between {@code GRAPH} and {@code EGRAPH}.
 */
public sealed interface GraphBuilder extends ContextFrame permits StatisticalGraphBuilder, MatrixGraphBuilder {

    /**
     * @param agentName An agent name.
     * @return true if the agent is already a node of the graph.
     */
    boolean hasNode(String agentName);

    Graph build();

    @Override
    default String closingOpcode() {
        return "EGRAPH";
    }
}
