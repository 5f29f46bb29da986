package org.aasm.compiler.frontend.parser.features.graph;

import org.aasm.compiler.diagnostics.CompilationException;
import org.aasm.compiler.frontend.parser.IOpcodeHandler;
import org.aasm.compiler.frontend.parser.Opcode;
import org.aasm.compiler.frontend.parser.ParsingContext;
import org.aasm.compiler.frontend.parser.Statement;
import org.aasm.compiler.frontend.parser.context.MatrixGraphBuilder;
import org.aasm.compiler.ir.graph.MatrixGraph;

import java.util.ArrayList;
import java.util.List;

/**
 * Handler for the statements of a matrix graph: {@code SCALE n} and
 * {@code DEFNODE agent, r1, r2, ...} with one 0/1 entry per node.
 */
public class MatrixGraphHandler implements IOpcodeHandler {

    @Override
    public void handle(Statement statement, ParsingContext context) throws CompilationException {
        MatrixGraphBuilder graph = context.expect(MatrixGraphBuilder.class, statement.opcode());
        if (statement.opcode() == Opcode.SCALE) {
            context.require(graph.scale().isEmpty(), "Graph scale already defined", "");
            int scale = GraphNumbers.nonNegativeInt(statement.arg(0), context);
            context.require(scale > 0, "Scale must be positive: " + scale, "");
            graph.setScale(scale);
            return;
        }
        String agent = statement.arg(0);
        context.require(context.state().agentExists(agent), "Agent not defined: " + agent,
                "Declare the agent before the graph");
        context.require(!graph.hasNode(agent), "Agent already in graph: " + agent, "");
        List<Integer> row = new ArrayList<>();
        for (String entry : statement.arguments().subList(1, statement.arity())) {
            context.require(entry.equals("0") || entry.equals("1"), "Invalid adjacency entry: " + entry,
                    "Rows contain only 0 and 1");
            row.add(Integer.parseInt(entry));
        }
        graph.addNode(new MatrixGraph.Node(agent, row));
    }
}
