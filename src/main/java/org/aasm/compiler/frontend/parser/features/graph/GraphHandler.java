package org.aasm.compiler.frontend.parser.features.graph;

import org.aasm.compiler.diagnostics.CompilationException;
import org.aasm.compiler.frontend.parser.IOpcodeHandler;
import org.aasm.compiler.frontend.parser.Opcode;
import org.aasm.compiler.frontend.parser.ParsingContext;
import org.aasm.compiler.frontend.parser.Statement;
import org.aasm.compiler.frontend.parser.context.GraphBuilder;
import org.aasm.compiler.frontend.parser.context.MatrixGraphBuilder;
import org.aasm.compiler.frontend.parser.context.StatisticalGraphBuilder;
import org.aasm.compiler.ir.graph.MatrixGraph;
import org.aasm.compiler.ir.graph.StatisticalGraph;

import java.math.BigDecimal;

/**
 * Handler for {@code GRAPH statistical|matrix} and {@code EGRAPH}.
 * A program declares at most one graph. Closing the graph checks the constraints that
 * span several statements: a statistical graph needs {@code SIZE} as soon as one amount
 * is a percentage, every row of a matrix graph has one entry per node, and the population
 * of either kind fits an {@code int}.
 */
public class GraphHandler implements IOpcodeHandler {

    private static final BigDecimal MAX_POPULATION = BigDecimal.valueOf(Integer.MAX_VALUE);

    @Override
    public void handle(Statement statement, ParsingContext context) throws CompilationException {
        if (statement.opcode() == Opcode.EGRAPH) {
            GraphBuilder graph = context.close(GraphBuilder.class, Opcode.EGRAPH);
            validate(graph, context);
            context.state().setGraph(graph.build());
            return;
        }
        context.requireTopLevel(Opcode.GRAPH);
        context.require(!context.state().graphExists(), "Graph already defined",
                "A program declares at most one GRAPH");
        String kind = statement.arg(0);
        switch (kind) {
            case "statistical" -> context.state().push(new StatisticalGraphBuilder());
            case "matrix" -> context.state().push(new MatrixGraphBuilder());
            default -> throw context.error("Unknown graph type: " + kind, "Use statistical or matrix");
        }
    }

    private static void validate(GraphBuilder graph, ParsingContext context) throws CompilationException {
        if (graph instanceof StatisticalGraphBuilder statistical) {
            context.require(statistical.size().isPresent() || !statistical.usesPercentages(),
                    "Graph size is not defined", "Percentage amounts need SIZE n");
            int size = statistical.size().orElse(0);
            BigDecimal total = BigDecimal.ZERO;
            for (StatisticalGraph.Node node : statistical.nodes()) {
                BigDecimal count = node.amount().count(size);
                context.require(count.compareTo(MAX_POPULATION) <= 0,
                        "Too many instances of " + node.agentName() + ": " + count.toPlainString(), "");
                total = total.add(count);
            }
            context.require(total.compareTo(MAX_POPULATION) <= 0,
                    "Graph population too large: " + total.toPlainString(), "");
        } else if (graph instanceof MatrixGraphBuilder matrix) {
            int count = matrix.nodes().size();
            for (MatrixGraph.Node node : matrix.nodes()) {
                context.require(node.row().size() == count, "Row of node " + node.agentName() + " has "
                        + node.row().size() + " entries, expected " + count,
                        "Every DEFNODE row has one 0/1 entry per node");
            }
            long population = (long) count * matrix.scale().orElse(MatrixGraph.DEFAULT_SCALE);
            context.require(population <= Integer.MAX_VALUE, "Graph population too large: " + population, "");
        } else {
            throw new IllegalStateException("Unknown graph builder: " + graph);
        }
    }
}
