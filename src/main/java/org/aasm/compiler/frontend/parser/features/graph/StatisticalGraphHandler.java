package org.aasm.compiler.frontend.parser.features.graph;

import org.aasm.compiler.diagnostics.CompilationException;
import org.aasm.compiler.frontend.parser.IOpcodeHandler;
import org.aasm.compiler.frontend.parser.Opcode;
import org.aasm.compiler.frontend.parser.ParsingContext;
import org.aasm.compiler.frontend.parser.Statement;
import org.aasm.compiler.frontend.parser.context.StatisticalGraphBuilder;
import org.aasm.compiler.ir.graph.ConnectionAmount;
import org.aasm.compiler.ir.graph.PopulationAmount;
import org.aasm.compiler.ir.graph.StatisticalGraph;

import java.util.List;

/**
 * Handler for the statements of a statistical graph:
 * <pre>
 * SIZE n
 * DEFG agent, amount, connections
 * </pre>
 * {@code amount} is {@code N} or {@code N%}; {@code connections} is {@code N},
 * {@code dist_normal, mean, std_dev}, {@code dist_exp, lambda} or {@code dist_uniform, a, b}.
 */
public class StatisticalGraphHandler implements IOpcodeHandler {

    @Override
    public void handle(Statement statement, ParsingContext context) throws CompilationException {
        StatisticalGraphBuilder graph = context.expect(StatisticalGraphBuilder.class, statement.opcode());
        if (statement.opcode() == Opcode.SIZE) {
            context.require(graph.size().isEmpty(), "Graph size already defined", "");
            graph.setSize(GraphNumbers.nonNegativeInt(statement.arg(0), context));
            return;
        }
        String agent = statement.arg(0);
        context.require(context.state().agentExists(agent), "Agent not defined: " + agent,
                "Declare the agent before the graph");
        context.require(!graph.hasNode(agent), "Agent already in graph: " + agent, "");
        PopulationAmount amount = population(statement.arg(1), context);
        ConnectionAmount connections = connections(statement.arguments().subList(2, statement.arity()), context);
        graph.addNode(new StatisticalGraph.Node(agent, amount, connections));
    }

    private static PopulationAmount population(String token, ParsingContext context) throws CompilationException {
        if (token.endsWith("%")) {
            GraphNumbers.nonNegative(token.substring(0, token.length() - 1), context);
        } else {
            GraphNumbers.nonNegativeInt(token, context);
        }
        return PopulationAmount.parse(token);
    }

    private static ConnectionAmount connections(List<String> args, ParsingContext context)
            throws CompilationException {
        String kind = args.get(0);
        if (args.size() == 1) {
            return new ConnectionAmount.Constant(String.valueOf(GraphNumbers.nonNegativeInt(kind, context)));
        }
        if (kind.equals("dist_normal") && args.size() == 3) {
            return new ConnectionAmount.Normal(GraphNumbers.number(args.get(1), context),
                    GraphNumbers.nonNegative(args.get(2), context));
        }
        if (kind.equals("dist_exp") && args.size() == 2) {
            return new ConnectionAmount.Exponential(GraphNumbers.positive(args.get(1), context));
        }
        if (kind.equals("dist_uniform") && args.size() == 3) {
            return new ConnectionAmount.Uniform(GraphNumbers.number(args.get(1), context),
                    GraphNumbers.number(args.get(2), context));
        }
        throw context.error("Invalid connection amount: " + args,
                "Use N, dist_normal, mean, std_dev | dist_exp, lambda | dist_uniform, a, b");
    }
}
