package org.aasm.compiler.backend.graph;

import org.aasm.compiler.backend.ICodeGenerator;
import org.aasm.compiler.backend.code.CodeWriter;
import org.aasm.compiler.ir.Program;
import org.aasm.compiler.ir.graph.ConnectionAmount;
import org.aasm.compiler.ir.graph.Graph;
import org.aasm.compiler.ir.graph.MatrixGraph;
import org.aasm.compiler.ir.graph.StatisticalGraph;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Emits {@code generate_graph_structure(domain)}, which builds the initial connections of
 * the simulation when it starts. The function returns a list of
 * {@code {"jid", "type", "connections"}} records, one per agent instance.
 * <p>
 * A statistical graph samples each instance's connection count from its type's distribution,
 * clamps it to the population and picks that many distinct peers other than the instance
 * itself. A matrix graph replicates the base adjacency matrix over {@code scale} shards and
 * additionally links every instance to its own type in the other shards.
 */
public class GraphGenerator implements ICodeGenerator {

    private static final String SIGNATURE = "def generate_graph_structure(domain):";

    private final int indentSize;

    public GraphGenerator(int indentSize) {
        this.indentSize = indentSize;
    }

    @Override
    public List<String> generate(Program program) {
        CodeWriter out = new CodeWriter(indentSize);
        Optional<Graph> graph = program.graph();
        if (graph.isEmpty()) {
            out.block(SIGNATURE, () -> out.line("return []"));
            return out.lines();
        }
        out.line("import random");
        out.line("import uuid");
        out.line("import numpy");
        out.newlines(2);
        out.block(SIGNATURE, () -> {
            if (graph.get().isEmpty()) {
                out.line("return []");
            } else if (graph.get() instanceof StatisticalGraph statistical) {
                statistical(out, statistical);
            } else if (graph.get() instanceof MatrixGraph matrix) {
                matrix(out, matrix);
            } else {
                throw new IllegalStateException("Unknown graph type: " + graph.get());
            }
        });
        return out.lines();
    }

    private static void statistical(CodeWriter out, StatisticalGraph graph) {
        for (String agent : graph.nodes().keySet()) {
            out.line(count(agent) + " = " + graph.populationOf(agent));
        }
        out.line("num_agents = " + graph.nodes().keySet().stream()
                .map(GraphGenerator::count)
                .collect(Collectors.joining(" + ")));
        out.line("random_id = str(uuid.uuid4())[:5]");
        out.line("jids = [f\"{i}_{random_id}@{domain}\" for i in range(num_agents)]");
        out.line("agents = []");
        out.line("next_agent_idx = 0");
        for (StatisticalGraph.Node node : graph.nodes().values()) {
            out.block("for _ in range(" + count(node.agentName()) + "):", () -> {
                out.line("num_connections = " + connections(node.connections()));
                out.line("num_connections = max(min(num_connections, len(jids) - 1), 0)");
                out.line("jid = jids[next_agent_idx]");
                out.block("agents.append({", () -> {
                    out.line("\"jid\": jid,");
                    out.line("\"type\": \"" + node.agentName() + "\",");
                    out.line("\"connections\": random.sample([other_jid for other_jid in jids if other_jid != jid], num_connections),");
                });
                out.line("})");
                out.line("next_agent_idx += 1");
            });
        }
        out.line("return agents");
    }

    private static String count(String agentName) {
        return "_num_" + agentName;
    }

    private static String connections(ConnectionAmount amount) {
        if (amount instanceof ConnectionAmount.Constant constant) {
            return constant.value();
        } else if (amount instanceof ConnectionAmount.Normal normal) {
            return "int(numpy.random.normal(" + normal.mean() + ", " + normal.stdDev() + "))";
        } else if (amount instanceof ConnectionAmount.Exponential exponential) {
            return "int(numpy.random.exponential(1 / " + exponential.lambda() + "))";
        } else if (amount instanceof ConnectionAmount.Uniform uniform) {
            return "int(random.uniform(" + uniform.a() + ", " + uniform.b() + "))";
        }
        throw new IllegalStateException("Unknown connection amount: " + amount);
    }

    private static void matrix(CodeWriter out, MatrixGraph graph) {
        out.line("scale_factor = " + graph.scale());
        out.line("n_agent_types = " + graph.nodes().size());
        out.line("graph_size = scale_factor * n_agent_types");
        out.line("agent_types = [" + graph.nodes().stream()
                .map(node -> "\"" + node.agentName() + "\"")
                .collect(Collectors.joining(", ")) + "]");
        out.line("random_id = str(uuid.uuid4())[:5]");
        out.line("jids = [f\"{i}_{random_id}@{domain}\" for i in range(graph_size)]");
        out.line("agents = []");
        out.line("indx_sets = []");
        for (MatrixGraph.Node node : graph.nodes()) {
            out.line("indx_sets.append(" + node.adjacentIndices() + ")");
        }
        out.block("for base_agent_index in range(n_agent_types):", () -> {
            out.line("indices = list(indx_sets[base_agent_index])");
            out.block("for shift in range(1, scale_factor):",
                    () -> out.line("indices.append((base_agent_index + shift * n_agent_types) % graph_size)"));
            out.block("for shift in range(scale_factor):", () -> {
                out.line("jid = jids[base_agent_index + shift * n_agent_types]");
                out.line("connections = []");
                out.block("for i in indices:",
                        () -> out.line("connections.append(jids[(i + shift * n_agent_types) % graph_size])"));
                out.block("agents.append({", () -> {
                    out.line("\"jid\": jid,");
                    out.line("\"type\": agent_types[base_agent_index],");
                    out.line("\"connections\": connections,");
                });
                out.line("})");
            });
        });
        out.line("return agents");
    }
}
