package org.aasm.compiler.backend.graph;

import org.aasm.compiler.ir.Program;
import org.aasm.compiler.ir.graph.ConnectionAmount;
import org.aasm.compiler.ir.graph.Graph;
import org.aasm.compiler.ir.graph.MatrixGraph;
import org.aasm.compiler.ir.graph.PopulationAmount;
import org.aasm.compiler.ir.graph.StatisticalGraph;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class GraphGeneratorTest {

    private final GraphGenerator generator = new GraphGenerator(4);

    private static Program withGraph(Graph graph) {
        return new Program(List.of(), List.of(), Optional.of(graph));
    }

    private static StatisticalGraph.Node node(String agent, String amount, ConnectionAmount connections) {
        return new StatisticalGraph.Node(agent, PopulationAmount.parse(amount), connections);
    }

    @Test
    void noGraphYieldsEmptyFunction() {
        List<String> lines = generator.generate(Program.empty());

        assertThat(lines).containsExactly("def generate_graph_structure(domain):", "    return []");
    }

    @Test
    void declaredEmptyGraphYieldsEmptyFunctionWithImports() {
        List<String> lines = generator.generate(withGraph(new MatrixGraph(1, List.of())));

        assertThat(lines).containsExactly(
                "import random", "import uuid", "import numpy", "", "",
                "def generate_graph_structure(domain):",
                "    return []");
    }

    @Test
    void statisticalGraphResolvesPercentagesAtCompileTime() {
        // Arrange
        Map<String, StatisticalGraph.Node> nodes = new LinkedHashMap<>();
        nodes.put("A", node("A", "60%", new ConnectionAmount.Constant("2")));
        nodes.put("B", node("B", "40%", new ConnectionAmount.Normal("3", "1")));

        // Act
        List<String> lines = generator.generate(withGraph(new StatisticalGraph(10, nodes)));

        // Assert
        assertThat(lines).startsWith("import random", "import uuid", "import numpy", "", "",
                "def generate_graph_structure(domain):",
                "    _num_A = 6",
                "    _num_B = 4",
                "    num_agents = _num_A + _num_B");
        assertThat(lines).contains(
                "    for _ in range(_num_A):",
                "        num_connections = 2",
                "    for _ in range(_num_B):",
                "        num_connections = int(numpy.random.normal(3, 1))",
                "            \"type\": \"B\",");
        assertThat(lines).last().isEqualTo("    return agents");
    }

    @Test
    void statisticalConnectionsAreClampedAndExcludeSelf() {
        Map<String, StatisticalGraph.Node> nodes = new LinkedHashMap<>();
        nodes.put("A", node("A", "3", new ConnectionAmount.Exponential("0.5")));

        List<String> lines = generator.generate(withGraph(new StatisticalGraph(0, nodes)));

        assertThat(lines).contains(
                "    _num_A = 3",
                "        num_connections = int(numpy.random.exponential(1 / 0.5))",
                "        num_connections = max(min(num_connections, len(jids) - 1), 0)",
                "            \"connections\": random.sample([other_jid for other_jid in jids if other_jid != jid], num_connections),");
    }

    @Test
    void uniformConnections() {
        Map<String, StatisticalGraph.Node> nodes = new LinkedHashMap<>();
        nodes.put("A", node("A", "3", new ConnectionAmount.Uniform("1", "4")));

        assertThat(generator.generate(withGraph(new StatisticalGraph(0, nodes))))
                .contains("        num_connections = int(random.uniform(1, 4))");
    }

    @Test
    void twoTypesInTwoShardsEmitTheWholeFunction() {
        // Arrange
        MatrixGraph graph = new MatrixGraph(2, List.of(
                new MatrixGraph.Node("A", List.of(0, 1)),
                new MatrixGraph.Node("B", List.of(1, 0))));

        // Act
        List<String> lines = generator.generate(withGraph(graph));

        // Assert
        // Population 4: jids 0 and 1 form shard 0, jids 2 and 3 shard 1. Instance i of shard s links to
        // (i + s * 2) % 4 for every i of its row, so A of shard 0 reaches B of shard 0 and A of shard 1
        // reaches B of shard 1. The last index appended per type links each instance to its replica.
        assertThat(graph.population()).isEqualTo(4);
        assertThat(lines).containsExactly(
                "import random",
                "import uuid",
                "import numpy",
                "",
                "",
                "def generate_graph_structure(domain):",
                "    scale_factor = 2",
                "    n_agent_types = 2",
                "    graph_size = scale_factor * n_agent_types",
                "    agent_types = [\"A\", \"B\"]",
                "    random_id = str(uuid.uuid4())[:5]",
                "    jids = [f\"{i}_{random_id}@{domain}\" for i in range(graph_size)]",
                "    agents = []",
                "    indx_sets = []",
                "    indx_sets.append([1])",
                "    indx_sets.append([0])",
                "    for base_agent_index in range(n_agent_types):",
                "        indices = list(indx_sets[base_agent_index])",
                "        for shift in range(1, scale_factor):",
                "            indices.append((base_agent_index + shift * n_agent_types) % graph_size)",
                "        for shift in range(scale_factor):",
                "            jid = jids[base_agent_index + shift * n_agent_types]",
                "            connections = []",
                "            for i in indices:",
                "                connections.append(jids[(i + shift * n_agent_types) % graph_size])",
                "            agents.append({",
                "                \"jid\": jid,",
                "                \"type\": agent_types[base_agent_index],",
                "                \"connections\": connections,",
                "            })",
                "    return agents");
    }

    @Test
    void matrixGraphReplicatesTheBaseMatrix() {
        MatrixGraph graph = new MatrixGraph(2, List.of(
                new MatrixGraph.Node("A", List.of(0, 1)),
                new MatrixGraph.Node("B", List.of(1, 1))));

        List<String> lines = generator.generate(withGraph(graph));

        assertThat(lines).contains(
                "    scale_factor = 2",
                "    n_agent_types = 2",
                "    graph_size = scale_factor * n_agent_types",
                "    agent_types = [\"A\", \"B\"]",
                "    indx_sets.append([1])",
                "    indx_sets.append([0, 1])",
                "        indices = list(indx_sets[base_agent_index])",
                "            indices.append((base_agent_index + shift * n_agent_types) % graph_size)",
                "                \"type\": agent_types[base_agent_index],");
        assertThat(lines).last().isEqualTo("    return agents");
    }
}
