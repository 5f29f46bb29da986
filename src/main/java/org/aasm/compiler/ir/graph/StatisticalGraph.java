package org.aasm.compiler.ir.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A graph whose population and connections are sampled at simulation start.
 *
 * @param size  The target size that percentage amounts refer to, 0 if undeclared.
 * @param nodes The agent types keyed by agent name, in declaration order.
 */
public record StatisticalGraph(int size, Map<String, Node> nodes) implements Graph {

    public StatisticalGraph {
        nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
    }

    @Override
    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /**
     * Resolves the number of instances of one agent type.
     * @param agentName The agent type.
     * @return The instance count.
     * @throws IllegalArgumentException if the type is not part of the graph.
     */
    public int populationOf(String agentName) {
        Node node = nodes.get(agentName);
        if (node == null) {
            throw new IllegalArgumentException("Agent type not in graph: " + agentName);
        }
        return node.amount().resolve(size);
    }

    /**
     * @return The total population, the sum of the per-type counts.
     */
    public int population() {
        return nodes.keySet().stream().mapToInt(this::populationOf).sum();
    }

    /**
     * One agent type of the graph.
     *
     * @param agentName   The agent type.
     * @param amount      How many instances to create.
     * @param connections How many connections each instance gets.
     */
    public record Node(String agentName, PopulationAmount amount, ConnectionAmount connections) {
    }
}
