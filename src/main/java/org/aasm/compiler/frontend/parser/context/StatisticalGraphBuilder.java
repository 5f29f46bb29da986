package org.aasm.compiler.frontend.parser.context;

import org.aasm.compiler.ir.graph.StatisticalGraph;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Collects {@code SIZE} and {@code DEFG} statements of a statistical graph.
 */
public final class StatisticalGraphBuilder implements GraphBuilder {

    private Integer size;
    private final Map<String, StatisticalGraph.Node> nodes = new LinkedHashMap<>();

    public OptionalInt size() {
        return size == null ? OptionalInt.empty() : OptionalInt.of(size);
    }

    public void setSize(int size) {
        this.size = size;
    }

    public void addNode(StatisticalGraph.Node node) {
        nodes.put(node.agentName(), node);
    }

    public Collection<StatisticalGraph.Node> nodes() {
        return nodes.values();
    }

    /**
     * @return true if some node sizes its population as a percentage of the graph size.
     */
    public boolean usesPercentages() {
        return nodes.values().stream().anyMatch(node -> node.amount().percent());
    }

    @Override
    public boolean hasNode(String agentName) {
        return nodes.containsKey(agentName);
    }

    @Override
    public StatisticalGraph build() {
        return new StatisticalGraph(size == null ? 0 : size, nodes);
    }

    @Override
    public String description() {
        return "statistical graph";
    }
}
