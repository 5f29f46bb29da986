package org.aasm.compiler.frontend.parser.context;

import org.aasm.compiler.ir.graph.MatrixGraph;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * Collects {@code SCALE} and {@code DEFNODE} statements of a matrix graph.
 */
public final class MatrixGraphBuilder implements GraphBuilder {

    private Integer scale;
    private final List<MatrixGraph.Node> nodes = new ArrayList<>();

    public OptionalInt scale() {
        return scale == null ? OptionalInt.empty() : OptionalInt.of(scale);
    }

    public void setScale(int scale) {
        this.scale = scale;
    }

    public void addNode(MatrixGraph.Node node) {
        nodes.add(node);
    }

    public List<MatrixGraph.Node> nodes() {
        return List.copyOf(nodes);
    }

    @Override
    public boolean hasNode(String agentName) {
        return nodes.stream().anyMatch(node -> node.agentName().equals(agentName));
    }

    @Override
    public MatrixGraph build() {
        return new MatrixGraph(scale == null ? MatrixGraph.DEFAULT_SCALE : scale, nodes);
    }

    @Override
    public String description() {
        return "matrix graph";
    }
}
