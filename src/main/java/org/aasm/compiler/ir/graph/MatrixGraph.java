package org.aasm.compiler.ir.graph;

import java.util.ArrayList;
import java.util.List;

/**
 * A graph replicated from a base adjacency matrix over agent types.
 * The population is {@code scale} shards of one instance per type.
 *
 * @param scale The number of shards, 1 when no {@code SCALE} was given.
 * @param nodes The agent types with their adjacency rows, in declaration order.
 */
public record MatrixGraph(int scale, List<Node> nodes) implements Graph {

    public static final int DEFAULT_SCALE = 1;

    public MatrixGraph {
        nodes = List.copyOf(nodes);
    }

    @Override
    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /**
     * @return The total population, types times shards.
     */
    public int population() {
        return nodes.size() * scale;
    }

    /**
     * One agent type with its row of the base adjacency matrix.
     *
     * @param agentName The agent type.
     * @param row       0/1 entries, one per type in declaration order.
     */
    public record Node(String agentName, List<Integer> row) {

        public Node {
            row = List.copyOf(row);
        }

        /**
         * @return The indices of the types this type links to.
         */
        public List<Integer> adjacentIndices() {
            List<Integer> indices = new ArrayList<>();
            for (int i = 0; i < row.size(); i++) {
                if (row.get(i) == 1) {
                    indices.add(i);
                }
            }
            return indices;
        }
    }
}
