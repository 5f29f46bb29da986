package org.aasm.compiler.ir.graph;

/**
 * The declared shape of the communication graph. The compiler does not build the
 * graph itself; it emits a function that builds it when the simulation starts.
 */
public sealed interface Graph permits StatisticalGraph, MatrixGraph {

    /**
     * @return true if the graph declares no agent types.
     */
    boolean isEmpty();
}
