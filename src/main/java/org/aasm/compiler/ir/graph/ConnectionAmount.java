package org.aasm.compiler.ir.graph;

/**
 * How many outgoing connections each instance of an agent type receives.
 * Distribution-based amounts are sampled per instance by the generated code.
 */
public sealed interface ConnectionAmount {

    /**
     * @param value A fixed count.
     */
    record Constant(String value) implements ConnectionAmount {
    }

    /**
     * @param mean   The distribution mean.
     * @param stdDev The standard deviation.
     */
    record Normal(String mean, String stdDev) implements ConnectionAmount {
    }

    /**
     * @param lambda The rate parameter.
     */
    record Exponential(String lambda) implements ConnectionAmount {
    }

    /**
     * @param a The lower bound.
     * @param b The upper bound.
     */
    record Uniform(String a, String b) implements ConnectionAmount {
    }
}
