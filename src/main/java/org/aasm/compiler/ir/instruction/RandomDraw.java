package org.aasm.compiler.ir.instruction;

import org.aasm.compiler.ir.Argument;

import java.util.List;

/**
 * {@code RAND}: draws a random number into a float target.
 *
 * @param distribution The distribution to sample.
 * @param target       The mutable float operand.
 * @param integer      Whether the result is truncated to an integer.
 * @param parameters   The distribution parameters: (a, b), (mean, std_dev) or (lambda).
 */
public record RandomDraw(Distribution distribution, Argument target, boolean integer, List<Argument> parameters)
        implements Instruction {

    public RandomDraw {
        parameters = List.copyOf(parameters);
        if (parameters.size() != distribution.parameterCount()) {
            throw new IllegalArgumentException(distribution + " expects " + distribution.parameterCount()
                    + " parameters, got " + parameters.size());
        }
    }

    /**
     * Supported distributions with their DSL keyword.
     */
    public enum Distribution {
        UNIFORM("uniform", 2),
        NORMAL("normal", 2),
        EXPONENTIAL("exp", 1);

        private final String keyword;
        private final int parameterCount;

        Distribution(String keyword, int parameterCount) {
            this.keyword = keyword;
            this.parameterCount = parameterCount;
        }

        public String keyword() {
            return keyword;
        }

        public int parameterCount() {
            return parameterCount;
        }
    }

    @Override
    public <R> R accept(InstructionVisitor<R> visitor) {
        return visitor.visitRandomDraw(this);
    }
}
