package org.aasm.compiler.ir.instruction;

import org.aasm.compiler.ir.Argument;

/**
 * A comparison-gated block: the {@code I*} opcodes run the body once, the {@code W*}
 * opcodes loop while the comparison holds.
 *
 * @param comparison The ordering tested.
 * @param loop       true for a loop, false for a one-shot conditional.
 * @param left       The left operand.
 * @param right      The right operand.
 * @param body       The guarded instructions.
 */
public record Conditional(Comparison comparison, boolean loop, Argument left, Argument right, Block body)
        implements Instruction {

    /**
     * The six orderings. Only {@link #EQUAL} and {@link #NOT_EQUAL} apply to enums and connections.
     */
    public enum Comparison {
        EQUAL("==", false),
        NOT_EQUAL("!=", false),
        GREATER(">", true),
        GREATER_OR_EQUAL(">=", true),
        LESS("<", true),
        LESS_OR_EQUAL("<=", true);

        private final String symbol;
        private final boolean ordered;

        Comparison(String symbol, boolean ordered) {
            this.symbol = symbol;
            this.ordered = ordered;
        }

        public String symbol() {
            return symbol;
        }

        public boolean isOrdered() {
            return ordered;
        }
    }

    @Override
    public <R> R accept(InstructionVisitor<R> visitor) {
        return visitor.visitConditional(this);
    }
}
