package org.aasm.compiler.ir.graph;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * How many instances of an agent type a statistical graph creates.
 *
 * @param value   The number as written in the source, without a trailing {@code %}.
 * @param percent Whether the number is a percentage of the graph size.
 */
public record PopulationAmount(BigDecimal value, boolean percent) {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    /**
     * Parses {@code N} or {@code N%}.
     * @param token The source token.
     * @return The parsed amount.
     * @throws NumberFormatException if the number part is not numeric.
     */
    public static PopulationAmount parse(String token) {
        if (token.endsWith("%")) {
            return new PopulationAmount(new BigDecimal(token.substring(0, token.length() - 1)), true);
        }
        return new PopulationAmount(new BigDecimal(token), false);
    }

    /**
     * Computes the instance count without a range limit. Percentages are rounded
     * half-to-even, which is how the generated code's runtime rounds, not truncated.
     * @param graphSize The declared graph size.
     * @return The number of instances, a whole number.
     */
    public BigDecimal count(int graphSize) {
        BigDecimal count = percent
                ? value.multiply(BigDecimal.valueOf(graphSize)).divide(HUNDRED)
                : value;
        return count.setScale(0, RoundingMode.HALF_EVEN);
    }

    /**
     * @param graphSize The declared graph size.
     * @return The number of instances.
     * @throws ArithmeticException if the count does not fit an {@code int}.
     */
    public int resolve(int graphSize) {
        return count(graphSize).intValueExact();
    }
}
