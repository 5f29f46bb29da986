package org.aasm.compiler.ir.instruction;

import org.aasm.compiler.ir.Argument;

/**
 * {@code SUBS}: assigns to the target an independent copy of a random sample of the source.
 * A count rounding to zero or less yields an empty list; the sample size is capped at the
 * source length.
 */
public record Subset(Argument target, Argument source, Argument count) implements Instruction {

    @Override
    public <R> R accept(InstructionVisitor<R> visitor) {
        return visitor.visitSubset(this);
    }
}
