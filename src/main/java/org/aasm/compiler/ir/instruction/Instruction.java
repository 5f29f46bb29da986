package org.aasm.compiler.ir.instruction;

/**
 * One primitive operation inside an action.
 * <p>
 * Every variant is a record listed in the {@code permits} clause and has a matching
 * method in {@link InstructionVisitor}, so adding a variant forces every translator
 * to handle it.
 */
public sealed interface Instruction
        permits Block, Declaration, Assignment, MessageSelection, Arithmetic, Round, RandomDraw,
        Conditional, Membership, ListModification, Length, Clear, Subset, RemoveRandomElements, Send {

    /**
     * Dispatches to the visitor method of this variant.
     * @param visitor The visitor.
     * @param <R>     The visitor result type.
     * @return The visitor result.
     */
    <R> R accept(InstructionVisitor<R> visitor);
}
