package org.aasm.compiler.ir.instruction;

/**
 * Exhaustive dispatch over the {@link Instruction} variants.
 *
 * @param <R> The result type.
 */
public interface InstructionVisitor<R> {

    R visitBlock(Block block);

    R visitDeclaration(Declaration declaration);

    R visitAssignment(Assignment assignment);

    R visitMessageSelection(MessageSelection selection);

    R visitArithmetic(Arithmetic arithmetic);

    R visitRound(Round round);

    R visitRandomDraw(RandomDraw draw);

    R visitConditional(Conditional conditional);

    R visitMembership(Membership membership);

    R visitListModification(ListModification modification);

    R visitLength(Length length);

    R visitClear(Clear clear);

    R visitSubset(Subset subset);

    R visitRemoveRandomElements(RemoveRandomElements removal);

    R visitSend(Send send);
}
