package org.aasm.compiler.backend.spade;

import org.aasm.compiler.backend.code.CodeWriter;
import org.aasm.compiler.ir.Argument;
import org.aasm.compiler.ir.instruction.Arithmetic;
import org.aasm.compiler.ir.instruction.Assignment;
import org.aasm.compiler.ir.instruction.Block;
import org.aasm.compiler.ir.instruction.Clear;
import org.aasm.compiler.ir.instruction.Conditional;
import org.aasm.compiler.ir.instruction.Declaration;
import org.aasm.compiler.ir.instruction.Instruction;
import org.aasm.compiler.ir.instruction.InstructionVisitor;
import org.aasm.compiler.ir.instruction.Length;
import org.aasm.compiler.ir.instruction.ListModification;
import org.aasm.compiler.ir.instruction.Membership;
import org.aasm.compiler.ir.instruction.MessageSelection;
import org.aasm.compiler.ir.instruction.RandomDraw;
import org.aasm.compiler.ir.instruction.RemoveRandomElements;
import org.aasm.compiler.ir.instruction.Round;
import org.aasm.compiler.ir.instruction.Send;
import org.aasm.compiler.ir.instruction.Subset;

import static org.aasm.compiler.backend.spade.PythonArguments.render;

/**
 * Translates action instructions into Python statements of a SPADE behaviour method.
 * Each visit emits complete statements at the writer's current indentation.
 */
final class SpadeInstructionTranslator implements InstructionVisitor<Void> {

    private final CodeWriter out;

    SpadeInstructionTranslator(CodeWriter out) {
        this.out = out;
    }

    /**
     * Emits a block; an empty block becomes {@code ...} so that the enclosing Python suite is valid.
     * @param block The block.
     */
    void translate(Block block) {
        block.accept(this);
    }

    @Override
    public Void visitBlock(Block block) {
        if (block.isEmpty()) {
            out.line("...");
            return null;
        }
        for (Instruction instruction : block.instructions()) {
            instruction.accept(this);
        }
        return null;
    }

    @Override
    public Void visitDeclaration(Declaration declaration) {
        out.line(declaration.name() + " = " + render(declaration.value()));
        return null;
    }

    @Override
    public Void visitAssignment(Assignment assignment) {
        out.line(render(assignment.target()) + " = " + render(assignment.value()));
        return null;
    }

    @Override
    public Void visitMessageSelection(MessageSelection selection) {
        String message = render(selection.target());
        String matching = "list(filter(lambda msg: msg[\"type\"] == " + message + "[\"type\"] and msg[\"performative\"] == "
                + message + "[\"performative\"], " + render(selection.messageList()) + "))";
        out.block("if len(" + matching + "):",
                () -> out.line(message + " = copy.deepcopy(random.choice(" + matching + "))"));
        out.block("else:", () -> out.line("return"));
        return null;
    }

    @Override
    public Void visitArithmetic(Arithmetic arithmetic) {
        String target = render(arithmetic.target());
        String value = render(arithmetic.value());
        switch (arithmetic.operator()) {
            case ADD -> out.line(target + " += " + value);
            case SUBTRACT -> out.line(target + " -= " + value);
            case MULTIPLY -> out.line(target + " *= " + value);
            case DIVIDE -> {
                out.line("if " + value + " == 0: return");
                out.line(target + " /= " + value);
            }
        }
        return null;
    }

    @Override
    public Void visitRound(Round round) {
        String target = render(round.target());
        out.line(target + " = round(" + target + ")");
        return null;
    }

    @Override
    public Void visitRandomDraw(RandomDraw draw) {
        String target = render(draw.target());
        String first = render(draw.parameters().get(0));
        switch (draw.distribution()) {
            case UNIFORM -> out.line(target + " = "
                    + cast(draw, "random.uniform(" + first + ", " + render(draw.parameters().get(1)) + ")"));
            case NORMAL -> out.line(target + " = "
                    + cast(draw, "numpy.random.normal(" + first + ", " + render(draw.parameters().get(1)) + ")"));
            case EXPONENTIAL -> out.line(target + " = "
                    + cast(draw, "numpy.random.exponential(1/" + first + ")") + " if " + first + " > 0 else 0");
        }
        return null;
    }

    private static String cast(RandomDraw draw, String expression) {
        return draw.integer() ? "int(" + expression + ")" : expression;
    }

    @Override
    public Void visitConditional(Conditional conditional) {
        String header = (conditional.loop() ? "while " : "if ") + render(conditional.left()) + " "
                + conditional.comparison().symbol() + " " + render(conditional.right()) + ":";
        out.block(header, () -> translate(conditional.body()));
        return null;
    }

    @Override
    public Void visitMembership(Membership membership) {
        String header = "if " + render(membership.element()) + (membership.negated() ? " not in " : " in ")
                + render(membership.list()) + ":";
        out.block(header, () -> translate(membership.body()));
        return null;
    }

    @Override
    public Void visitListModification(ListModification modification) {
        String list = render(modification.list());
        String element = render(modification.element());
        switch (modification.operation()) {
            case ADD_IF_ABSENT -> out.line("if " + element + " not in " + list + ": " + list + ".append(" + element + ")");
            case REMOVE_IF_PRESENT -> out.line("if " + element + " in " + list + ": " + list + ".remove(" + element + ")");
        }
        return null;
    }

    @Override
    public Void visitLength(Length length) {
        out.line(render(length.result()) + " = len(" + render(length.list()) + ")");
        return null;
    }

    @Override
    public Void visitClear(Clear clear) {
        out.line(render(clear.list()) + ".clear()");
        return null;
    }

    @Override
    public Void visitSubset(Subset subset) {
        String target = render(subset.target());
        String source = render(subset.source());
        String count = render(subset.count());
        out.block("if round(" + count + ") > 0:", () -> out.line(target + " = [copy.deepcopy(elem) for elem in random.sample("
                + source + ", min(round(" + count + "), len(" + source + ")))]"));
        out.block("else:", () -> out.line(target + " = []"));
        return null;
    }

    @Override
    public Void visitRemoveRandomElements(RemoveRandomElements removal) {
        String list = render(removal.list());
        String count = render(removal.count());
        out.block("if round(" + count + ") > 0:", () -> {
            out.block("if round(" + count + ") < len(" + list + "):", () -> {
                out.line("random.shuffle(" + list + ")");
                out.line(list + " = " + list + "[:len(" + list + ") - round(" + count + ")]");
            });
            out.block("else:", () -> out.line(list + " = []"));
        });
        return null;
    }

    @Override
    public Void visitSend(Send send) {
        String receiver = render(send.receiver());
        out.line("if self.agent.logger: self.agent.logger.debug(f\"[{self.agent.jid}] Send message {send} to "
                + receiver + "\")");
        if (send.receiver().type() == Argument.ValueType.CONNECTION) {
            out.line("await self.send(self.agent.get_spade_message(" + receiver + ", send))");
            out.line("self.agent.msgSCount += 1");
        } else if (send.receiver().type() == Argument.ValueType.CONNECTION_LIST) {
            out.block("for receiver in " + receiver + ":", () -> {
                out.line("await self.send(self.agent.get_spade_message(receiver, send))");
                out.line("self.agent.msgSCount += 1");
            });
        } else {
            throw new IllegalStateException("Cannot send to " + send.receiver().type() + " " + receiver);
        }
        return null;
    }
}
