package org.aasm.compiler.frontend.parser.features.instruction;

import org.aasm.compiler.diagnostics.CompilationException;
import org.aasm.compiler.ir.Agent;
import org.aasm.compiler.ir.Argument;
import org.aasm.compiler.ir.Argument.Origin;
import org.aasm.compiler.ir.Argument.ValueType;
import org.aasm.compiler.ir.Behaviour;
import org.aasm.compiler.ir.instruction.Arithmetic;
import org.aasm.compiler.ir.instruction.Assignment;
import org.aasm.compiler.ir.instruction.Clear;
import org.aasm.compiler.ir.instruction.Conditional;
import org.aasm.compiler.ir.instruction.Declaration;
import org.aasm.compiler.ir.instruction.Instruction;
import org.aasm.compiler.ir.instruction.Length;
import org.aasm.compiler.ir.instruction.ListModification;
import org.aasm.compiler.ir.instruction.Membership;
import org.aasm.compiler.ir.instruction.MessageSelection;
import org.aasm.compiler.ir.instruction.RandomDraw;
import org.aasm.compiler.ir.instruction.RemoveRandomElements;
import org.aasm.compiler.ir.instruction.Round;
import org.aasm.compiler.ir.instruction.Subset;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.aasm.compiler.frontend.parser.ParserTestSupport.failure;
import static org.aasm.compiler.frontend.parser.ParserTestSupport.parse;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests operand resolution and type checks of the instruction handlers.
 * Every snippet runs inside action {@code act} of behaviour {@code beh} of an agent with a fixed set of fields.
 */
@Tag("unit")
class InstructionParsingTest {

    private static final List<String> DECLARATIONS = List.of(
            "MESSAGE offer, request",
            "PRM price, float",
            "EMESSAGE",
            "AGENT Trader",
            "PRM money, float, init, 100",
            "PRM mood, enum, happy, 1, sad, 1",
            "PRM wealth, enum, rich, 1, poor, 1",
            "PRM friends, list, conn",
            "PRM inbox, list, msg");

    private static String[] program(String behaviourHeader, String actionHeader, String... body) {
        List<String> lines = new ArrayList<>(DECLARATIONS);
        lines.add(behaviourHeader);
        lines.add(actionHeader);
        lines.addAll(Arrays.asList(body));
        lines.add("EACTION");
        lines.add("EBEHAV");
        lines.add("EAGENT");
        return lines.toArray(new String[0]);
    }

    private static String[] modifySelf(String... body) {
        return program("BEHAV beh, cyclic, 1", "ACTION act, modify_self", body);
    }

    private static String[] sendMessage(String... body) {
        return program("BEHAV beh, cyclic, 1", "ACTION act, send_msg, offer, request", body);
    }

    private static String[] onReceive(String... body) {
        return program("BEHAV beh, msg_rcv, offer, request", "ACTION act, modify_self", body);
    }

    private static List<Instruction> instructions(String... lines) throws CompilationException {
        Agent agent = parse(lines).agents().get(0);
        Behaviour behaviour = agent.cyclicBehaviours().containsKey("beh")
                ? agent.cyclicBehaviours().get("beh")
                : agent.messageReceivedBehaviours().get("beh");
        return behaviour.actions().get("act").body().instructions();
    }

    @Test
    void resolvesOperandOrigins() throws CompilationException {
        List<Instruction> body = instructions(onReceive(
                "DECL total, rcv.price",
                "ADD total, 2.5",
                "ADD money, total",
                "SET mood, sad"));

        Declaration declaration = (Declaration) body.get(0);
        assertThat(declaration.value()).isEqualTo(
                new Argument("rcv.price", Origin.RECEIVED_MESSAGE_PARAM, ValueType.FLOAT, false));

        Arithmetic addLiteral = (Arithmetic) body.get(1);
        assertThat(addLiteral.target()).isEqualTo(new Argument("total", Origin.LOCAL, ValueType.FLOAT, true));
        assertThat(addLiteral.value()).isEqualTo(new Argument("2.5", Origin.LITERAL, ValueType.FLOAT, false));

        Arithmetic addLocal = (Arithmetic) body.get(2);
        assertThat(addLocal.target().origin()).isEqualTo(Origin.AGENT_PARAM);
        assertThat(addLocal.value().origin()).isEqualTo(Origin.LOCAL);

        Assignment assignment = (Assignment) body.get(3);
        assertThat(assignment.value()).isEqualTo(new Argument("sad", Origin.ENUM_VALUE, ValueType.ENUM, false));
    }

    @Test
    void builtInFieldsAreAvailable() throws CompilationException {
        List<Instruction> body = instructions(modifySelf(
                "ADD msgRCount, 1",
                "LEN money, connections",
                "SET money, connCount"));

        assertThat(((Arithmetic) body.get(0)).target().type()).isEqualTo(ValueType.FLOAT);
        assertThat(((Length) body.get(1)).list().type()).isEqualTo(ValueType.CONNECTION_LIST);
        assertThat(((Assignment) body.get(2)).value().mutable()).isFalse();
    }

    @Test
    void connCountIsReadOnly() {
        assertThat(failure(modifySelf("ADD connCount, 1")).reason()).isEqualTo("Cannot modify 'connCount'");
    }

    @Test
    void literalsAndEnumValuesCannotBeModified() {
        assertThat(failure(modifySelf("ROUND 5")).reason()).isEqualTo("Cannot modify '5'");
        assertThat(failure(onReceive("SET rcv.price, 1")).reason()).isEqualTo("Cannot modify 'rcv.price'");
    }

    @Test
    void operandTypesAreChecked() {
        assertThat(failure(modifySelf("ADD mood, 1")).reason())
                .isEqualTo("Invalid argument 'mood': expected float, got enum");
        assertThat(failure(modifySelf("IGT mood, 1")).reason())
                .isEqualTo("Invalid argument 'mood': expected float, got enum");
        assertThat(failure(modifySelf("ADDE friends, money")).reason())
                .isEqualTo("Invalid argument 'money': expected connection, got float");
        assertThat(failure(modifySelf("SET money, mood")).reason())
                .isEqualTo("Mismatched arguments 'money' (float) and 'mood' (enum)");
    }

    @Test
    void enumValuesMustBelongToTheField() {
        assertThat(failure(modifySelf("SET mood, rich")).reason())
                .isEqualTo("'rich' is not a value of enum 'mood'");
        assertThat(failure(modifySelf("IEQ wealth, happy", "EBLOCK")).reason())
                .isEqualTo("'happy' is not a value of enum 'wealth'");
    }

    @Test
    void unknownArgumentIsRejected() {
        assertThat(failure(modifySelf("ADD money, salary")).reason()).isEqualTo("Unknown argument: salary");
    }

    @Test
    void receivedMessageOnlyInsideMessageReceivedBehaviours() {
        assertThat(failure(modifySelf("ADD money, rcv.price")).reason())
                .isEqualTo("'rcv.price' is only available in msg_rcv behaviours");
        assertThat(failure(onReceive("ADD money, rcv.volume")).reason())
                .isEqualTo("Message offer/request has no field 'volume'");
    }

    @Test
    void outgoingMessageOnlyInsideSendActions() {
        assertThat(failure(modifySelf("SET send.price, 1")).reason())
                .isEqualTo("'send.price' is only available in send_msg actions");
        assertThat(failure(modifySelf("SEND friends")).reason())
                .isEqualTo("SEND is only allowed in send_msg actions");
    }

    @Test
    void setSendSelectsFromMessageList() throws CompilationException {
        List<Instruction> body = instructions(sendMessage("SET send, inbox", "SEND friends"));

        assertThat(body.get(0)).isInstanceOf(MessageSelection.class);
        MessageSelection selection = (MessageSelection) body.get(0);
        assertThat(selection.target().origin()).isEqualTo(Origin.SEND_MESSAGE);
        assertThat(selection.messageList().expr()).isEqualTo("inbox");
    }

    @Test
    void setSendRequiresMessageList() {
        assertThat(failure(sendMessage("SET send, friends")).reason())
                .isEqualTo("Invalid argument 'friends': expected message list, got connection list");
    }

    @Test
    void localsOutliveTheirBlock() throws CompilationException {
        List<Instruction> body = instructions(modifySelf(
                "IGT money, 10",
                "    DECL bonus, 5",
                "EBLOCK",
                "ADD money, bonus"));

        assertThat(body).hasExactlyElementsOfTypes(Conditional.class, Arithmetic.class);
        assertThat(((Arithmetic) body.get(1)).value().origin()).isEqualTo(Origin.LOCAL);
    }

    @Test
    void localsAreScopedToTheirAction() {
        String[] lines = program("BEHAV beh, cyclic, 1", "ACTION first, modify_self",
                "DECL bonus, 5",
                "EACTION",
                "ACTION act, modify_self",
                "ADD money, bonus");

        assertThat(failure(lines).reason()).isEqualTo("Unknown argument: bonus");
    }

    @Test
    void declarationsMustNotClash() {
        assertThat(failure(modifySelf("DECL x, 1", "DECL x, 2")).reason()).isEqualTo("Local already declared: x");
        assertThat(failure(modifySelf("DECL money, 1")).reason()).isEqualTo("Name already used by the agent: money");
        assertThat(failure(modifySelf("DECL happy, 1")).reason()).isEqualTo("Name already used by the agent: happy");
        assertThat(failure(modifySelf("DECL self, 1")).reason()).isEqualTo("Reserved name: self");
        assertThat(failure(modifySelf("DECL all, friends")).reason())
                .isEqualTo("Invalid argument 'friends': expected float or enum or connection, got connection list");
    }

    @Test
    void localTakesTheTypeOfItsValue() throws CompilationException {
        List<Instruction> body = instructions(onReceive("DECL peer, rcv.sender", "ADDE friends, peer"));

        ListModification modification = (ListModification) body.get(1);
        assertThat(modification.element()).isEqualTo(new Argument("peer", Origin.LOCAL, ValueType.CONNECTION, true));
        assertThat(modification.operation()).isEqualTo(ListModification.Operation.ADD_IF_ABSENT);
    }

    @Test
    void comparisonOpcodesMapToConditionalsAndLoops() throws CompilationException {
        List<Instruction> body = instructions(modifySelf(
                "WLT money, 10",
                "    ADD money, 1",
                "EBLOCK",
                "INEQ mood, happy",
                "EBLOCK",
                "IGTEQ money, 3",
                "    WEQ mood, sad",
                "        SET mood, happy",
                "    EBLOCK",
                "EBLOCK"));

        Conditional loop = (Conditional) body.get(0);
        assertThat(loop.loop()).isTrue();
        assertThat(loop.comparison()).isEqualTo(Conditional.Comparison.LESS);
        assertThat(loop.body().instructions()).hasSize(1);

        Conditional notEqual = (Conditional) body.get(1);
        assertThat(notEqual.loop()).isFalse();
        assertThat(notEqual.comparison()).isEqualTo(Conditional.Comparison.NOT_EQUAL);
        assertThat(notEqual.body().instructions()).isEmpty();

        Conditional outer = (Conditional) body.get(2);
        assertThat(outer.comparison()).isEqualTo(Conditional.Comparison.GREATER_OR_EQUAL);
        Conditional inner = (Conditional) outer.body().instructions().get(0);
        assertThat(inner.loop()).isTrue();
        assertThat(inner.body().instructions()).singleElement().isInstanceOf(Assignment.class);
    }

    @Test
    void membershipOpensABlock() throws CompilationException {
        List<Instruction> body = instructions(onReceive(
                "NIN friends, rcv.sender",
                "    ADDE friends, rcv.sender",
                "EBLOCK"));

        Membership membership = (Membership) body.get(0);
        assertThat(membership.negated()).isTrue();
        assertThat(membership.body().instructions()).hasSize(1);
    }

    @Test
    void strayEblockIsRejected() {
        assertThat(failure(modifySelf("EBLOCK")).reason()).isEqualTo("EBLOCK without matching a conditional block");
    }

    @Test
    void listOperations() throws CompilationException {
        List<Instruction> body = instructions(onReceive(
                "DECL n, 2",
                "SUBS friends, connections, n",
                "REMEN friends, 1",
                "REME friends, rcv.sender",
                "CLR inbox",
                "LEN n, inbox"));

        assertThat(body).hasExactlyElementsOfTypes(Declaration.class, Subset.class, RemoveRandomElements.class,
                ListModification.class, Clear.class, Length.class);
        assertThat(((ListModification) body.get(3)).operation())
                .isEqualTo(ListModification.Operation.REMOVE_IF_PRESENT);
    }

    @Test
    void listOperationsAreTypeChecked() {
        assertThat(failure(modifySelf("SUBS friends, inbox, 1")).reason())
                .isEqualTo("Invalid argument 'inbox': expected connection list, got message list");
        assertThat(failure(modifySelf("CLR money")).reason())
                .isEqualTo("Invalid argument 'money': expected connection list or message list, got float");
        assertThat(failure(modifySelf("REMEN friends, mood")).reason())
                .isEqualTo("Invalid argument 'mood': expected float, got enum");
    }

    @Test
    void randomDraws() throws CompilationException {
        List<Instruction> body = instructions(modifySelf(
                "RAND money, int, uniform, 1, 6",
                "RAND money, float, normal, 0, 1",
                "RAND money, float, exp, 2"));

        RandomDraw uniform = (RandomDraw) body.get(0);
        assertThat(uniform.integer()).isTrue();
        assertThat(uniform.distribution()).isEqualTo(RandomDraw.Distribution.UNIFORM);
        assertThat(uniform.parameters()).extracting(Argument::expr).containsExactly("1", "6");
        assertThat(((RandomDraw) body.get(1)).distribution()).isEqualTo(RandomDraw.Distribution.NORMAL);
        assertThat(((RandomDraw) body.get(2)).parameters()).hasSize(1);
    }

    @Test
    void randomDrawsAreValidated() {
        assertThat(failure(modifySelf("RAND money, double, uniform, 1, 6")).reason()).isEqualTo("Unknown cast: double");
        assertThat(failure(modifySelf("RAND money, float, poisson, 1")).reason())
                .isEqualTo("Unknown distribution: poisson");
        assertThat(failure(modifySelf("RAND money, float, normal, 1")).reason())
                .isEqualTo("Distribution normal expects 2 parameters, got 1");
        assertThat(failure(modifySelf("RAND money, float, exp")).reason())
                .isEqualTo("Unknown tokens: [RAND, money, float, exp]");
    }

    @Test
    void roundTargetsAFloat() throws CompilationException {
        List<Instruction> body = instructions(modifySelf("ROUND money"));

        assertThat(body).singleElement().isEqualTo(
                new Round(new Argument("money", Origin.AGENT_PARAM, ValueType.FLOAT, true)));
    }
}
