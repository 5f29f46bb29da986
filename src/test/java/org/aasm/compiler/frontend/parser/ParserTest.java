package org.aasm.compiler.frontend.parser;

import org.aasm.compiler.diagnostics.CompilationException;
import org.aasm.compiler.diagnostics.Diagnostic;
import org.aasm.compiler.ir.Action;
import org.aasm.compiler.ir.Agent;
import org.aasm.compiler.ir.AgentParameter;
import org.aasm.compiler.ir.Behaviour;
import org.aasm.compiler.ir.Message;
import org.aasm.compiler.ir.Program;
import org.aasm.compiler.ir.instruction.Arithmetic;
import org.aasm.compiler.ir.instruction.Assignment;
import org.aasm.compiler.ir.instruction.Conditional;
import org.aasm.compiler.ir.instruction.ListModification;
import org.aasm.compiler.ir.instruction.RandomDraw;
import org.aasm.compiler.ir.instruction.Send;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.aasm.compiler.frontend.parser.ParserTestSupport.failure;
import static org.aasm.compiler.frontend.parser.ParserTestSupport.parse;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests the parsing state machine on whole programs: nesting, uniqueness and closing rules.
 */
@Tag("unit")
class ParserTest {

    private static final String[] TRADERS = {
            "MESSAGE offer, request",
            "    PRM price, float",
            "EMESSAGE",
            "AGENT Trader",
            "    PRM money, float, init, 100",
            "    PRM mood, enum, happy, 70, sad, 30",
            "    PRM friends, list, conn",
            "    PRM inbox, list, msg",
            "    BEHAV boot, setup",
            "        ACTION init, modify_self",
            "            RAND money, float, uniform, 0, 10",
            "        EACTION",
            "    EBEHAV",
            "    BEHAV ask, cyclic, 5",
            "        ACTION send_offer, send_msg, offer, request",
            "            SET send.price, money",
            "            SEND friends",
            "        EACTION",
            "    EBEHAV",
            "    BEHAV listen, msg_rcv, offer, request",
            "        ACTION accept, modify_self",
            "            IGT rcv.price, 10",
            "                ADD money, rcv.price",
            "                SET mood, happy",
            "            EBLOCK",
            "            ADDE friends, rcv.sender",
            "        EACTION",
            "    EBEHAV",
            "EAGENT",
            "GRAPH statistical",
            "    SIZE 10",
            "    DEFG Trader, 100%, 2",
            "EGRAPH"
    };

    @Test
    @DisplayName("A complete program is parsed into agents, messages and a graph")
    void parsesCompleteProgram() throws CompilationException {
        // Act
        Program program = parse(TRADERS);

        // Assert
        assertThat(program.messages()).containsExactly(new Message("offer", "request", List.of("price")));
        assertThat(program.agents()).hasSize(1);
        assertThat(program.graph()).isPresent();

        Agent trader = program.agents().get(0);
        assertThat(trader.name()).isEqualTo("Trader");
        assertThat(trader.parameters().keySet()).containsExactly("money", "mood", "friends", "inbox");
        assertThat(trader.parameters().get("money")).isEqualTo(new AgentParameter.InitFloat("money", "100"));
        assertThat(trader.floatParamNames()).containsExactly("money");
        assertThat(trader.setupBehaviours()).containsOnlyKeys("boot");
        assertThat(trader.cyclicBehaviours().get("ask").period()).isEqualTo("5");
        assertThat(trader.oneTimeBehaviours()).isEmpty();
        assertThat(trader.messageReceivedBehaviours()).containsOnlyKeys("listen");
    }

    @Test
    void buildsInstructionTrees() throws CompilationException {
        Agent trader = parse(TRADERS).agents().get(0);

        Action init = trader.setupBehaviours().get("boot").actions().get("init");
        assertThat(init).isInstanceOf(Action.ModifySelf.class);
        assertThat(init.body().instructions()).singleElement().isInstanceOf(RandomDraw.class);

        Action send = trader.cyclicBehaviours().get("ask").actions().get("send_offer");
        assertThat(send).isInstanceOf(Action.SendMessage.class);
        assertThat(send.body().instructions()).hasSize(2);
        assertThat(send.body().instructions().get(0)).isInstanceOf(Assignment.class);
        assertThat(send.body().instructions().get(1)).isInstanceOf(Send.class);

        Action accept = trader.messageReceivedBehaviours().get("listen").actions().get("accept");
        assertThat(accept.body().instructions()).hasSize(2);
        Conditional conditional = (Conditional) accept.body().instructions().get(0);
        assertThat(conditional.comparison()).isEqualTo(Conditional.Comparison.GREATER);
        assertThat(conditional.loop()).isFalse();
        assertThat(conditional.body().instructions())
                .hasExactlyElementsOfTypes(Arithmetic.class, Assignment.class);
        assertThat(accept.body().instructions().get(1)).isInstanceOf(ListModification.class);
    }

    @Test
    void usageSitesHoldCopiesOfMessageTemplates() throws CompilationException {
        Program program = parse(TRADERS);
        Message template = program.messages().get(0);
        Agent trader = program.agents().get(0);

        Behaviour.MessageReceived listen = trader.messageReceivedBehaviours().get("listen");
        Action.SendMessage send = (Action.SendMessage) trader.cyclicBehaviours().get("ask").actions().get("send_offer");

        assertThat(listen.receivedMessage()).isEqualTo(template).isNotSameAs(template);
        assertThat(send.sendMessage()).isEqualTo(template).isNotSameAs(template);
        assertThat(send.sendMessage()).isNotSameAs(listen.receivedMessage());
    }

    @Test
    void emptySourceGivesEmptyProgram() throws CompilationException {
        Program program = parse("# nothing here", "");

        assertThat(program.agents()).isEmpty();
        assertThat(program.messages()).isEmpty();
        assertThat(program.graph()).isEmpty();
    }

    @Test
    void opcodesAreCaseInsensitive() throws CompilationException {
        Program program = parse("agent A", "prm x, float, init, 1", "eagent");

        assertThat(program.agents().get(0).parameters()).containsOnlyKeys("x");
    }

    @Test
    void unknownOpcodeIsRejected() {
        Diagnostic diagnostic = failure("AGENT A", "JUMP x", "EAGENT");

        assertThat(diagnostic.reason()).isEqualTo("Unknown tokens: [JUMP, x]");
        assertThat(diagnostic.line()).isEqualTo(2);
    }

    @Test
    void wrongArityIsRejected() {
        Diagnostic diagnostic = failure("AGENT A, B");

        assertThat(diagnostic.reason()).isEqualTo("Unknown tokens: [AGENT, A, B]");
    }

    @Test
    void missingEagentIsReportedAtTheLastLine() {
        Diagnostic diagnostic = failure("AGENT A", "    PRM x, float, init, 1", "", "# end");

        assertThat(diagnostic.reason()).isEqualTo("Missing EAGENT");
        assertThat(diagnostic.suggestion()).isEqualTo("Close agent 'A' with EAGENT");
        assertThat(diagnostic.line()).isEqualTo(2);
    }

    @Test
    void missingCloseReportsTheInnermostConstruct() {
        assertThat(failure("MESSAGE m, p").reason()).isEqualTo("Missing EMESSAGE");
        assertThat(failure("AGENT A", "BEHAV b, setup").reason()).isEqualTo("Missing EBEHAV");
        assertThat(failure("AGENT A", "BEHAV b, setup", "ACTION a, modify_self").reason())
                .isEqualTo("Missing EACTION");
        assertThat(failure("GRAPH matrix").reason()).isEqualTo("Missing EGRAPH");
    }

    @Test
    void closingWithoutOpeningIsRejected() {
        assertThat(failure("EAGENT").reason()).isEqualTo("EAGENT without matching AGENT");
        assertThat(failure("AGENT A", "EMESSAGE").reason()).isEqualTo("EMESSAGE without matching MESSAGE");
    }

    @Test
    void blockMustBeClosedBeforeTheAction() {
        Diagnostic diagnostic = failure(
                "AGENT A",
                "PRM x, float, init, 1",
                "BEHAV b, setup",
                "ACTION a, modify_self",
                "IEQ x, 1",
                "EACTION");

        assertThat(diagnostic.reason()).isEqualTo("EACTION while block 'IEQ' is still open");
        assertThat(diagnostic.suggestion()).isEqualTo("Close it with EBLOCK");
        assertThat(diagnostic.line()).isEqualTo(6);
    }

    @Test
    void constructsMustBeNestedCorrectly() {
        assertThat(failure("PRM x, float, init, 1").reason()).isEqualTo("PRM is not allowed at top level");
        assertThat(failure("AGENT A", "AGENT B").reason()).isEqualTo("AGENT cannot be nested in agent 'A'");
        assertThat(failure("AGENT A", "MESSAGE m, p").reason()).isEqualTo("MESSAGE cannot be nested in agent 'A'");
        assertThat(failure("AGENT A", "ACTION a, modify_self").reason())
                .isEqualTo("ACTION is not allowed in agent 'A'");
        assertThat(failure("AGENT A", "BEHAV b, setup", "PRM x, float, init, 1").reason())
                .isEqualTo("PRM is not allowed in behaviour 'b'");
        assertThat(failure("AGENT A", "BEHAV b, setup", "ADD x, 1").reason())
                .isEqualTo("ADD is not allowed in behaviour 'b'");
    }

    @Test
    void duplicateDeclarationsAreRejected() {
        assertThat(failure("AGENT A", "EAGENT", "AGENT A", "EAGENT").reason()).isEqualTo("Agent already defined: A");
        assertThat(failure("MESSAGE m, p", "PRM x, float", "PRM x, float").reason())
                .isEqualTo("Message field already defined: x");
        assertThat(failure("AGENT A", "PRM x, float, init, 1", "PRM x, list, conn").reason())
                .isEqualTo("Parameter already defined: x");
        assertThat(failure("AGENT A", "BEHAV b, setup", "EBEHAV", "BEHAV b, cyclic, 1").reason())
                .isEqualTo("Behaviour already defined: b");
        assertThat(failure("AGENT A", "BEHAV b, setup",
                "ACTION a, modify_self", "EACTION", "ACTION a, modify_self").reason())
                .isEqualTo("Action already defined: a");
    }

    @Test
    @DisplayName("Redeclaring a message replaces the template for later uses only")
    void redeclaredMessageReplacesTheTemplate() throws CompilationException {
        // Arrange
        String[] source = {
                "MESSAGE m, inform",
                "    PRM old, float",
                "EMESSAGE",
                "AGENT A",
                "    BEHAV early, msg_rcv, m, inform",
                "    EBEHAV",
                "EAGENT",
                "MESSAGE m, inform",
                "    PRM fresh, float",
                "EMESSAGE",
                "AGENT B",
                "    BEHAV late, msg_rcv, m, inform",
                "    EBEHAV",
                "EAGENT"
        };

        // Act
        Program program = parse(source);

        // Assert
        assertThat(program.messages()).containsExactly(new Message("m", "inform", List.of("fresh")));
        assertThat(program.agents().get(0).messageReceivedBehaviours().get("early").receivedMessage().floatParams())
                .containsExactly("old");
        assertThat(program.agents().get(1).messageReceivedBehaviours().get("late").receivedMessage().floatParams())
                .containsExactly("fresh");
    }

    @Test
    void sameMessageTypeWithAnotherPerformativeIsAllowed() throws CompilationException {
        Program program = parse("MESSAGE m, request", "EMESSAGE", "MESSAGE m, inform", "EMESSAGE");

        assertThat(program.messages()).extracting(Message::performative).containsExactly("request", "inform");
    }

    @Test
    void parameterCategoriesAreValidated() {
        assertThat(failure("AGENT A", "PRM x, float, dist, normal, 1, -2").reason())
                .isEqualTo("Standard deviation must not be negative: -2");
        assertThat(failure("AGENT A", "PRM x, float, dist, exp, 0").reason())
                .isEqualTo("Lambda must be positive: 0");
        assertThat(failure("AGENT A", "PRM x, enum, a, 1, b").reason())
                .isEqualTo("Enum values must come in (value, weight) pairs");
        assertThat(failure("AGENT A", "PRM x, enum, a, 1, a, 2").reason())
                .isEqualTo("Enum value already defined: a");
        assertThat(failure("AGENT A", "PRM x, list, float").reason())
                .isEqualTo("Invalid list parameter definition");
        assertThat(failure("AGENT A", "PRM x, set, conn").reason())
                .isEqualTo("Unknown parameter category: set");
        assertThat(failure("AGENT A", "PRM connections, list, conn").reason())
                .isEqualTo("Reserved name: connections");
    }

    @Test
    void behaviourKindsAreValidated() {
        assertThat(failure("AGENT A", "BEHAV b, cyclic, 0").reason()).isEqualTo("Period must be positive: 0");
        assertThat(failure("AGENT A", "BEHAV b, one_time, -1").reason()).isEqualTo("Delay must not be negative: -1");
        assertThat(failure("AGENT A", "BEHAV b, setup, 5").reason()).isEqualTo("Wrong number of arguments for BEHAV");
        assertThat(failure("AGENT A", "BEHAV b, periodic, 5").reason()).isEqualTo("Unknown behaviour category: periodic");
        assertThat(failure("AGENT A", "BEHAV b, msg_rcv, m, p").reason()).isEqualTo("Message not defined: m/p");
    }

    @Test
    void errorsInsideMacrosPointAtTheInvocation() {
        Diagnostic diagnostic = failure(
                ".MACRO PAY amount",
                "ADD money, amount",
                ".ENDM",
                "AGENT A",
                "BEHAV b, setup",
                "ACTION a, modify_self",
                "PAY 5",
                "EACTION");

        assertThat(diagnostic.reason()).isEqualTo("Unknown argument: money");
        assertThat(diagnostic.line()).isEqualTo(7);
        assertThat(diagnostic.directive()).isEqualTo("macro PAY");
    }
}
