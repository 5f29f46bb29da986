package org.aasm.compiler.frontend.parser;

import org.aasm.compiler.diagnostics.CompilationException;
import org.aasm.compiler.diagnostics.Diagnostic;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.aasm.compiler.frontend.parser.ParserTestSupport.failure;
import static org.aasm.compiler.frontend.parser.ParserTestSupport.parse;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests that declarations cannot take names the generated Python already binds.
 */
@Tag("unit")
class ReservedNamesTest {

    @ParameterizedTest
    @ValueSource(strings = {"random", "spade", "len", "class", "__init__"})
    void agentNamesMustNotShadowModuleLevelNames(String name) {
        Diagnostic diagnostic = failure("AGENT " + name);

        assertThat(diagnostic.reason()).isEqualTo("Reserved name: " + name);
        assertThat(diagnostic.line()).isEqualTo(1);
    }

    @ParameterizedTest
    @ValueSource(strings = {"type", "performative", "sender", "if"})
    void messageFieldsMustNotOverwriteRoutingKeys(String name) {
        Diagnostic diagnostic = failure("MESSAGE m, inform", "    PRM " + name + ", float");

        assertThat(diagnostic.reason()).isEqualTo("Reserved name: " + name);
        assertThat(diagnostic.line()).isEqualTo(2);
    }

    @ParameterizedTest
    @ValueSource(strings = {"setup", "jid", "logger", "backup_url", "BackupBehaviour", "if", "while", "msgRCount"})
    void agentFieldsMustNotReplaceAgentMembers(String name) {
        assertThat(failure("AGENT A", "PRM " + name + ", float, init, 1").reason())
                .isEqualTo("Reserved name: " + name);
    }

    @Test
    void enumValuesMustNotShadowOperands() {
        assertThat(failure("AGENT A", "PRM mood, enum, rcv, 1, calm, 1").reason()).isEqualTo("Reserved name: rcv");
    }

    @ParameterizedTest
    @ValueSource(strings = {"BackupBehaviour", "setup", "start", "add_behaviour", "def"})
    void behaviourNamesMustNotReplaceAgentMembers(String name) {
        assertThat(failure("AGENT A", "BEHAV " + name + ", setup").reason()).isEqualTo("Reserved name: " + name);
    }

    @Test
    @DisplayName("Fields and behaviours of an agent share one attribute namespace")
    void fieldsAndBehavioursMustNotCollide() {
        assertThat(failure("AGENT A", "PRM work, float, init, 1", "BEHAV work, setup").reason())
                .isEqualTo("Name already used by a field: work");
        assertThat(failure("AGENT A", "BEHAV work, setup", "EBEHAV", "PRM work, float, init, 1").reason())
                .isEqualTo("Name already used by a behaviour: work");
    }

    @ParameterizedTest
    @ValueSource(strings = {"run", "send", "receive", "agent", "__init__", "on_start", "return"})
    void actionNamesMustNotReplaceBehaviourMembers(String name) {
        Diagnostic diagnostic = failure("AGENT A", "BEHAV b, setup", "ACTION " + name + ", modify_self");

        assertThat(diagnostic.reason()).isEqualTo("Reserved name: " + name);
        assertThat(diagnostic.line()).isEqualTo(3);
    }

    @ParameterizedTest
    @ValueSource(strings = {"random", "numpy", "copy", "len", "round", "int", "list", "min", "filter",
            "msg", "elem", "receiver", "self", "rcv", "for"})
    void localsMustNotShadowNamesOfGeneratedStatements(String name) {
        Diagnostic diagnostic = failure(
                "AGENT A",
                "    PRM x, float, init, 0",
                "    BEHAV b, setup",
                "        ACTION a, modify_self",
                "            DECL " + name + ", 1");

        assertThat(diagnostic.reason()).isEqualTo("Reserved name: " + name);
        assertThat(diagnostic.line()).isEqualTo(5);
    }

    @Test
    void namesReservedInOneNamespaceAreFreeInAnother() throws CompilationException {
        parse(
                "MESSAGE m, inform",
                "    PRM run, float",
                "EMESSAGE",
                "AGENT A",
                "    PRM receiver, float, init, 0",
                "    BEHAV b, setup",
                "        ACTION setup_done, modify_self",
                "            DECL jid, 1",
                "        EACTION",
                "    EBEHAV",
                "EAGENT");
    }
}
