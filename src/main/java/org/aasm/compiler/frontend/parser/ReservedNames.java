package org.aasm.compiler.frontend.parser;

import org.aasm.compiler.diagnostics.CompilationException;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Names the generated Python already binds, grouped by the namespace a declaration lands in.
 * A declaration reusing one of them would overwrite or shadow generated code, so it is
 * rejected. Names starting with a double underscore are reserved everywhere.
 */
public final class ReservedNames {

    private static final Set<String> KEYWORDS = Set.of(
            "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class", "continue",
            "def", "del", "elif", "else", "except", "finally", "for", "from", "global", "if", "import", "in",
            "is", "lambda", "nonlocal", "not", "or", "pass", "raise", "return", "try", "while", "with", "yield");

    /** Modules imported by the agent unit. */
    private static final Set<String> MODULES = Set.of(
            "copy", "datetime", "random", "httpx", "numpy", "orjson", "spade");

    /** Builtins called by generated statements. */
    private static final Set<String> BUILTINS = Set.of(
            "len", "round", "int", "list", "min", "filter", "str", "super", "property", "Exception");

    /** Operands with a fixed meaning inside actions. */
    private static final Set<String> OPERANDS = Set.of(
            ArgumentResolver.RECEIVED, ArgumentResolver.SEND, "connections", "msgRCount", "msgSCount", "connCount");

    /** Keys of the message dictionaries next to the body fields. */
    private static final Set<String> MESSAGE_KEYS = Set.of("type", "performative", ArgumentResolver.SENDER_FIELD);

    /** Attributes of the generated agent class and of {@code spade.agent.Agent}. */
    private static final Set<String> AGENT_MEMBERS = Set.of(
            "logger", "backup_url", "backup_period", "backup_delay", "setup", "get_json_from_spade_message",
            "get_spade_message", "BackupBehaviour", "jid", "password", "name", "verify_security", "behaviours",
            "presence", "web", "client", "loop", "container", "traces", "avatar", "stream", "message_dispatcher",
            "start", "stop", "is_alive", "add_behaviour", "remove_behaviour", "has_behaviour", "set", "get",
            "submit", "set_loop", "set_container", "dispatch", "build_avatar_url");

    /** Attributes of the generated behaviour classes and of {@code spade.behaviour}. */
    private static final Set<String> BEHAVIOUR_MEMBERS = Set.of(
            "run", "agent", "send", "receive", "kill", "is_killed", "is_done", "is_running", "exit_code",
            "on_start", "on_end", "template", "set_agent", "set_template", "match", "set", "get", "start",
            "join", "done", "mailbox_size", "enqueue", "queue", "presence", "web", "period", "start_at",
            "timeout", "http_client");

    /** Names bound by generated statements of an action method. */
    private static final Set<String> ACTION_SCOPE = Set.of("self", "receiver", "msg", "elem");

    /**
     * Where a declared name ends up in the generated code.
     */
    public enum Namespace {
        /** Module-level agent classes. */
        AGENT(MODULES, BUILTINS),
        /** Keys of the outgoing and received message dictionaries. */
        MESSAGE_FIELD(MESSAGE_KEYS),
        /** Attributes of the agent instance. */
        AGENT_FIELD(AGENT_MEMBERS, OPERANDS),
        /** Operands that resolve to enum literals. */
        ENUM_VALUE(OPERANDS),
        /** Behaviour classes nested in the agent class. */
        BEHAVIOUR(AGENT_MEMBERS, OPERANDS),
        /** Methods of a behaviour class. */
        ACTION(BEHAVIOUR_MEMBERS),
        /** Local variables of an action method. */
        LOCAL(MODULES, BUILTINS, OPERANDS, ACTION_SCOPE);

        private final Set<String> names;

        @SafeVarargs
        Namespace(Set<String>... groups) {
            Set<String> all = new HashSet<>(KEYWORDS);
            List.of(groups).forEach(all::addAll);
            this.names = Set.copyOf(all);
        }

        public boolean isReserved(String name) {
            return name.startsWith("__") || names.contains(name);
        }
    }

    private ReservedNames() {
    }

    /**
     * Rejects a name the generated code already uses in the given namespace.
     * @param name      The declared name.
     * @param namespace Where the name is emitted.
     * @param context   The parsing context, used to position the error.
     * @throws CompilationException if the name is reserved.
     */
    public static void require(String name, Namespace namespace, ParsingContext context) throws CompilationException {
        context.require(!namespace.isReserved(name), "Reserved name: " + name,
                "'" + name + "' is already used by the generated code, choose another name");
    }
}
