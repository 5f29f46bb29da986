package org.aasm.compiler.frontend.parser.context;

import org.aasm.compiler.ir.Action;
import org.aasm.compiler.ir.Behaviour;
import org.aasm.compiler.ir.Message;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Collects the actions of the behaviour between {@code BEHAV} and {@code EBEHAV}.
 */
public final class BehaviourBuilder implements ContextFrame {

    /**
     * The trigger kinds with their DSL keyword.
     */
    public enum Kind {
        SETUP("setup"),
        ONE_TIME("one_time"),
        CYCLIC("cyclic"),
        MESSAGE_RECEIVED("msg_rcv");

        private final String keyword;

        Kind(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }

        /**
         * @param keyword A category token.
         * @return The matching kind, or empty.
         */
        public static Optional<Kind> fromKeyword(String keyword) {
            for (Kind kind : values()) {
                if (kind.keyword.equals(keyword)) {
                    return Optional.of(kind);
                }
            }
            return Optional.empty();
        }
    }

    private final String name;
    private final Kind kind;
    private final String schedule;
    private final Message receivedMessage;
    private final Map<String, Action> actions = new LinkedHashMap<>();

    private BehaviourBuilder(String name, Kind kind, String schedule, Message receivedMessage) {
        this.name = name;
        this.kind = kind;
        this.schedule = schedule;
        this.receivedMessage = receivedMessage;
    }

    public static BehaviourBuilder setup(String name) {
        return new BehaviourBuilder(name, Kind.SETUP, null, null);
    }

    public static BehaviourBuilder oneTime(String name, String delay) {
        return new BehaviourBuilder(name, Kind.ONE_TIME, delay, null);
    }

    public static BehaviourBuilder cyclic(String name, String period) {
        return new BehaviourBuilder(name, Kind.CYCLIC, period, null);
    }

    public static BehaviourBuilder messageReceived(String name, Message receivedMessage) {
        return new BehaviourBuilder(name, Kind.MESSAGE_RECEIVED, null, receivedMessage);
    }

    public String name() {
        return name;
    }

    public Kind kind() {
        return kind;
    }

    /**
     * @return The message that triggers this behaviour, empty unless it is a message-received behaviour.
     */
    public Optional<Message> receivedMessage() {
        return Optional.ofNullable(receivedMessage);
    }

    public boolean hasAction(String actionName) {
        return actions.containsKey(actionName);
    }

    public void addAction(Action action) {
        actions.put(action.name(), action);
    }

    public Behaviour build() {
        return switch (kind) {
            case SETUP -> new Behaviour.Setup(name, actions);
            case ONE_TIME -> new Behaviour.OneTime(name, schedule, actions);
            case CYCLIC -> new Behaviour.Cyclic(name, schedule, actions);
            case MESSAGE_RECEIVED -> new Behaviour.MessageReceived(name, receivedMessage, actions);
        };
    }

    @Override
    public String closingOpcode() {
        return "EBEHAV";
    }

    @Override
    public String description() {
        return "behaviour '" + name + "'";
    }
}
