package org.aasm.compiler.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A schedulable unit of agent logic. The four variants differ only in their trigger;
 * all of them own an ordered mapping of named actions.
 */
public sealed interface Behaviour {

    /**
     * @return The behaviour name, unique within its agent.
     */
    String name();

    /**
     * @return The actions in declaration order, keyed by name.
     */
    Map<String, Action> actions();

    /**
     * Checks whether the behaviour is triggered by an inbound message.
     * Actions of such behaviours receive the message as an argument.
     * @return true for message-received behaviours.
     */
    default boolean receivesMessage() {
        return false;
    }

    private static Map<String, Action> freeze(Map<String, Action> actions) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(actions));
    }

    /**
     * Runs once when the agent starts.
     *
     * @param name    The behaviour name.
     * @param actions The actions in declaration order.
     */
    record Setup(String name, Map<String, Action> actions) implements Behaviour {
        public Setup {
            actions = freeze(actions);
        }
    }

    /**
     * Runs once after a fixed delay.
     *
     * @param name    The behaviour name.
     * @param delay   The delay in seconds as written in the source.
     * @param actions The actions in declaration order.
     */
    record OneTime(String name, String delay, Map<String, Action> actions) implements Behaviour {
        public OneTime {
            actions = freeze(actions);
        }
    }

    /**
     * Runs repeatedly with a fixed period.
     *
     * @param name    The behaviour name.
     * @param period  The period in seconds as written in the source.
     * @param actions The actions in declaration order.
     */
    record Cyclic(String name, String period, Map<String, Action> actions) implements Behaviour {
        public Cyclic {
            actions = freeze(actions);
        }
    }

    /**
     * Runs once per inbound message matching the template.
     *
     * @param name            The behaviour name.
     * @param receivedMessage The private copy of the matched message template.
     * @param actions         The actions in declaration order.
     */
    record MessageReceived(String name, Message receivedMessage, Map<String, Action> actions) implements Behaviour {
        public MessageReceived {
            actions = freeze(actions);
        }

        @Override
        public boolean receivesMessage() {
            return true;
        }
    }
}
