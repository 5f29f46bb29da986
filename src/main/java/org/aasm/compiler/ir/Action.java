package org.aasm.compiler.ir;

import org.aasm.compiler.ir.instruction.Block;

/**
 * A named sequence of instructions belonging to a behaviour.
 */
public sealed interface Action {

    /**
     * @return The action name, unique within its behaviour.
     */
    String name();

    /**
     * @return The top-level instruction block of the action.
     */
    Block body();

    /**
     * An action that only changes the state of its own agent.
     *
     * @param name The action name.
     * @param body The instructions.
     */
    record ModifySelf(String name, Block body) implements Action {
    }

    /**
     * An action that fills in and transmits a message.
     *
     * @param name        The action name.
     * @param body        The instructions.
     * @param sendMessage The private copy of the template being sent.
     */
    record SendMessage(String name, Block body, Message sendMessage) implements Action {
    }
}
