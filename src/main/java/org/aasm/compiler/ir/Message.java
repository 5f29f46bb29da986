package org.aasm.compiler.ir;

import java.util.ArrayList;
import java.util.List;

/**
 * A message template, identified by its (type, performative) pair.
 * <p>
 * Templates are shared by every behaviour and action that refers to them, so usage
 * sites never hold the declared instance: they bind an independent copy obtained via
 * {@link #copy()}.
 *
 * @param type          The message type.
 * @param performative  The message performative.
 * @param floatParams   Names of the float fields carried in the message body, in declaration order.
 */
public record Message(String type, String performative, List<String> floatParams) {

    public Message {
        floatParams = List.copyOf(floatParams);
    }

    /**
     * Returns the lookup key of this template.
     * @return The (type, performative) key.
     */
    public MessageKey key() {
        return new MessageKey(type, performative);
    }

    /**
     * Checks whether the body declares the given float field.
     * @param name The field name.
     * @return true if the field is declared.
     */
    public boolean hasFloatParam(String name) {
        return floatParams.contains(name);
    }

    /**
     * Creates an independent instance of this template for a single usage site.
     * @return A copy that shares no mutable state with this template.
     */
    public Message copy() {
        return new Message(type, performative, new ArrayList<>(floatParams));
    }
}
