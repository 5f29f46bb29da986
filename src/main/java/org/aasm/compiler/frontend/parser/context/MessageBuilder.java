package org.aasm.compiler.frontend.parser.context;

import org.aasm.compiler.ir.Message;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the body fields of the message between {@code MESSAGE} and {@code EMESSAGE}.
 */
public final class MessageBuilder implements ContextFrame {

    private final String type;
    private final String performative;
    private final List<String> floatParams = new ArrayList<>();

    public MessageBuilder(String type, String performative) {
        this.type = type;
        this.performative = performative;
    }

    public boolean hasParam(String name) {
        return floatParams.contains(name);
    }

    public void addFloatParam(String name) {
        floatParams.add(name);
    }

    public Message build() {
        return new Message(type, performative, floatParams);
    }

    @Override
    public String closingOpcode() {
        return "EMESSAGE";
    }

    @Override
    public String description() {
        return "message '" + type + "/" + performative + "'";
    }
}
