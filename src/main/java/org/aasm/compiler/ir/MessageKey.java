package org.aasm.compiler.ir;

/**
 * Identity of a message template.
 *
 * @param type         The message type.
 * @param performative The message performative.
 */
public record MessageKey(String type, String performative) {

    @Override
    public String toString() {
        return type + "/" + performative;
    }
}
