package org.aasm.compiler.backend.spade;

import org.aasm.compiler.ir.Argument;

/**
 * Renders operands as Python expressions inside a behaviour's action method.
 * Agent fields live on {@code self.agent}, message fields are dictionary lookups and
 * enum values are string literals.
 */
final class PythonArguments {

    private PythonArguments() {
    }

    static String render(Argument argument) {
        return switch (argument.origin()) {
            case AGENT_PARAM -> "self.agent." + argument.expr();
            case ENUM_VALUE -> quote(argument.expr());
            case RECEIVED_MESSAGE_PARAM -> "rcv[" + quote(argument.field()) + "]";
            case SEND_MESSAGE_PARAM -> "send[" + quote(argument.field()) + "]";
            case LITERAL, LOCAL, RECEIVED_MESSAGE, SEND_MESSAGE -> argument.expr();
        };
    }

    static String quote(String text) {
        return "\"" + text + "\"";
    }
}
