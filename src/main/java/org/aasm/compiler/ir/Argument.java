package org.aasm.compiler.ir;

/**
 * An instruction operand, resolved by the parser.
 * The origin decides how the code generator qualifies the reference;
 * the value type decides which instructions may use it.
 *
 * @param expr    The operand as written in the source.
 * @param origin  Where the operand comes from.
 * @param type    The kind of value it denotes.
 * @param mutable Whether the operand may be the target of an assignment.
 */
public record Argument(String expr, Origin origin, ValueType type, boolean mutable) {

    /**
     * Where an operand comes from.
     */
    public enum Origin {
        /** A numeric constant. */
        LITERAL,
        /** A local bound with DECL. */
        LOCAL,
        /** A field of the owning agent. */
        AGENT_PARAM,
        /** A candidate value of an enum field. */
        ENUM_VALUE,
        /** The received message itself ({@code rcv}). */
        RECEIVED_MESSAGE,
        /** A field of the received message ({@code rcv.x}). */
        RECEIVED_MESSAGE_PARAM,
        /** The message being built for sending ({@code send}). */
        SEND_MESSAGE,
        /** A field of the message being built ({@code send.x}). */
        SEND_MESSAGE_PARAM
    }

    /**
     * The kind of value an operand denotes.
     */
    public enum ValueType {
        FLOAT,
        ENUM,
        CONNECTION,
        CONNECTION_LIST,
        MESSAGE,
        MESSAGE_LIST;

        /**
         * @return true for the two list types.
         */
        public boolean isList() {
            return this == CONNECTION_LIST || this == MESSAGE_LIST;
        }

        /**
         * Returns the type of the elements of a list type.
         * @return The element type.
         * @throws IllegalStateException if this is not a list type.
         */
        public ValueType elementType() {
            return switch (this) {
                case CONNECTION_LIST -> CONNECTION;
                case MESSAGE_LIST -> MESSAGE;
                default -> throw new IllegalStateException(this + " is not a list type");
            };
        }
    }

    /**
     * Returns the field part of a message field reference.
     * @return The text after the first dot, e.g. {@code x} for {@code rcv.x}.
     * @throws IllegalStateException if the operand is not a message field.
     */
    public String field() {
        int dot = expr.indexOf('.');
        if (dot < 0) {
            throw new IllegalStateException("Not a message field reference: " + expr);
        }
        return expr.substring(dot + 1);
    }
}
