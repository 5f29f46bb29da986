package org.aasm.compiler.frontend.parser.context;

/**
 * An open construct on the parser's context stack. Frames are pushed by the opening
 * opcode and popped by the matching closing opcode; the entity they build becomes
 * immutable when the frame is popped.
 */
public sealed interface ContextFrame
        permits AgentBuilder, MessageBuilder, BehaviourBuilder, InstructionSink, GraphBuilder {

    /**
     * @return The opcode that closes this construct, e.g. {@code EAGENT}.
     */
    String closingOpcode();

    /**
     * @return A short description for diagnostics, e.g. {@code agent 'Seller'}.
     */
    String description();
}
