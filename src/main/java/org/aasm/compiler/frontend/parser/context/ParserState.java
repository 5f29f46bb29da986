package org.aasm.compiler.frontend.parser.context;

import org.aasm.compiler.ir.Agent;
import org.aasm.compiler.ir.Message;
import org.aasm.compiler.ir.MessageKey;
import org.aasm.compiler.ir.Program;
import org.aasm.compiler.ir.graph.Graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Everything the parser has built so far: the closed agents and messages, the graph,
 * and the stack of constructs that are still open.
 * <p>
 * The "current" agent, behaviour or action is always the innermost open frame of that
 * kind. Closed entities are immutable; message templates are handed out as copies.
 */
public class ParserState {

    private final Map<String, Agent> agents = new LinkedHashMap<>();
    private final Map<MessageKey, Message> messages = new LinkedHashMap<>();
    private Graph graph;
    private final Deque<ContextFrame> frames = new ArrayDeque<>();

    /**
     * @param name An agent name.
     * @return true if a closed agent of that name exists.
     */
    public boolean agentExists(String name) {
        return agents.containsKey(name);
    }

    /**
     * @param key A message key.
     * @return true if a closed message template with that key exists.
     */
    public boolean messageExists(MessageKey key) {
        return messages.containsKey(key);
    }

    /**
     * Returns an independent instance of a declared message template.
     * @param key The message key.
     * @return A copy of the template.
     * @throws IllegalArgumentException if no such message exists.
     */
    public Message getMessageInstance(MessageKey key) {
        Message template = messages.get(key);
        if (template == null) {
            throw new IllegalArgumentException("Unknown message: " + key);
        }
        return template.copy();
    }

    public void addAgent(Agent agent) {
        agents.put(agent.name(), agent);
    }

    /**
     * Stores a closed template, replacing an earlier one with the same key in place.
     * @param message The template.
     */
    public void addMessage(Message message) {
        messages.put(message.key(), message);
    }

    /**
     * @return true if a graph is declared, open or closed.
     */
    public boolean graphExists() {
        return graph != null || innermost(GraphBuilder.class).isPresent();
    }

    public void setGraph(Graph graph) {
        this.graph = graph;
    }

    public void push(ContextFrame frame) {
        frames.push(frame);
    }

    public ContextFrame pop() {
        return frames.pop();
    }

    /**
     * @return The innermost open frame, or empty at top level.
     */
    public Optional<ContextFrame> top() {
        return Optional.ofNullable(frames.peek());
    }

    /**
     * Finds the innermost open frame of a kind.
     * @param kind The frame type.
     * @param <T>  The frame type.
     * @return The frame, or empty if none of that kind is open.
     */
    public <T extends ContextFrame> Optional<T> innermost(Class<T> kind) {
        for (ContextFrame frame : frames) {
            if (kind.isInstance(frame)) {
                return Optional.of(kind.cast(frame));
            }
        }
        return Optional.empty();
    }

    /**
     * Snapshots the parsed program.
     * @return The program in declaration order.
     * @throws IllegalStateException if a construct is still open.
     */
    public Program toProgram() {
        if (!frames.isEmpty()) {
            throw new IllegalStateException("Unclosed construct: " + frames.peek().description());
        }
        return new Program(new ArrayList<>(agents.values()), new ArrayList<>(messages.values()),
                Optional.ofNullable(graph));
    }
}
