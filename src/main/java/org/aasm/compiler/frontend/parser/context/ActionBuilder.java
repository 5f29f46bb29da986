package org.aasm.compiler.frontend.parser.context;

import org.aasm.compiler.ir.Action;
import org.aasm.compiler.ir.Argument;
import org.aasm.compiler.ir.Message;
import org.aasm.compiler.ir.instruction.Block;
import org.aasm.compiler.ir.instruction.Instruction;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Collects the top-level instructions and the locals of the action between
 * {@code ACTION} and {@code EACTION}.
 */
public final class ActionBuilder implements InstructionSink {

    private final String name;
    private final Message sendMessage;
    private final List<Instruction> instructions = new ArrayList<>();
    private final Map<String, Argument.ValueType> locals = new HashMap<>();

    private ActionBuilder(String name, Message sendMessage) {
        this.name = name;
        this.sendMessage = sendMessage;
    }

    public static ActionBuilder modifySelf(String name) {
        return new ActionBuilder(name, null);
    }

    public static ActionBuilder sendMessage(String name, Message sendMessage) {
        return new ActionBuilder(name, sendMessage);
    }

    public String name() {
        return name;
    }

    /**
     * @return The message this action sends, empty for actions that only modify their agent.
     */
    public Optional<Message> sendMessage() {
        return Optional.ofNullable(sendMessage);
    }

    public void declareLocal(String localName, Argument.ValueType type) {
        locals.put(localName, type);
    }

    public Optional<Argument.ValueType> local(String localName) {
        return Optional.ofNullable(locals.get(localName));
    }

    @Override
    public void add(Instruction instruction) {
        instructions.add(instruction);
    }

    public Action build() {
        Block body = new Block(instructions);
        if (sendMessage != null) {
            return new Action.SendMessage(name, body, sendMessage);
        }
        return new Action.ModifySelf(name, body);
    }

    @Override
    public String closingOpcode() {
        return "EACTION";
    }

    @Override
    public String description() {
        return "action '" + name + "'";
    }
}
