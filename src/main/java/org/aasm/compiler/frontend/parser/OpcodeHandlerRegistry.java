package org.aasm.compiler.frontend.parser;

import org.aasm.compiler.frontend.parser.features.action.ActionHandler;
import org.aasm.compiler.frontend.parser.features.agent.AgentHandler;
import org.aasm.compiler.frontend.parser.features.agent.ParameterHandler;
import org.aasm.compiler.frontend.parser.features.behaviour.BehaviourHandler;
import org.aasm.compiler.frontend.parser.features.graph.GraphHandler;
import org.aasm.compiler.frontend.parser.features.graph.MatrixGraphHandler;
import org.aasm.compiler.frontend.parser.features.graph.StatisticalGraphHandler;
import org.aasm.compiler.frontend.parser.features.instruction.ArithmeticHandler;
import org.aasm.compiler.frontend.parser.features.instruction.AssignmentHandler;
import org.aasm.compiler.frontend.parser.features.instruction.BlockEndHandler;
import org.aasm.compiler.frontend.parser.features.instruction.ConditionalHandler;
import org.aasm.compiler.frontend.parser.features.instruction.DeclarationHandler;
import org.aasm.compiler.frontend.parser.features.instruction.ListHandler;
import org.aasm.compiler.frontend.parser.features.instruction.MembershipHandler;
import org.aasm.compiler.frontend.parser.features.instruction.RandomHandler;
import org.aasm.compiler.frontend.parser.features.instruction.RoundHandler;
import org.aasm.compiler.frontend.parser.features.instruction.SendHandler;
import org.aasm.compiler.frontend.parser.features.message.MessageHandler;

import java.util.EnumMap;
import java.util.Map;

/**
 * Registry for opcode handlers. Maps every {@link Opcode} to the handler of its family.
 */
public class OpcodeHandlerRegistry {

    private final Map<Opcode, IOpcodeHandler> handlers = new EnumMap<>(Opcode.class);

    /**
     * Registers a handler for one or more opcodes.
     * @param handler The handler.
     * @param opcodes The opcodes it handles.
     */
    public void register(IOpcodeHandler handler, Opcode... opcodes) {
        for (Opcode opcode : opcodes) {
            handlers.put(opcode, handler);
        }
    }

    /**
     * Looks up the handler of an opcode.
     * @param opcode The opcode.
     * @return The handler.
     * @throws IllegalStateException if no handler is registered, which is a registry defect.
     */
    public IOpcodeHandler get(Opcode opcode) {
        IOpcodeHandler handler = handlers.get(opcode);
        if (handler == null) {
            throw new IllegalStateException("No handler registered for opcode " + opcode);
        }
        return handler;
    }

    /**
     * Creates a registry with all built-in opcode handlers.
     * @return A new registry instance covering every opcode.
     */
    public static OpcodeHandlerRegistry initialize() {
        OpcodeHandlerRegistry registry = new OpcodeHandlerRegistry();
        registry.register(new AgentHandler(), Opcode.AGENT, Opcode.EAGENT);
        registry.register(new MessageHandler(), Opcode.MESSAGE, Opcode.EMESSAGE);
        registry.register(new ParameterHandler(), Opcode.PRM);
        registry.register(new BehaviourHandler(), Opcode.BEHAV, Opcode.EBEHAV);
        registry.register(new ActionHandler(), Opcode.ACTION, Opcode.EACTION);

        registry.register(new DeclarationHandler(), Opcode.DECL);
        registry.register(new AssignmentHandler(), Opcode.SET);
        registry.register(new ArithmeticHandler(), Opcode.ADD, Opcode.SUBT, Opcode.MULT, Opcode.DIV);
        registry.register(new RoundHandler(), Opcode.ROUND);
        registry.register(new RandomHandler(), Opcode.RAND);
        registry.register(new ConditionalHandler(),
                Opcode.IEQ, Opcode.INEQ, Opcode.IGT, Opcode.IGTEQ, Opcode.ILT, Opcode.ILTEQ,
                Opcode.WEQ, Opcode.WNEQ, Opcode.WGT, Opcode.WGTEQ, Opcode.WLT, Opcode.WLTEQ);
        registry.register(new MembershipHandler(), Opcode.IN, Opcode.NIN);
        registry.register(new BlockEndHandler(), Opcode.EBLOCK);
        registry.register(new ListHandler(),
                Opcode.ADDE, Opcode.REME, Opcode.LEN, Opcode.CLR, Opcode.SUBS, Opcode.REMEN);
        registry.register(new SendHandler(), Opcode.SEND);

        registry.register(new GraphHandler(), Opcode.GRAPH, Opcode.EGRAPH);
        registry.register(new StatisticalGraphHandler(), Opcode.SIZE, Opcode.DEFG);
        registry.register(new MatrixGraphHandler(), Opcode.SCALE, Opcode.DEFNODE);

        for (Opcode opcode : Opcode.values()) {
            registry.get(opcode);
        }
        return registry;
    }
}
