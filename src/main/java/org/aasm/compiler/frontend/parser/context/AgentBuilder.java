package org.aasm.compiler.frontend.parser.context;

import org.aasm.compiler.ir.Agent;
import org.aasm.compiler.ir.AgentParameter;
import org.aasm.compiler.ir.Behaviour;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Collects the fields and behaviours of the agent between {@code AGENT} and {@code EAGENT}.
 */
public final class AgentBuilder implements ContextFrame {

    private final String name;
    private final Map<String, AgentParameter> parameters = new LinkedHashMap<>();
    private final Map<String, Behaviour.Setup> setupBehaviours = new LinkedHashMap<>();
    private final Map<String, Behaviour.OneTime> oneTimeBehaviours = new LinkedHashMap<>();
    private final Map<String, Behaviour.Cyclic> cyclicBehaviours = new LinkedHashMap<>();
    private final Map<String, Behaviour.MessageReceived> messageReceivedBehaviours = new LinkedHashMap<>();

    public AgentBuilder(String name) {
        this.name = name;
    }

    public String name() {
        return name;
    }

    public boolean hasParameter(String parameterName) {
        return parameters.containsKey(parameterName);
    }

    public Optional<AgentParameter> parameter(String parameterName) {
        return Optional.ofNullable(parameters.get(parameterName));
    }

    public void addParameter(AgentParameter parameter) {
        parameters.put(parameter.name(), parameter);
    }

    /**
     * Checks whether any enum field lists the value.
     * @param value The candidate enum value.
     * @return true if some enum field declares it.
     */
    public boolean isEnumValue(String value) {
        return parameters.values().stream()
                .anyMatch(p -> p instanceof AgentParameter.EnumField && ((AgentParameter.EnumField) p).hasValue(value));
    }

    /**
     * @param behaviourName A behaviour name.
     * @return true if a behaviour of any kind already uses the name.
     */
    public boolean hasBehaviour(String behaviourName) {
        return setupBehaviours.containsKey(behaviourName)
                || oneTimeBehaviours.containsKey(behaviourName)
                || cyclicBehaviours.containsKey(behaviourName)
                || messageReceivedBehaviours.containsKey(behaviourName);
    }

    /**
     * Files a closed behaviour under its trigger kind.
     * @param behaviour The behaviour.
     */
    public void addBehaviour(Behaviour behaviour) {
        if (behaviour instanceof Behaviour.Setup setup) {
            setupBehaviours.put(setup.name(), setup);
        } else if (behaviour instanceof Behaviour.OneTime oneTime) {
            oneTimeBehaviours.put(oneTime.name(), oneTime);
        } else if (behaviour instanceof Behaviour.Cyclic cyclic) {
            cyclicBehaviours.put(cyclic.name(), cyclic);
        } else if (behaviour instanceof Behaviour.MessageReceived received) {
            messageReceivedBehaviours.put(received.name(), received);
        } else {
            throw new IllegalStateException("Unknown behaviour variant: " + behaviour);
        }
    }

    public Agent build() {
        return new Agent(name, parameters, setupBehaviours, oneTimeBehaviours, cyclicBehaviours,
                messageReceivedBehaviours);
    }

    @Override
    public String closingOpcode() {
        return "EAGENT";
    }

    @Override
    public String description() {
        return "agent '" + name + "'";
    }
}
