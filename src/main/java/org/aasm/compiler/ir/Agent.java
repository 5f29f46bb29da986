package org.aasm.compiler.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * An agent type: its state fields and its behaviours grouped by trigger.
 * All mappings preserve declaration order, which is also the emission order.
 *
 * @param name                      The agent name, unique within the program.
 * @param parameters                All declared fields keyed by name.
 * @param setupBehaviours           Behaviours run once at start.
 * @param oneTimeBehaviours         Behaviours run once after a delay.
 * @param cyclicBehaviours          Behaviours run periodically.
 * @param messageReceivedBehaviours Behaviours triggered by inbound messages.
 */
public record Agent(
        String name,
        Map<String, AgentParameter> parameters,
        Map<String, Behaviour.Setup> setupBehaviours,
        Map<String, Behaviour.OneTime> oneTimeBehaviours,
        Map<String, Behaviour.Cyclic> cyclicBehaviours,
        Map<String, Behaviour.MessageReceived> messageReceivedBehaviours
) {

    public Agent {
        parameters = freeze(parameters);
        setupBehaviours = freeze(setupBehaviours);
        oneTimeBehaviours = freeze(oneTimeBehaviours);
        cyclicBehaviours = freeze(cyclicBehaviours);
        messageReceivedBehaviours = freeze(messageReceivedBehaviours);
    }

    private static <V> Map<String, V> freeze(Map<String, V> map) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }

    /**
     * Returns the declared fields of one category, in declaration order.
     * @param category The parameter record type.
     * @param <T>      The parameter type.
     * @return The matching parameters.
     */
    public <T extends AgentParameter> List<T> parametersOf(Class<T> category) {
        return parameters.values().stream()
                .filter(category::isInstance)
                .map(category::cast)
                .collect(Collectors.toList());
    }

    /**
     * Returns the names of every float field (fixed and distribution-initialised).
     * @return The float field names in declaration order.
     */
    public List<String> floatParamNames() {
        return parameters.values().stream()
                .filter(p -> p instanceof AgentParameter.InitFloat
                        || p instanceof AgentParameter.NormalFloat
                        || p instanceof AgentParameter.ExpFloat)
                .map(AgentParameter::name)
                .collect(Collectors.toList());
    }
}
