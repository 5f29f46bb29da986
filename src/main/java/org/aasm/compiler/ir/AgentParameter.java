package org.aasm.compiler.ir;

import java.util.List;

/**
 * A state field declared on an agent with {@code PRM}.
 * Every category initialises the field differently in the generated agent constructor.
 */
public sealed interface AgentParameter {

    /**
     * @return The field name, unique across all categories of the owning agent.
     */
    String name();

    /**
     * A float field with a fixed initial value.
     *
     * @param name  The field name.
     * @param value The initial value as written in the source.
     */
    record InitFloat(String name, String value) implements AgentParameter {
    }

    /**
     * A float field drawn from a normal distribution when the agent is created.
     *
     * @param name   The field name.
     * @param mean   The distribution mean.
     * @param stdDev The standard deviation.
     */
    record NormalFloat(String name, String mean, String stdDev) implements AgentParameter {
    }

    /**
     * A float field drawn from an exponential distribution when the agent is created.
     *
     * @param name   The field name.
     * @param lambda The rate parameter.
     */
    record ExpFloat(String name, String lambda) implements AgentParameter {
    }

    /**
     * An enumerated field whose initial value is chosen by weighted random choice.
     * Weights are relative and do not have to add up to 100.
     *
     * @param name   The field name.
     * @param values The candidate values with their weights, in declaration order.
     */
    record EnumField(String name, List<EnumValue> values) implements AgentParameter {

        public EnumField {
            values = List.copyOf(values);
        }

        /**
         * Checks whether the given value is one of the declared candidates.
         * @param value The value to look up.
         * @return true if the value belongs to this enum.
         */
        public boolean hasValue(String value) {
            return values.stream().anyMatch(v -> v.value().equals(value));
        }
    }

    /**
     * A list of connections (peer identifiers), empty at start.
     *
     * @param name The field name.
     */
    record ConnectionList(String name) implements AgentParameter {
    }

    /**
     * A list of buffered received messages, empty at start.
     *
     * @param name The field name.
     */
    record MessageList(String name) implements AgentParameter {
    }

    /**
     * One candidate value of an enum field.
     *
     * @param value  The value.
     * @param weight The relative weight as written in the source.
     */
    record EnumValue(String value, String weight) {
    }
}
