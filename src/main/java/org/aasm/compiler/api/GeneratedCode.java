package org.aasm.compiler.api;

import java.util.List;

/**
 * The result of a successful compilation: two independent Python units.
 *
 * @param agentCode One class per declared agent, line by line.
 * @param graphCode The {@code generate_graph_structure(domain)} function, line by line.
 */
public record GeneratedCode(List<String> agentCode, List<String> graphCode) {

    public GeneratedCode {
        agentCode = List.copyOf(agentCode);
        graphCode = List.copyOf(graphCode);
    }

    /**
     * @return The agent unit as file content.
     */
    public String agentSource() {
        return join(agentCode);
    }

    /**
     * @return The graph unit as file content.
     */
    public String graphSource() {
        return join(graphCode);
    }

    private static String join(List<String> lines) {
        if (lines.isEmpty()) {
            return "";
        }
        return String.join("\n", lines) + "\n";
    }
}
