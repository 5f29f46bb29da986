package org.aasm.compiler.frontend.preprocessor.features.macro;

import org.aasm.compiler.frontend.lexer.Tokenizer;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A macro registered with {@code .MACRO}.
 *
 * @param name       The macro name, used as the opcode of an invocation.
 * @param parameters The formal parameter names.
 * @param body       The body lines as written.
 * @param declaredAt The source line of the {@code .MACRO} directive.
 */
public record MacroDefinition(String name, List<String> parameters, List<String> body, int declaredAt) {

    public MacroDefinition {
        parameters = List.copyOf(parameters);
        body = List.copyOf(body);
    }

    /**
     * Substitutes the actual arguments for the parameters in every body line.
     * Blank and comment-only body lines are dropped.
     * @param arguments The actual arguments, one per parameter.
     * @return The expanded lines.
     */
    public List<String> expand(List<String> arguments) {
        Map<String, String> bindings = new HashMap<>();
        for (int i = 0; i < parameters.size(); i++) {
            bindings.put(parameters.get(i), arguments.get(i));
        }
        List<String> expanded = new ArrayList<>();
        for (String line : body) {
            List<String> tokens = Tokenizer.split(line);
            if (tokens.isEmpty()) {
                continue;
            }
            List<String> substituted = new ArrayList<>(tokens.size());
            for (String token : tokens) {
                substituted.add(bindings.getOrDefault(token, token));
            }
            expanded.add(String.join(" ", substituted));
        }
        return expanded;
    }
}
