package org.aasm.compiler.frontend.preprocessor;

import org.aasm.compiler.frontend.preprocessor.features.define.DefineDirectiveHandler;
import org.aasm.compiler.frontend.preprocessor.features.macro.MacroDirectiveHandler;
import org.aasm.compiler.frontend.preprocessor.features.repeat.RepeatDirectiveHandler;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Registry for preprocessor directive handlers.
 * Maps directive names (e.g., ".MACRO", ".REPEAT") to their handlers.
 */
public class PreProcessorDirectiveRegistry {

    private final Map<String, IPreProcessorDirectiveHandler> handlers = new HashMap<>();

    /**
     * Registers a handler for a directive name.
     * @param directiveName The directive name (e.g., ".MACRO").
     * @param handler       The handler for this directive.
     */
    public void register(String directiveName, IPreProcessorDirectiveHandler handler) {
        handlers.put(directiveName.toUpperCase(Locale.ROOT), handler);
    }

    /**
     * Looks up the handler for a directive name.
     * @param directiveName The directive name.
     * @return The handler, or empty if no handler is registered for this directive.
     */
    public Optional<IPreProcessorDirectiveHandler> get(String directiveName) {
        return Optional.ofNullable(handlers.get(directiveName.toUpperCase(Locale.ROOT)));
    }

    /**
     * Creates a registry with all built-in directive handlers.
     * Block terminators are registered too, so that a stray terminator gets a precise message.
     * @return A new registry instance.
     */
    public static PreProcessorDirectiveRegistry initialize() {
        PreProcessorDirectiveRegistry registry = new PreProcessorDirectiveRegistry();
        registry.register(DefineDirectiveHandler.DIRECTIVE, new DefineDirectiveHandler());
        registry.register(MacroDirectiveHandler.DIRECTIVE, new MacroDirectiveHandler());
        registry.register(RepeatDirectiveHandler.DIRECTIVE, new RepeatDirectiveHandler());
        registry.register(MacroDirectiveHandler.END_DIRECTIVE, (pp, ctx) -> {
            throw pp.error(pp.peek(), "Unexpected " + MacroDirectiveHandler.END_DIRECTIVE + " without "
                    + MacroDirectiveHandler.DIRECTIVE, "Remove the line or open the macro first");
        });
        registry.register(RepeatDirectiveHandler.END_DIRECTIVE, (pp, ctx) -> {
            throw pp.error(pp.peek(), "Unexpected " + RepeatDirectiveHandler.END_DIRECTIVE + " without "
                    + RepeatDirectiveHandler.DIRECTIVE, "Remove the line or open the block first");
        });
        return registry;
    }
}
