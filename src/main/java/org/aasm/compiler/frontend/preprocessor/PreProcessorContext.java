package org.aasm.compiler.frontend.preprocessor;

import org.aasm.compiler.frontend.preprocessor.features.macro.MacroDefinition;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Shared state of one preprocessor run: macro and constant definitions.
 */
public class PreProcessorContext {

    private final Map<String, MacroDefinition> macros = new HashMap<>();
    private final Map<String, String> defines = new HashMap<>();

    public void registerMacro(MacroDefinition macro) {
        macros.put(macro.name(), macro);
    }

    public Optional<MacroDefinition> getMacro(String name) {
        return Optional.ofNullable(macros.get(name));
    }

    public void registerDefine(String name, String value) {
        defines.put(name, value);
    }

    public Optional<String> getDefine(String name) {
        return Optional.ofNullable(defines.get(name));
    }

    /**
     * @return true if at least one constant is defined.
     */
    public boolean hasDefines() {
        return !defines.isEmpty();
    }
}
