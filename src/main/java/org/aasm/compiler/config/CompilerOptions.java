package org.aasm.compiler.config;

import com.typesafe.config.Config;

import java.io.File;

/**
 * Settings of one compiler instance, read from the {@code aasm.compiler} section.
 *
 * @param indentSize     Spaces per indentation level in the generated code.
 * @param receiveTimeout Seconds a message-received behaviour waits for a message.
 * @param maxMacroDepth  Maximum nesting of macro expansions.
 * @param debug          Whether every parsed statement is traced.
 */
public record CompilerOptions(int indentSize, int receiveTimeout, int maxMacroDepth, boolean debug) {

    public static final String CONFIG_PATH = "aasm.compiler";

    public CompilerOptions {
        if (indentSize < 1) {
            throw new IllegalArgumentException("indent-size must be positive, got " + indentSize);
        }
        if (receiveTimeout <= 0) {
            throw new IllegalArgumentException("receive-timeout must be positive, got " + receiveTimeout);
        }
        if (maxMacroDepth < 1) {
            throw new IllegalArgumentException("max-macro-depth must be positive, got " + maxMacroDepth);
        }
    }

    /**
     * Reads the options from a resolved configuration.
     * @param config The root configuration containing {@code aasm.compiler}.
     * @return The options.
     * @throws com.typesafe.config.ConfigException if a key is missing or has the wrong type.
     */
    public static CompilerOptions fromConfig(Config config) {
        Config section = config.getConfig(CONFIG_PATH);
        return new CompilerOptions(
                section.getInt("indent-size"),
                section.getInt("receive-timeout"),
                section.getInt("max-macro-depth"),
                section.getBoolean("debug"));
    }

    /**
     * Loads the options through the configuration cascade of {@link ConfigLoader#resolve(File)}.
     * @param configFile A configuration file, or {@code null} to look for {@code -Dconfig.file}
     *                   and {@code config/aasm.conf} before falling back to {@code reference.conf}.
     * @return The options.
     * @throws IllegalArgumentException            if an explicitly named file does not exist.
     * @throws com.typesafe.config.ConfigException if the configuration is invalid.
     */
    public static CompilerOptions load(File configFile) {
        return fromConfig(ConfigLoader.resolve(configFile));
    }

    /**
     * Returns a copy with a different debug flag.
     * @param enabled The new flag.
     * @return The modified options.
     */
    public CompilerOptions withDebug(boolean enabled) {
        return new CompilerOptions(indentSize, receiveTimeout, maxMacroDepth, enabled);
    }
}
