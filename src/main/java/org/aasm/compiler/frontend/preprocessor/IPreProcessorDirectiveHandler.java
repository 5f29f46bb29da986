package org.aasm.compiler.frontend.preprocessor;

import org.aasm.compiler.diagnostics.CompilationException;

/**
 * Handler interface for line-level preprocessor directives.
 * Handlers rewrite the line stream (expanding macros, repeating blocks, removing
 * definitions) before any opcode is parsed.
 */
@FunctionalInterface
public interface IPreProcessorDirectiveHandler {

    /**
     * Processes the directive at the preprocessor's current line.
     *
     * @param preProcessor        The preprocessor, providing direct access to the line stream.
     * @param preProcessorContext The shared preprocessor state (macro definitions, constants).
     * @throws CompilationException if the directive is malformed.
     */
    void process(PreProcessor preProcessor, PreProcessorContext preProcessorContext) throws CompilationException;
}
