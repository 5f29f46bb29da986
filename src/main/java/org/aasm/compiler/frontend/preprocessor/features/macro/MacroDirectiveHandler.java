package org.aasm.compiler.frontend.preprocessor.features.macro;

import org.aasm.compiler.diagnostics.CompilationException;
import org.aasm.compiler.frontend.lexer.Tokenizer;
import org.aasm.compiler.frontend.preprocessor.IPreProcessorDirectiveHandler;
import org.aasm.compiler.frontend.preprocessor.PreProcessor;
import org.aasm.compiler.frontend.preprocessor.PreProcessorContext;
import org.aasm.compiler.frontend.preprocessor.ProcessedLine;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

/**
 * Handles the <code>.MACRO</code> and <code>.ENDM</code> directives.
 * This handler parses a macro definition and registers it with the {@link PreProcessorContext}.
 * The entire macro definition block is then removed from the line stream.
 */
public class MacroDirectiveHandler implements IPreProcessorDirectiveHandler {

    public static final String DIRECTIVE = ".MACRO";
    public static final String END_DIRECTIVE = ".ENDM";

    /**
     * Parses a macro definition.
     * The syntax is <code>.MACRO &lt;name&gt; [&lt;param1&gt; &lt;param2&gt; ...] ... .ENDM</code>.
     * @param preProcessor The preprocessor providing direct access to the line stream.
     * @param preProcessorContext The preprocessor context for registering the macro.
     * @throws CompilationException if the definition is malformed or never closed.
     */
    @Override
    public void process(PreProcessor preProcessor, PreProcessorContext preProcessorContext) throws CompilationException {
        int startIndex = preProcessor.getCurrentIndex();
        ProcessedLine header = preProcessor.advance();
        List<String> tokens = header.tokens();

        if (tokens.size() < 2) {
            throw preProcessor.error(header, "Expected macro name after " + DIRECTIVE,
                    DIRECTIVE + " name [param1 param2 ...]");
        }
        String name = tokens.get(1);
        if (!Tokenizer.isIdentifier(name)) {
            throw preProcessor.error(header, "Invalid macro name: " + name, "Use letters, digits and underscores");
        }
        if (preProcessorContext.getMacro(name).isPresent()) {
            throw preProcessor.error(header, "Macro '" + name + "' is already defined", "Rename one of the macros");
        }
        List<String> params = tokens.subList(2, tokens.size());
        for (String param : params) {
            if (!Tokenizer.isIdentifier(param)) {
                throw preProcessor.error(header, "Invalid macro parameter name: " + param, "");
            }
        }
        if (new HashSet<>(params).size() != params.size()) {
            throw preProcessor.error(header, "Duplicate parameter in macro '" + name + "'", "");
        }

        List<String> body = new ArrayList<>();
        boolean closed = false;
        while (!preProcessor.isAtEnd()) {
            ProcessedLine line = preProcessor.advance();
            List<String> lineTokens = line.tokens();
            String head = lineTokens.isEmpty() ? "" : lineTokens.get(0);
            if (head.equalsIgnoreCase(END_DIRECTIVE)) {
                closed = true;
                break;
            }
            if (head.equalsIgnoreCase(DIRECTIVE)) {
                throw preProcessor.error(line, "Nested macro definitions are not supported",
                        "Close macro '" + name + "' with " + END_DIRECTIVE + " first");
            }
            body.add(line.text());
        }
        if (!closed) {
            throw preProcessor.error(header, "Missing " + END_DIRECTIVE, "Close macro '" + name + "' with " + END_DIRECTIVE);
        }

        preProcessorContext.registerMacro(new MacroDefinition(name, params, body, header.origin().line()));

        int endIndex = preProcessor.getCurrentIndex();
        // Remove the entire .MACRO...ENDM block
        preProcessor.removeLines(startIndex, endIndex - startIndex);
    }
}
