package org.aasm.compiler.frontend.preprocessor;

import org.aasm.compiler.diagnostics.CompilationException;
import org.aasm.compiler.diagnostics.Diagnostic;
import org.aasm.compiler.diagnostics.SourceMap;
import org.aasm.compiler.frontend.preprocessor.features.macro.MacroDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The line-level preprocessor of the Agents Assembly language. It runs before tokenization.
 * Its responsibilities are resolving directives (lines starting with {@code .}), expanding
 * macro invocations and substituting constants, while recording where every resulting
 * line comes from.
 */
public class PreProcessor {

    private static final Logger log = LoggerFactory.getLogger(PreProcessor.class);

    private static final String DIRECTIVE_PREFIX = ".";

    private final List<ProcessedLine> lines = new ArrayList<>();
    private final PreProcessorDirectiveRegistry directiveRegistry;
    private final PreProcessorContext ppContext = new PreProcessorContext();
    private final int maxMacroDepth;
    private int current = 0;

    /**
     * Constructs a new PreProcessor.
     * @param sourceLines   The raw source lines.
     * @param maxMacroDepth The maximum nesting of macro expansions.
     */
    public PreProcessor(List<String> sourceLines, int maxMacroDepth) {
        for (int i = 0; i < sourceLines.size(); i++) {
            lines.add(ProcessedLine.fromSource(stripLineTerminator(sourceLines.get(i)), i + 1));
        }
        this.maxMacroDepth = maxMacroDepth;
        this.directiveRegistry = PreProcessorDirectiveRegistry.initialize();
    }

    /**
     * Runs the preprocessor over all lines until no directive or macro invocation is left.
     * @return The processed lines and their source map.
     * @throws CompilationException if a directive is malformed or a macro cannot be expanded.
     */
    public PreProcessedSource expand() throws CompilationException {
        while (!isAtEnd()) {
            ProcessedLine line = peek();
            List<String> tokens = line.tokens();
            if (tokens.isEmpty()) {
                current++;
                continue;
            }

            String head = tokens.get(0);
            if (head.startsWith(DIRECTIVE_PREFIX)) {
                Optional<IPreProcessorDirectiveHandler> handler = directiveRegistry.get(head);
                if (handler.isEmpty()) {
                    throw error(line, "Unknown preprocessor directive: " + head, "");
                }
                handler.get().process(this, ppContext);
                continue;
            }

            Optional<MacroDefinition> macro = ppContext.getMacro(head);
            if (macro.isPresent()) {
                expandMacro(macro.get(), line, tokens);
                continue;
            }

            if (ppContext.hasDefines()) {
                lines.set(current, substituteDefines(line, tokens));
            }
            current++;
        }

        List<String> texts = new ArrayList<>(lines.size());
        List<SourceMap.LineOrigin> origins = new ArrayList<>(lines.size());
        for (ProcessedLine line : lines) {
            texts.add(line.text());
            origins.add(line.origin());
        }
        log.debug("Preprocessed {} lines", texts.size());
        return new PreProcessedSource(texts, new SourceMap(origins));
    }

    private void expandMacro(MacroDefinition macro, ProcessedLine call, List<String> tokens) throws CompilationException {
        List<String> actualArgs = tokens.subList(1, tokens.size());
        if (actualArgs.size() != macro.parameters().size()) {
            throw error(call, "Macro '" + macro.name() + "' expects " + macro.parameters().size()
                    + " arguments, but got " + actualArgs.size(), "Check the parameters of the macro declared at line "
                    + macro.declaredAt());
        }
        int depth = call.macroDepth() + 1;
        if (depth > maxMacroDepth) {
            throw error(call, "Macro expansion exceeds the maximum depth of " + maxMacroDepth,
                    "Check for recursive invocations of '" + macro.name() + "'");
        }

        String directive = "macro " + macro.name();
        List<ProcessedLine> expanded = new ArrayList<>();
        for (String bodyLine : macro.expand(actualArgs)) {
            expanded.add(call.derive(bodyLine, directive, depth));
        }
        removeLines(current, 1);
        injectLines(expanded);
    }

    private ProcessedLine substituteDefines(ProcessedLine line, List<String> tokens) {
        boolean replaced = false;
        List<String> result = new ArrayList<>(tokens.size());
        result.add(tokens.get(0));
        for (String token : tokens.subList(1, tokens.size())) {
            Optional<String> value = ppContext.getDefine(token);
            replaced |= value.isPresent();
            result.add(value.orElse(token));
        }
        if (!replaced) {
            return line;
        }
        return new ProcessedLine(String.join(" ", result), line.origin(), line.macroDepth());
    }

    private static String stripLineTerminator(String line) {
        int end = line.length();
        while (end > 0 && (line.charAt(end - 1) == '\n' || line.charAt(end - 1) == '\r')) {
            end--;
        }
        return line.substring(0, end);
    }

    // --- Line stream navigation (used by directive handlers) ---

    /**
     * Returns the current line without consuming it.
     * @return The current line.
     */
    public ProcessedLine peek() {
        return lines.get(current);
    }

    /**
     * Consumes the current line.
     * @return The consumed line.
     */
    public ProcessedLine advance() {
        return lines.get(current++);
    }

    /**
     * Checks if the end of the line stream has been reached.
     * @return true if there are no more lines.
     */
    public boolean isAtEnd() {
        return current >= lines.size();
    }

    /**
     * Gets the current index in the line stream.
     * @return The current index.
     */
    public int getCurrentIndex() {
        return current;
    }

    // --- Line stream manipulation ---

    /**
     * Removes a number of lines starting at a given index and moves the cursor there.
     * @param startIndex The starting index.
     * @param count The number of lines to remove.
     */
    public void removeLines(int startIndex, int count) {
        if (startIndex < 0 || (startIndex + count) > lines.size()) return;
        lines.subList(startIndex, startIndex + count).clear();
        this.current = startIndex;
    }

    /**
     * Inserts lines at the current position. The cursor stays on the first inserted line,
     * so generated lines are preprocessed too.
     * @param newLines The lines to insert.
     */
    public void injectLines(List<ProcessedLine> newLines) {
        lines.addAll(current, newLines);
    }

    /**
     * Builds the diagnostic exception for a line. The caller throws it.
     * @param line       The offending line.
     * @param reason     What is wrong.
     * @param suggestion How to fix it, or an empty string.
     * @return The exception to throw.
     */
    public CompilationException error(ProcessedLine line, String reason, String suggestion) {
        SourceMap.LineOrigin origin = line.origin();
        return new CompilationException(new Diagnostic(origin.line(), origin.directive(), line.text(), reason, suggestion));
    }

    /**
     * Gets the shared context for the preprocessor.
     * @return The preprocessor context.
     */
    public PreProcessorContext getPreProcessorContext() {
        return this.ppContext;
    }
}
