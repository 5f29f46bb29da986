package org.aasm.compiler.frontend.preprocessor.features.repeat;

import org.aasm.compiler.diagnostics.CompilationException;
import org.aasm.compiler.diagnostics.SourceMap;
import org.aasm.compiler.frontend.preprocessor.IPreProcessorDirectiveHandler;
import org.aasm.compiler.frontend.preprocessor.PreProcessor;
import org.aasm.compiler.frontend.preprocessor.PreProcessorContext;
import org.aasm.compiler.frontend.preprocessor.ProcessedLine;

import java.util.ArrayList;
import java.util.List;

/**
 * Handles the {@code .REPEAT} directive for repeating a block of lines.
 *
 * <p>Example:</p>
 * <pre>
 * .REPEAT 2
 *     ADD counter, 1
 * .ENDR
 * </pre>
 * expands to two {@code ADD} lines. Blocks may be nested; a count of zero removes the block.
 */
public class RepeatDirectiveHandler implements IPreProcessorDirectiveHandler {

    public static final String DIRECTIVE = ".REPEAT";
    public static final String END_DIRECTIVE = ".ENDR";

    /**
     * Parses a {@code .REPEAT} directive and expands the body.
     *
     * @param preProcessor The preprocessor for line stream access.
     * @param ppContext    The preprocessor context (not used, but required by interface).
     * @throws CompilationException if the count is invalid or the block is never closed.
     */
    @Override
    public void process(PreProcessor preProcessor, PreProcessorContext ppContext) throws CompilationException {
        int startIndex = preProcessor.getCurrentIndex();
        ProcessedLine header = preProcessor.advance();
        List<String> tokens = header.tokens();

        if (tokens.size() != 2) {
            throw preProcessor.error(header, "Expected repeat count after " + DIRECTIVE, DIRECTIVE + " n");
        }
        int count;
        try {
            count = Integer.parseInt(tokens.get(1));
        } catch (NumberFormatException e) {
            throw preProcessor.error(header, "Repeat count must be an integer, got: " + tokens.get(1), "");
        }
        if (count < 0) {
            throw preProcessor.error(header, "Repeat count must be non-negative, got: " + count, "");
        }

        List<ProcessedLine> body = readUntilEndr(preProcessor, header);

        List<ProcessedLine> expanded = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            for (ProcessedLine line : body) {
                String directive = DIRECTIVE + " " + count + ", iteration " + i + ", body line " + line.origin().line();
                SourceMap.LineOrigin origin = new SourceMap.LineOrigin(header.origin().line(), directive);
                expanded.add(line.origin().isGenerated() ? line : new ProcessedLine(line.text(), origin, line.macroDepth()));
            }
        }

        int endIndex = preProcessor.getCurrentIndex();
        preProcessor.removeLines(startIndex, endIndex - startIndex);
        preProcessor.injectLines(expanded);
    }

    /**
     * Reads lines until the {@code .ENDR} matching the header, keeping nested blocks intact
     * so that they are expanded when the preprocessor reaches them.
     */
    private List<ProcessedLine> readUntilEndr(PreProcessor preProcessor, ProcessedLine header) throws CompilationException {
        List<ProcessedLine> body = new ArrayList<>();
        int nesting = 0;
        while (!preProcessor.isAtEnd()) {
            ProcessedLine line = preProcessor.advance();
            List<String> tokens = line.tokens();
            String head = tokens.isEmpty() ? "" : tokens.get(0);
            if (head.equalsIgnoreCase(DIRECTIVE)) {
                nesting++;
            } else if (head.equalsIgnoreCase(END_DIRECTIVE)) {
                if (nesting == 0) {
                    return body;
                }
                nesting--;
            }
            body.add(line);
        }
        throw preProcessor.error(header, "Missing " + END_DIRECTIVE, "Close the block with " + END_DIRECTIVE);
    }
}
