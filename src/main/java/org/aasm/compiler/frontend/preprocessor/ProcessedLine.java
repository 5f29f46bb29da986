package org.aasm.compiler.frontend.preprocessor;

import org.aasm.compiler.diagnostics.SourceMap.LineOrigin;
import org.aasm.compiler.frontend.lexer.Tokenizer;

import java.util.List;

/**
 * A line travelling through the preprocessor together with its origin.
 *
 * @param text       The line text.
 * @param origin     Where the line comes from.
 * @param macroDepth How many macro expansions produced this line.
 */
public record ProcessedLine(String text, LineOrigin origin, int macroDepth) {

    /**
     * @param text       The line text.
     * @param lineNumber The 1-based line number in the source.
     * @return A line written by the user.
     */
    public static ProcessedLine fromSource(String text, int lineNumber) {
        return new ProcessedLine(text, LineOrigin.source(lineNumber), 0);
    }

    /**
     * @return The tokens of the line, with the first token left as written.
     */
    public List<String> tokens() {
        return Tokenizer.split(text);
    }

    /**
     * Creates a line generated from this one by a directive. A line that is already
     * generated keeps its origin, so diagnostics point at the outermost directive.
     * @param newText   The generated text.
     * @param directive The description of the generating directive.
     * @param depth     The macro depth of the generated line.
     * @return The generated line.
     */
    public ProcessedLine derive(String newText, String directive, int depth) {
        LineOrigin newOrigin = origin.isGenerated() ? origin : new LineOrigin(origin.line(), directive);
        return new ProcessedLine(newText, newOrigin, depth);
    }
}
