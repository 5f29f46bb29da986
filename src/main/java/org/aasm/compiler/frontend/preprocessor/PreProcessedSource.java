package org.aasm.compiler.frontend.preprocessor;

import org.aasm.compiler.diagnostics.SourceMap;

import java.util.List;

/**
 * The output of the preprocessor.
 *
 * @param lines     The processed lines, ready for tokenization.
 * @param sourceMap Maps every processed line back to the original source.
 */
public record PreProcessedSource(List<String> lines, SourceMap sourceMap) {

    public PreProcessedSource {
        lines = List.copyOf(lines);
    }

    /**
     * Returns the text of a processed line.
     * @param processedLine The 1-based processed line index.
     * @return The line text.
     */
    public String lineText(int processedLine) {
        return lines.get(processedLine - 1);
    }
}
