package org.aasm.compiler.diagnostics;

import java.util.List;

/**
 * Maps processed lines back to the original source.
 * Lines written by the user map to themselves with an empty directive description;
 * lines generated by a directive map to the directive's line and describe it.
 */
public final class SourceMap {

    private final List<LineOrigin> origins;

    public SourceMap(List<LineOrigin> origins) {
        this.origins = List.copyOf(origins);
    }

    /**
     * Resolves the origin of a processed line.
     * @param processedLine The 1-based index in the processed line list.
     * @return The origin.
     * @throws IndexOutOfBoundsException if the index is outside the processed source.
     */
    public LineOrigin originOf(int processedLine) {
        return origins.get(processedLine - 1);
    }

    /**
     * @return The number of processed lines.
     */
    public int size() {
        return origins.size();
    }

    /**
     * Where a processed line comes from.
     *
     * @param line      The original line number (1-based).
     * @param directive The generating directive, or an empty string.
     */
    public record LineOrigin(int line, String directive) {

        /**
         * @param line The original line number.
         * @return The origin of a line written by the user.
         */
        public static LineOrigin source(int line) {
            return new LineOrigin(line, "");
        }

        /**
         * @return true if a directive generated the line.
         */
        public boolean isGenerated() {
            return !directive.isEmpty();
        }
    }
}
