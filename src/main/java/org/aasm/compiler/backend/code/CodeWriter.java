package org.aasm.compiler.backend.code;

import java.util.ArrayList;
import java.util.List;

/**
 * An append-only line buffer with an indentation cursor.
 * <p>
 * Indentation only changes inside {@link #indented(Runnable)} and
 * {@link #block(String, Runnable)}, which restore the previous level when the body
 * returns, so every indent is matched by a dedent. Blank lines carry no indentation.
 */
public final class CodeWriter {

    private final String indentUnit;
    private final List<String> lines = new ArrayList<>();
    private int depth;

    /**
     * @param indentSize The number of spaces per indentation level.
     */
    public CodeWriter(int indentSize) {
        if (indentSize < 1) {
            throw new IllegalArgumentException("Indent size must be positive, got " + indentSize);
        }
        this.indentUnit = " ".repeat(indentSize);
    }

    /**
     * Appends a line at the current indentation.
     * @param text The line content.
     * @return This writer.
     */
    public CodeWriter line(String text) {
        lines.add(text.isEmpty() ? "" : indentUnit.repeat(depth) + text);
        return this;
    }

    public CodeWriter newline() {
        lines.add("");
        return this;
    }

    public CodeWriter newlines(int count) {
        for (int i = 0; i < count; i++) {
            newline();
        }
        return this;
    }

    /**
     * Emits the body one level deeper.
     * @param body Emits the nested lines.
     * @return This writer.
     */
    public CodeWriter indented(Runnable body) {
        depth++;
        try {
            body.run();
        } finally {
            depth--;
        }
        return this;
    }

    /**
     * Emits a header line followed by its body one level deeper.
     * @param header The opening line, e.g. {@code if x > 0:}.
     * @param body   Emits the nested lines.
     * @return This writer.
     */
    public CodeWriter block(String header, Runnable body) {
        line(header);
        return indented(body);
    }

    /**
     * @return The current indentation level.
     */
    public int depth() {
        return depth;
    }

    /**
     * @return A snapshot of the emitted lines.
     */
    public List<String> lines() {
        return List.copyOf(lines);
    }
}
