package org.aasm.compiler.diagnostics;

/**
 * A positioned compilation error. Every user-facing failure is reported as exactly one diagnostic.
 *
 * @param line       The line number in the original source (1-based).
 * @param directive  A description of the preprocessor directive that generated the line,
 *                   or an empty string if the line was written by the user.
 * @param lineText   The text of the offending line after preprocessing.
 * @param reason     What is wrong.
 * @param suggestion How to fix it, or an empty string.
 */
public record Diagnostic(int line, String directive, String lineText, String reason, String suggestion) {

    public Diagnostic {
        directive = directive == null ? "" : directive;
        lineText = lineText == null ? "" : lineText.strip();
        suggestion = suggestion == null ? "" : suggestion;
    }

    /**
     * @return true if the line was produced by a preprocessor directive.
     */
    public boolean isFromDirective() {
        return !directive.isEmpty();
    }

    /**
     * Describes where the error happened.
     * @return The location line of the report.
     */
    public String place() {
        if (isFromDirective()) {
            return "Error in preprocessor directive: " + directive + ", declared at line " + line;
        }
        return "Error in line " + line + ": " + lineText;
    }

    /**
     * Renders the full report: location, reason and, if present, the suggestion.
     * @return The human-readable report.
     */
    public String format() {
        StringBuilder sb = new StringBuilder(place()).append(System.lineSeparator()).append(reason);
        if (!suggestion.isEmpty()) {
            sb.append(System.lineSeparator()).append("Suggestion: ").append(suggestion);
        }
        return sb.toString();
    }
}
