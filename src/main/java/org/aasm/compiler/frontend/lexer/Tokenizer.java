package org.aasm.compiler.frontend.lexer;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Splits processed lines into tokens.
 * <p>
 * Everything from the first {@value #COMMENT_MARKER} on is a comment, commas count as
 * whitespace, and the first token of a line is upper-cased. Blank lines yield nothing,
 * but they still advance the line counter so that diagnostics can be positioned.
 */
public class Tokenizer {

    public static final char COMMENT_MARKER = '#';

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    /**
     * Tokenizes every line of the processed source.
     * @param lines The processed lines.
     * @return One entry per non-blank line, in order.
     */
    public List<SourceLine> tokenize(List<String> lines) {
        List<SourceLine> result = new ArrayList<>();
        int lineNumber = 0;
        for (String line : lines) {
            lineNumber++;
            List<String> tokens = split(line);
            if (tokens.isEmpty()) {
                continue;
            }
            tokens.set(0, tokens.get(0).toUpperCase(Locale.ROOT));
            result.add(new SourceLine(lineNumber, line, tokens));
        }
        return result;
    }

    /**
     * Splits a single line without normalising the opcode.
     * @param line The raw line.
     * @return The tokens, empty for blank or comment-only lines.
     */
    public static List<String> split(String line) {
        String uncommented = stripComment(line);
        List<String> tokens = new ArrayList<>();
        for (String token : uncommented.replace(',', ' ').trim().split("\\s+")) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    /**
     * @param line The raw line.
     * @return The part of the line before the comment marker.
     */
    public static String stripComment(String line) {
        int marker = line.indexOf(COMMENT_MARKER);
        return marker < 0 ? line : line.substring(0, marker);
    }

    /**
     * @param token A token.
     * @return true if the token can name an agent, field, behaviour, action or macro.
     */
    public static boolean isIdentifier(String token) {
        return IDENTIFIER.matcher(token).matches();
    }
}
