package org.aasm.compiler.frontend.parser.features.graph;

import org.aasm.compiler.diagnostics.CompilationException;
import org.aasm.compiler.frontend.parser.ArgumentResolver;
import org.aasm.compiler.frontend.parser.ParsingContext;

import java.math.BigDecimal;

/**
 * Numeric argument checks for graph statements.
 */
final class GraphNumbers {

    private GraphNumbers() {
    }

    static int nonNegativeInt(String token, ParsingContext context) throws CompilationException {
        context.require(token.matches("\\d+"), "Expected a non-negative integer, got: " + token, "");
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw context.error("Number out of range: " + token);
        }
    }

    static String number(String token, ParsingContext context) throws CompilationException {
        context.require(ArgumentResolver.isNumber(token), "Expected a number, got: " + token, "");
        return token;
    }

    static String nonNegative(String token, ParsingContext context) throws CompilationException {
        number(token, context);
        context.require(new BigDecimal(token).signum() >= 0, "Expected a non-negative number, got: " + token, "");
        return token;
    }

    static String positive(String token, ParsingContext context) throws CompilationException {
        number(token, context);
        context.require(new BigDecimal(token).signum() > 0, "Expected a positive number, got: " + token, "");
        return token;
    }
}
