package org.aasm.compiler.frontend.parser;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Every opcode of the language with the number of arguments it accepts.
 * A line whose opcode is unknown or whose argument count is out of range is
 * rejected before any handler runs.
 */
public enum Opcode {
    AGENT(1),
    EAGENT(0),
    MESSAGE(2),
    EMESSAGE(0),
    PRM(2, Integer.MAX_VALUE),
    BEHAV(2, 4),
    EBEHAV(0),
    ACTION(2, 4),
    EACTION(0),

    DECL(2),
    SET(2),
    EBLOCK(0),
    IEQ(2),
    INEQ(2),
    IGT(2),
    IGTEQ(2),
    ILT(2),
    ILTEQ(2),
    WEQ(2),
    WNEQ(2),
    WGT(2),
    WGTEQ(2),
    WLT(2),
    WLTEQ(2),
    IN(2),
    NIN(2),
    ADD(2),
    SUBT(2),
    MULT(2),
    DIV(2),
    ROUND(1),
    RAND(4, 5),
    ADDE(2),
    REME(2),
    LEN(2),
    CLR(1),
    SUBS(3),
    REMEN(2),
    SEND(1),

    GRAPH(1),
    EGRAPH(0),
    SIZE(1),
    DEFG(3, 5),
    SCALE(1),
    DEFNODE(1, Integer.MAX_VALUE);

    private static final Map<String, Opcode> BY_NAME = Arrays.stream(values())
            .collect(Collectors.toMap(Opcode::name, Function.identity()));

    private final int minArguments;
    private final int maxArguments;

    Opcode(int arguments) {
        this(arguments, arguments);
    }

    Opcode(int minArguments, int maxArguments) {
        this.minArguments = minArguments;
        this.maxArguments = maxArguments;
    }

    /**
     * Looks up an opcode by its upper-cased token.
     * @param token The opcode token.
     * @return The opcode, or empty if the token is not an opcode.
     */
    public static Optional<Opcode> of(String token) {
        return Optional.ofNullable(BY_NAME.get(token));
    }

    /**
     * @param argumentCount The number of tokens after the opcode.
     * @return true if the opcode accepts that many arguments.
     */
    public boolean accepts(int argumentCount) {
        return argumentCount >= minArguments && argumentCount <= maxArguments;
    }
}
