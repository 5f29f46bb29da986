package org.aasm.compiler.frontend.parser;

import org.aasm.compiler.diagnostics.CompilationException;
import org.aasm.compiler.diagnostics.Diagnostic;
import org.aasm.compiler.diagnostics.SourceMap;
import org.aasm.compiler.frontend.lexer.SourceLine;
import org.aasm.compiler.frontend.parser.context.ActionBuilder;
import org.aasm.compiler.frontend.parser.context.AgentBuilder;
import org.aasm.compiler.frontend.parser.context.BehaviourBuilder;
import org.aasm.compiler.frontend.parser.context.BlockBuilder;
import org.aasm.compiler.frontend.parser.context.ContextFrame;
import org.aasm.compiler.frontend.parser.context.GraphBuilder;
import org.aasm.compiler.frontend.parser.context.InstructionSink;
import org.aasm.compiler.frontend.parser.context.MatrixGraphBuilder;
import org.aasm.compiler.frontend.parser.context.MessageBuilder;
import org.aasm.compiler.frontend.parser.context.ParserState;
import org.aasm.compiler.frontend.parser.context.StatisticalGraphBuilder;
import org.aasm.compiler.ir.Argument;
import org.aasm.compiler.ir.Program;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The parsing state machine. It dispatches every tokenized line to the handler of its
 * opcode and lets the handlers build the program on a shared {@link ParserState}.
 * <p>
 * A line whose opcode is unknown, or whose argument count the opcode does not accept,
 * fails before any handler runs. Parsing stops at the first error.
 */
public class Parser implements ParsingContext {

    private static final Logger log = LoggerFactory.getLogger(Parser.class);

    /** The opening statement of each construct, for diagnostics. */
    private static final Map<Class<? extends ContextFrame>, String> OPENERS = Map.of(
            AgentBuilder.class, "AGENT",
            MessageBuilder.class, "MESSAGE",
            BehaviourBuilder.class, "BEHAV",
            ActionBuilder.class, "ACTION",
            InstructionSink.class, "ACTION",
            BlockBuilder.class, "a conditional block",
            GraphBuilder.class, "GRAPH",
            StatisticalGraphBuilder.class, "GRAPH statistical",
            MatrixGraphBuilder.class, "GRAPH matrix");

    private final List<SourceLine> lines;
    private final SourceMap sourceMap;
    private final OpcodeHandlerRegistry registry;
    private final boolean trace;
    private final ParserState state = new ParserState();
    private SourceLine current;

    /**
     * Creates a parser with the built-in opcode handlers.
     * @param lines     The tokenized lines.
     * @param sourceMap Maps processed line numbers back to the original source.
     * @param trace     Whether to log every statement at debug level.
     */
    public Parser(List<SourceLine> lines, SourceMap sourceMap, boolean trace) {
        this(lines, sourceMap, OpcodeHandlerRegistry.initialize(), trace);
    }

    /**
     * Creates a parser with a custom handler registry.
     * @param lines     The tokenized lines.
     * @param sourceMap Maps processed line numbers back to the original source.
     * @param registry  The opcode handlers.
     * @param trace     Whether to log every statement at debug level.
     */
    public Parser(List<SourceLine> lines, SourceMap sourceMap, OpcodeHandlerRegistry registry, boolean trace) {
        this.lines = List.copyOf(lines);
        this.sourceMap = sourceMap;
        this.registry = registry;
        this.trace = trace;
    }

    /**
     * Parses all lines.
     * @return The parsed program.
     * @throws CompilationException on the first structural, referential or arity violation.
     */
    public Program parse() throws CompilationException {
        for (SourceLine line : lines) {
            current = line;
            Statement statement = recognize(line);
            if (trace) {
                log.debug("line {}: {} {}", line.number(), statement.opcode(), statement.arguments());
            }
            registry.get(statement.opcode()).handle(statement, this);
        }
        verifyEndState();
        return state.toProgram();
    }

    private Statement recognize(SourceLine line) throws CompilationException {
        Optional<Opcode> opcode = Opcode.of(line.opcode());
        if (opcode.isEmpty() || !opcode.get().accepts(line.arguments().size())) {
            throw error("Unknown tokens: " + line.tokens());
        }
        return new Statement(opcode.get(), line.arguments());
    }

    private void verifyEndState() throws CompilationException {
        Optional<ContextFrame> open = state.top();
        if (open.isPresent()) {
            if (trace) {
                log.debug("input ended inside {}", open.get().description());
            }
            throw error("Missing " + open.get().closingOpcode(),
                    "Close " + open.get().description() + " with " + open.get().closingOpcode());
        }
    }

    @Override
    public ParserState state() {
        return state;
    }

    @Override
    public CompilationException error(String reason, String suggestion) {
        if (current == null) {
            return new CompilationException(new Diagnostic(0, "", "", reason, suggestion));
        }
        SourceMap.LineOrigin origin = sourceMap.originOf(current.number());
        return new CompilationException(
                new Diagnostic(origin.line(), origin.directive(), current.text(), reason, suggestion));
    }

    @Override
    public Argument resolveArgument(String token) throws CompilationException {
        return ArgumentResolver.resolve(token, this);
    }

    @Override
    public <T extends ContextFrame> T expect(Class<T> kind, Opcode opcode) throws CompilationException {
        Optional<ContextFrame> top = state.top();
        if (top.isPresent() && kind.isInstance(top.get())) {
            return kind.cast(top.get());
        }
        String reason = top.map(frame -> opcode + " is not allowed in " + frame.description())
                .orElse(opcode + " is not allowed at top level");
        throw error(reason, opcode + " must appear directly inside " + OPENERS.getOrDefault(kind, kind.getSimpleName()));
    }

    @Override
    public <T extends ContextFrame> T close(Class<T> kind, Opcode opcode) throws CompilationException {
        Optional<ContextFrame> top = state.top();
        if (top.isEmpty() || (!kind.isInstance(top.get()) && state.innermost(kind).isEmpty())) {
            throw error(opcode + " without matching " + OPENERS.getOrDefault(kind, kind.getSimpleName()));
        }
        if (!kind.isInstance(top.get())) {
            throw error(opcode + " while " + top.get().description() + " is still open",
                    "Close it with " + top.get().closingOpcode());
        }
        return kind.cast(state.pop());
    }

    @Override
    public void requireTopLevel(Opcode opcode) throws CompilationException {
        Optional<ContextFrame> top = state.top();
        if (top.isPresent()) {
            throw error(opcode + " cannot be nested in " + top.get().description(),
                    "Close it with " + top.get().closingOpcode());
        }
    }
}
