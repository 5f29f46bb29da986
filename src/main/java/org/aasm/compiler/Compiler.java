package org.aasm.compiler;

import org.aasm.compiler.api.GeneratedCode;
import org.aasm.compiler.backend.graph.GraphGenerator;
import org.aasm.compiler.backend.spade.SpadeAgentGenerator;
import org.aasm.compiler.config.CompilerOptions;
import org.aasm.compiler.diagnostics.CompilationException;
import org.aasm.compiler.frontend.lexer.SourceLine;
import org.aasm.compiler.frontend.lexer.Tokenizer;
import org.aasm.compiler.frontend.parser.Parser;
import org.aasm.compiler.frontend.preprocessor.PreProcessedSource;
import org.aasm.compiler.frontend.preprocessor.PreProcessor;
import org.aasm.compiler.ir.Program;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Compiles Agents Assembly programs into SPADE agent code and a graph generation function.
 * <p>
 * The pipeline runs in a single pass: preprocessing, tokenization, parsing into the
 * intermediate representation, then the two independent code generators. Parsing stops at
 * the first error, reported as a {@link CompilationException} carrying one diagnostic.
 * A compiler instance holds no state between calls.
 */
public class Compiler {

    private static final Logger log = LoggerFactory.getLogger(Compiler.class);

    private final CompilerOptions options;

    /**
     * Creates a compiler with the options found by {@link CompilerOptions#load(java.io.File)}
     * without an explicit file.
     */
    public Compiler() {
        this(CompilerOptions.load(null));
    }

    public Compiler(CompilerOptions options) {
        this.options = options;
    }

    /**
     * Compiles a program.
     * @param sourceLines The program text, one entry per line.
     * @return The agent code and the graph code.
     * @throws CompilationException if the program is invalid.
     */
    public GeneratedCode compile(List<String> sourceLines) throws CompilationException {
        Program program = parse(sourceLines);
        List<String> agentCode = new SpadeAgentGenerator(options.indentSize(), options.receiveTimeout())
                .generate(program);
        List<String> graphCode = new GraphGenerator(options.indentSize()).generate(program);
        log.debug("Generated {} lines of agent code and {} lines of graph code", agentCode.size(), graphCode.size());
        return new GeneratedCode(agentCode, graphCode);
    }

    /**
     * Runs the front end only.
     * @param sourceLines The program text, one entry per line.
     * @return The parsed program.
     * @throws CompilationException if the program is invalid.
     */
    public Program parse(List<String> sourceLines) throws CompilationException {
        log.debug("Compiling {} source lines", sourceLines.size());
        PreProcessedSource processed = new PreProcessor(sourceLines, options.maxMacroDepth()).expand();
        List<SourceLine> lines = new Tokenizer().tokenize(processed.lines());
        log.debug("Tokenized {} statements", lines.size());
        Program program = new Parser(lines, processed.sourceMap(), options.debug()).parse();
        log.debug("Parsed {} agents, {} messages, graph: {}", program.agents().size(), program.messages().size(),
                program.graph().map(graph -> graph.getClass().getSimpleName()).orElse("none"));
        return program;
    }
}
