package org.aasm.compiler.frontend.preprocessor.features.define;

import org.aasm.compiler.diagnostics.CompilationException;
import org.aasm.compiler.frontend.lexer.Tokenizer;
import org.aasm.compiler.frontend.preprocessor.IPreProcessorDirectiveHandler;
import org.aasm.compiler.frontend.preprocessor.PreProcessor;
import org.aasm.compiler.frontend.preprocessor.PreProcessorContext;
import org.aasm.compiler.frontend.preprocessor.ProcessedLine;

import java.util.List;

/**
 * Handler for the <code>.DEFINE</code> directive.
 * Registers a named constant; every later argument token equal to the name is replaced by the value.
 */
public class DefineDirectiveHandler implements IPreProcessorDirectiveHandler {

    public static final String DIRECTIVE = ".DEFINE";

    /**
     * Parses a <code>.DEFINE</code> directive.
     * The syntax is <code>.DEFINE &lt;name&gt; &lt;value&gt;</code>.
     * @param preProcessor The preprocessor.
     * @param preProcessorContext The context receiving the constant.
     * @throws CompilationException if the directive is malformed or the name is taken.
     */
    @Override
    public void process(PreProcessor preProcessor, PreProcessorContext preProcessorContext) throws CompilationException {
        ProcessedLine line = preProcessor.peek();
        List<String> tokens = line.tokens();
        if (tokens.size() != 3) {
            throw preProcessor.error(line, "Expected a constant name and a value after " + DIRECTIVE,
                    DIRECTIVE + " NAME value");
        }
        String name = tokens.get(1);
        if (!Tokenizer.isIdentifier(name)) {
            throw preProcessor.error(line, "Invalid constant name: " + name, "Use letters, digits and underscores");
        }
        if (preProcessorContext.getDefine(name).isPresent()) {
            throw preProcessor.error(line, "Constant '" + name + "' is already defined", "Rename one of the constants");
        }
        preProcessorContext.registerDefine(name, tokens.get(2));
        preProcessor.removeLines(preProcessor.getCurrentIndex(), 1);
    }
}
