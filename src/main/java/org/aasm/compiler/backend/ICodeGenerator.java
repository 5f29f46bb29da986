package org.aasm.compiler.backend;

import org.aasm.compiler.ir.Program;

import java.util.List;

/**
 * Emits one unit of target source text from a parsed program.
 * Generators read the program and never modify it.
 */
public interface ICodeGenerator {

    /**
     * Generates the unit.
     * @param program The parsed program.
     * @return The emitted lines, without line terminators.
     */
    List<String> generate(Program program);
}
