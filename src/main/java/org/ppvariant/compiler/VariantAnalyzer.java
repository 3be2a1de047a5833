package org.ppvariant.compiler;

import org.ppvariant.compiler.api.CompilationException;
import org.ppvariant.compiler.diagnostics.DiagnosticsEngine;
import org.ppvariant.compiler.frontend.lexer.Lexer;
import org.ppvariant.compiler.frontend.preprocessor.flow.FlowTree;
import org.ppvariant.compiler.frontend.preprocessor.flow.FlowTreeException;
import org.ppvariant.compiler.frontend.preprocessor.flow.MacroIdTable;
import org.ppvariant.compiler.model.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs the front end on one source file: lexing, then construction of the conditional
 * flow tree. The returned tree is ready for variant enumeration.
 */
public class VariantAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(VariantAnalyzer.class);

    private final int maxMacros;

    public VariantAnalyzer() {
        this(MacroIdTable.DEFAULT_MAX_MACROS);
    }

    /**
     * @param maxMacros The maximum number of distinct conditional macros per file.
     */
    public VariantAnalyzer(int maxMacros) {
        this.maxMacros = maxMacros;
    }

    /**
     * Lexes the source and builds its flow tree.
     *
     * @param source The source text.
     * @param fileName The name recorded in tokens and diagnostics.
     * @return The flow tree.
     * @throws CompilationException if the lexer reports errors or the conditionals are malformed.
     */
    public FlowTree analyze(String source, String fileName) throws CompilationException {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        List<Token> tokens = new Lexer(source, fileName, diagnostics).scanTokens();
        if (diagnostics.hasErrors()) {
            throw new CompilationException(diagnostics.summary(), diagnostics.getDiagnostics());
        }
        log.debug("Lexed {} tokens from {}", tokens.size(), fileName);
        return analyze(tokens);
    }

    /**
     * Builds the flow tree of an already lexed token sequence.
     *
     * @param tokens The tokens.
     * @return The flow tree.
     * @throws CompilationException if the conditionals are malformed.
     */
    public FlowTree analyze(List<Token> tokens) throws CompilationException {
        try {
            return FlowTree.of(tokens, maxMacros);
        } catch (FlowTreeException e) {
            throw new CompilationException(e.getMessage(), e);
        }
    }
}
