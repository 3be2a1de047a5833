package org.ppvariant.compiler.frontend.preprocessor.flow;

import org.ppvariant.compiler.model.Token;
import org.ppvariant.compiler.model.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Builds the {@link FlowGraph} of a token sequence in a single left-to-right pass.
 * <p>
 * Plain tokens fall through to their successor. Conditional directives are grouped into
 * blocks on a stack; when a block's {@code `endif} is reached its branch, fall-through and
 * convergence edges are added and the block is popped. Any structural problem aborts the
 * build with a {@link FlowTreeException}, so a partial graph is never returned.
 */
public class FlowGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(FlowGraphBuilder.class);

    private final List<Token> tokens;
    private final MacroIdTable macroTable;
    private final List<List<Integer>> edges;
    private final int[] macroIds;
    private final Deque<OpenBlock> openBlocks = new ArrayDeque<>();
    private final List<ConditionalBlock> completedBlocks = new ArrayList<>();

    /**
     * A block whose {@code `endif} has not been seen yet.
     */
    private static final class OpenBlock {
        private final int openIndex;
        private final boolean negated;
        private final List<Integer> elsifIndices = new ArrayList<>();
        private int elseIndex = ConditionalBlock.NONE;

        private OpenBlock(int openIndex, boolean negated) {
            this.openIndex = openIndex;
            this.negated = negated;
        }
    }

    /**
     * Creates a builder with the default macro limit.
     * @param tokens The token sequence; copied.
     */
    public FlowGraphBuilder(List<Token> tokens) {
        this(tokens, MacroIdTable.DEFAULT_MAX_MACROS);
    }

    /**
     * @param tokens The token sequence; copied.
     * @param maxMacros The maximum number of distinct conditional macros.
     */
    public FlowGraphBuilder(List<Token> tokens, int maxMacros) {
        this.tokens = List.copyOf(tokens);
        this.macroTable = new MacroIdTable(maxMacros);
        this.edges = new ArrayList<>(this.tokens.size());
        for (int i = 0; i < this.tokens.size(); i++) {
            edges.add(new ArrayList<>(2));
        }
        this.macroIds = new int[this.tokens.size()];
    }

    /**
     * Scans the token sequence and builds the graph.
     * @return The finished flow graph.
     * @throws MalformedConditionalException if a branching directive lacks its macro name.
     * @throws MacroLimitExceededException if too many distinct macros are tested.
     * @throws UnbalancedConditionalException if the directives do not form complete blocks.
     */
    public FlowGraph build() {
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            switch (token.type()) {
                case PP_IFDEF, PP_IFNDEF -> {
                    openBlocks.push(new OpenBlock(i, token.type() == TokenType.PP_IFNDEF));
                    macroIds[i] = assignMacroId(i);
                }
                case PP_ELSIF -> {
                    OpenBlock block = requireOpenBlock(token);
                    if (block.elseIndex != ConditionalBlock.NONE) {
                        throw new UnbalancedConditionalException("'" + token.text() + "' after '`else'", token);
                    }
                    block.elsifIndices.add(i);
                    macroIds[i] = assignMacroId(i);
                }
                case PP_ELSE -> {
                    OpenBlock block = requireOpenBlock(token);
                    if (block.elseIndex != ConditionalBlock.NONE) {
                        throw new UnbalancedConditionalException("Duplicate '" + token.text() + "' in block", token);
                    }
                    block.elseIndex = i;
                }
                case PP_ENDIF -> {
                    OpenBlock block = requireOpenBlock(token);
                    ConditionalBlock completed = new ConditionalBlock(
                            block.openIndex, block.negated, block.elsifIndices, block.elseIndex, i);
                    addBlockEdges(completed);
                    completedBlocks.add(completed);
                    openBlocks.pop();
                }
                default -> {
                    // Continuations are reached through the block edges instead.
                    if (i + 1 < tokens.size() && !tokens.get(i + 1).type().isBlockContinuation()) {
                        addEdge(i, i + 1);
                    }
                }
            }
        }
        if (!openBlocks.isEmpty()) {
            Token unclosed = tokens.get(openBlocks.peek().openIndex);
            throw new UnbalancedConditionalException("Missing '`endif' for '" + unclosed.text() + "'", unclosed);
        }

        int[][] edgeTable = new int[edges.size()][];
        for (int i = 0; i < edges.size(); i++) {
            edgeTable[i] = edges.get(i).stream().mapToInt(Integer::intValue).toArray();
        }
        FlowGraph graph = new FlowGraph(tokens, edgeTable, macroIds, completedBlocks, macroTable.asMap());
        log.debug("Built flow graph: {} tokens, {} edges, {} blocks, {} macros",
                graph.size(), graph.edgeCount(), completedBlocks.size(), macroTable.size());
        return graph;
    }

    /**
     * Adds the branch, fall-through and convergence edges of a completed block.
     * The first edge of each branching directive is its true edge.
     */
    private void addBlockEdges(ConditionalBlock block) {
        int open = block.openIndex();
        int endif = block.endifIndex();

        addEdge(open, open + 1);
        addEdge(open, block.falseSuccessorOf(-1));

        List<Integer> elsifs = block.elsifIndices();
        for (int i = 0; i < elsifs.size(); i++) {
            int elsif = elsifs.get(i);
            addEdge(elsif, elsif + 1);
            addEdge(elsif, block.falseSuccessorOf(i));
        }

        if (block.hasElse()) {
            addEdge(block.elseIndex(), block.elseIndex() + 1);
        }

        // Every branch tail rejoins at `endif.
        addEdge(endif - 1, endif);
        for (int elsif : elsifs) {
            addEdge(elsif - 1, endif);
        }
        if (block.hasElse()) {
            addEdge(block.elseIndex() - 1, endif);
        }

        int next = endif + 1;
        if (next < tokens.size() && !tokens.get(next).type().isBlockContinuation()) {
            addEdge(endif, next);
        }
    }

    private void addEdge(int from, int to) {
        List<Integer> successors = edges.get(from);
        // Branch edges are never equal; only fall-through and convergence can coincide.
        if (!tokens.get(from).type().isBranching() && successors.contains(to)) {
            return;
        }
        successors.add(to);
    }

    private int assignMacroId(int directiveIndex) {
        Token directive = tokens.get(directiveIndex);
        int nameIndex = directiveIndex + 1;
        if (nameIndex >= tokens.size() || tokens.get(nameIndex).type() != TokenType.PP_IDENTIFIER) {
            throw new MalformedConditionalException(directive);
        }
        return macroTable.resolveOrAssign(tokens.get(nameIndex));
    }

    private OpenBlock requireOpenBlock(Token directive) {
        OpenBlock block = openBlocks.peek();
        if (block == null) {
            throw new UnbalancedConditionalException("'" + directive.text() + "' without matching '`ifdef' or '`ifndef'", directive);
        }
        return block;
    }
}
