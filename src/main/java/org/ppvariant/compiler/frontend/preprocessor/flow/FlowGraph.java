package org.ppvariant.compiler.frontend.preprocessor.flow;

import org.ppvariant.compiler.model.Token;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The conditional flow graph of a token sequence: for each token index, the ordered
 * successor indices. A branching directive has exactly two successors, the first taken
 * when its condition holds and the second when it does not. Every other token has at
 * most one.
 * <p>
 * Instances are immutable and may be enumerated from several threads at once.
 */
public final class FlowGraph {

    private final List<Token> tokens;
    private final int[][] edges;
    private final int[] macroIds;
    private final List<ConditionalBlock> blocks;
    private final Map<String, Integer> macros;

    FlowGraph(List<Token> tokens, int[][] edges, int[] macroIds,
              List<ConditionalBlock> blocks, Map<String, Integer> macros) {
        this.tokens = tokens;
        this.edges = edges;
        this.macroIds = macroIds;
        this.blocks = List.copyOf(blocks);
        this.macros = Collections.unmodifiableMap(new LinkedHashMap<>(macros));
    }

    /**
     * @return The number of nodes, equal to the number of input tokens.
     */
    public int size() {
        return tokens.size();
    }

    public Token token(int index) {
        return tokens.get(index);
    }

    /**
     * Returns a copy of the successors of a node.
     * @param index The node index.
     * @return The successor indices, {@code [true, false]} for a branching directive.
     */
    public int[] successors(int index) {
        return edges[index].clone();
    }

    /**
     * Returns the macro ID tested by the branching directive at {@code index}.
     * @param index The node index.
     * @return The macro ID, or 0 if the node is not a branching directive.
     */
    public int macroIdAt(int index) {
        return macroIds[index];
    }

    /**
     * @return The completed conditional blocks in the order their {@code `endif} was seen.
     */
    public List<ConditionalBlock> blocks() {
        return blocks;
    }

    /**
     * @return Macro name to ID for every macro tested by a conditional directive, in discovery order.
     */
    public Map<String, Integer> macros() {
        return macros;
    }

    /**
     * @return The total number of edges.
     */
    public int edgeCount() {
        return Arrays.stream(edges).mapToInt(e -> e.length).sum();
    }

    int[] edgesOf(int index) {
        return edges[index];
    }
}
