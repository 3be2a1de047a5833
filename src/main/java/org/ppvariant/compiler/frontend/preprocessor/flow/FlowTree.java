package org.ppvariant.compiler.frontend.preprocessor.flow;

import org.ppvariant.compiler.model.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for enumerating the preprocessing variants of a token sequence.
 * <p>
 * Building the tree validates the conditional structure; once built, the tree can be
 * enumerated any number of times, also concurrently.
 * <pre>{@code
 * FlowTree tree = FlowTree.of(tokens);
 * tree.generateVariants(VariantReceiver.onCompleted(variant -> print(variant)));
 * }</pre>
 */
public final class FlowTree {

    private final FlowGraph graph;

    private FlowTree(FlowGraph graph) {
        this.graph = graph;
    }

    /**
     * Builds the flow tree with the default macro limit.
     * @param tokens The token sequence.
     * @return The flow tree.
     * @throws FlowTreeException if the conditional structure is malformed.
     */
    public static FlowTree of(List<Token> tokens) {
        return new FlowTree(new FlowGraphBuilder(tokens).build());
    }

    /**
     * Builds the flow tree.
     * @param tokens The token sequence.
     * @param maxMacros The maximum number of distinct conditional macros.
     * @return The flow tree.
     * @throws FlowTreeException if the conditional structure is malformed or too large.
     */
    public static FlowTree of(List<Token> tokens, int maxMacros) {
        return new FlowTree(new FlowGraphBuilder(tokens, maxMacros).build());
    }

    /**
     * Reports every variant to the receiver.
     * @param receiver The event receiver.
     * @return The number of completed variants.
     */
    public int generateVariants(VariantReceiver receiver) {
        return new VariantEnumerator(graph).enumerate(receiver);
    }

    /**
     * @return All completed variants in enumeration order.
     */
    public List<List<Token>> collectVariants() {
        List<List<Token>> variants = new ArrayList<>();
        generateVariants(VariantReceiver.onCompleted(variants::add));
        return variants;
    }

    public FlowGraph graph() {
        return graph;
    }
}
