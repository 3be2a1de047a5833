package org.ppvariant.compiler.frontend.preprocessor.flow;

import org.ppvariant.compiler.model.Token;
import org.ppvariant.compiler.model.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks a {@link FlowGraph} depth first and materializes one variant per distinct
 * combination of macro assumptions reachable from the first token.
 * <p>
 * A macro is decided at most once per path: the first directive that tests it branches
 * both ways, later directives on the same path follow the value already assumed. The
 * decision is undone when the recursion returns, so sibling paths decide independently.
 * Recursion depth grows with the path length.
 */
public class VariantEnumerator {

    private static final Logger log = LoggerFactory.getLogger(VariantEnumerator.class);

    private final FlowGraph graph;

    public VariantEnumerator(FlowGraph graph) {
        this.graph = graph;
    }

    /**
     * Enumerates all variants. Each call uses fresh state, so repeated calls report the
     * same variants with the same indices.
     * <p>
     * An exception thrown by the receiver aborts the enumeration and propagates unchanged.
     *
     * @param receiver The event receiver.
     * @return The number of completed variants.
     */
    public int enumerate(VariantReceiver receiver) {
        TraversalState state = new TraversalState();
        if (graph.size() == 0) {
            if (receiver.receive(new VariantEvent.Visiting(state.outputView(), 0))) {
                receiver.receive(new VariantEvent.Completed(state.snapshot(), 0));
                state.countVariant();
            }
            return state.variantCount();
        }
        try {
            visit(0, receiver, state);
        } catch (RuntimeException e) {
            log.debug("Variant enumeration aborted after {} variants: {}", state.variantCount(), e.toString());
            throw e;
        }
        log.debug("Enumerated {} variants over {} tokens", state.variantCount(), graph.size());
        return state.variantCount();
    }

    private void visit(int node, VariantReceiver receiver, TraversalState state) {
        if (!receiver.receive(new VariantEvent.Visiting(state.outputView(), state.variantCount()))) {
            return;
        }
        Token token = graph.token(node);
        TokenType type = token.type();
        boolean emitted = !type.isPreprocessorOnly();
        if (emitted) {
            state.push(token);
        }

        int[] successors = graph.edgesOf(node);
        if (type.isBranching()) {
            int macroId = graph.macroIdAt(node);
            boolean negated = type == TokenType.PP_IFNDEF;
            if (state.isAssumed(macroId)) {
                boolean conditionHolds = state.isDefined(macroId) ^ negated;
                visit(successors[conditionHolds ? 0 : 1], receiver, state);
            } else {
                boolean wasDefined = state.isDefined(macroId);
                state.assume(macroId, !negated);
                visit(successors[0], receiver, state);
                state.assume(macroId, negated);
                visit(successors[1], receiver, state);
                state.restore(macroId, false, wasDefined);
            }
        } else {
            for (int successor : successors) {
                visit(successor, receiver, state);
            }
        }

        if (node == graph.size() - 1) {
            receiver.receive(new VariantEvent.Completed(state.snapshot(), state.variantCount()));
            state.countVariant();
        }
        if (emitted) {
            state.pop();
        }
    }
}
