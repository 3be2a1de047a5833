package org.ppvariant.compiler.frontend.preprocessor.flow;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.ppvariant.compiler.model.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests the receiver protocol of {@link FlowTree}: event order, pruning, exceptions and
 * repeatability.
 */
@Tag("unit")
@ExtendWith(MockitoExtension.class)
public class FlowTreeTest {

    private static final List<Token> TWO_BLOCKS = TestTokens.of(
            "a", "`ifdef", "A", "b", "`endif", "`ifndef", "B", "c", "`else", "d", "`endif", "e");

    @Mock
    private VariantReceiver receiver;

    @Test
    void receiverRejectingFirstVisitStopsEverything() {
        when(receiver.receive(any())).thenReturn(false);

        int count = FlowTree.of(TWO_BLOCKS).generateVariants(receiver);

        assertThat(count).isZero();
        verify(receiver, times(1)).receive(any());
    }

    @Test
    void visitsEveryNodeThenCompletesOnLastToken() {
        when(receiver.receive(any())).thenReturn(true);

        FlowTree.of(TestTokens.of("a", "b", "c")).generateVariants(receiver);

        ArgumentCaptor<VariantEvent> events = ArgumentCaptor.forClass(VariantEvent.class);
        verify(receiver, times(4)).receive(events.capture());
        List<VariantEvent> captured = events.getAllValues();
        assertThat(captured.subList(0, 3)).allMatch(e -> e instanceof VariantEvent.Visiting);
        assertThat(captured.get(3)).isInstanceOf(VariantEvent.Completed.class);
        assertThat(TestTokens.texts(captured.get(3).tokens())).containsExactly("a", "b", "c");
        assertThat(captured.get(3).variantIndex()).isZero();
    }

    @Test
    void visitingEventsExposeThePrefixBuiltSoFar() {
        List<List<String>> prefixes = new ArrayList<>();
        FlowTree.of(TestTokens.of("a", "b", "c")).generateVariants(event -> {
            if (event instanceof VariantEvent.Visiting) {
                prefixes.add(TestTokens.texts(event.tokens()));
            }
            return true;
        });

        assertThat(prefixes).containsExactly(List.of(), List.of("a"), List.of("a", "b"));
    }

    @Test
    void rejectingVisitPrunesOnlyThatSubtree() {
        List<List<String>> variants = new ArrayList<>();
        int count = FlowTree.of(TestTokens.of("a", "`ifdef", "M", "b", "`endif", "c")).generateVariants(event -> {
            if (event instanceof VariantEvent.Completed completed) {
                variants.add(TestTokens.texts(completed.tokens()));
                return true;
            }
            List<Token> prefix = event.tokens();
            return prefix.isEmpty() || !prefix.get(prefix.size() - 1).text().equals("b");
        });

        assertThat(count).isEqualTo(1);
        assertThat(variants).containsExactly(List.of("a", "c"));
    }

    @Test
    void receiverExceptionAbortsEnumeration() {
        List<Integer> seen = new ArrayList<>();
        FlowTree tree = FlowTree.of(TWO_BLOCKS);

        assertThatThrownBy(() -> tree.generateVariants(event -> {
            if (event instanceof VariantEvent.Completed completed) {
                seen.add(completed.variantIndex());
                throw new IllegalStateException("stop");
            }
            return true;
        })).isInstanceOf(IllegalStateException.class).hasMessage("stop");
        assertThat(seen).containsExactly(0);
    }

    @Test
    void completedVariantsAreImmutableSnapshots() {
        List<List<Token>> variants = FlowTree.of(TWO_BLOCKS).collectVariants();

        assertThat(variants).hasSize(4);
        assertThatThrownBy(() -> variants.get(0).clear()).isInstanceOf(UnsupportedOperationException.class);
        assertThat(TestTokens.texts(variants.get(0))).containsExactly("a", "b", "c", "e");
        assertThat(TestTokens.texts(variants.get(3))).containsExactly("a", "d", "e");
    }

    @Test
    void buildingAndEnumeratingTwiceIsDeterministic() {
        List<List<String>> first = TestTokens.variants(TWO_BLOCKS);
        List<List<String>> second = TestTokens.variants(TWO_BLOCKS);

        FlowTree tree = FlowTree.of(TWO_BLOCKS);
        List<List<String>> third = tree.collectVariants().stream().map(TestTokens::texts).toList();
        List<List<String>> fourth = tree.collectVariants().stream().map(TestTokens::texts).toList();

        assertThat(second).isEqualTo(first);
        assertThat(third).isEqualTo(first);
        assertThat(fourth).isEqualTo(first);
    }

    @Test
    void treeCanBeEnumeratedConcurrently() throws Exception {
        FlowTree tree = FlowTree.of(TWO_BLOCKS);
        List<List<Token>> expected = tree.collectVariants();

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<List<List<Token>>>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                futures.add(executor.submit(tree::collectVariants));
            }
            for (Future<List<List<Token>>> future : futures) {
                assertThat(future.get()).isEqualTo(expected);
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void onCompletedAdapterIgnoresVisits() {
        List<List<Token>> variants = new ArrayList<>();
        VariantReceiver adapter = VariantReceiver.onCompleted(variants::add);

        assertThat(adapter.receive(new VariantEvent.Visiting(List.of(), 0))).isTrue();
        assertThat(variants).isEmpty();
        assertThat(adapter.receive(new VariantEvent.Completed(List.of(), 0))).isTrue();
        assertThat(variants).hasSize(1);
    }
}
