package org.ppvariant.compiler.frontend.preprocessor.flow;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.ppvariant.compiler.model.Token;
import org.ppvariant.compiler.model.TokenType;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.ppvariant.compiler.frontend.preprocessor.flow.TestTokens.variants;

/**
 * Tests the variants produced by {@link VariantEnumerator} for the common block shapes.
 */
@Tag("unit")
public class VariantEnumeratorTest {

    @Test
    void sourceWithoutConditionalsYieldsItself() {
        assertThat(variants(TestTokens.of("module", "m", ";", "endmodule")))
                .containsExactly(List.of("module", "m", ";", "endmodule"));
    }

    @Test
    void ifdefYieldsVariantWithAndWithoutBody() {
        assertThat(variants(TestTokens.of("a", "`ifdef", "M", "b", "`endif", "c")))
                .containsExactly(List.of("a", "b", "c"), List.of("a", "c"));
    }

    @Test
    void ifdefElseYieldsExactlyOneBodyPerVariant() {
        assertThat(variants(TestTokens.of("a", "`ifdef", "M", "b1", "`else", "b2", "`endif", "d")))
                .containsExactly(List.of("a", "b1", "d"), List.of("a", "b2", "d"));
    }

    @Test
    void ifndefTakesBodyWhenMacroIsUndefined() {
        assertThat(variants(TestTokens.of("`ifndef", "M", "x", "`else", "y", "`endif", "z")))
                .containsExactly(List.of("x", "z"), List.of("y", "z"));
    }

    @Test
    void elsifReferencingDecidedMacroDoesNotBranchAgain() {
        // With M undefined the `elsif M is known to be false, so "y" is unreachable.
        assertThat(variants(TestTokens.of("`ifdef", "M", "x", "`elsif", "M", "y", "`endif", "z")))
                .containsExactly(List.of("x", "z"), List.of("z"));
    }

    @Test
    void laterBlockOnSameMacroFollowsEarlierDecision() {
        assertThat(variants(TestTokens.of(
                "`ifndef", "M", "a", "`endif", "`ifdef", "M", "b", "`endif")))
                .containsExactly(List.of("a"), List.of("b"));
    }

    @Test
    void macroDecisionDoesNotLeakIntoSiblingBranch() {
        // M is decided inside both branches of A; each branch must split on M on its own.
        assertThat(variants(TestTokens.of(
                "`ifdef", "A", "`ifdef", "M", "x", "`endif",
                "`else", "`ifdef", "M", "y", "`endif", "`endif")))
                .containsExactly(List.of("x"), List.of(), List.of("y"), List.of());
    }

    @Test
    void siblingBlocksOnDistinctMacrosYieldCrossProduct() {
        assertThat(variants(TestTokens.of(
                "a", "`ifdef", "M1", "b", "`endif", "`ifdef", "M2", "c", "`endif", "d")))
                .containsExactly(
                        List.of("a", "b", "c", "d"),
                        List.of("a", "b", "d"),
                        List.of("a", "c", "d"),
                        List.of("a", "d"));
    }

    @Test
    void nestedBlockIsOnlyDecidedWhenReached() {
        assertThat(variants(TestTokens.of(
                "a", "`ifdef", "A", "b", "`ifdef", "B", "c", "`endif", "d", "`endif", "e")))
                .containsExactly(
                        List.of("a", "b", "c", "d", "e"),
                        List.of("a", "b", "d", "e"),
                        List.of("a", "e"));
    }

    @Test
    void elsifChainYieldsOneVariantPerArm() {
        assertThat(variants(TestTokens.of(
                "`ifdef", "A", "a", "`elsif", "B", "b", "`else", "c", "`endif", "z")))
                .containsExactly(List.of("a", "z"), List.of("b", "z"), List.of("c", "z"));
    }

    @Test
    void emptyBranchesStillYieldOneVariantPerDecision() {
        assertThat(variants(TestTokens.of("`ifdef", "A", "`else", "`endif", "x")))
                .containsExactly(List.of("x"), List.of("x"));
    }

    @Test
    void preprocessorTokensNeverAppearInVariants() {
        List<Token> tokens = new ArrayList<>();
        tokens.add(Token.of(TokenType.PP_DEFINE, "`define"));
        tokens.add(Token.of(TokenType.PP_IDENTIFIER, "W"));
        tokens.add(Token.of(TokenType.PP_DEFINE_BODY, "8"));
        tokens.addAll(TestTokens.of(
                "`ifdef", "A", "a", "`elsif", "B", "`ifndef", "C", "b", "`endif", "`else", "c", "`endif", "z"));

        List<List<Token>> variants = FlowTree.of(tokens).collectVariants();

        assertThat(variants).hasSize(4);
        assertThat(variants).allSatisfy(variant ->
                assertThat(variant).noneMatch(token -> token.type().isPreprocessorOnly()));
    }

    @Test
    void emptyInputYieldsOneEmptyVariant() {
        assertThat(FlowTree.of(List.of()).collectVariants()).containsExactly(List.of());
    }

    @Test
    void completedVariantsCarryConsecutiveIndices() {
        List<Integer> indices = new ArrayList<>();
        int count = FlowTree.of(TestTokens.of("`ifdef", "A", "x", "`endif", "`ifdef", "B", "y", "`endif"))
                .generateVariants(event -> {
                    if (event instanceof VariantEvent.Completed completed) {
                        indices.add(completed.variantIndex());
                    }
                    return true;
                });

        assertThat(count).isEqualTo(4);
        assertThat(indices).containsExactly(0, 1, 2, 3);
    }
}
