package org.pragmatica.sharplint.rules.ordering;

import org.junit.jupiter.api.Test;
import org.pragmatica.sharplint.tree.SyntaxKind;
import org.pragmatica.sharplint.tree.SyntaxToken;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ModifierPriorityTest {

    @Test
    void resolve_noModifiersIsPrivate() {
        assertThat(ModifierPriority.resolve(List.of())).isEqualTo(ModifierPriority.PRIVATE);
    }

    @Test
    void resolve_singleModifiers() {
        assertThat(resolve(SyntaxKind.PUBLIC_KEYWORD)).isEqualTo(ModifierPriority.PUBLIC);
        assertThat(resolve(SyntaxKind.INTERNAL_KEYWORD)).isEqualTo(ModifierPriority.INTERNAL);
        assertThat(resolve(SyntaxKind.PROTECTED_KEYWORD)).isEqualTo(ModifierPriority.PROTECTED);
        assertThat(resolve(SyntaxKind.PRIVATE_KEYWORD)).isEqualTo(ModifierPriority.PRIVATE);
    }

    @Test
    void resolve_protectedInternalPairOnlyInThatOrder() {
        assertThat(resolve(SyntaxKind.PROTECTED_KEYWORD, SyntaxKind.INTERNAL_KEYWORD))
            .isEqualTo(ModifierPriority.PROTECTED_INTERNAL);
        assertThat(resolve(SyntaxKind.INTERNAL_KEYWORD, SyntaxKind.PROTECTED_KEYWORD))
            .isEqualTo(ModifierPriority.INTERNAL);
        assertThat(resolve(SyntaxKind.PRIVATE_KEYWORD, SyntaxKind.PROTECTED_KEYWORD))
            .isEqualTo(ModifierPriority.PRIVATE);
    }

    @Test
    void resolve_unknownFirstTokenIsPrivate() {
        assertThat(resolve(SyntaxKind.STATIC_KEYWORD)).isEqualTo(ModifierPriority.PRIVATE);
    }

    @Test
    void displayNames_matchSourceSpelling() {
        assertThat(ModifierPriority.PROTECTED_INTERNAL.displayName()).isEqualTo("protected internal");
        assertThat(ModifierPriority.PUBLIC.displayName()).isEqualTo("public");
    }

    @Test
    void nearestLower_picksLargestPresentBelow() {
        var present = EnumSet.of(ModifierPriority.INTERNAL, ModifierPriority.PROTECTED, ModifierPriority.PRIVATE);

        assertThat(ModifierPriority.PRIVATE.nearestLowerIn(present)).isEqualTo(ModifierPriority.PROTECTED);
        assertThat(ModifierPriority.PROTECTED.nearestLowerIn(present)).isEqualTo(ModifierPriority.INTERNAL);
    }

    @Test
    void nearestLower_fallsBackToPublic() {
        assertThat(ModifierPriority.INTERNAL.nearestLowerIn(EnumSet.of(ModifierPriority.INTERNAL)))
            .isEqualTo(ModifierPriority.PUBLIC);
        assertThat(ModifierPriority.PUBLIC.nearestLowerIn(EnumSet.allOf(ModifierPriority.class)))
            .isEqualTo(ModifierPriority.PUBLIC);
    }

    private static ModifierPriority resolve(SyntaxKind... kinds) {
        return ModifierPriority.resolve(Arrays.stream(kinds)
                                              .map(SyntaxToken::token)
                                              .toList());
    }
}
