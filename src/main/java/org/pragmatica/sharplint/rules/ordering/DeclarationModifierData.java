package org.pragmatica.sharplint.rules.ordering;

import org.pragmatica.sharplint.tree.SyntaxElement;
import org.pragmatica.sharplint.tree.SyntaxKind;
import org.pragmatica.sharplint.tree.SyntaxNode;
import org.pragmatica.sharplint.tree.SyntaxToken;

import java.util.ArrayList;
import java.util.List;

/**
 * Modifiers of one member declaration and the priority they resolve to.
 *
 * @param priority        Resolved access priority
 * @param accessModifiers Access-modifier tokens in source order
 * @param modifiers       All modifier tokens in source order
 * @param declaration     The member declaration
 */
public record DeclarationModifierData(
    ModifierPriority priority,
    List<SyntaxToken> accessModifiers,
    List<SyntaxToken> modifiers,
    SyntaxNode declaration) {

    public DeclarationModifierData {
        accessModifiers = List.copyOf(accessModifiers);
        modifiers = List.copyOf(modifiers);
    }

    public static DeclarationModifierData of(SyntaxNode declaration) {
        var modifiers = new ArrayList<SyntaxToken>();
        for (var child : declaration.children()) {
            if (child.isKind(SyntaxKind.ATTRIBUTE_LIST)) {
                continue;
            }
            if (!(child instanceof SyntaxToken token) || !token.kind()
                                                                .isModifier()) {
                break;
            }
            modifiers.add(token);
        }
        var accessModifiers = modifiers.stream()
                                       .filter(token -> token.kind()
                                                             .isAccessModifier())
                                       .toList();
        return new DeclarationModifierData(ModifierPriority.resolve(accessModifiers),
                                           accessModifiers,
                                           modifiers,
                                           declaration);
    }

    /**
     * Where a diagnostic about this declaration is reported: its first modifier, or the declaration itself.
     */
    public SyntaxElement anchor() {
        return modifiers.isEmpty()
               ? declaration
               : modifiers.get(0);
    }
}
