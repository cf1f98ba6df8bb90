package org.pragmatica.sharplint.rules.ordering;

import org.pragmatica.sharplint.tree.SyntaxKind;
import org.pragmatica.sharplint.tree.SyntaxToken;

import java.util.Collection;
import java.util.List;

/**
 * Access levels in the order members are expected to appear. Smaller ordinal means earlier.
 */
public enum ModifierPriority {
    PUBLIC("public"),
    INTERNAL("internal"),
    PROTECTED_INTERNAL("protected internal"),
    PROTECTED("protected"),
    PRIVATE("private");

    private final String displayName;

    ModifierPriority(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    public boolean isBefore(ModifierPriority other) {
        return compareTo(other) < 0;
    }

    /**
     * Priority of a declaration from its access-modifier tokens, in source order.
     * Only {@code protected internal} is recognized as a pair; otherwise the first token decides.
     */
    public static ModifierPriority resolve(List<SyntaxToken> accessModifiers) {
        if (accessModifiers.isEmpty()) {
            return PRIVATE;
        }
        var first = accessModifiers.get(0)
                                   .kind();
        if (accessModifiers.size() == 2 && first == SyntaxKind.PROTECTED_KEYWORD
            && accessModifiers.get(1)
                              .kind() == SyntaxKind.INTERNAL_KEYWORD) {
            return PROTECTED_INTERNAL;
        }
        return switch (first) {
            case PUBLIC_KEYWORD -> PUBLIC;
            case INTERNAL_KEYWORD -> INTERNAL;
            case PROTECTED_KEYWORD -> PROTECTED;
            default -> PRIVATE;
        };
    }

    /**
     * Largest of the present priorities strictly between {@link #PUBLIC} and this one, or {@link #PUBLIC}.
     */
    public ModifierPriority nearestLowerIn(Collection<ModifierPriority> present) {
        var next = PUBLIC;
        for (var priority : present) {
            if (next.isBefore(priority) && priority.isBefore(this)) {
                next = priority;
            }
        }
        return next;
    }
}
