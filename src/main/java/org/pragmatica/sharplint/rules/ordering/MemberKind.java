package org.pragmatica.sharplint.rules.ordering;

import org.pragmatica.sharplint.tree.SyntaxKind;

import java.util.EnumSet;
import java.util.Set;

/**
 * Groups of member declarations whose access order is checked independently of each other.
 */
public enum MemberKind {
    FIELDS("fields", EnumSet.of(SyntaxKind.FIELD_DECLARATION)),
    METHODS("methods", EnumSet.of(SyntaxKind.METHOD_DECLARATION)),
    DELEGATES("delegates", EnumSet.of(SyntaxKind.DELEGATE_DECLARATION)),
    EVENTS("events", EnumSet.of(SyntaxKind.EVENT_FIELD_DECLARATION, SyntaxKind.EVENT_DECLARATION)),
    PROPERTIES("properties", EnumSet.of(SyntaxKind.PROPERTY_DECLARATION)),
    INDEXERS("indexers", EnumSet.of(SyntaxKind.INDEXER_DECLARATION));

    private final String label;
    private final Set<SyntaxKind> declarationKinds;

    MemberKind(String label, Set<SyntaxKind> declarationKinds) {
        this.label = label;
        this.declarationKinds = declarationKinds;
    }

    /**
     * Kinds checked unless configured otherwise. Properties and indexers are opt-in.
     */
    public static EnumSet<MemberKind> defaults() {
        return EnumSet.of(FIELDS, METHODS, DELEGATES, EVENTS);
    }

    /**
     * Plural noun used in messages, e.g. {@code fields}.
     */
    public String label() {
        return label;
    }

    public boolean matches(SyntaxKind kind) {
        return declarationKinds.contains(kind);
    }
}
