package org.pragmatica.sharplint.rules.ordering;

import org.pragmatica.sharplint.error.Diagnostic;
import org.pragmatica.sharplint.error.DiagnosticDescriptor;
import org.pragmatica.sharplint.rules.DiagnosticSink;
import org.pragmatica.sharplint.rules.SyntaxRule;
import org.pragmatica.sharplint.tree.SyntaxKind;
import org.pragmatica.sharplint.tree.SyntaxNode;
import org.pragmatica.sharplint.tree.SyntaxNodes;
import org.pragmatica.sharplint.tree.SyntaxTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * SA1202: within a class or struct, members of one kind must be ordered public, internal,
 * protected internal, protected, private.
 *
 * <p>Every adjacent pair where the second member is more accessible than the first is reported at the first
 * member. The message names the first member's access level and the nearest more accessible level present
 * among members of the same kind.
 */
public final class ElementsOrderedByAccessRule implements SyntaxRule {
    private static final Logger log = LoggerFactory.getLogger(ElementsOrderedByAccessRule.class);

    public static final DiagnosticDescriptor DESCRIPTOR = new DiagnosticDescriptor(
        "SA1202",
        "Elements must be ordered by access",
        "All {0} {2} must be placed after all {1} {2}",
        "Ordering",
        Diagnostic.Severity.WARNING,
        "An element within a C# code file is out of order within regard to access level, in relation to other elements in the code.",
        "http://www.stylecop.com/docs/SA1202.html");

    private final EnumSet<MemberKind> memberKinds;

    public ElementsOrderedByAccessRule() {
        this(MemberKind.defaults());
    }

    public ElementsOrderedByAccessRule(Set<MemberKind> memberKinds) {
        this.memberKinds = memberKinds.isEmpty()
                           ? EnumSet.noneOf(MemberKind.class)
                           : EnumSet.copyOf(memberKinds);
    }

    @Override
    public DiagnosticDescriptor descriptor() {
        return DESCRIPTOR;
    }

    public Set<MemberKind> memberKinds() {
        return EnumSet.copyOf(memberKinds);
    }

    @Override
    public void analyze(SyntaxTree tree, DiagnosticSink sink) {
        var containers = SyntaxNodes.descendants(tree.root(), ElementsOrderedByAccessRule::isContainer);
        for (var container : containers) {
            evaluateOrdering(tree, container).forEach(sink::report);
        }
    }

    /**
     * Check every configured member kind of one class or struct. Diagnostics are ordered by location.
     */
    public List<Diagnostic> evaluateOrdering(SyntaxTree tree, SyntaxNode container) {
        var diagnostics = new ArrayList<Diagnostic>();
        for (var kind : memberKinds) {
            diagnostics.addAll(evaluateOrdering(tree, container, kind));
        }
        diagnostics.sort(Diagnostic.BY_LOCATION);
        return diagnostics;
    }

    /**
     * Check the direct members of one kind declared in a class or struct. Anything else yields no diagnostics.
     */
    public List<Diagnostic> evaluateOrdering(SyntaxTree tree, SyntaxNode container, MemberKind kind) {
        if (!isContainer(container)) {
            return List.of();
        }
        var data = container.childNodes()
                            .stream()
                            .filter(member -> kind.matches(member.kind()))
                            .map(DeclarationModifierData::of)
                            .toList();
        if (data.size() < 2) {
            return List.of();
        }
        var present = data.stream()
                          .map(DeclarationModifierData::priority)
                          .distinct()
                          .toList();
        var diagnostics = new ArrayList<Diagnostic>();
        for (int i = 0; i < data.size() - 1; i++) {
            var current = data.get(i);
            var next = data.get(i + 1);
            if (!next.priority()
                     .isBefore(current.priority())) {
                continue;
            }
            var diagnostic = Diagnostic.create(DESCRIPTOR,
                                               tree.span(current.anchor()),
                                               current.priority()
                                                      .displayName(),
                                               current.priority()
                                                      .nearestLowerIn(present)
                                                      .displayName(),
                                               kind.label());
            log.debug("{} at {}: {}", diagnostic.id(), diagnostic.location(), diagnostic.message());
            diagnostics.add(diagnostic);
        }
        return diagnostics;
    }

    private static boolean isContainer(SyntaxNode node) {
        return node.kind() == SyntaxKind.CLASS_DECLARATION || node.kind() == SyntaxKind.STRUCT_DECLARATION;
    }
}
