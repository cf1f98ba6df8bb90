package org.pragmatica.sharplint;

import org.pragmatica.sharplint.error.Diagnostic;
import org.pragmatica.sharplint.format.FormattingOptions;
import org.pragmatica.sharplint.format.SingleLineBlockFix;
import org.pragmatica.sharplint.parser.CSharpParser;
import org.pragmatica.sharplint.parser.ParseResult;
import org.pragmatica.sharplint.rules.DiagnosticSink;
import org.pragmatica.sharplint.rules.SyntaxRule;
import org.pragmatica.sharplint.rules.layout.SingleLineBlockRule;
import org.pragmatica.sharplint.rules.ordering.ElementsOrderedByAccessRule;
import org.pragmatica.sharplint.rules.ordering.MemberKind;
import org.pragmatica.sharplint.tree.SyntaxNode;
import org.pragmatica.sharplint.tree.SyntaxTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Main entry point for analyzing and fixing C# sources.
 *
 * <p>Example usage:
 * <pre>{@code
 * var lint = SharpLint.sharpLint();
 * var tree = SharpLint.parse(source).unwrap();
 * var fixed = lint.fixAll(tree);
 * lint.analyze(fixed).forEach(d -> System.out.println(d.formatSimple()));
 * }</pre>
 */
public final class SharpLint {
    private static final Logger log = LoggerFactory.getLogger(SharpLint.class);

    private final LintConfig config;
    private final ElementsOrderedByAccessRule orderingRule;
    private final SingleLineBlockRule singleLineBlockRule;
    private final SingleLineBlockFix singleLineBlockFix;

    private SharpLint(LintConfig config) {
        this.config = config;
        this.orderingRule = new ElementsOrderedByAccessRule(config.orderedKinds());
        this.singleLineBlockRule = new SingleLineBlockRule();
        this.singleLineBlockFix = new SingleLineBlockFix(config.formatting());
    }

    /**
     * Parse C# source text.
     */
    public static ParseResult parse(String source) {
        return CSharpParser.parse(source);
    }

    public static SharpLint sharpLint() {
        return sharpLint(LintConfig.DEFAULT);
    }

    public static SharpLint sharpLint(LintConfig config) {
        return new SharpLint(config);
    }

    /**
     * Create a builder for more complex analyzer configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    public LintConfig config() {
        return config;
    }

    /**
     * Enabled rules, in the order they run.
     */
    public List<SyntaxRule> rules() {
        return List.<SyntaxRule>of(orderingRule, singleLineBlockRule)
                   .stream()
                   .filter(rule -> config.isRuleEnabled(rule.id()))
                   .toList();
    }

    /**
     * Run all enabled rules. Diagnostics are sorted by location.
     */
    public List<Diagnostic> analyze(SyntaxTree tree) {
        var diagnostics = new ArrayList<Diagnostic>();
        var sink = DiagnosticSink.collectingInto(diagnostics);
        for (var rule : rules()) {
            rule.analyze(tree, sink);
        }
        diagnostics.sort(Diagnostic.BY_LOCATION);
        log.debug("Found {} diagnostic(s)", diagnostics.size());
        return diagnostics;
    }

    /**
     * SA1202 diagnostics for one class or struct declaration. Empty when the rule is disabled.
     */
    public List<Diagnostic> evaluateOrdering(SyntaxTree tree, SyntaxNode container) {
        if (!config.isRuleEnabled(ElementsOrderedByAccessRule.DESCRIPTOR.id())) {
            return List.of();
        }
        return orderingRule.evaluateOrdering(tree, container);
    }

    public List<Diagnostic> evaluateOrdering(SyntaxTree tree, SyntaxNode container, MemberKind kind) {
        if (!config.isRuleEnabled(ElementsOrderedByAccessRule.DESCRIPTOR.id())) {
            return List.of();
        }
        return orderingRule.evaluateOrdering(tree, container, kind);
    }

    /**
     * Fixed tree for a diagnostic, or empty when the diagnostic has no fix.
     */
    public Optional<SyntaxTree> computeFix(SyntaxTree tree, Diagnostic diagnostic) {
        if (!diagnostic.id()
                       .equals(SingleLineBlockRule.DESCRIPTOR.id())) {
            return Optional.empty();
        }
        return singleLineBlockFix.computeFix(tree, diagnostic);
    }

    /**
     * Fix every single-line block in the tree. Returns the input tree when the rule is disabled.
     */
    public SyntaxTree fixAll(SyntaxTree tree) {
        if (!config.isRuleEnabled(SingleLineBlockRule.DESCRIPTOR.id())) {
            return tree;
        }
        return singleLineBlockFix.fixAll(tree);
    }

    public static final class Builder {
        private FormattingOptions formatting = FormattingOptions.DEFAULT;
        private Set<MemberKind> orderedKinds = MemberKind.defaults();
        private final Set<String> disabledRules = new HashSet<>();

        private Builder() {}

        public Builder formatting(FormattingOptions options) {
            this.formatting = options;
            return this;
        }

        public Builder indentation(int size, boolean useTabs) {
            this.formatting = formatting.withIndentationSize(size)
                                        .withTabs(useTabs);
            return this;
        }

        public Builder endOfLine(String endOfLine) {
            this.formatting = formatting.withEndOfLine(endOfLine);
            return this;
        }

        public Builder orderedKinds(Set<MemberKind> kinds) {
            this.orderedKinds = kinds.isEmpty()
                                ? EnumSet.noneOf(MemberKind.class)
                                : EnumSet.copyOf(kinds);
            return this;
        }

        public Builder disable(String ruleId) {
            disabledRules.add(ruleId);
            return this;
        }

        public SharpLint build() {
            return sharpLint(new LintConfig(formatting, orderedKinds, disabledRules));
        }
    }
}
