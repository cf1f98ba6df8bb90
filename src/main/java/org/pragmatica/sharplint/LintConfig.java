package org.pragmatica.sharplint;

import org.pragmatica.sharplint.format.FormattingOptions;
import org.pragmatica.sharplint.rules.ordering.MemberKind;

import java.util.Objects;
import java.util.Set;

/**
 * Analyzer configuration options.
 *
 * @param formatting      Whitespace conventions for fixes
 * @param orderedKinds    Member kinds checked by SA1202
 * @param disabledRules   Ids of rules that are not run
 */
public record LintConfig(
    FormattingOptions formatting,
    Set<MemberKind> orderedKinds,
    Set<String> disabledRules
) {
    public static final LintConfig DEFAULT = new LintConfig(
        FormattingOptions.DEFAULT,
        MemberKind.defaults(),
        Set.of()
    );

    public LintConfig {
        Objects.requireNonNull(formatting, "formatting");
        orderedKinds = Set.copyOf(orderedKinds);
        disabledRules = Set.copyOf(disabledRules);
    }

    public boolean isRuleEnabled(String id) {
        return !disabledRules.contains(id);
    }
}
