package org.pragmatica.sharplint.error;

import java.util.List;
import java.util.Objects;

/**
 * Static description of a rule's diagnostics.
 *
 * @param id            Rule identifier, e.g. {@code SA1202}
 * @param title         Short rule title
 * @param messageFormat Message with positional placeholders {@code {0}}, {@code {1}}, ...
 * @param category      Rule category, e.g. {@code Ordering}
 * @param severity      Default severity
 * @param description   Longer description of the violation
 * @param helpLink      Documentation link
 */
public record DiagnosticDescriptor(
    String id,
    String title,
    String messageFormat,
    String category,
    Diagnostic.Severity severity,
    String description,
    String helpLink) {

    public DiagnosticDescriptor {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(messageFormat, "messageFormat");
        Objects.requireNonNull(severity, "severity");
    }

    /**
     * Substitute arguments into the message format. Placeholders without a matching argument are kept verbatim.
     */
    public String formatMessage(List<String> arguments) {
        var sb = new StringBuilder(messageFormat.length() + 32);
        int i = 0;
        while (i < messageFormat.length()) {
            char c = messageFormat.charAt(i);
            int close = c == '{'
                        ? messageFormat.indexOf('}', i)
                        : -1;
            if (close > i + 1 && isIndex(messageFormat, i + 1, close)) {
                int index = Integer.parseInt(messageFormat.substring(i + 1, close));
                if (index < arguments.size()) {
                    sb.append(arguments.get(index));
                    i = close + 1;
                    continue;
                }
            }
            sb.append(c);
            i++ ;
        }
        return sb.toString();
    }

    private static boolean isIndex(String text, int from, int to) {
        for (int i = from; i < to; i++) {
            if (!Character.isDigit(text.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
