package org.pragmatica.sentinel.lint;

import java.text.MessageFormat;

/// Diagnostic metadata of a rule, keyed by rule id.
///
/// The engine never reads these; they are attached when a rule is registered and used only when
/// violations are rendered. `messageTemplate` is a [MessageFormat] pattern whose `{0}` is bound to
/// the label of the violating node.
public record RuleDescriptor(String id,
                             String title,
                             String messageTemplate,
                             String description,
                             String category,
                             DiagnosticSeverity defaultSeverity,
                             String helpLink,
                             boolean enabledByDefault) {

    public String formatMessage(String nodeLabel) {
        return MessageFormat.format(messageTemplate, nodeLabel);
    }

    public boolean hasHelpLink() {
        return !helpLink.isEmpty();
    }
}
