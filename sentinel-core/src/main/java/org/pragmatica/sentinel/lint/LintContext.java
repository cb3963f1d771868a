package org.pragmatica.sentinel.lint;

/// Context for rendering violations of one file into diagnostics.
public record LintContext(LintConfig config, String fileName) {

    /// Get the configured severity for a rule, falling back to the descriptor default.
    public DiagnosticSeverity severityFor(RuleDescriptor descriptor) {
        return config.ruleSeverities()
                     .getOrDefault(descriptor.id(), descriptor.defaultSeverity());
    }

    /// Check if a rule is enabled. Disabling wins over enabling.
    public boolean isRuleEnabled(RuleDescriptor descriptor) {
        if (config.disabledRules()
                  .contains(descriptor.id())) {
            return false;
        }
        return descriptor.enabledByDefault() || config.enabledRules()
                                                      .contains(descriptor.id());
    }

    /// Factory method with default configuration.
    public static LintContext defaultContext() {
        return new LintContext(LintConfig.defaultConfig(), "Unknown.java");
    }

    /// Builder-style method to set config.
    public LintContext withConfig(LintConfig config) {
        return new LintContext(config, fileName);
    }

    /// Builder-style method to set file name.
    public LintContext withFileName(String fileName) {
        return new LintContext(config, fileName);
    }
}
