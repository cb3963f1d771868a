package org.pragmatica.sentinel.lint;

import org.pragmatica.sentinel.engine.EngineConfig;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Configuration for the linter.
 */
public record LintConfig(
        Map<String, DiagnosticSeverity> ruleSeverities,
        Set<String> disabledRules,
        Set<String> enabledRules,
        boolean failOnWarning,
        EngineConfig engine
) {

    /**
     * Default lint configuration. Rules without an entry use their descriptor's default severity.
     */
    public static final LintConfig DEFAULT = new LintConfig(Map.of(), Set.of(), Set.of(), false, EngineConfig.defaultConfig());

    public LintConfig {
        ruleSeverities = Map.copyOf(ruleSeverities);
        disabledRules = Set.copyOf(disabledRules);
        enabledRules = Set.copyOf(enabledRules);
    }

    /**
     * Factory method for default config.
     */
    public static LintConfig defaultConfig() {
        return DEFAULT;
    }

    /**
     * Builder-style method to set rule severity.
     */
    public LintConfig withRuleSeverity(String ruleId, DiagnosticSeverity severity) {
        var newSeverities = new HashMap<>(ruleSeverities);
        newSeverities.put(ruleId, severity);
        return new LintConfig(newSeverities, disabledRules, enabledRules, failOnWarning, engine);
    }

    /**
     * Builder-style method to disable a rule.
     */
    public LintConfig withDisabledRule(String ruleId) {
        var newDisabled = new HashSet<>(disabledRules);
        newDisabled.add(ruleId);
        return new LintConfig(ruleSeverities, newDisabled, enabledRules, failOnWarning, engine);
    }

    /**
     * Builder-style method to turn on a rule that is off by default.
     */
    public LintConfig withEnabledRule(String ruleId) {
        var newEnabled = new HashSet<>(enabledRules);
        newEnabled.add(ruleId);
        return new LintConfig(ruleSeverities, disabledRules, newEnabled, failOnWarning, engine);
    }

    /**
     * Builder-style method to set fail on warning.
     */
    public LintConfig withFailOnWarning(boolean failOnWarning) {
        return new LintConfig(ruleSeverities, disabledRules, enabledRules, failOnWarning, engine);
    }

    /**
     * Builder-style method to set engine configuration.
     */
    public LintConfig withEngine(EngineConfig engine) {
        return new LintConfig(ruleSeverities, disabledRules, enabledRules, failOnWarning, engine);
    }
}
