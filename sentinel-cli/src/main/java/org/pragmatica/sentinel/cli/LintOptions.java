package org.pragmatica.sentinel.cli;

import org.pragmatica.sentinel.engine.EngineConfig;
import org.pragmatica.sentinel.lint.DiagnosticSeverity;
import org.pragmatica.sentinel.lint.LintConfig;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import picocli.CommandLine;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Options shared by the commands that run the linter.
 */
public class LintOptions {

    @Spec(Spec.Target.MIXEE)
    CommandSpec mixee;

    @Option(
            names = {"--disable", "-d"},
            paramLabel = "<rule>",
            description = "Disable a rule by id (repeatable)"
    )
    List<String> disabledRules = new ArrayList<>();

    @Option(
            names = {"--severity"},
            paramLabel = "<rule>=<severity>",
            description = "Override a rule's severity, e.g. SNT-EX-01=ERROR (repeatable)"
    )
    Map<String, DiagnosticSeverity> severities = new LinkedHashMap<>();

    @Option(
            names = {"--max-depth"},
            description = "Maximum tree nesting before a block is reported as malformed (default: ${DEFAULT-VALUE})"
    )
    int maxDepth = EngineConfig.DEFAULT.maxDepth();

    /// Build the linter configuration; rejects option values the engine cannot run with as usage errors.
    LintConfig toConfig() {
        if (maxDepth < 1) {
            throw new CommandLine.ParameterException(mixee.commandLine(),
                                                     "Invalid value for option '--max-depth': must be at least 1, got " + maxDepth);
        }

        var config = LintConfig.defaultConfig()
                               .withEngine(EngineConfig.defaultConfig().withMaxDepth(maxDepth));

        for (var rule : disabledRules) {
            config = config.withDisabledRule(rule);
        }
        for (var entry : severities.entrySet()) {
            config = config.withRuleSeverity(entry.getKey(), entry.getValue());
        }
        return config;
    }
}
