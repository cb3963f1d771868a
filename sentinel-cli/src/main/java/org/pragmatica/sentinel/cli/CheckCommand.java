package org.pragmatica.sentinel.cli;

import org.pragmatica.sentinel.lint.Diagnostic;
import org.pragmatica.sentinel.lint.DiagnosticSeverity;
import org.pragmatica.sentinel.lint.SentinelLinter;
import org.pragmatica.sentinel.shared.FileCollector;
import org.pragmatica.sentinel.shared.SourceFile;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Check command - lint Java sources and report diagnostics (for CI).
 * <p>
 * Exit codes: 0 clean, 1 findings that fail the build, 2 files that could not be read or parsed.
 */
@Command(
        name = "check",
        description = "Lint Java sources and report diagnostics",
        mixinStandardHelpOptions = true
)
public class CheckCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(CheckCommand.class);

    static final int EXIT_CLEAN = 0;
    static final int EXIT_FINDINGS = 1;
    static final int EXIT_FAILURE = 2;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Parameters(
            paramLabel = "<path>",
            description = "Files or directories to check",
            arity = "1..*"
    )
    List<Path> paths;

    @Option(
            names = {"--fail-on-warning", "-w"},
            description = "Treat warnings as errors"
    )
    boolean failOnWarning;

    @Mixin
    LintOptions lintOptions = new LintOptions();

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();
        var linter = SentinelLinter.sentinelLinter(lintOptions.toConfig().withFailOnWarning(failOnWarning));
        var collectionErrors = new ArrayList<String>();
        var files = FileCollector.collectJavaFiles(paths, collectionErrors::add);
        var diagnostics = new ArrayList<Diagnostic>();
        var failures = collectionErrors.size();

        collectionErrors.forEach(err::println);

        for (var file : files) {
            var result = SourceFile.read(file).flatMap(linter::lint);

            if (result.isLeft()) {
                failures++;
                result.peekLeft(cause -> err.println(cause.message()));
                continue;
            }
            result.peek(diagnostics::addAll);
        }

        diagnostics.forEach(diagnostic -> out.println(diagnostic.format()));
        out.println(summary(files.size(), diagnostics));
        out.flush();
        err.flush();
        log.debug("Checked {} file(s), {} diagnostic(s), {} failure(s)", files.size(), diagnostics.size(), failures);

        if (failures > 0) {
            return EXIT_FAILURE;
        }
        return failsBuild(diagnostics, linter.config().failOnWarning())
               ? EXIT_FINDINGS
               : EXIT_CLEAN;
    }

    static boolean failsBuild(List<Diagnostic> diagnostics, boolean failOnWarning) {
        return diagnostics.stream()
                          .anyMatch(diagnostic -> diagnostic.isError()
                                                  || (failOnWarning && diagnostic.severity() == DiagnosticSeverity.WARNING));
    }

    private static String summary(int fileCount, List<Diagnostic> diagnostics) {
        var errors = diagnostics.stream().filter(Diagnostic::isError).count();
        var warnings = diagnostics.stream().filter(d -> d.severity() == DiagnosticSeverity.WARNING).count();
        return "Checked " + fileCount + " file(s): " + errors + " error(s), " + warnings + " warning(s), "
               + (diagnostics.size() - errors - warnings) + " info";
    }
}
