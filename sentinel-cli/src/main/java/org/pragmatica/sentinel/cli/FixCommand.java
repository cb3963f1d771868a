package org.pragmatica.sentinel.cli;

import org.pragmatica.sentinel.lint.FixProposal;
import org.pragmatica.sentinel.lint.SentinelLinter;
import org.pragmatica.sentinel.shared.FileCollector;
import org.pragmatica.sentinel.shared.SourceFile;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

/**
 * Fix command - preview the rewrites proposed for each diagnostic.
 * <p>
 * Source files are not modified. Each plan is applied to a copy of the operation tree and
 * detection is re-run to confirm the violation is gone.
 */
@Command(
        name = "fix",
        description = "Preview structural fixes for lint diagnostics",
        mixinStandardHelpOptions = true
)
public class FixCommand implements Callable<Integer> {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Parameters(
            paramLabel = "<path>",
            description = "Files or directories to inspect",
            arity = "1..*"
    )
    List<Path> paths;

    @Mixin
    LintOptions lintOptions = new LintOptions();

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();
        var linter = SentinelLinter.sentinelLinter(lintOptions.toConfig());
        var collectionErrors = new ArrayList<String>();
        var files = FileCollector.collectJavaFiles(paths, collectionErrors::add);
        var failures = collectionErrors.size();

        collectionErrors.forEach(err::println);

        for (var file : files) {
            var result = SourceFile.read(file).flatMap(linter::proposeFixes);

            if (result.isLeft()) {
                failures++;
                result.peekLeft(cause -> err.println(cause.message()));
                continue;
            }
            result.peek(proposals -> proposals.forEach(proposal -> print(out, proposal)));
        }
        out.flush();
        err.flush();

        return failures > 0
               ? CheckCommand.EXIT_FAILURE
               : CheckCommand.EXIT_CLEAN;
    }

    private static void print(PrintWriter out, FixProposal proposal) {
        out.println(proposal.diagnostic().format());

        if (proposal instanceof FixProposal.Planned planned) {
            out.println("    fix in " + planned.block() + ": " + planned.plan().describe()
                        + (planned.verified() ? "" : " (unverified)"));
        } else if (proposal instanceof FixProposal.Skipped skipped) {
            out.println("    no fix: " + skipped.reason());
        }
    }
}
