package org.pragmatica.sentinel.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

/// Sentinel command line.
///
/// Usage examples:
/// ```
/// sentinel check src/main/java
/// sentinel check --fail-on-warning --disable SNT-EX-02 src/main/java
/// sentinel fix src/main/java/com/example/Service.java
/// ```
@Command(name = "sentinel",
        mixinStandardHelpOptions = true,
        version = "Sentinel 0.1.0",
        description = "Structural lint for cleanup regions in Java sources",
        subcommands = {CheckCommand.class, FixCommand.class})
public class SentinelCli implements Runnable {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    public static CommandLine commandLine() {
        return new CommandLine(new SentinelCli());
    }

    @Override
    public void run() {
        spec.commandLine()
            .usage(spec.commandLine().getOut());
    }
}
