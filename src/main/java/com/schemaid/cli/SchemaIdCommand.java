package com.schemaid.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level command; prints usage when no subcommand is given.
 */
@Command(
        name = "schema-id",
        mixinStandardHelpOptions = true,
        version = "schema-id 1.0.0",
        description = "Stable structural identifiers for Java data models.",
        subcommands = { FingerprintCommand.class }
)
public class SchemaIdCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing required subcommand");
    }
}
