package com.schemaid;

import com.schemaid.cli.SchemaIdCommand;
import picocli.CommandLine;

/**
 * Main entry point of the schema identity command-line tool.
 */
public class SchemaIdApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new SchemaIdCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
