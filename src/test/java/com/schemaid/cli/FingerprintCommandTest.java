package com.schemaid.cli;

import com.schemaid.fixtures.SampleOrder;
import com.schemaid.fixtures.SampleOrderReordered;
import com.schemaid.fixtures.SampleOrderV2;
import com.schemaid.identity.SchemaIdentity;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the "fingerprint" command end to end, through picocli.
 */
class FingerprintCommandTest {

    @TempDir
    Path tempDir;

    private static int run(String... args) {
        return new CommandLine(new SchemaIdCommand()).execute(args);
    }

    @Test
    void testFingerprintSingleModel() {
        int exitCode = run("fingerprint", "-m", SampleOrder.class.getName(), "--show-canonical");

        assertThat(exitCode).isEqualTo(FingerprintCommand.EXIT_OK);
    }

    @Test
    void testCompareSameSchemas() {
        int exitCode = run("fingerprint", "--compare",
                "-m", SampleOrder.class.getName(),
                "-m", SampleOrderReordered.class.getName());

        assertThat(exitCode).isEqualTo(FingerprintCommand.EXIT_OK);
    }

    @Test
    void testCompareDifferentSchemas() {
        int exitCode = run("fingerprint", "--compare",
                "-m", SampleOrder.class.getName(),
                "-m", SampleOrderV2.class.getName());

        assertThat(exitCode).isEqualTo(FingerprintCommand.EXIT_DIFFERENT);
    }

    @Test
    void testTrackedFieldOrderMakesReorderedModelDifferent() {
        int exitCode = run("fingerprint", "--compare", "--track-field-order",
                "-m", SampleOrder.class.getName(),
                "-m", SampleOrderReordered.class.getName());

        assertThat(exitCode).isEqualTo(FingerprintCommand.EXIT_DIFFERENT);
    }

    @Test
    void testUnknownModelClassFails() {
        int exitCode = run("fingerprint", "-m", "com.acme.DoesNotExist");

        assertThat(exitCode).isEqualTo(FingerprintCommand.EXIT_ERROR);
    }

    @Test
    void testInvalidOptionsFail() {
        int exitCode = run("fingerprint", "-m", SampleOrder.class.getName(), "--digest-length", "3");

        assertThat(exitCode).isEqualTo(FingerprintCommand.EXIT_ERROR);
    }

    @Test
    void testWritesReportFile() throws IOException {
        Path report = tempDir.resolve("out/identity.txt");

        int exitCode = run("fingerprint", "-m", SampleOrder.class.getName(), "-r", report.toString());

        // Verify the report holds the same identifier the library computes
        assertThat(exitCode).isEqualTo(FingerprintCommand.EXIT_OK);
        assertThat(report).exists();
        assertThat(Files.readString(report))
                .contains(SampleOrder.class.getName())
                .contains(SchemaIdentity.identifierFor(SampleOrder.class).toString());
    }

    @Test
    void testMissingSubcommandIsUsageError() {
        int exitCode = run();

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
    }
}
