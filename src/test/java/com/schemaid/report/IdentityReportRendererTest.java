package com.schemaid.report;

import com.schemaid.identity.SchemaIdentityReport;
import com.schemaid.model.IdentitySettings;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for rendering identity reports through FreeMarker.
 */
class IdentityReportRendererTest {

    private final IdentityReportRenderer renderer = new IdentityReportRenderer();

    @TempDir
    Path tempDir;

    private static SchemaIdentityReport report(IdentitySettings settings, int degraded) {
        return SchemaIdentityReport.builder()
                .modelName("com.acme.Order")
                .identifier("v1:0123456789abcdef")
                .computedAt(Instant.parse("2024-03-01T10:15:30Z"))
                .settings(settings)
                .nodeCount(12)
                .tableSize(9)
                .canonicalLength(1024)
                .degradedBehaviors(degraded)
                .build();
    }

    @Test
    void testRendersReportFields() {
        String text = renderer.render(List.of(report(IdentitySettings.defaults(), 0)));

        assertThat(text).startsWith("Schema identity report (algorithm v1)");
        assertThat(text).contains("Model:              com.acme.Order");
        assertThat(text).contains("Identifier:         v1:0123456789abcdef");
        assertThat(text).contains("Computed at:        2024-03-01T10:15:30Z");
        assertThat(text).contains("Track descriptions: false");
        assertThat(text).contains("Digest length:      64");
        assertThat(text).contains("Canonical bytes:    1024");
        assertThat(text).doesNotContain("Extra data:");
        assertThat(text).doesNotContain("Degraded behaviors");
    }

    @Test
    void testRendersExtraDataSortedAndDegradedCount() {
        IdentitySettings settings = IdentitySettings.builder()
                .trackFieldOrder(true)
                .extraData("zone", "eu")
                .extraData("tenant", "acme")
                .build();

        String text = renderer.render(List.of(report(settings, 2)));

        assertThat(text).contains("Track field order:  true");
        assertThat(text).contains("Extra data:");
        assertThat(text.indexOf("  tenant = acme")).isLessThan(text.indexOf("  zone = eu"));
        assertThat(text).contains("Degraded behaviors: 2");
    }

    @Test
    void testRendersEmptyList() {
        assertThat(renderer.render(List.of())).contains("No models.");
    }

    @Test
    void testWritesFileCreatingParentDirectories() throws IOException {
        Path target = tempDir.resolve("reports/nested/identity.txt");

        renderer.write(List.of(report(IdentitySettings.defaults(), 0)), target);

        assertThat(target).exists();
        assertThat(Files.readString(target)).contains("com.acme.Order");
    }

    @Test
    void testWriteFailureIsWrapped() throws IOException {
        Path directory = Files.createDirectory(tempDir.resolve("taken"));

        assertThatThrownBy(() -> renderer.write(List.of(), directory))
                .isInstanceOf(ReportRenderingException.class)
                .hasMessageContaining("taken");
    }
}
