package com.schemaid.cli.output;

import com.schemaid.cli.model.ValidatedFingerprintOptions;
import com.schemaid.identity.SchemaIdentityReport;
import com.schemaid.model.CanonicalForm;
import com.schemaid.model.IdentitySettings;
import com.schemaid.model.SchemaComparison;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;

/**
 * Responsible only for printing CLI output for the "fingerprint" command.
 * No validation, no execution.
 */
public class FingerprintResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(FingerprintResultsPrinter.class);

    public void printBanner(ValidatedFingerprintOptions v) {
        IdentitySettings settings = v.getSettings();
        log.info("=================================================");
        log.info("Schema Identity");
        log.info("=================================================");
        log.info("Models: {}", v.getModelNames());
        log.info("Class Path: {}", v.getClasspathEntries().isEmpty() ? "None" : v.getClasspathEntries());
        log.info("Track Descriptions: {}", settings.isTrackDescriptions());
        log.info("Track Field Order: {}", settings.isTrackFieldOrder());
        log.info("Track Type Order: {}", settings.isTrackTypeOrder());
        if (!settings.getTrackedExtraData().isEmpty()) {
            log.info("Extra Data: {}", settings.getSortedExtraData());
        }
        log.info("Digest Length: {}", settings.getDigestLength());
        log.info("Max Nodes: {}", settings.getMaxNodes());
        log.info("=================================================");
    }

    public void printReport(SchemaIdentityReport report) {
        log.info("{} -> {}", report.getModelName(), report.getIdentifier());
        log.info("  Graph Nodes: {}, Table Entries: {}, Canonical Bytes: {}",
                report.getNodeCount(), report.getTableSize(), report.getCanonicalLength());
        if (report.getDegradedBehaviors() > 0) {
            log.warn("  {} behavior(s) fingerprinted without a stable name", report.getDegradedBehaviors());
        }
    }

    public void printCanonical(String modelName, CanonicalForm form) {
        log.info("  Canonical Form of {}: {}", modelName, form.toHex());
    }

    public void printComparison(String first, String second, SchemaComparison comparison) {
        log.info("-------------------------------------------------");
        switch (comparison) {
            case SAME:
                log.info("SAME SCHEMA: {} and {}", first, second);
                break;
            case DIFFERENT:
                log.info("DIFFERENT SCHEMAS: {} and {}", first, second);
                break;
            default:
                log.info("INCOMPARABLE: {} and {} use different algorithm versions", first, second);
                break;
        }
    }

    public void printReportWritten(Path reportFile) {
        log.info("Report File: {}", reportFile);
    }

    public void printValidationErrors(List<String> errors) {
        log.error("Invalid options:");
        for (String error : errors) {
            log.error("  - {}", error);
        }
    }

    public void printFailure(String message) {
        log.error("Fingerprinting failed: {}", message);
    }
}
