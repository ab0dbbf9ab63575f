package com.schemaid.cli;

import com.schemaid.cli.exception.OptionsValidationException;
import com.schemaid.cli.model.FingerprintOptions;
import com.schemaid.cli.model.ValidatedFingerprintOptions;
import com.schemaid.cli.output.FingerprintResultsPrinter;
import com.schemaid.cli.validation.FingerprintOptionsValidator;
import com.schemaid.exception.SchemaIdentityException;
import com.schemaid.identity.SchemaIdentityEngine;
import com.schemaid.identity.SchemaIdentityReport;
import com.schemaid.model.SchemaComparison;
import com.schemaid.report.IdentityReportRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.io.IOException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command that computes schema identifiers for model classes.
 */
@Command(
        name = "fingerprint",
        mixinStandardHelpOptions = true,
        version = "schema-id 1.0.0",
        description = "Computes stable schema identifiers for model classes and optionally compares two of them."
)
public class FingerprintCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(FingerprintCommand.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_ERROR = 1;
    public static final int EXIT_DIFFERENT = 2;

    @Mixin
    private FingerprintOptions options = new FingerprintOptions();

    private final FingerprintOptionsValidator validator = new FingerprintOptionsValidator();
    private final FingerprintResultsPrinter printer = new FingerprintResultsPrinter();
    private final IdentityReportRenderer renderer = new IdentityReportRenderer();

    @Override
    public Integer call() {
        ValidatedFingerprintOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            printer.printValidationErrors(e.getErrors());
            return EXIT_ERROR;
        }

        printer.printBanner(validated);

        try (URLClassLoader loader = classLoader(validated.getClasspathEntries())) {
            SchemaIdentityEngine engine = new SchemaIdentityEngine(validated.getSettings());

            List<Class<?>> models = new ArrayList<>();
            List<SchemaIdentityReport> reports = new ArrayList<>();
            for (String name : validated.getModelNames()) {
                Class<?> model = Class.forName(name, false, loader);
                SchemaIdentityReport report = engine.reportFor(model);
                printer.printReport(report);
                if (options.isShowCanonical()) {
                    printer.printCanonical(name, engine.canonicalForm(model));
                }
                models.add(model);
                reports.add(report);
            }

            if (validated.getReportFile() != null) {
                renderer.write(reports, validated.getReportFile());
                printer.printReportWritten(validated.getReportFile());
            }

            if (options.isCompare()) {
                SchemaComparison comparison = engine.compare(models.get(0), models.get(1));
                printer.printComparison(models.get(0).getName(), models.get(1).getName(), comparison);
                return comparison == SchemaComparison.SAME ? EXIT_OK : EXIT_DIFFERENT;
            }
            return EXIT_OK;

        } catch (ClassNotFoundException e) {
            printer.printFailure("model class not found: " + e.getMessage());
            return EXIT_ERROR;
        } catch (SchemaIdentityException e) {
            printer.printFailure(e.getMessage());
            log.debug("Fingerprinting failure", e);
            return EXIT_ERROR;
        } catch (IOException e) {
            printer.printFailure("cannot open class path: " + e.getMessage());
            return EXIT_ERROR;
        }
    }

    private static URLClassLoader classLoader(List<Path> entries) throws IOException {
        URL[] urls = new URL[entries.size()];
        for (int i = 0; i < urls.length; i++) {
            urls[i] = entries.get(i).toAbsolutePath().toUri().toURL();
        }
        return new URLClassLoader(urls, FingerprintCommand.class.getClassLoader());
    }
}
