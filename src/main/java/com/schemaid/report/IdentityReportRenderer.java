package com.schemaid.report;

import com.schemaid.identity.SchemaIdentityReport;
import com.schemaid.model.AlgorithmVersion;
import com.schemaid.model.IdentitySettings;
import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders identity reports as plain text through the {@code identity-report.ftl} template.
 */
public class IdentityReportRenderer {

    private static final Logger log = LoggerFactory.getLogger(IdentityReportRenderer.class);

    static final String TEMPLATE_NAME = "identity-report.ftl";

    private final Configuration freemarkerConfig;

    public IdentityReportRenderer() {
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    public String render(List<SchemaIdentityReport> reports) {
        StringWriter out = new StringWriter();
        render(reports, out);
        return out.toString();
    }

    public void render(List<SchemaIdentityReport> reports, Writer out) {
        Map<String, Object> model = new LinkedHashMap<>();
        model.put("algorithmVersion", AlgorithmVersion.current().getTag());
        model.put("reports", toTemplateModel(reports));
        try {
            Template template = freemarkerConfig.getTemplate(TEMPLATE_NAME);
            template.process(model, out);
        } catch (IOException | TemplateException e) {
            throw new ReportRenderingException("Failed to render " + TEMPLATE_NAME, e);
        }
    }

    public void write(List<SchemaIdentityReport> reports, Path target) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, render(reports), StandardCharsets.UTF_8);
            log.info("Wrote identity report for {} model(s) to {}", reports.size(), target);
        } catch (IOException e) {
            throw new ReportRenderingException("Failed to write report to " + target, e);
        }
    }

    private static List<Map<String, Object>> toTemplateModel(List<SchemaIdentityReport> reports) {
        List<Map<String, Object>> rows = new ArrayList<>(reports.size());
        for (SchemaIdentityReport report : reports) {
            IdentitySettings settings = report.getSettings();
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("modelName", report.getModelName());
            row.put("identifier", report.getIdentifier());
            row.put("computedAt", report.getComputedAt().toString());
            row.put("trackDescriptions", settings.isTrackDescriptions());
            row.put("trackFieldOrder", settings.isTrackFieldOrder());
            row.put("trackTypeOrder", settings.isTrackTypeOrder());
            row.put("extraData", settings.getSortedExtraData());
            row.put("digestLength", settings.getDigestLength());
            row.put("nodeCount", report.getNodeCount());
            row.put("tableSize", report.getTableSize());
            row.put("canonicalLength", report.getCanonicalLength());
            row.put("degradedBehaviors", report.getDegradedBehaviors());
            rows.add(row);
        }
        return rows;
    }
}
