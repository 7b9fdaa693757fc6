package com.receptor.normalizer.report;

import com.receptor.normalizer.model.JunctionResult;
import com.receptor.normalizer.model.StandardizationResult;
import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders batch results into plain-text reports.
 */
public class BatchReportWriter {

    private static final Logger log = LoggerFactory.getLogger(BatchReportWriter.class);

    static final String SYMBOL_TEMPLATE = "symbol-report.ftl";
    static final String JUNCTION_TEMPLATE = "junction-report.ftl";
    static final String LISTING_TEMPLATE = "listing-report.ftl";

    private final Configuration freemarkerConfig;

    public BatchReportWriter() {
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

    public String renderSymbolReport(String heading, List<StandardizationResult> results) {
        List<Map<String, Object>> rows = new ArrayList<>();
        int failed = 0;
        for (StandardizationResult result : results) {
            Map<String, Object> row = new HashMap<>();
            row.put("input", result.getOriginalInput());
            result.getHighestPrecision().ifPresent(v -> row.put("result", v));
            result.getError().ifPresent(v -> row.put("error", v));
            result.getAttemptedFix().ifPresent(v -> row.put("attemptedFix", v));
            rows.add(row);
            if (result.isFailed()) {
                failed++;
            }
        }
        return render(SYMBOL_TEMPLATE, summary(heading, rows, failed));
    }

    public String renderJunctionReport(String heading, List<JunctionResult> results) {
        List<Map<String, Object>> rows = new ArrayList<>();
        int failed = 0;
        for (JunctionResult result : results) {
            Map<String, Object> row = new HashMap<>();
            row.put("input", result.getOriginalInput());
            result.getJunction().ifPresent(v -> row.put("junction", v));
            result.getCdr3().ifPresent(v -> row.put("cdr3", v));
            result.getError().ifPresent(v -> row.put("error", v));
            result.getAttemptedFix().ifPresent(v -> row.put("attemptedFix", v));
            rows.add(row);
            if (result.isFailed()) {
                failed++;
            }
        }
        return render(JUNCTION_TEMPLATE, summary(heading, rows, failed));
    }

    /**
     * Heading followed by one line per entry, for queries and sequence lookups.
     */
    public String renderListing(String heading, List<String> lines) {
        Map<String, Object> model = new LinkedHashMap<>();
        model.put("heading", heading);
        model.put("lines", lines);
        return render(LISTING_TEMPLATE, model);
    }

    public void write(Path target, String content) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, content, StandardCharsets.UTF_8);
            log.info("Report written to {}", target.toAbsolutePath());
        } catch (IOException e) {
            throw new ReportException("Failed to write report " + target, e);
        }
    }

    private static Map<String, Object> summary(String heading, List<Map<String, Object>> rows, int failed) {
        Map<String, Object> model = new LinkedHashMap<>();
        model.put("heading", heading);
        model.put("rows", rows);
        model.put("total", rows.size());
        model.put("succeeded", rows.size() - failed);
        model.put("failed", failed);
        return model;
    }

    private String render(String templateName, Map<String, Object> model) {
        try {
            Template template = freemarkerConfig.getTemplate(templateName);
            StringWriter out = new StringWriter();
            template.process(model, out);
            return out.toString();
        } catch (IOException | TemplateException e) {
            throw new ReportException("Failed to render " + templateName, e);
        }
    }
}
