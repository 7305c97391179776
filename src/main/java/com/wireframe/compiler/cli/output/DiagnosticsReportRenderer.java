package com.wireframe.compiler.cli.output;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.wireframe.compiler.ir.IrBuildResult;
import com.wireframe.compiler.ir.error.IrError;
import com.wireframe.compiler.syntax.SourceSpan;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders build errors and warnings as text, one line per diagnostic, prefixed with
 * {@code <source>:<line>:<column>} where the error has a location.
 */
public class DiagnosticsReportRenderer {
    static final String TEMPLATE = "diagnostics.ftl";

    private final Configuration freemarkerConfig;

    public DiagnosticsReportRenderer() {
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

    public String render(String sourceName, IrBuildResult result) {
        List<Map<String, String>> errors = new ArrayList<>();
        for (IrError error : result.getErrors()) {
            Map<String, String> entry = new LinkedHashMap<>();
            entry.put("location", location(sourceName, error.getLocation()));
            entry.put("code", error.code());
            entry.put("message", error.describe());
            errors.add(entry);
        }

        Map<String, Object> model = new LinkedHashMap<>();
        model.put("source", sourceName);
        model.put("errors", errors);
        model.put("warnings", result.getWarnings());

        try {
            Template template = freemarkerConfig.getTemplate(TEMPLATE);
            StringWriter out = new StringWriter();
            template.process(model, out);
            return out.toString();
        } catch (IOException | TemplateException e) {
            throw new IllegalStateException("Failed to render diagnostics report", e);
        }
    }

    static String location(String sourceName, SourceSpan span) {
        if (span == null) {
            return sourceName;
        }
        return sourceName + ":" + span.getLine() + ":" + span.getColumn();
    }
}
