package com.wireframe.compiler.cli.output;

import java.nio.file.Path;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.wireframe.compiler.cli.model.CompileOptions;
import com.wireframe.compiler.cli.model.ValidatedCompileOptions;
import com.wireframe.compiler.ir.IrBuildResult;
import com.wireframe.compiler.layout.LayoutResult;
import com.wireframe.compiler.pipeline.CompilationResult;

/**
 * Responsible only for printing CLI output for the "compile" command.
 * No validation, no execution.
 */
public class CompileResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(CompileResultsPrinter.class);

    private final DiagnosticsReportRenderer reportRenderer;

    public CompileResultsPrinter() {
        this(new DiagnosticsReportRenderer());
    }

    public CompileResultsPrinter(DiagnosticsReportRenderer reportRenderer) {
        this.reportRenderer = reportRenderer;
    }

    public void printBanner(CompileOptions o, ValidatedCompileOptions v) {
        log.info("=================================================");
        log.info("Wireframe Compiler");
        log.info("=================================================");
        log.info("Input: {}", v.getNormalizedInput());
        log.info("Screen: {}", o.getScreen() != null ? o.getScreen() : "All screens");
        log.info("Width: {}", o.getWidth() != null ? o.getWidth() + " px" : "Device default");
        if (o.isReportOnly()) {
            log.info("Output Directory: {}", "N/A (report only)");
        } else {
            log.info("Output Directory: {}", v.getNormalizedOutputDir());
        }
        log.info("=================================================");
    }

    public void printSuccess(ValidatedCompileOptions v, CompilationResult result) {
        IrBuildResult build = result.getBuildResult();

        log.info("");
        log.info("=================================================");
        log.info("COMPILATION SUCCESSFUL");
        log.info("=================================================");
        log.info("Screens: {}", build.getGraph().screens().size());
        log.info("Nodes: {}", build.getGraph().size());
        log.info("Warnings: {}", build.getWarnings().size());

        log.info("");
        log.info("Layouts:");
        for (Map.Entry<String, LayoutResult> layout : result.getLayouts().entrySet()) {
            log.info("  {}: {} box(es)", layout.getKey(), layout.getValue().size());
        }

        if (!result.getWrittenFiles().isEmpty()) {
            log.info("");
            log.info("Files Written:");
            for (Path file : result.getWrittenFiles()) {
                log.info("  {}", file);
            }
        }

        if (!build.getWarnings().isEmpty()) {
            log.info("");
            printReport(v, build);
        }
        log.info("=================================================");
    }

    public void printFailure(ValidatedCompileOptions v, CompilationResult result) {
        if (result.hasBuildResult() && !result.getBuildResult().isSuccess()) {
            log.error("Compilation failed with {} error(s)", result.getBuildResult().getErrors().size());
            printReport(v, result.getBuildResult());
        }
        if (result.getErrorMessage() != null) {
            log.error("Compilation failed: {}", result.getErrorMessage());
        }
    }

    private void printReport(ValidatedCompileOptions v, IrBuildResult build) {
        String sourceName = v.getNormalizedInput().getFileName().toString();
        String report = reportRenderer.render(sourceName, build);
        for (String line : report.split("\\R")) {
            if (build.isSuccess()) {
                log.warn(line);
            } else {
                log.error(line);
            }
        }
    }
}
