package com.wireframe.compiler.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.wireframe.compiler.cli.exception.OptionsValidationException;
import com.wireframe.compiler.cli.model.CompileOptions;
import com.wireframe.compiler.cli.model.ValidatedCompileOptions;
import com.wireframe.compiler.cli.output.CompileResultsPrinter;
import com.wireframe.compiler.cli.validation.CompileOptionsValidator;
import com.wireframe.compiler.config.CompilerConfig;
import com.wireframe.compiler.pipeline.CompilationPipeline;
import com.wireframe.compiler.pipeline.CompilationResult;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command compiling a wireframe syntax tree into IR and layout JSON.
 */
@Command(
        name = "compile",
        mixinStandardHelpOptions = true,
        version = "wireframe-compiler 1.0.0",
        description = "Builds the node graph for a wireframe syntax tree and computes the layout of its screens."
)
public class CompileCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CompileCommand.class);

    @Mixin
    private CompileOptions options = new CompileOptions();

    private final CompileOptionsValidator validator = new CompileOptionsValidator();
    private final CompileResultsPrinter printer = new CompileResultsPrinter();

    @Override
    public Integer call() {
        ValidatedCompileOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error("{}", error));
            return 1;
        }

        printer.printBanner(options, validated);

        CompilerConfig config = CompilerConfig.builder()
                .inputPath(validated.getNormalizedInput())
                .outputDir(validated.getNormalizedOutputDir())
                .screen(options.getScreen())
                .width(options.getWidth())
                .force(options.isForce())
                .reportOnly(options.isReportOnly())
                .build();

        try {
            CompilationResult result = new CompilationPipeline(config).run();
            if (!result.isSuccess()) {
                printer.printFailure(validated, result);
                return 1;
            }
            printer.printSuccess(validated, result);
            return 0;
        } catch (RuntimeException e) {
            log.error("Compilation failed with exception", e);
            return 1;
        }
    }
}
