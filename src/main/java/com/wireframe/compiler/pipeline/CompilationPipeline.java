package com.wireframe.compiler.pipeline;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.wireframe.compiler.config.CompilerConfig;
import com.wireframe.compiler.export.IrJsonWriter;
import com.wireframe.compiler.export.LayoutJsonWriter;
import com.wireframe.compiler.ir.IrBuildResult;
import com.wireframe.compiler.ir.IrBuilder;
import com.wireframe.compiler.ir.model.IrNodeGraph;
import com.wireframe.compiler.ir.model.IrScreen;
import com.wireframe.compiler.layout.LayoutEngine;
import com.wireframe.compiler.layout.LayoutResult;
import com.wireframe.compiler.syntax.SyntaxTree;
import com.wireframe.compiler.syntax.SyntaxTreeFormatException;
import com.wireframe.compiler.syntax.SyntaxTreeReader;

/**
 * Reads a syntax tree, builds the node graph, lays out the selected screens and writes the JSON output.
 */
public class CompilationPipeline {
    private static final Logger log = LoggerFactory.getLogger(CompilationPipeline.class);

    private final CompilerConfig config;
    private final SyntaxTreeReader reader;
    private final IrBuilder builder;
    private final LayoutEngine layoutEngine;

    public CompilationPipeline(CompilerConfig config) {
        this(config, new SyntaxTreeReader(), new IrBuilder(), new LayoutEngine());
    }

    public CompilationPipeline(CompilerConfig config, SyntaxTreeReader reader, IrBuilder builder,
            LayoutEngine layoutEngine) {
        this.config = config;
        this.reader = reader;
        this.builder = builder;
        this.layoutEngine = layoutEngine;
    }

    public CompilationResult run() {
        // Step 1: read the syntax tree
        SyntaxTree tree;
        try {
            tree = reader.read(config.getInputPath());
        } catch (IOException e) {
            log.error("Cannot read input {}", config.getInputPath(), e);
            return CompilationResult.failure("Cannot read input " + config.getInputPath() + ": " + e.getMessage());
        } catch (SyntaxTreeFormatException e) {
            log.error("Malformed syntax tree in {}", config.getInputPath(), e);
            return CompilationResult.failure(e.getMessage());
        }

        // Step 2: build the node graph
        IrBuildResult buildResult = builder.build(tree);
        if (!buildResult.isSuccess()) {
            return CompilationResult.builder()
                    .success(false)
                    .buildResult(buildResult)
                    .build();
        }
        IrNodeGraph graph = buildResult.getGraph();

        // Step 3: lay out the selected screens
        List<IrScreen> screens = selectScreens(graph);
        if (screens.isEmpty() && config.getScreen() != null) {
            return CompilationResult.failure("Unknown screen: " + config.getScreen(), buildResult);
        }
        Map<String, LayoutResult> layouts = new LinkedHashMap<>();
        for (IrScreen screen : screens) {
            LayoutResult layout = config.hasWidthOverride()
                    ? layoutEngine.layout(graph, screen.getId(), config.getWidth())
                    : layoutEngine.layout(graph, screen.getId());
            layouts.put(screen.getId(), layout);
        }

        if (config.isReportOnly()) {
            log.info("Report-only run, no files written");
            return CompilationResult.builder()
                    .success(true)
                    .buildResult(buildResult)
                    .layouts(layouts)
                    .build();
        }

        // Step 4: write the output
        Map<Path, String> outputs = new LinkedHashMap<>();
        outputs.put(config.getOutputDir().resolve(OutputFiles.IR_FILE), new IrJsonWriter().write(graph));
        LayoutJsonWriter layoutWriter = new LayoutJsonWriter();
        layouts.forEach((screenId, layout) -> outputs.put(
                config.getOutputDir().resolve(OutputFiles.layoutFileName(screenId)), layoutWriter.write(layout)));

        Optional<Path> existing = outputs.keySet().stream().filter(Files::exists).findFirst();
        if (existing.isPresent() && !config.isForce()) {
            return CompilationResult.failure(
                    "Output file already exists: " + existing.get() + ". Use --force to overwrite.", buildResult);
        }

        List<Path> written = new ArrayList<>();
        try {
            for (Map.Entry<Path, String> output : outputs.entrySet()) {
                OutputFiles.write(output.getKey(), output.getValue());
                written.add(output.getKey());
                log.debug("Wrote {}", output.getKey());
            }
        } catch (IOException e) {
            log.error("Failed to write output to {}", config.getOutputDir(), e);
            return CompilationResult.failure("Failed to write output: " + e.getMessage(), buildResult);
        }

        log.info("Wrote {} file(s) to {}", written.size(), config.getOutputDir());
        return CompilationResult.builder()
                .success(true)
                .buildResult(buildResult)
                .layouts(layouts)
                .writtenFiles(List.copyOf(written))
                .build();
    }

    private List<IrScreen> selectScreens(IrNodeGraph graph) {
        if (config.getScreen() == null) {
            return graph.screens();
        }
        return graph.findScreen(config.getScreen()).map(List::of).orElse(List.of());
    }
}
