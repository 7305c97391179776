package com.wireframe.compiler.ir;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.wireframe.compiler.ir.error.CyclicComponentDefinition;
import com.wireframe.compiler.ir.error.IrError;
import com.wireframe.compiler.ir.model.IrNodeGraph;
import com.wireframe.compiler.ir.model.IrProject;
import com.wireframe.compiler.ir.model.IrScreen;
import com.wireframe.compiler.ir.model.IrStyle;
import com.wireframe.compiler.ir.schema.ComponentCatalog;
import com.wireframe.compiler.syntax.SyntaxTree;

/**
 * Turns a syntax tree into an immutable {@link IrNodeGraph}.
 *
 * Steps run in a fixed order: hoisting, cycle detection, name resolution, expansion, validation.
 * The first three abort the build on error; validation collects everything. Bad input never
 * throws, it yields a failed {@link IrBuildResult}.
 *
 * The builder keeps no per-build state and may be shared between threads.
 */
public class IrBuilder {
    private static final Logger log = LoggerFactory.getLogger(IrBuilder.class);

    private final ComponentCatalog catalog;

    public IrBuilder() {
        this(ComponentCatalog.standard());
    }

    public IrBuilder(ComponentCatalog catalog) {
        this.catalog = catalog;
    }

    public IrBuildResult build(SyntaxTree tree) {
        BuildSession session = new BuildSession(catalog);
        BuildDiagnostics diagnostics = session.getDiagnostics();
        log.info("Building IR for project '{}': {} screen(s), {} definition(s)",
                tree.getName(), tree.getScreens().size(), tree.getDefinitions().size());

        // Step 1: hoist definitions
        DefinitionTable definitions = DefinitionTable.hoist(tree.getDefinitions(), diagnostics);
        if (diagnostics.hasErrors()) {
            return abort("definition hoisting", diagnostics);
        }

        // Step 2: reject recursive definitions before anything is expanded
        Optional<CyclicComponentDefinition> cycle = new DefinitionCycleDetector(definitions).detect();
        if (cycle.isPresent()) {
            diagnostics.error(cycle.get());
            return abort("cycle detection", diagnostics);
        }

        // Step 3: every name must resolve
        new ComponentResolver(catalog, definitions).resolve(tree, diagnostics);
        if (diagnostics.hasErrors()) {
            return abort("name resolution", diagnostics);
        }

        // Step 4: defaults, expansion and ids
        IrStyle style = projectStyle(tree.getStyle());
        List<IrScreen> screens = new NodeExpander(session, definitions, style).expandScreens(tree.getScreens());

        IrProject project = IrProject.builder()
                .id(NamingUtil.sanitizeId(tree.getName()))
                .name(tree.getName() == null ? "" : tree.getName())
                .style(style)
                .colors(copy(tree.getColors()))
                .mocks(copy(tree.getMocks()))
                .screens(screens)
                .nodes(session.nodeTable())
                .build();

        // Step 5: accumulate semantic errors
        new SemanticValidator(catalog).validate(tree, project, diagnostics);

        if (diagnostics.hasErrors()) {
            log.info("IR build failed with {} error(s) and {} warning(s)",
                    diagnostics.getErrors().size(), diagnostics.getWarnings().size());
            logErrors(diagnostics);
            return IrBuildResult.failure(diagnostics.getErrors(), diagnostics.getWarnings());
        }

        IrNodeGraph graph = new IrNodeGraph(project);
        log.info("IR build finished: {} screen(s), {} node(s), {} warning(s)",
                screens.size(), graph.size(), diagnostics.getWarnings().size());
        return IrBuildResult.success(graph, diagnostics.getWarnings());
    }

    static IrStyle projectStyle(Map<String, String> tokens) {
        IrStyle.IrStyleBuilder style = IrStyle.builder();
        if (tokens == null) {
            return style.build();
        }
        Optional.ofNullable(tokens.get("density")).ifPresent(style::density);
        Optional.ofNullable(tokens.get("spacing")).ifPresent(style::spacing);
        Optional.ofNullable(tokens.get("radius")).ifPresent(style::radius);
        Optional.ofNullable(tokens.get("stroke")).ifPresent(style::stroke);
        Optional.ofNullable(tokens.get("font")).ifPresent(style::font);
        style.background(tokens.get("background"));
        style.theme(tokens.get("theme"));
        style.device(tokens.get("device"));
        return style.build();
    }

    private IrBuildResult abort(String step, BuildDiagnostics diagnostics) {
        log.warn("IR build aborted during {} with {} error(s)", step, diagnostics.getErrors().size());
        logErrors(diagnostics);
        return IrBuildResult.failure(diagnostics.getErrors(), diagnostics.getWarnings());
    }

    private static void logErrors(BuildDiagnostics diagnostics) {
        for (IrError error : diagnostics.getErrors()) {
            log.debug("{}", error);
        }
    }

    private static Map<String, String> copy(Map<String, String> values) {
        return values == null ? Map.of() : new LinkedHashMap<>(values);
    }
}
