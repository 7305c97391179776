package com.wireframe.compiler.ir;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.wireframe.compiler.ir.error.UndefinedComponent;
import com.wireframe.compiler.ir.schema.ComponentCatalog;
import com.wireframe.compiler.syntax.CellSyntax;
import com.wireframe.compiler.syntax.ComponentSyntax;
import com.wireframe.compiler.syntax.DefinitionSyntax;
import com.wireframe.compiler.syntax.LayoutSyntax;
import com.wireframe.compiler.syntax.ScreenSyntax;
import com.wireframe.compiler.syntax.SyntaxNode;
import com.wireframe.compiler.syntax.SyntaxNodeVisitor;
import com.wireframe.compiler.syntax.SyntaxTree;

/**
 * Checks that every component and layout name used anywhere in the tree refers to something.
 *
 * A component name resolves to a component definition, a built-in leaf, or {@code Children}.
 * A layout type resolves to a container kind or a layout definition. Each unresolved occurrence
 * is reported with the span of the node that used it.
 */
public class ComponentResolver {
    private static final Logger log = LoggerFactory.getLogger(ComponentResolver.class);

    private final ComponentCatalog catalog;
    private final DefinitionTable definitions;

    public ComponentResolver(ComponentCatalog catalog, DefinitionTable definitions) {
        this.catalog = catalog;
        this.definitions = definitions;
    }

    public void resolve(SyntaxTree tree, BuildDiagnostics diagnostics) {
        NameChecker checker = new NameChecker(diagnostics);

        for (ScreenSyntax screen : tree.getScreens()) {
            for (LayoutSyntax layout : screen.getLayouts()) {
                walk(layout, checker);
            }
        }
        for (DefinitionSyntax definition : definitions.all()) {
            walk(definition.getBody(), checker);
        }

        if (checker.unresolved > 0) {
            log.debug("{} unresolved name(s)", checker.unresolved);
        }
    }

    private void walk(SyntaxNode root, NameChecker checker) {
        Deque<SyntaxNode> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            SyntaxNode node = pending.pop();
            node.accept(checker);
            List<SyntaxNode> children = node.getChildNodes();
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
        }
    }

    private final class NameChecker implements SyntaxNodeVisitor {
        private final BuildDiagnostics diagnostics;
        private int unresolved;

        private NameChecker(BuildDiagnostics diagnostics) {
            this.diagnostics = diagnostics;
        }

        @Override
        public void visit(LayoutSyntax layout) {
            String type = layout.getLayoutType();
            if (catalog.isContainer(type) || definitions.layout(type).isPresent()) {
                return;
            }
            report(type, layout);
        }

        @Override
        public void visit(ComponentSyntax component) {
            String type = component.getComponentType();
            if (component.isChildrenSlot() || catalog.isComponent(type) || definitions.component(type).isPresent()) {
                return;
            }
            report(type, component);
        }

        @Override
        public void visit(CellSyntax cell) {
            // no name to resolve
        }

        private void report(String name, SyntaxNode node) {
            unresolved++;
            diagnostics.error(new UndefinedComponent(name, node.getSpan()));
        }
    }
}
