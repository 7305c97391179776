package com.wireframe.compiler.ir;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.wireframe.compiler.ir.error.InvalidPropertyValue;
import com.wireframe.compiler.ir.error.StructuralViolation;
import com.wireframe.compiler.ir.model.ComponentNode;
import com.wireframe.compiler.ir.model.ContainerNode;
import com.wireframe.compiler.ir.model.ContainerType;
import com.wireframe.compiler.ir.model.IrNode;
import com.wireframe.compiler.ir.model.IrProject;
import com.wireframe.compiler.ir.model.IrScreen;
import com.wireframe.compiler.ir.model.IrStyle;
import com.wireframe.compiler.ir.model.NodeRef;
import com.wireframe.compiler.ir.model.NodeStyle;
import com.wireframe.compiler.ir.model.PropertyBag;
import com.wireframe.compiler.ir.schema.ComponentCatalog;
import com.wireframe.compiler.ir.schema.ComponentSchema;
import com.wireframe.compiler.ir.schema.PropertySchema;
import com.wireframe.compiler.ir.schema.PropertyType;
import com.wireframe.compiler.syntax.ScreenSyntax;
import com.wireframe.compiler.syntax.SourceSpan;
import com.wireframe.compiler.syntax.SyntaxTree;

/**
 * Post-expansion checks. Every problem is recorded; nothing stops at the first error.
 */
public class SemanticValidator {
    private static final Logger log = LoggerFactory.getLogger(SemanticValidator.class);

    static final String SPAN = "span";
    static final int DEFAULT_COLUMNS = 12;

    private static final Map<String, PropertySchema> STYLE_SCHEMA = Map.of(
            "density", enumSchema("density", "compact", "normal", "comfortable"),
            "spacing", enumSchema("spacing", "xs", "sm", "md", "lg", "xl"),
            "radius", enumSchema("radius", "none", "sm", "md", "lg", "full"),
            "stroke", enumSchema("stroke", "thin", "normal", "thick"),
            "font", enumSchema("font", "sm", "base", "lg"));

    private final ComponentCatalog catalog;

    public SemanticValidator(ComponentCatalog catalog) {
        this.catalog = catalog;
    }

    public void validate(SyntaxTree tree, IrProject project, BuildDiagnostics diagnostics) {
        int before = diagnostics.getErrors().size();

        validateProjectStyle(project.getStyle(), tree.getSpan(), diagnostics);
        validateScreens(tree, project, diagnostics);

        Map<String, ContainerNode> parents = parentIndex(project.getNodes());
        for (IrNode node : project.getNodes().values()) {
            validateReferences(node, project.getNodes(), diagnostics);
            if (node instanceof ContainerNode container) {
                validateContainer(container, parents.get(container.getId()), diagnostics);
            } else if (node instanceof ComponentNode component) {
                validateComponent(component, diagnostics);
            }
        }

        log.debug("Semantic validation found {} error(s)", diagnostics.getErrors().size() - before);
    }

    private void validateProjectStyle(IrStyle style, SourceSpan span, BuildDiagnostics diagnostics) {
        Map<String, String> tokens = Map.of(
                "density", style.getDensity(),
                "spacing", style.getSpacing(),
                "radius", style.getRadius(),
                "stroke", style.getStroke(),
                "font", style.getFont());
        for (String key : new String[] {"density", "spacing", "radius", "stroke", "font"}) {
            PropertySchema schema = STYLE_SCHEMA.get(key);
            String value = tokens.get(key);
            if (!schema.accepts(value)) {
                diagnostics.error(new InvalidPropertyValue(null, "style." + key, schema.describeDomain(), value, span));
            }
        }
    }

    private void validateScreens(SyntaxTree tree, IrProject project, BuildDiagnostics diagnostics) {
        Set<String> names = new HashSet<>();
        Set<String> ids = new HashSet<>();
        for (ScreenSyntax screen : tree.getScreens()) {
            int roots = screen.getLayouts().size();
            if (roots != 1) {
                diagnostics.error(new StructuralViolation(
                        StructuralViolation.SCREEN_ROOT_COUNT,
                        null,
                        "Screen '" + screen.getName() + "' must have exactly one root layout, found " + roots,
                        screen.getSpan()));
            }
            String id = NamingUtil.sanitizeId(screen.getName());
            if (!names.add(screen.getName()) || !ids.add(id)) {
                diagnostics.error(new StructuralViolation(
                        StructuralViolation.DUPLICATE_SCREEN_NAME,
                        null,
                        "Screen name '" + screen.getName() + "' collides with an earlier screen (id '" + id + "')",
                        screen.getSpan()));
            }
        }

        for (IrScreen screen : project.getScreens()) {
            if (!project.getNodes().containsKey(screen.getRoot().getRef())) {
                diagnostics.error(new StructuralViolation(
                        StructuralViolation.DANGLING_REF,
                        null,
                        "Root of screen '" + screen.getName() + "' points at missing node " + screen.getRoot(),
                        null));
            }
        }
    }

    private void validateReferences(IrNode node, Map<String, IrNode> nodes, BuildDiagnostics diagnostics) {
        for (NodeRef ref : node.references()) {
            if (!nodes.containsKey(ref.getRef())) {
                diagnostics.error(new StructuralViolation(
                        StructuralViolation.DANGLING_REF,
                        node.getId(),
                        "Node " + node.getId() + " references missing node " + ref,
                        node.getMeta().getSource()));
            }
        }
    }

    private void validateContainer(ContainerNode container, ContainerNode parent, BuildDiagnostics diagnostics) {
        SourceSpan location = container.getMeta().getSource();

        if (container.isCell()) {
            validateCell(container, parent, diagnostics);
            return;
        }

        if (container.getContainerType() == ContainerType.SPLIT && container.getChildren().size() != 2) {
            diagnostics.error(new StructuralViolation(
                    StructuralViolation.SPLIT_ARITY,
                    container.getId(),
                    "split " + container.getId() + " must have exactly two children, found " + container.getChildren().size(),
                    location));
        }

        ComponentSchema schema = catalog.container(container.getContainerType().tag()).orElse(null);
        if (schema == null) {
            return;
        }
        validateValues(container.getId(), "layout '" + schema.getName() + "'", container.getParams(), schema, location, diagnostics);
        validateStyle(container, schema, diagnostics);
    }

    private void validateCell(ContainerNode cell, ContainerNode parent, BuildDiagnostics diagnostics) {
        int columns = DEFAULT_COLUMNS;
        if (parent != null && parent.getContainerType() == ContainerType.GRID) {
            Integer declared = parent.getParams().getInt("columns");
            if (declared != null && declared > 0) {
                columns = declared;
            }
        }

        PropertyBag props = cell.getParams();
        for (String key : props.keys()) {
            if (!SPAN.equals(key)) {
                diagnostics.warn("Unknown property '" + key + "' on cell " + cell.getId() + at(cell.getMeta().getSource()));
            }
        }
        if (!props.has(SPAN)) {
            return;
        }
        Integer span = props.getInt(SPAN);
        if (span == null || span < 1 || span > columns) {
            diagnostics.error(new InvalidPropertyValue(
                    cell.getId(), SPAN, "integer in 1.." + columns, props.get(SPAN), cell.getMeta().getSource()));
        }
    }

    private void validateComponent(ComponentNode component, BuildDiagnostics diagnostics) {
        ComponentSchema schema = catalog.component(component.getComponentType()).orElse(null);
        if (schema == null) {
            return;
        }
        SourceSpan location = component.getMeta().getSource();
        validateValues(component.getId(), "component '" + schema.getName() + "'", component.getProps(), schema, location, diagnostics);

        for (PropertySchema property : schema.getProperties().values()) {
            if (property.isRequired() && !component.getProps().has(property.getName())) {
                diagnostics.error(new InvalidPropertyValue(
                        component.getId(), property.getName(), property.describeDomain(), null, location));
            }
        }
    }

    private void validateValues(String nodeId, String owner, PropertyBag values, ComponentSchema schema,
                                SourceSpan location, BuildDiagnostics diagnostics) {
        for (Map.Entry<String, Object> entry : values.asMap().entrySet()) {
            PropertySchema property = schema.getProperties().get(entry.getKey());
            if (property == null) {
                diagnostics.warn("Unknown property '" + entry.getKey() + "' on " + owner + " (" + nodeId + ")" + at(location));
                continue;
            }
            if (!property.accepts(entry.getValue())) {
                diagnostics.error(new InvalidPropertyValue(
                        nodeId, entry.getKey(), property.describeDomain(), entry.getValue(), location));
            }
        }
    }

    private void validateStyle(ContainerNode container, ComponentSchema schema, BuildDiagnostics diagnostics) {
        NodeStyle style = container.getStyle();
        Map<String, String> tokens = new HashMap<>();
        tokens.put("padding", style.getPadding());
        tokens.put("gap", style.getGap());
        tokens.put("align", style.getAlign());
        tokens.put("justify", style.getJustify());
        tokens.put("background", style.getBackground());

        for (String key : new String[] {"padding", "gap", "align", "justify", "background"}) {
            String value = tokens.get(key);
            if (value == null) {
                continue;
            }
            PropertySchema property = schema.getProperties().get(key);
            if (property == null) {
                diagnostics.warn("Unknown property '" + key + "' on layout '" + schema.getName() + "' ("
                        + container.getId() + ")" + at(container.getMeta().getSource()));
                continue;
            }
            if (!property.accepts(value)) {
                diagnostics.error(new InvalidPropertyValue(
                        container.getId(), key, property.describeDomain(), value, container.getMeta().getSource()));
            }
        }
    }

    private static Map<String, ContainerNode> parentIndex(Map<String, IrNode> nodes) {
        Map<String, ContainerNode> parents = new HashMap<>();
        for (IrNode node : nodes.values()) {
            if (node instanceof ContainerNode container) {
                for (NodeRef child : container.getChildren()) {
                    parents.put(child.getRef(), container);
                }
            }
        }
        return parents;
    }

    private static PropertySchema enumSchema(String name, String... values) {
        return PropertySchema.builder()
                .name(name)
                .type(PropertyType.ENUM)
                .allowedValues(List.of(values))
                .build();
    }

    private static String at(SourceSpan span) {
        return span == null ? "" : " (at " + span + ")";
    }
}
