package com.wireframe.compiler.ir;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.wireframe.compiler.ir.error.StructuralViolation;
import com.wireframe.compiler.ir.model.ComponentNode;
import com.wireframe.compiler.ir.model.ContainerNode;
import com.wireframe.compiler.ir.model.ContainerType;
import com.wireframe.compiler.ir.model.DevicePreset;
import com.wireframe.compiler.ir.model.InstanceNode;
import com.wireframe.compiler.ir.model.IrScreen;
import com.wireframe.compiler.ir.model.IrStyle;
import com.wireframe.compiler.ir.model.NodeKind;
import com.wireframe.compiler.ir.model.NodeMeta;
import com.wireframe.compiler.ir.model.NodeRef;
import com.wireframe.compiler.ir.model.NodeStyle;
import com.wireframe.compiler.ir.model.PropertyBag;
import com.wireframe.compiler.ir.schema.ComponentSchema;
import com.wireframe.compiler.syntax.CellSyntax;
import com.wireframe.compiler.syntax.ComponentSyntax;
import com.wireframe.compiler.syntax.DefinitionKind;
import com.wireframe.compiler.syntax.DefinitionSyntax;
import com.wireframe.compiler.syntax.LayoutSyntax;
import com.wireframe.compiler.syntax.ScreenSyntax;
import com.wireframe.compiler.syntax.SourceSpan;
import com.wireframe.compiler.syntax.SyntaxNode;

/**
 * Materializes screens into the node table: applies schema defaults, moves style tokens into
 * {@link NodeStyle}, expands every definition invocation into an {@link InstanceNode} with its own
 * copy of the body, and allocates ids in pre-order.
 *
 * Must only run after cycle detection and name resolution succeeded.
 */
class NodeExpander {
    private static final Logger log = LoggerFactory.getLogger(NodeExpander.class);

    private static final List<String> STYLE_KEYS = List.of("padding", "gap", "align", "justify", "background");

    private final BuildSession session;
    private final DefinitionTable definitions;
    private final IrStyle projectStyle;

    NodeExpander(BuildSession session, DefinitionTable definitions, IrStyle projectStyle) {
        this.session = session;
        this.definitions = definitions;
        this.projectStyle = projectStyle;
    }

    /**
     * Expands each screen's first layout. Screens without a layout produce no {@link IrScreen};
     * the validator reports them.
     */
    List<IrScreen> expandScreens(List<ScreenSyntax> screens) {
        List<IrScreen> result = new ArrayList<>();
        for (ScreenSyntax screen : screens) {
            if (screen.getLayouts().isEmpty()) {
                continue;
            }
            NodeRef root = expandLayout(screen.getLayouts().get(0), ExpansionContext.screen());
            if (root == null) {
                continue;
            }
            Object background = screen.getParams().get("background");
            result.add(IrScreen.builder()
                    .id(NamingUtil.sanitizeId(screen.getName()))
                    .name(screen.getName())
                    .viewport(DevicePreset.resolve(projectStyle.getDevice()).viewport())
                    .root(root)
                    .background(background != null ? String.valueOf(background) : projectStyle.getBackground())
                    .build());
            log.debug("Expanded screen '{}' with root {}", screen.getName(), root);
        }
        return result;
    }

    private NodeRef expandNode(SyntaxNode node, ExpansionContext context) {
        if (node instanceof LayoutSyntax layout) {
            return expandLayout(layout, context);
        }
        if (node instanceof ComponentSyntax component) {
            return expandComponent(component, context);
        }
        if (node instanceof CellSyntax cell) {
            return expandCell(cell, context);
        }
        throw new IllegalStateException("Unsupported syntax node: " + node.getClass().getName());
    }

    private NodeRef expandLayout(LayoutSyntax layout, ExpansionContext context) {
        String type = layout.getLayoutType();
        Optional<ComponentSchema> schema = session.getCatalog().container(type);
        Map<String, Object> params = bindValues(type, layout.getParams(), schema.orElse(null), layout.getSpan(), context);

        Optional<DefinitionSyntax> definition = definitions.layout(type);
        if (definition.isPresent()) {
            return expandLayoutDefinition(definition.get(), params, layout, context);
        }

        Optional<ContainerType> containerType = ContainerType.fromName(type);
        if (containerType.isEmpty()) {
            log.debug("Skipping unresolved layout type '{}'", type);
            return null;
        }

        String id = session.allocate(NodeKind.CONTAINER);
        List<NodeRef> children = expandChildren(layout.getChildren(), context);

        Map<String, Object> merged = withDefaults(params, schema.orElse(null));
        ContainerNode node = ContainerNode.builder()
                .id(id)
                .containerType(containerType.get())
                .params(PropertyBag.of(withoutStyleKeys(merged)))
                .children(children)
                .style(containerStyle(containerType.get(), merged))
                .meta(meta(layout, null))
                .build();
        session.register(node);
        return NodeRef.of(id);
    }

    private NodeRef expandCell(CellSyntax cell, ExpansionContext context) {
        Map<String, Object> props = bindValues("cell", cell.getProps(), null, cell.getSpan(), context);

        String id = session.allocate(NodeKind.CONTAINER);
        List<NodeRef> children = expandChildren(cell.getChildren(), context);

        ContainerNode node = ContainerNode.builder()
                .id(id)
                .containerType(ContainerType.STACK)
                .params(PropertyBag.of(props))
                .children(children)
                .style(NodeStyle.builder().padding("none").build())
                .meta(meta(cell, NodeMeta.ORIGIN_CELL))
                .build();
        session.register(node);
        return NodeRef.of(id);
    }

    private NodeRef expandComponent(ComponentSyntax component, ExpansionContext context) {
        if (component.isChildrenSlot()) {
            return expandChildrenSlot(component, context);
        }

        String type = component.getComponentType();
        Optional<DefinitionSyntax> definition = definitions.component(type);
        Optional<ComponentSchema> schema = definition.isPresent()
                ? Optional.empty()
                : session.getCatalog().component(type);
        Map<String, Object> props = bindValues(type, component.getProps(), schema.orElse(null), component.getSpan(), context);

        if (definition.isPresent()) {
            return expandComponentDefinition(definition.get(), props, component);
        }

        String id = session.allocate(NodeKind.COMPONENT);
        ComponentNode node = ComponentNode.builder()
                .id(id)
                .componentType(type)
                .props(PropertyBag.of(withDefaults(props, schema.orElse(null))))
                .style(NodeStyle.EMPTY)
                .meta(meta(component, null))
                .build();
        session.register(node);
        return NodeRef.of(id);
    }

    private NodeRef expandChildrenSlot(ComponentSyntax placeholder, ExpansionContext context) {
        if (!context.isChildrenSlotAllowed()) {
            session.getDiagnostics().error(new StructuralViolation(
                    StructuralViolation.CHILDREN_SLOT_OUTSIDE_LAYOUT,
                    null,
                    "'" + ComponentSyntax.CHILDREN_SLOT + "' can only be used inside a layout definition body",
                    placeholder.getSpan()));
            return null;
        }
        if (context.getChildrenSlot() == null) {
            // arity already reported at the invocation
            return null;
        }
        return expandNode(context.getChildrenSlot(), context.getSlotScope());
    }

    private NodeRef expandComponentDefinition(DefinitionSyntax definition, Map<String, Object> args,
                                              ComponentSyntax invocation) {
        String id = session.allocate(NodeKind.INSTANCE);
        ExpansionContext scope = ExpansionContext.forComponent(definition.getName(), args);

        NodeRef expandedRoot = expandNode(definition.getBody(), scope);
        reportUnusedArguments(scope, invocation.getSpan());
        if (expandedRoot == null) {
            return null;
        }

        session.register(InstanceNode.builder()
                .id(id)
                .definitionName(definition.getName())
                .definitionKind(DefinitionKind.COMPONENT)
                .props(PropertyBag.of(args))
                .expandedRoot(expandedRoot)
                .style(NodeStyle.EMPTY)
                .meta(meta(invocation, null))
                .build());
        return NodeRef.of(id);
    }

    private NodeRef expandLayoutDefinition(DefinitionSyntax definition, Map<String, Object> args,
                                           LayoutSyntax invocation, ExpansionContext context) {
        List<SyntaxNode> supplied = invocation.getChildren();
        if (supplied.size() != 1) {
            session.getDiagnostics().error(new StructuralViolation(
                    StructuralViolation.LAYOUT_CHILDREN_ARITY,
                    null,
                    "Layout '" + definition.getName() + "' expects exactly one child, received " + supplied.size(),
                    invocation.getSpan()));
        }

        String id = session.allocate(NodeKind.INSTANCE);
        SyntaxNode slot = supplied.isEmpty() ? null : supplied.get(0);
        ExpansionContext scope = ExpansionContext.forLayout(definition.getName(), args, slot, context);

        NodeRef expandedRoot = expandNode(definition.getBody(), scope);
        reportUnusedArguments(scope, invocation.getSpan());
        if (expandedRoot == null) {
            return null;
        }

        session.register(InstanceNode.builder()
                .id(id)
                .definitionName(definition.getName())
                .definitionKind(DefinitionKind.LAYOUT)
                .props(PropertyBag.of(args))
                .expandedRoot(expandedRoot)
                .style(NodeStyle.EMPTY)
                .meta(meta(invocation, null))
                .build());
        return NodeRef.of(id);
    }

    private List<NodeRef> expandChildren(List<SyntaxNode> children, ExpansionContext context) {
        List<NodeRef> refs = new ArrayList<>();
        for (SyntaxNode child : children) {
            NodeRef ref = expandNode(child, context);
            if (ref != null) {
                refs.add(ref);
            }
        }
        return refs;
    }

    /**
     * Substitutes {@code prop_<arg>} values with the enclosing invocation's arguments.
     * Outside a definition body such values are kept literally.
     */
    private Map<String, Object> bindValues(String targetType, Map<String, Object> values, ComponentSchema schema,
                                           SourceSpan span, ExpansionContext context) {
        Map<String, Object> bound = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();

            if (!(value instanceof String text) || !text.startsWith(ExpansionContext.ARGUMENT_PREFIX)
                    || !context.isInsideDefinition()) {
                bound.put(key, value);
                continue;
            }

            String arg = text.substring(ExpansionContext.ARGUMENT_PREFIX.length());
            if (context.hasArg(arg)) {
                bound.put(key, context.useArg(arg));
                continue;
            }

            // a required target left unbound is reported by the validator as a missing property
            if (schema == null || !schema.isRequiredWithoutDefault(key)) {
                session.getDiagnostics().warn("Optional property '" + key + "' of '" + targetType
                        + "' was omitted because argument '" + arg + "' was not provided while expanding "
                        + context.describe() + at(span));
            }
        }
        return bound;
    }

    private void reportUnusedArguments(ExpansionContext scope, SourceSpan span) {
        for (String arg : scope.getArgs().keySet()) {
            if (!scope.getUsedArgs().contains(arg)) {
                session.getDiagnostics().warn("Argument '" + arg + "' is not used by " + scope.describe() + at(span));
            }
        }
    }

    private static Map<String, Object> withDefaults(Map<String, Object> explicit, ComponentSchema schema) {
        Map<String, Object> merged = new LinkedHashMap<>(explicit);
        if (schema != null) {
            schema.defaults().forEach(merged::putIfAbsent);
        }
        return merged;
    }

    private static Map<String, Object> withoutStyleKeys(Map<String, Object> params) {
        Map<String, Object> remaining = new LinkedHashMap<>(params);
        STYLE_KEYS.forEach(remaining::remove);
        return remaining;
    }

    private static NodeStyle containerStyle(ContainerType type, Map<String, Object> params) {
        boolean framed = type == ContainerType.PANEL || type == ContainerType.CARD;
        return NodeStyle.builder()
                .padding(token(params, "padding", framed ? "md" : "none"))
                .gap(token(params, "gap", type == ContainerType.CARD ? "md" : null))
                .align(token(params, "align", null))
                .justify(token(params, "justify", null))
                .background(token(params, "background", null))
                .build();
    }

    private static String token(Map<String, Object> params, String key, String fallback) {
        Object value = params.get(key);
        return value == null ? fallback : String.valueOf(value);
    }

    private static NodeMeta meta(SyntaxNode node, String origin) {
        return NodeMeta.builder()
                .source(node.getSpan())
                .sourceNodeId(node.getNodeId())
                .origin(origin)
                .build();
    }

    private static String at(SourceSpan span) {
        return span == null ? "" : " (at " + span + ")";
    }
}
