package com.wireframe.compiler.export;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.wireframe.compiler.ir.model.ComponentNode;
import com.wireframe.compiler.ir.model.ContainerNode;
import com.wireframe.compiler.ir.model.InstanceNode;
import com.wireframe.compiler.ir.model.IrNode;
import com.wireframe.compiler.ir.model.IrNodeGraph;
import com.wireframe.compiler.ir.model.IrProject;
import com.wireframe.compiler.ir.model.IrScreen;
import com.wireframe.compiler.ir.model.IrStyle;
import com.wireframe.compiler.ir.model.NodeMeta;
import com.wireframe.compiler.ir.model.NodeRef;
import com.wireframe.compiler.ir.model.NodeStyle;
import com.wireframe.compiler.syntax.SourceSpan;

/**
 * Serializes a node graph as {@code {"irVersion": "1.0", "project": {...}}}.
 *
 * Field names are fixed and every map keeps its build order, so equal graphs produce identical text.
 */
public class IrJsonWriter {

    public String write(IrNodeGraph graph) {
        return JsonSupport.GSON.toJson(toJson(graph));
    }

    public JsonObject toJson(IrNodeGraph graph) {
        JsonObject root = new JsonObject();
        root.addProperty("irVersion", IrNodeGraph.IR_VERSION);
        root.add("project", project(graph.getProject()));
        return root;
    }

    private JsonObject project(IrProject project) {
        JsonObject json = new JsonObject();
        json.addProperty("id", project.getId());
        json.addProperty("name", project.getName());
        json.add("style", style(project.getStyle()));
        json.add("colors", JsonSupport.object(project.getColors()));
        json.add("mocks", JsonSupport.object(project.getMocks()));

        JsonArray screens = new JsonArray();
        project.getScreens().forEach(screen -> screens.add(screen(screen)));
        json.add("screens", screens);

        JsonObject nodes = new JsonObject();
        project.getNodes().forEach((id, node) -> nodes.add(id, node(node)));
        json.add("nodes", nodes);
        return json;
    }

    private JsonObject style(IrStyle style) {
        JsonObject json = new JsonObject();
        json.addProperty("density", style.getDensity());
        json.addProperty("spacing", style.getSpacing());
        json.addProperty("radius", style.getRadius());
        json.addProperty("stroke", style.getStroke());
        json.addProperty("font", style.getFont());
        JsonSupport.putIfPresent(json, "background", style.getBackground());
        JsonSupport.putIfPresent(json, "theme", style.getTheme());
        JsonSupport.putIfPresent(json, "device", style.getDevice());
        return json;
    }

    private JsonObject screen(IrScreen screen) {
        JsonObject json = new JsonObject();
        json.addProperty("id", screen.getId());
        json.addProperty("name", screen.getName());

        JsonObject viewport = new JsonObject();
        viewport.addProperty("width", screen.getViewport().getWidth());
        viewport.addProperty("height", screen.getViewport().getHeight());
        json.add("viewport", viewport);

        json.add("root", ref(screen.getRoot()));
        JsonSupport.putIfPresent(json, "background", screen.getBackground());
        return json;
    }

    private JsonObject node(IrNode node) {
        JsonObject json = new JsonObject();
        json.addProperty("id", node.getId());
        json.addProperty("kind", node.getKind().tag());

        if (node instanceof ContainerNode container) {
            json.addProperty("containerType", container.getContainerType().tag());
            json.add("params", JsonSupport.object(container.getParams().asMap()));
            JsonArray children = new JsonArray();
            container.getChildren().forEach(child -> children.add(ref(child)));
            json.add("children", children);
        } else if (node instanceof ComponentNode component) {
            json.addProperty("componentType", component.getComponentType());
            json.add("props", JsonSupport.object(component.getProps().asMap()));
        } else if (node instanceof InstanceNode instance) {
            json.addProperty("definitionName", instance.getDefinitionName());
            json.addProperty("definitionKind", instance.getDefinitionKind().tag());
            json.add("props", JsonSupport.object(instance.getProps().asMap()));
            json.add("expandedRoot", ref(instance.getExpandedRoot()));
        }

        json.add("style", nodeStyle(node.getStyle()));
        json.add("meta", meta(node.getMeta()));
        return json;
    }

    private JsonObject nodeStyle(NodeStyle style) {
        JsonObject json = new JsonObject();
        JsonSupport.putIfPresent(json, "padding", style.getPadding());
        JsonSupport.putIfPresent(json, "gap", style.getGap());
        JsonSupport.putIfPresent(json, "align", style.getAlign());
        JsonSupport.putIfPresent(json, "justify", style.getJustify());
        JsonSupport.putIfPresent(json, "background", style.getBackground());
        return json;
    }

    private JsonObject meta(NodeMeta meta) {
        JsonObject json = new JsonObject();
        SourceSpan source = meta.getSource();
        if (source != null) {
            JsonObject span = new JsonObject();
            span.addProperty("line", source.getLine());
            span.addProperty("column", source.getColumn());
            span.addProperty("offset", source.getOffset());
            json.add("source", span);
        }
        JsonSupport.putIfPresent(json, "nodeId", meta.getSourceNodeId());
        JsonSupport.putIfPresent(json, "origin", meta.getOrigin());
        return json;
    }

    private static JsonObject ref(NodeRef ref) {
        JsonObject json = new JsonObject();
        json.addProperty("ref", ref.getRef());
        return json;
    }
}
