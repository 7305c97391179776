package com.wireframe.compiler.export;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.wireframe.compiler.ir.IrBuilder;
import com.wireframe.compiler.ir.model.IrNodeGraph;
import com.wireframe.compiler.layout.LayoutEngine;
import com.wireframe.compiler.syntax.SyntaxTreeReader;

/**
 * Tests for the IR and layout JSON output.
 */
class IrJsonWriterTest {

    private static final String TREE = """
            {
              "name": "Demo",
              "style": { "device": "tablet" },
              "definitions": [
                { "type": "defineComponent", "name": "Header",
                  "body": { "type": "component", "componentType": "Heading", "props": { "text": "prop_title" } } }
              ],
              "screens": [
                { "name": "Home", "layouts": [
                  { "type": "layout", "layoutType": "stack", "params": { "padding": "md" },
                    "span": { "line": 4, "column": 3, "offset": 40 }, "children": [
                    { "type": "component", "componentType": "Header", "props": { "title": "Hello <world>" } } ] } ] }
              ]
            }
            """;

    @Test
    void testWriteIrDocument() {
        IrNodeGraph graph = new IrBuilder().build(new SyntaxTreeReader().read(TREE)).getGraph();

        String json = new IrJsonWriter().write(graph);
        JsonObject root = JsonParser.parseString(json).getAsJsonObject();

        assertThat(root.get("irVersion").getAsString()).isEqualTo("1.0");
        JsonObject project = root.getAsJsonObject("project");
        assertThat(project.get("id").getAsString()).isEqualTo("demo");
        assertThat(project.getAsJsonObject("style").get("density").getAsString()).isEqualTo("normal");

        JsonObject screen = project.getAsJsonArray("screens").get(0).getAsJsonObject();
        assertThat(screen.get("id").getAsString()).isEqualTo("home");
        assertThat(screen.getAsJsonObject("viewport").get("width").getAsInt()).isEqualTo(768);
        assertThat(screen.getAsJsonObject("root").get("ref").getAsString()).isEqualTo("container_1");

        JsonObject nodes = project.getAsJsonObject("nodes");
        assertThat(nodes.keySet()).containsExactly("container_1", "instance_2", "component_3");

        JsonObject stack = nodes.getAsJsonObject("container_1");
        assertThat(stack.get("kind").getAsString()).isEqualTo("container");
        assertThat(stack.get("containerType").getAsString()).isEqualTo("stack");
        assertThat(stack.getAsJsonObject("style").get("padding").getAsString()).isEqualTo("md");
        assertThat(stack.getAsJsonObject("meta").getAsJsonObject("source").get("line").getAsInt()).isEqualTo(4);

        JsonObject instance = nodes.getAsJsonObject("instance_2");
        assertThat(instance.get("definitionName").getAsString()).isEqualTo("Header");
        assertThat(instance.get("definitionKind").getAsString()).isEqualTo("component");
        assertThat(instance.getAsJsonObject("expandedRoot").get("ref").getAsString()).isEqualTo("component_3");

        JsonObject heading = nodes.getAsJsonObject("component_3");
        assertThat(heading.getAsJsonObject("props").get("text").getAsString()).isEqualTo("Hello <world>");
    }

    @Test
    void testHtmlCharactersAreNotEscaped() {
        IrNodeGraph graph = new IrBuilder().build(new SyntaxTreeReader().read(TREE)).getGraph();

        assertThat(new IrJsonWriter().write(graph)).contains("Hello <world>");
    }

    @Test
    void testWriteLayoutDocument() {
        IrNodeGraph graph = new IrBuilder().build(new SyntaxTreeReader().read(TREE)).getGraph();

        String json = new LayoutJsonWriter().write(new LayoutEngine().layout(graph, "home"));
        JsonObject root = JsonParser.parseString(json).getAsJsonObject();

        assertThat(root.keySet()).containsExactly("container_1", "instance_2", "component_3");
        JsonObject heading = root.getAsJsonObject("component_3");
        assertThat(heading.get("x").getAsDouble()).isEqualTo(16);
        assertThat(heading.get("y").getAsDouble()).isEqualTo(16);
        assertThat(heading.get("width").getAsDouble()).isEqualTo(736);
        assertThat(heading.get("height").getAsDouble()).isEqualTo(40);
    }
}
