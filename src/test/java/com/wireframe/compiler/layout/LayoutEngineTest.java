package com.wireframe.compiler.layout;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.wireframe.compiler.ir.IrBuildResult;
import com.wireframe.compiler.ir.IrBuilder;
import com.wireframe.compiler.ir.model.IrNodeGraph;
import com.wireframe.compiler.syntax.SyntaxTreeReader;

/**
 * Layout tests at the default desktop width (1280) and normal density, where {@code md} spacing is 16
 * and a control is 40 high.
 */
class LayoutEngineTest {

    private final LayoutEngine engine = new LayoutEngine();

    @Test
    void testHeadingInVerticalStack() {
        IrNodeGraph graph = graph(screen("""
                { "type": "layout", "layoutType": "stack", "children": [
                  { "type": "component", "componentType": "Heading", "props": { "text": "Hi" } } ] }
                """));

        LayoutResult layout = engine.layout(graph, "home");

        assertThat(layout.box("container_1")).contains(new LayoutBox(0, 0, 1280, 40));
        assertThat(layout.box("component_2")).contains(new LayoutBox(0, 0, 1280, 40));
    }

    @ParameterizedTest
    @ValueSource(doubles = { 320, 1280, 1920 })
    void testVerticalStackAddsGapsBetweenChildren(double width) {
        IrNodeGraph graph = graph(screen("""
                { "type": "layout", "layoutType": "stack", "params": { "gap": 10 }, "children": [
                  { "type": "component", "componentType": "Button", "props": { "text": "A" } },
                  { "type": "component", "componentType": "Button", "props": { "text": "B", "height": 60 } } ] }
                """));

        LayoutResult layout = engine.layout(graph, "home", width);

        assertThat(layout.box("container_1").orElseThrow().getHeight()).isEqualTo(110);
        assertThat(layout.box("component_3")).contains(new LayoutBox(0, 50, width, 60));
    }

    @Test
    void testHorizontalStackStretchesByDefault() {
        IrNodeGraph graph = graph(screen("""
                { "type": "layout", "layoutType": "stack", "params": { "direction": "horizontal" }, "children": [
                  { "type": "component", "componentType": "Button", "props": { "text": "A" } },
                  { "type": "component", "componentType": "Button", "props": { "text": "B" } } ] }
                """));

        LayoutResult layout = engine.layout(graph, "home");

        assertThat(layout.box("component_2")).contains(new LayoutBox(0, 0, 632, 40));
        assertThat(layout.box("component_3")).contains(new LayoutBox(648, 0, 632, 40));
        assertThat(layout.box("container_1").orElseThrow().getHeight()).isEqualTo(40);
    }

    @Test
    void testHorizontalStackJustifyEnd() {
        IrNodeGraph graph = graph(screen("""
                { "type": "layout", "layoutType": "stack",
                  "params": { "direction": "horizontal", "justify": "end" }, "children": [
                  { "type": "component", "componentType": "Button", "props": { "text": "OK" } },
                  { "type": "component", "componentType": "Button", "props": { "text": "No" } } ] }
                """));

        LayoutResult layout = engine.layout(graph, "home");

        assertThat(layout.box("component_2").orElseThrow().getX()).isEqualTo(1104);
        assertThat(layout.box("component_3").orElseThrow().getX()).isEqualTo(1200);
        assertThat(layout.box("component_3").orElseThrow().right()).isEqualTo(1280);
    }

    @Test
    void testGridWrapsCellsThatDoNotFit() {
        IrNodeGraph graph = graph(screen("""
                { "type": "layout", "layoutType": "grid", "children": [
                  { "type": "cell", "props": { "span": 5 }, "children": [
                    { "type": "component", "componentType": "Button", "props": { "text": "A" } } ] },
                  { "type": "cell", "props": { "span": 5 }, "children": [
                    { "type": "component", "componentType": "Button", "props": { "text": "B" } } ] },
                  { "type": "cell", "props": { "span": 5 }, "children": [
                    { "type": "component", "componentType": "Button", "props": { "text": "C" } } ] } ] }
                """));

        LayoutResult layout = engine.layout(graph, "home");

        // column width (1280 - 11 * 16) / 12 = 92, five columns with four gaps = 524
        assertThat(layout.box("container_2")).contains(new LayoutBox(0, 0, 524, 40));
        assertThat(layout.box("container_4")).contains(new LayoutBox(540, 0, 524, 40));
        assertThat(layout.box("container_6")).contains(new LayoutBox(0, 56, 524, 40));
        assertThat(layout.box("container_1").orElseThrow().getHeight()).isEqualTo(96);
    }

    @Test
    void testSplitWithFixedSidebar() {
        IrNodeGraph graph = graph(screen("""
                { "type": "layout", "layoutType": "split", "params": { "sidebar": 200 }, "children": [
                  { "type": "component", "componentType": "Button", "props": { "text": "Nav" } },
                  { "type": "component", "componentType": "Button", "props": { "text": "Main" } } ] }
                """));

        LayoutResult layout = engine.layout(graph, "home");

        assertThat(layout.box("component_2")).contains(new LayoutBox(0, 0, 200, 40));
        assertThat(layout.box("component_3")).contains(new LayoutBox(216, 0, 1064, 40));
    }

    @Test
    void testSplitWithFixedRightPane() {
        IrNodeGraph graph = graph(screen("""
                { "type": "layout", "layoutType": "split", "params": { "right": 300 }, "children": [
                  { "type": "component", "componentType": "Button", "props": { "text": "Main" } },
                  { "type": "component", "componentType": "Button", "props": { "text": "Aside" } } ] }
                """));

        LayoutResult layout = engine.layout(graph, "home");

        assertThat(layout.box("component_2").orElseThrow().getWidth()).isEqualTo(964);
        assertThat(layout.box("component_3")).contains(new LayoutBox(980, 0, 300, 40));
    }

    @Test
    void testPanelAppliesDefaultPadding() {
        IrNodeGraph graph = graph(screen("""
                { "type": "layout", "layoutType": "panel", "children": [
                  { "type": "component", "componentType": "Button", "props": { "text": "Go" } } ] }
                """));

        LayoutResult layout = engine.layout(graph, "home");

        assertThat(layout.box("container_1")).contains(new LayoutBox(0, 0, 1280, 72));
        assertThat(layout.box("component_2")).contains(new LayoutBox(16, 16, 1248, 40));
    }

    @Test
    void testEmptyContainerKeepsControlHeight() {
        IrNodeGraph graph = graph(screen("""
                { "type": "layout", "layoutType": "stack" }
                """));

        assertThat(engine.layout(graph, "home").box("container_1")).contains(new LayoutBox(0, 0, 1280, 40));
    }

    @Test
    void testEmptyCellHasNoHeight() {
        IrNodeGraph graph = graph(screen("""
                { "type": "layout", "layoutType": "grid", "params": { "columns": 2 }, "children": [
                  { "type": "cell" },
                  { "type": "cell", "children": [
                    { "type": "component", "componentType": "Button", "props": { "text": "Go" } } ] } ] }
                """));

        LayoutResult layout = engine.layout(graph, "home");

        // the empty cell is stretched to its row, but measures 0 on its own
        assertThat(layout.box("container_1").orElseThrow().getHeight()).isEqualTo(40);
        assertThat(layout.box("container_2").orElseThrow().getHeight()).isEqualTo(40);
    }

    @Test
    void testGridOfEmptyCellsCollapses() {
        IrNodeGraph graph = graph(screen("""
                { "type": "layout", "layoutType": "grid", "children": [ { "type": "cell" } ] }
                """));

        assertThat(engine.layout(graph, "home").box("container_1").orElseThrow().getHeight()).isEqualTo(0);
    }

    @Test
    void testInstanceSharesItsExpansionBox() {
        IrNodeGraph graph = new IrBuilder().build(new SyntaxTreeReader().read("""
                {
                  "definitions": [
                    { "type": "defineComponent", "name": "Header",
                      "body": { "type": "component", "componentType": "Heading", "props": { "text": "Title" } } }
                  ],
                  "screens": [
                    { "name": "Home", "layouts": [
                      { "type": "layout", "layoutType": "stack", "children": [
                        { "type": "component", "componentType": "Button", "props": { "text": "A" } },
                        { "type": "component", "componentType": "Header" } ] } ] }
                  ]
                }
                """)).getGraph();

        LayoutResult layout = engine.layout(graph, "home");

        assertThat(layout.box("instance_3")).isEqualTo(layout.box("component_4"));
        assertThat(layout.box("instance_3").orElseThrow().getY()).isEqualTo(56);
        assertThat(layout.asMap().keySet()).containsExactly("container_1", "component_2", "instance_3", "component_4");
    }

    @Test
    void testTextWrapsAtViewportWidthOverride() {
        IrNodeGraph graph = graph(screen("""
                { "type": "layout", "layoutType": "stack", "children": [
                  { "type": "component", "componentType": "Text", "props": { "text": "hello world again today" } } ] }
                """));

        LayoutResult layout = engine.layout(graph, "home", 100);

        // 14px text fits 11 characters in 100px: two lines of 21px
        assertThat(layout.box("component_2")).contains(new LayoutBox(0, 0, 100, 42));
    }

    @Test
    void testFixedDensityOverridesProjectDensity() {
        IrNodeGraph graph = graph(screen("""
                { "type": "layout", "layoutType": "stack", "children": [
                  { "type": "component", "componentType": "Button", "props": { "text": "Go" } } ] }
                """));

        LayoutResult layout = new LayoutEngine(DensityMetrics.COMPACT).layout(graph, "home");

        assertThat(layout.box("component_2").orElseThrow().getHeight()).isEqualTo(32);
    }

    @Test
    void testScreenCanBeSelectedByName() {
        IrNodeGraph graph = graph(screen("""
                { "type": "layout", "layoutType": "stack" }
                """));

        assertThat(engine.layout(graph, "Home").contains("container_1")).isTrue();
    }

    @Test
    void testUnknownScreenYieldsEmptyLayout() {
        IrNodeGraph graph = graph(screen("""
                { "type": "layout", "layoutType": "stack" }
                """));

        assertThat(engine.layout(graph, "missing").isEmpty()).isTrue();
    }

    @Test
    void testLayoutIsDeterministic() {
        IrNodeGraph graph = graph(screen("""
                { "type": "layout", "layoutType": "grid", "params": { "columns": 3 }, "children": [
                  { "type": "cell", "children": [
                    { "type": "component", "componentType": "Paragraph", "props": { "text": "Some longer paragraph text" } } ] },
                  { "type": "cell", "props": { "span": 2 }, "children": [
                    { "type": "component", "componentType": "Image" } ] } ] }
                """));

        assertThat(engine.layout(graph, "home").asMap()).isEqualTo(engine.layout(graph, "home").asMap());
    }

    private static String screen(String root) {
        return """
                { "name": "Demo", "screens": [ { "name": "Home", "layouts": [ %s ] } ] }
                """.formatted(root);
    }

    private static IrNodeGraph graph(String json) {
        IrBuildResult result = new IrBuilder().build(new SyntaxTreeReader().read(json));
        assertThat(result.isSuccess()).as("build errors: %s", result.getErrors()).isTrue();
        return result.getGraph();
    }
}
