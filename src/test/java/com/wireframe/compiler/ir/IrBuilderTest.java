package com.wireframe.compiler.ir;

import static org.assertj.core.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.wireframe.compiler.export.IrJsonWriter;
import com.wireframe.compiler.ir.error.CyclicComponentDefinition;
import com.wireframe.compiler.ir.error.InvalidPropertyValue;
import com.wireframe.compiler.ir.error.StructuralViolation;
import com.wireframe.compiler.ir.error.UndefinedComponent;
import com.wireframe.compiler.ir.model.ComponentNode;
import com.wireframe.compiler.ir.model.ContainerNode;
import com.wireframe.compiler.ir.model.ContainerType;
import com.wireframe.compiler.ir.model.InstanceNode;
import com.wireframe.compiler.ir.model.IrNode;
import com.wireframe.compiler.ir.model.IrNodeGraph;
import com.wireframe.compiler.ir.model.IrScreen;
import com.wireframe.compiler.syntax.DefinitionKind;
import com.wireframe.compiler.syntax.SyntaxTreeReader;

/**
 * Unit tests for the IR build pipeline.
 */
class IrBuilderTest {

    private final IrBuilder builder = new IrBuilder();

    @Test
    void testBuildSimpleScreen() {
        IrBuildResult result = build("""
                {
                  "name": "Demo App",
                  "screens": [
                    { "name": "Home", "layouts": [
                      { "type": "layout", "layoutType": "stack", "params": { "gap": "lg" }, "children": [
                        { "type": "component", "componentType": "Heading", "props": { "text": "Welcome" } }
                      ] }
                    ] }
                  ]
                }
                """);

        assertThat(result.isSuccess()).isTrue();
        IrNodeGraph graph = result.getGraph();
        assertThat(graph.getProject().getId()).isEqualTo("demo_app");
        assertThat(graph.screens()).hasSize(1);

        IrScreen screen = graph.screens().get(0);
        assertThat(screen.getId()).isEqualTo("home");
        assertThat(screen.getViewport().getWidth()).isEqualTo(1280);
        assertThat(screen.getRoot().getRef()).isEqualTo("container_1");

        ContainerNode root = (ContainerNode) graph.node("container_1").orElseThrow();
        assertThat(root.getContainerType()).isEqualTo(ContainerType.STACK);
        assertThat(root.getParams().getString("direction")).isEqualTo("vertical");
        assertThat(root.getParams().has("gap")).isFalse();
        assertThat(root.getStyle().getGap()).isEqualTo("lg");
        assertThat(root.getStyle().getPadding()).isEqualTo("none");
        assertThat(root.getChildren()).extracting(ref -> ref.getRef()).containsExactly("component_2");

        ComponentNode heading = (ComponentNode) graph.node("component_2").orElseThrow();
        assertThat(heading.getComponentType()).isEqualTo("Heading");
        assertThat(heading.getProps().getString("text")).isEqualTo("Welcome");
    }

    @Test
    void testBuildIsDeterministic() {
        String json = """
                {
                  "name": "Demo",
                  "definitions": [
                    { "type": "defineComponent", "name": "Header",
                      "body": { "type": "component", "componentType": "Heading", "props": { "text": "prop_title" } } }
                  ],
                  "screens": [
                    { "name": "Home", "layouts": [
                      { "type": "layout", "layoutType": "grid", "children": [
                        { "type": "cell", "props": { "span": 6 }, "children": [
                          { "type": "component", "componentType": "Header", "props": { "title": "Left" } } ] },
                        { "type": "cell", "props": { "span": 6 }, "children": [
                          { "type": "component", "componentType": "Header", "props": { "title": "Right" } } ] }
                      ] }
                    ] }
                  ]
                }
                """;

        IrJsonWriter writer = new IrJsonWriter();
        String first = writer.write(build(json).getGraph());
        String second = writer.write(build(json).getGraph());

        assertThat(first).isEqualTo(second);
    }

    @Test
    void testDefinitionsUsableBeforeDeclarationOrder() {
        IrBuildResult result = build("""
                {
                  "definitions": [
                    { "type": "defineComponent", "name": "Page",
                      "body": { "type": "layout", "layoutType": "stack", "children": [
                        { "type": "component", "componentType": "Toolbar" } ] } },
                    { "type": "defineComponent", "name": "Toolbar",
                      "body": { "type": "component", "componentType": "Button", "props": { "text": "Save" } } }
                  ],
                  "screens": [
                    { "name": "Main", "layouts": [
                      { "type": "layout", "layoutType": "stack", "children": [
                        { "type": "component", "componentType": "Page" } ] }
                    ] }
                  ]
                }
                """);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getGraph().nodes())
                .filteredOn(node -> node instanceof InstanceNode)
                .extracting(node -> ((InstanceNode) node).getDefinitionName())
                .containsExactly("Page", "Toolbar");
    }

    @Test
    void testDefinitionOrderDoesNotChangeTheGraph() {
        String header = """
                { "type": "defineComponent", "name": "Header",
                  "body": { "type": "component", "componentType": "Heading", "props": { "text": "Hi" } } }
                """;
        String footer = """
                { "type": "defineComponent", "name": "Footer",
                  "body": { "type": "component", "componentType": "Header" } }
                """;
        String tree = """
                { "definitions": [ %s, %s ],
                  "screens": [ { "name": "Home", "layouts": [
                    { "type": "layout", "layoutType": "stack", "children": [
                      { "type": "component", "componentType": "Footer" } ] } ] } ] }
                """;

        IrJsonWriter writer = new IrJsonWriter();
        String usedBeforeDefined = writer.write(build(tree.formatted(footer, header)).getGraph());
        String definedFirst = writer.write(build(tree.formatted(header, footer)).getGraph());

        assertThat(usedBeforeDefined).isEqualTo(definedFirst);
    }

    @Test
    void testIdsAreAllocatedInPreOrder() {
        IrBuildResult result = build("""
                {
                  "definitions": [
                    { "type": "defineComponent", "name": "Header",
                      "body": { "type": "component", "componentType": "Heading", "props": { "text": "Hi" } } }
                  ],
                  "screens": [
                    { "name": "Home", "layouts": [
                      { "type": "layout", "layoutType": "stack", "children": [
                        { "type": "component", "componentType": "Header" },
                        { "type": "component", "componentType": "Button", "props": { "text": "Go" } }
                      ] }
                    ] }
                  ]
                }
                """);

        assertThat(result.getGraph().nodeTable().keySet())
                .containsExactly("container_1", "instance_2", "component_3", "component_4");
        InstanceNode header = (InstanceNode) result.getGraph().node("instance_2").orElseThrow();
        assertThat(header.getExpandedRoot().getRef()).isEqualTo("component_3");
    }

    @Test
    void testEachInvocationGetsItsOwnExpansion() {
        IrBuildResult result = build("""
                {
                  "definitions": [
                    { "type": "defineComponent", "name": "Header",
                      "body": { "type": "component", "componentType": "Heading", "props": { "text": "prop_title" } } }
                  ],
                  "screens": [
                    { "name": "Home", "layouts": [
                      { "type": "layout", "layoutType": "stack", "children": [
                        { "type": "component", "componentType": "Header", "props": { "title": "One" } },
                        { "type": "component", "componentType": "Header", "props": { "title": "Two" } }
                      ] }
                    ] }
                  ]
                }
                """);

        List<String> texts = result.getGraph().nodes().stream()
                .filter(node -> node instanceof ComponentNode)
                .map(node -> ((ComponentNode) node).getProps().getString("text"))
                .toList();
        assertThat(texts).containsExactly("One", "Two");
    }

    @Test
    void testMutualRecursionIsRejected() {
        IrBuildResult result = build("""
                {
                  "definitions": [
                    { "type": "defineComponent", "name": "A",
                      "body": { "type": "component", "componentType": "B" } },
                    { "type": "defineComponent", "name": "B",
                      "body": { "type": "component", "componentType": "A" } }
                  ],
                  "screens": [
                    { "name": "Home", "layouts": [
                      { "type": "layout", "layoutType": "stack", "children": [
                        { "type": "component", "componentType": "A" } ] }
                    ] }
                  ]
                }
                """);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getGraph()).isNull();
        assertThat(result.getErrors()).hasSize(1);
        assertThat(result.errorsOfType(CyclicComponentDefinition.class).get(0).getChain())
                .containsExactly("A", "B", "A");
    }

    @Test
    void testSelfRecursionIsRejectedEvenWhenUnused() {
        IrBuildResult result = build("""
                {
                  "definitions": [
                    { "type": "defineComponent", "name": "Loop",
                      "body": { "type": "layout", "layoutType": "stack", "children": [
                        { "type": "component", "componentType": "Loop" } ] } }
                  ],
                  "screens": [
                    { "name": "Home", "layouts": [ { "type": "layout", "layoutType": "stack" } ] }
                  ]
                }
                """);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.errorsOfType(CyclicComponentDefinition.class)).singleElement()
                .satisfies(cycle -> assertThat(cycle.getChain()).containsExactly("Loop", "Loop"));
    }

    @Test
    void testUndefinedComponentCarriesLocation() {
        IrBuildResult result = build("""
                {
                  "screens": [
                    { "name": "Home", "layouts": [
                      { "type": "layout", "layoutType": "stack", "children": [
                        { "type": "component", "componentType": "Sparkline",
                          "span": { "line": 3, "column": 5, "offset": 42 } } ] }
                    ] }
                  ]
                }
                """);

        assertThat(result.isSuccess()).isFalse();
        UndefinedComponent error = result.errorsOfType(UndefinedComponent.class).get(0);
        assertThat(error.getName()).isEqualTo("Sparkline");
        assertThat(error.getLocation().getLine()).isEqualTo(3);
        assertThat(error.getLocation().getColumn()).isEqualTo(5);
    }

    @Test
    void testDuplicateDefinitionIsRejected() {
        IrBuildResult result = build("""
                {
                  "definitions": [
                    { "type": "defineComponent", "name": "Card2",
                      "body": { "type": "component", "componentType": "Card" } },
                    { "type": "defineLayout", "name": "Card2",
                      "body": { "type": "layout", "layoutType": "stack" } }
                  ],
                  "screens": [
                    { "name": "Home", "layouts": [ { "type": "layout", "layoutType": "stack" } ] }
                  ]
                }
                """);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.errorsOfType(StructuralViolation.class))
                .extracting(StructuralViolation::getRule)
                .containsExactly(StructuralViolation.DUPLICATE_DEFINITION);
    }

    @Test
    void testSplitArityIsValidated() {
        IrBuildResult result = build("""
                {
                  "screens": [
                    { "name": "One", "layouts": [
                      { "type": "layout", "layoutType": "split", "children": [
                        { "type": "component", "componentType": "Divider" } ] } ] },
                    { "name": "Three", "layouts": [
                      { "type": "layout", "layoutType": "split", "children": [
                        { "type": "component", "componentType": "Divider" },
                        { "type": "component", "componentType": "Divider" },
                        { "type": "component", "componentType": "Divider" } ] } ] }
                  ]
                }
                """);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.errorsOfType(StructuralViolation.class))
                .extracting(StructuralViolation::getRule)
                .containsExactly(StructuralViolation.SPLIT_ARITY, StructuralViolation.SPLIT_ARITY);
    }

    @Test
    void testErrorsAccumulateAcrossScreens() {
        IrBuildResult result = build("""
                {
                  "screens": [
                    { "name": "First", "layouts": [
                      { "type": "layout", "layoutType": "stack", "children": [
                        { "type": "component", "componentType": "Button", "props": { "text": "Go", "variant": "loud" } } ] } ] },
                    { "name": "Second", "layouts": [
                      { "type": "layout", "layoutType": "stack", "children": [
                        { "type": "component", "componentType": "Heading" } ] } ] }
                  ]
                }
                """);

        assertThat(result.isSuccess()).isFalse();
        List<InvalidPropertyValue> errors = result.errorsOfType(InvalidPropertyValue.class);
        assertThat(errors).extracting(InvalidPropertyValue::getProperty).containsExactly("variant", "text");
        assertThat(errors.get(0).getActual()).isEqualTo("loud");
        assertThat(errors.get(1).isMissing()).isTrue();
    }

    @Test
    void testDefaultsAreApplied() {
        IrBuildResult result = build("""
                {
                  "screens": [
                    { "name": "Home", "layouts": [
                      { "type": "layout", "layoutType": "grid", "children": [
                        { "type": "cell", "children": [
                          { "type": "component", "componentType": "Button", "props": { "text": "Go" } } ] } ] }
                    ] }
                  ]
                }
                """);

        IrNodeGraph graph = result.getGraph();
        ContainerNode grid = (ContainerNode) graph.node("container_1").orElseThrow();
        assertThat(grid.getParams().getInt("columns")).isEqualTo(12);

        ContainerNode cell = (ContainerNode) graph.node("container_2").orElseThrow();
        assertThat(cell.isCell()).isTrue();
        assertThat(cell.getContainerType()).isEqualTo(ContainerType.STACK);

        ComponentNode button = (ComponentNode) graph.node("component_3").orElseThrow();
        assertThat(button.getProps().getBoolean("disabled")).isFalse();
    }

    @Test
    void testCellSpanOutsideGridColumnsIsRejected() {
        IrBuildResult result = build("""
                {
                  "screens": [
                    { "name": "Home", "layouts": [
                      { "type": "layout", "layoutType": "grid", "params": { "columns": 4 }, "children": [
                        { "type": "cell", "props": { "span": 5 } } ] }
                    ] }
                  ]
                }
                """);

        assertThat(result.isSuccess()).isFalse();
        InvalidPropertyValue error = result.errorsOfType(InvalidPropertyValue.class).get(0);
        assertThat(error.getProperty()).isEqualTo("span");
        assertThat(error.getExpectedDomain()).isEqualTo("integer in 1..4");
    }

    @ParameterizedTest
    @ValueSource(strings = { "1e400", "\"Infinity\"", "\"-Infinity\"" })
    void testNonFiniteDimensionIsRejected(String width) {
        IrBuildResult result = build("""
                {
                  "screens": [
                    { "name": "Home", "layouts": [
                      { "type": "layout", "layoutType": "stack", "children": [
                        { "type": "component", "componentType": "Button", "props": { "text": "Go", "width": %s } } ] }
                    ] }
                  ]
                }
                """.formatted(width));

        assertThat(result.isSuccess()).isFalse();
        InvalidPropertyValue error = result.errorsOfType(InvalidPropertyValue.class).get(0);
        assertThat(error.getProperty()).isEqualTo("width");
        assertThat(error.getExpectedDomain()).isEqualTo("number");
    }

    @Test
    void testArgumentsAreBoundAndUnusedOnesReported() {
        IrBuildResult result = build("""
                {
                  "definitions": [
                    { "type": "defineComponent", "name": "Header",
                      "body": { "type": "component", "componentType": "Heading",
                                "props": { "text": "prop_title", "level": "prop_level" } } }
                  ],
                  "screens": [
                    { "name": "Home", "layouts": [
                      { "type": "layout", "layoutType": "stack", "children": [
                        { "type": "component", "componentType": "Header", "props": { "title": "Hello", "color": "red" } } ] }
                    ] }
                  ]
                }
                """);

        assertThat(result.isSuccess()).isTrue();
        ComponentNode heading = (ComponentNode) result.getGraph().node("component_3").orElseThrow();
        assertThat(heading.getProps().getString("text")).isEqualTo("Hello");
        assertThat(heading.getProps().has("level")).isFalse();

        assertThat(result.getWarnings())
                .anySatisfy(warning -> assertThat(warning).contains("Optional property 'level'"))
                .anySatisfy(warning -> assertThat(warning).contains("Argument 'color' is not used"));
    }

    @Test
    void testMissingRequiredArgumentIsAnError() {
        IrBuildResult result = build("""
                {
                  "definitions": [
                    { "type": "defineComponent", "name": "Header",
                      "body": { "type": "component", "componentType": "Heading", "props": { "text": "prop_title" } } }
                  ],
                  "screens": [
                    { "name": "Home", "layouts": [
                      { "type": "layout", "layoutType": "stack", "children": [
                        { "type": "component", "componentType": "Header" } ] }
                    ] }
                  ]
                }
                """);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.errorsOfType(InvalidPropertyValue.class))
                .singleElement()
                .satisfies(error -> {
                    assertThat(error.getProperty()).isEqualTo("text");
                    assertThat(error.isMissing()).isTrue();
                });
    }

    @Test
    void testLayoutDefinitionWrapsItsChild() {
        IrBuildResult result = build("""
                {
                  "definitions": [
                    { "type": "defineLayout", "name": "Shell",
                      "body": { "type": "layout", "layoutType": "stack", "children": [
                        { "type": "component", "componentType": "Topbar", "props": { "title": "prop_title" } },
                        { "type": "component", "componentType": "Children" } ] } }
                  ],
                  "screens": [
                    { "name": "Home", "layouts": [
                      { "type": "layout", "layoutType": "Shell", "params": { "title": "Admin" }, "children": [
                        { "type": "component", "componentType": "Button", "props": { "text": "Go" } } ] }
                    ] }
                  ]
                }
                """);

        assertThat(result.isSuccess()).isTrue();
        IrNodeGraph graph = result.getGraph();
        InstanceNode shell = (InstanceNode) graph.node(graph.screens().get(0).getRoot()).orElseThrow();
        assertThat(shell.getDefinitionKind()).isEqualTo(DefinitionKind.LAYOUT);
        assertThat(shell.getProps().getString("title")).isEqualTo("Admin");

        ContainerNode body = (ContainerNode) graph.node(shell.getExpandedRoot()).orElseThrow();
        List<IrNode> children = body.getChildren().stream().map(ref -> graph.node(ref).orElseThrow()).toList();
        assertThat(children).extracting(node -> ((ComponentNode) node).getComponentType())
                .containsExactly("Topbar", "Button");
        assertThat(((ComponentNode) children.get(0)).getProps().getString("title")).isEqualTo("Admin");
    }

    @Test
    void testLayoutDefinitionRequiresExactlyOneChild() {
        IrBuildResult result = build("""
                {
                  "definitions": [
                    { "type": "defineLayout", "name": "Shell",
                      "body": { "type": "layout", "layoutType": "stack", "children": [
                        { "type": "component", "componentType": "Children" } ] } }
                  ],
                  "screens": [
                    { "name": "Home", "layouts": [
                      { "type": "layout", "layoutType": "Shell", "children": [
                        { "type": "component", "componentType": "Divider" },
                        { "type": "component", "componentType": "Divider" } ] }
                    ] }
                  ]
                }
                """);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.errorsOfType(StructuralViolation.class))
                .extracting(StructuralViolation::getRule)
                .contains(StructuralViolation.LAYOUT_CHILDREN_ARITY);
    }

    @Test
    void testChildrenSlotOutsideLayoutDefinitionIsRejected() {
        IrBuildResult result = build("""
                {
                  "screens": [
                    { "name": "Home", "layouts": [
                      { "type": "layout", "layoutType": "stack", "children": [
                        { "type": "component", "componentType": "Children" } ] }
                    ] }
                  ]
                }
                """);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.errorsOfType(StructuralViolation.class))
                .extracting(StructuralViolation::getRule)
                .containsExactly(StructuralViolation.CHILDREN_SLOT_OUTSIDE_LAYOUT);
    }

    @Test
    void testScreenRootCountAndDuplicateNames() {
        IrBuildResult result = build("""
                {
                  "screens": [
                    { "name": "Home", "layouts": [ { "type": "layout", "layoutType": "stack" } ] },
                    { "name": "Home", "layouts": [ { "type": "layout", "layoutType": "stack" } ] },
                    { "name": "Empty", "layouts": [] }
                  ]
                }
                """);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.errorsOfType(StructuralViolation.class))
                .extracting(StructuralViolation::getRule)
                .containsExactlyInAnyOrder(StructuralViolation.DUPLICATE_SCREEN_NAME, StructuralViolation.SCREEN_ROOT_COUNT);
    }

    @Test
    void testInvalidProjectStyleTokenIsAnError() {
        IrBuildResult result = build("""
                {
                  "style": { "density": "roomy" },
                  "screens": [
                    { "name": "Home", "layouts": [ { "type": "layout", "layoutType": "stack" } ] }
                  ]
                }
                """);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.errorsOfType(InvalidPropertyValue.class))
                .extracting(InvalidPropertyValue::getProperty)
                .containsExactly("style.density");
    }

    @Test
    void testDeviceStyleSelectsViewport() {
        IrBuildResult result = build("""
                {
                  "style": { "device": "mobile", "background": "#fafafa" },
                  "screens": [
                    { "name": "Home", "layouts": [ { "type": "layout", "layoutType": "stack" } ] }
                  ]
                }
                """);

        IrScreen screen = result.getGraph().screens().get(0);
        assertThat(screen.getViewport().getWidth()).isEqualTo(375);
        assertThat(screen.getViewport().getHeight()).isEqualTo(812);
        assertThat(screen.getBackground()).isEqualTo("#fafafa");
    }

    private IrBuildResult build(String json) {
        return builder.build(new SyntaxTreeReader().read(json));
    }
}
