package com.wireframe.compiler.syntax;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

/**
 * Reads the JSON form of a parsed wireframe into a {@link SyntaxTree}.
 *
 * Node objects are discriminated by their {@code type} field: {@code layout}, {@code component}
 * or {@code cell}. Integral numbers are read as {@link Integer}, other numbers as {@link Double}.
 */
public class SyntaxTreeReader {
    private static final Logger log = LoggerFactory.getLogger(SyntaxTreeReader.class);

    public SyntaxTree read(Path path) throws IOException {
        String json = Files.readString(path, StandardCharsets.UTF_8);
        log.info("Reading syntax tree: {}", path);
        return read(json);
    }

    public SyntaxTree read(String json) {
        JsonElement rootElement;
        try {
            rootElement = JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw new SyntaxTreeFormatException("Syntax tree is not valid JSON: " + e.getMessage(), e);
        }
        if (!rootElement.isJsonObject()) {
            throw new SyntaxTreeFormatException("Syntax tree root must be a JSON object");
        }
        JsonObject root = rootElement.getAsJsonObject();

        List<DefinitionSyntax> definitions = new ArrayList<>();
        for (JsonElement element : array(root, "definitions")) {
            definitions.add(readDefinition(object(element, "definition")));
        }

        List<ScreenSyntax> screens = new ArrayList<>();
        for (JsonElement element : array(root, "screens")) {
            screens.add(readScreen(object(element, "screen")));
        }

        SyntaxTree tree = SyntaxTree.builder()
                .name(string(root, "name", "Untitled"))
                .style(stringMap(root, "style"))
                .colors(stringMap(root, "colors"))
                .mocks(stringMap(root, "mocks"))
                .definitions(definitions)
                .screens(screens)
                .span(readSpan(root))
                .build();

        log.debug("Read syntax tree '{}' with {} screen(s) and {} definition(s)",
                tree.getName(), screens.size(), definitions.size());
        return tree;
    }

    private DefinitionSyntax readDefinition(JsonObject json) {
        String type = string(json, "type", "defineComponent");
        DefinitionKind kind = switch (type) {
            case "defineComponent", "definedComponent" -> DefinitionKind.COMPONENT;
            case "defineLayout", "definedLayout" -> DefinitionKind.LAYOUT;
            default -> throw new SyntaxTreeFormatException("Unknown definition type: " + type);
        };
        String name = requiredString(json, "name", "definition");
        if (!json.has("body")) {
            throw new SyntaxTreeFormatException("Definition '" + name + "' has no body");
        }
        return DefinitionSyntax.builder()
                .name(name)
                .kind(kind)
                .body(readNode(object(json.get("body"), "definition body")))
                .span(readSpan(json))
                .nodeId(string(json, "nodeId", null))
                .build();
    }

    private ScreenSyntax readScreen(JsonObject json) {
        List<LayoutSyntax> layouts = new ArrayList<>();
        // Older parser output carries a single "layout" instead of a "layouts" list
        if (json.has("layout") && json.get("layout").isJsonObject()) {
            layouts.add(readLayout(json.getAsJsonObject("layout")));
        }
        for (JsonElement element : array(json, "layouts")) {
            SyntaxNode node = readNode(object(element, "screen layout"));
            if (!(node instanceof LayoutSyntax layout)) {
                throw new SyntaxTreeFormatException("Screen root must be a layout, found: " + node.getClass().getSimpleName());
            }
            layouts.add(layout);
        }

        return ScreenSyntax.builder()
                .name(requiredString(json, "name", "screen"))
                .params(valueMap(json, "params"))
                .layouts(layouts)
                .span(readSpan(json))
                .nodeId(string(json, "nodeId", null))
                .build();
    }

    private SyntaxNode readNode(JsonObject json) {
        String type = requiredString(json, "type", "node");
        return switch (type) {
            case "layout" -> readLayout(json);
            case "component" -> ComponentSyntax.builder()
                    .componentType(requiredString(json, "componentType", "component"))
                    .props(valueMap(json, "props"))
                    .span(readSpan(json))
                    .nodeId(string(json, "nodeId", null))
                    .build();
            case "cell" -> CellSyntax.builder()
                    .props(valueMap(json, "props"))
                    .children(readChildren(json))
                    .span(readSpan(json))
                    .nodeId(string(json, "nodeId", null))
                    .build();
            default -> throw new SyntaxTreeFormatException("Unknown syntax node type: " + type);
        };
    }

    private LayoutSyntax readLayout(JsonObject json) {
        return LayoutSyntax.builder()
                .layoutType(requiredString(json, "layoutType", "layout"))
                .params(valueMap(json, "params"))
                .children(readChildren(json))
                .span(readSpan(json))
                .nodeId(string(json, "nodeId", null))
                .build();
    }

    private List<SyntaxNode> readChildren(JsonObject json) {
        List<SyntaxNode> children = new ArrayList<>();
        for (JsonElement element : array(json, "children")) {
            children.add(readNode(object(element, "child")));
        }
        return children;
    }

    private SourceSpan readSpan(JsonObject json) {
        JsonElement element = json.has("span") ? json.get("span") : json.get("location");
        if (element == null || !element.isJsonObject()) {
            return null;
        }
        JsonObject span = element.getAsJsonObject();
        return new SourceSpan(integer(span, "line"), integer(span, "column"), integer(span, "offset"));
    }

    private Map<String, Object> valueMap(JsonObject json, String field) {
        Map<String, Object> values = new LinkedHashMap<>();
        JsonElement element = json.get(field);
        if (element == null || element.isJsonNull()) {
            return values;
        }
        if (!element.isJsonObject()) {
            throw new SyntaxTreeFormatException("Field '" + field + "' must be an object");
        }
        for (Map.Entry<String, JsonElement> entry : element.getAsJsonObject().entrySet()) {
            JsonElement value = entry.getValue();
            if (value.isJsonPrimitive()) {
                values.put(entry.getKey(), primitive(value.getAsJsonPrimitive()));
            } else if (!value.isJsonNull()) {
                values.put(entry.getKey(), value.toString());
            }
        }
        return values;
    }

    private Map<String, String> stringMap(JsonObject json, String field) {
        Map<String, String> values = new LinkedHashMap<>();
        valueMap(json, field).forEach((key, value) -> values.put(key, stringify(value)));
        return values;
    }

    static Object primitive(JsonPrimitive primitive) {
        if (primitive.isBoolean()) {
            return primitive.getAsBoolean();
        }
        if (primitive.isNumber()) {
            double number = primitive.getAsDouble();
            if (number == Math.rint(number) && !Double.isInfinite(number)
                    && number <= Integer.MAX_VALUE && number >= Integer.MIN_VALUE) {
                return (int) number;
            }
            return number;
        }
        return primitive.getAsString();
    }

    private static String stringify(Object value) {
        return String.valueOf(value);
    }

    private static JsonArray array(JsonObject json, String field) {
        JsonElement element = json.get(field);
        if (element == null || element.isJsonNull()) {
            return new JsonArray();
        }
        if (!element.isJsonArray()) {
            throw new SyntaxTreeFormatException("Field '" + field + "' must be an array");
        }
        return element.getAsJsonArray();
    }

    private static JsonObject object(JsonElement element, String what) {
        if (element == null || !element.isJsonObject()) {
            throw new SyntaxTreeFormatException("Expected an object for " + what);
        }
        return element.getAsJsonObject();
    }

    private static String string(JsonObject json, String field, String fallback) {
        JsonElement element = json.get(field);
        if (element == null || element.isJsonNull()) {
            return fallback;
        }
        if (!element.isJsonPrimitive()) {
            throw new SyntaxTreeFormatException("Field '" + field + "' must be a string");
        }
        return element.getAsString();
    }

    private static String requiredString(JsonObject json, String field, String what) {
        String value = string(json, field, null);
        if (value == null || value.isBlank()) {
            throw new SyntaxTreeFormatException("Missing '" + field + "' on " + what);
        }
        return value;
    }

    private static int integer(JsonObject json, String field) {
        JsonElement element = json.get(field);
        if (element == null || element.isJsonNull()) {
            return 0;
        }
        try {
            if (!element.isJsonPrimitive()) {
                throw new NumberFormatException(element.toString());
            }
            return element.getAsInt();
        } catch (NumberFormatException e) {
            throw new SyntaxTreeFormatException("Field '" + field + "' must be an integer, got " + element, e);
        }
    }
}
