package com.wireframe.compiler.ir.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Closed catalog of built-in leaf components and structural containers.
 *
 * Passed explicitly to the builder; {@link #standard()} returns the stock catalog.
 */
public final class ComponentCatalog {

    private static final List<String> SPACING = PropertySchema.SPACING_TOKENS;
    private static final List<String> TEXT_SIZE = List.of("xs", "sm", "md", "lg", "xl");
    private static final List<String> ICON_SIZE = List.of("sm", "md", "lg");
    private static final List<String> TEXT_ALIGN = List.of("left", "center", "right");
    private static final List<String> HEADING_LEVEL = List.of("h1", "h2", "h3", "h4", "h5", "h6");
    private static final List<String> IMAGE_PLACEHOLDER = List.of("landscape", "portrait", "square", "icon", "avatar");
    private static final List<String> JUSTIFY = List.of("stretch", "start", "center", "end", "spaceBetween", "spaceAround");
    private static final List<String> ALIGN = List.of("start", "center", "end", "left", "right");
    private static final List<String> VARIANT = List.of(
            "primary", "secondary", "success", "warning", "danger", "info",
            "red", "pink", "purple", "deep_purple", "indigo", "blue", "light_blue",
            "cyan", "teal", "green", "light_green", "lime", "yellow", "amber",
            "orange", "deep_orange", "brown", "grey", "blue_grey");
    private static final List<String> VARIANT_WITH_DEFAULT = concat("default", VARIANT);

    private static final ComponentCatalog STANDARD = new ComponentCatalog(standardComponents(), standardContainers());

    private final Map<String, ComponentSchema> components;
    private final Map<String, ComponentSchema> containers;

    public ComponentCatalog(Map<String, ComponentSchema> components, Map<String, ComponentSchema> containers) {
        this.components = Collections.unmodifiableMap(new LinkedHashMap<>(components));
        this.containers = Collections.unmodifiableMap(new LinkedHashMap<>(containers));
    }

    public static ComponentCatalog standard() {
        return STANDARD;
    }

    public boolean isComponent(String name) {
        return components.containsKey(name);
    }

    public boolean isContainer(String name) {
        return containers.containsKey(name);
    }

    public Optional<ComponentSchema> component(String name) {
        return Optional.ofNullable(components.get(name));
    }

    public Optional<ComponentSchema> container(String name) {
        return Optional.ofNullable(containers.get(name));
    }

    private static Map<String, ComponentSchema> standardComponents() {
        Map<String, ComponentSchema> catalog = new LinkedHashMap<>();

        add(catalog, leaf("Heading")
                .string("text", true)
                .enumeration("level", HEADING_LEVEL)
                .enumeration("spacing", SPACING)
                .enumeration("variant", VARIANT_WITH_DEFAULT));
        add(catalog, leaf("Text")
                .string("text", true)
                .enumeration("size", TEXT_SIZE)
                .bool("bold")
                .bool("italic"));
        add(catalog, leaf("Label")
                .string("text", true));
        add(catalog, leaf("Paragraph")
                .string("text", true)
                .enumeration("align", TEXT_ALIGN)
                .enumeration("size", TEXT_SIZE)
                .bool("bold")
                .bool("italic"));
        add(catalog, leaf("Button")
                .string("text", true)
                .enumeration("variant", VARIANT_WITH_DEFAULT)
                .enumeration("size", TEXT_SIZE)
                .string("icon", false)
                .enumeration("iconAlign", List.of("left", "right"))
                .enumeration("align", TEXT_ALIGN)
                .bool("labelSpace")
                .enumeration("padding", SPACING)
                .bool("block")
                .bool("disabled", false));
        add(catalog, leaf("Link")
                .string("text", true)
                .enumeration("variant", VARIANT)
                .enumeration("size", TEXT_SIZE));
        add(catalog, leaf("Input")
                .string("label", false)
                .string("placeholder", false)
                .enumeration("size", TEXT_SIZE)
                .string("iconLeft", false)
                .string("iconRight", false)
                .bool("disabled", false));
        add(catalog, leaf("Textarea")
                .string("label", false)
                .string("placeholder", false)
                .number("rows", false));
        add(catalog, leaf("Select")
                .string("label", false)
                .string("placeholder", false)
                .string("items", false)
                .enumeration("size", TEXT_SIZE)
                .string("iconLeft", false)
                .string("iconRight", false)
                .bool("disabled", false));
        add(catalog, leaf("Checkbox")
                .string("label", true)
                .bool("checked")
                .bool("disabled", false));
        add(catalog, leaf("Radio")
                .string("label", true)
                .bool("checked")
                .bool("disabled", false));
        add(catalog, leaf("Toggle")
                .string("label", true)
                .bool("enabled")
                .bool("disabled", false));
        add(catalog, leaf("Topbar")
                .string("title", true)
                .string("subtitle", false)
                .string("icon", false)
                .bool("avatar")
                .string("actions", false)
                .string("user", false)
                .enumeration("variant", VARIANT_WITH_DEFAULT)
                .bool("border")
                .color("background")
                .enumeration("radius", List.of("none", "sm", "md", "lg", "xl"))
                .enumeration("size", ICON_SIZE, "md"));
        add(catalog, leaf("SidebarMenu")
                .string("items", true)
                .string("icons", false)
                .number("active", false)
                .enumeration("variant", VARIANT_WITH_DEFAULT));
        add(catalog, leaf("Sidebar")
                .string("title", false)
                .string("items", true)
                .string("active", false)
                .number("itemsMock", false));
        add(catalog, leaf("Breadcrumbs")
                .string("items", true)
                .string("separator", false));
        add(catalog, leaf("Tabs")
                .string("items", true)
                .number("active", false)
                .enumeration("variant", VARIANT_WITH_DEFAULT)
                .enumeration("radius", List.of("none", "sm", "md", "lg", "full"), "md")
                .enumeration("size", ICON_SIZE, "md")
                .string("icons", false)
                .bool("flat", false));
        add(catalog, leaf("Table")
                .string("title", false)
                .string("columns", true)
                .number("rows", false)
                .number("rowsMock", false)
                .string("mock", false)
                .bool("random")
                .bool("pagination")
                .number("pages", false)
                .enumeration("paginationAlign", TEXT_ALIGN)
                .string("actions", false)
                .string("caption", false)
                .enumeration("captionAlign", TEXT_ALIGN)
                .bool("border")
                .bool("innerBorder")
                .bool("background"));
        add(catalog, leaf("List")
                .string("title", false)
                .string("items", false)
                .number("itemsMock", false)
                .string("mock", false)
                .bool("random"));
        add(catalog, leaf("Stat")
                .string("title", true)
                .string("value", true)
                .string("caption", false)
                .string("icon", false)
                .enumeration("variant", VARIANT_WITH_DEFAULT));
        add(catalog, leaf("StatCard")
                .string("title", false)
                .string("value", false)
                .string("caption", false)
                .string("icon", false)
                .enumeration("variant", VARIANT_WITH_DEFAULT));
        add(catalog, leaf("Card")
                .string("title", false)
                .string("text", false));
        add(catalog, leaf("Chart")
                .enumeration("type", List.of("bar", "line", "pie", "area"), true));
        add(catalog, leaf("ChartPlaceholder")
                .enumeration("type", List.of("bar", "line", "pie", "area"), false));
        add(catalog, leaf("Code")
                .string("code", true));
        add(catalog, leaf("Image")
                .enumeration("placeholder", IMAGE_PLACEHOLDER)
                .string("icon", false)
                .enumeration("variant", VARIANT_WITH_DEFAULT)
                .bool("circle", false));
        add(catalog, leaf("Icon")
                .string("icon", true)
                .enumeration("size", ICON_SIZE)
                .enumeration("variant", VARIANT_WITH_DEFAULT)
                .bool("circle", false));
        add(catalog, leaf("IconButton")
                .string("icon", true)
                .enumeration("size", TEXT_SIZE)
                .enumeration("variant", VARIANT_WITH_DEFAULT)
                .bool("disabled")
                .bool("labelSpace")
                .enumeration("padding", SPACING));
        add(catalog, leaf("Divider"));
        add(catalog, leaf("Separate")
                .enumeration("size", SPACING));
        add(catalog, leaf("Badge")
                .string("text", true)
                .enumeration("variant", VARIANT_WITH_DEFAULT)
                .enumeration("size", TEXT_SIZE, "md")
                .number("padding", false));
        add(catalog, leaf("Alert")
                .enumeration("variant", VARIANT)
                .string("title", false)
                .string("text", false));
        add(catalog, leaf("Modal")
                .string("title", true)
                .bool("visible", true));

        return catalog;
    }

    private static Map<String, ComponentSchema> standardContainers() {
        Map<String, ComponentSchema> catalog = new LinkedHashMap<>();

        add(catalog, containerSchema("stack")
                .enumeration("direction", List.of("horizontal", "vertical"), "vertical")
                .enumeration("justify", JUSTIFY)
                .enumeration("align", ALIGN)
                .spacing("gap")
                .spacing("padding")
                .color("background"));
        add(catalog, containerSchema("grid")
                .number("columns", 12)
                .spacing("gap")
                .enumeration("justify", JUSTIFY)
                .spacing("padding")
                .color("background"));
        add(catalog, containerSchema("split")
                .number("sidebar", false)
                .number("left", false)
                .number("right", false)
                .color("background")
                .bool("border")
                .spacing("gap")
                .spacing("padding"));
        add(catalog, containerSchema("panel")
                .spacing("padding")
                .spacing("gap")
                .color("background"));
        add(catalog, containerSchema("card")
                .spacing("padding")
                .spacing("gap")
                .enumeration("radius", List.of("none", "sm", "md", "lg"))
                .bool("border")
                .color("background"));

        return catalog;
    }

    private static void add(Map<String, ComponentSchema> catalog, SchemaBuilder builder) {
        ComponentSchema schema = builder.build();
        catalog.put(schema.getName(), schema);
    }

    private static SchemaBuilder leaf(String name) {
        // Every leaf accepts explicit pixel dimensions
        return new SchemaBuilder(name, false)
                .number("width", false)
                .number("height", false);
    }

    private static SchemaBuilder containerSchema(String name) {
        return new SchemaBuilder(name, true);
    }

    private static List<String> concat(String first, List<String> rest) {
        List<String> values = new ArrayList<>();
        values.add(first);
        values.addAll(rest);
        return List.copyOf(values);
    }

    private static final class SchemaBuilder {
        private final String name;
        private final boolean container;
        private final Map<String, PropertySchema> properties = new LinkedHashMap<>();

        private SchemaBuilder(String name, boolean container) {
            this.name = name;
            this.container = container;
        }

        SchemaBuilder string(String property, boolean required) {
            return put(PropertySchema.builder().name(property).type(PropertyType.STRING).required(required).build());
        }

        SchemaBuilder number(String property, boolean required) {
            return put(PropertySchema.builder().name(property).type(PropertyType.NUMBER).required(required).build());
        }

        SchemaBuilder number(String property, int defaultValue) {
            return put(PropertySchema.builder().name(property).type(PropertyType.NUMBER).defaultValue(defaultValue).build());
        }

        SchemaBuilder bool(String property) {
            return put(PropertySchema.builder().name(property).type(PropertyType.BOOLEAN).build());
        }

        SchemaBuilder bool(String property, boolean defaultValue) {
            return put(PropertySchema.builder().name(property).type(PropertyType.BOOLEAN).defaultValue(defaultValue).build());
        }

        SchemaBuilder color(String property) {
            return put(PropertySchema.builder().name(property).type(PropertyType.COLOR).build());
        }

        SchemaBuilder spacing(String property) {
            return put(PropertySchema.builder().name(property).type(PropertyType.SPACING).build());
        }

        SchemaBuilder enumeration(String property, List<String> values) {
            return enumeration(property, values, false);
        }

        SchemaBuilder enumeration(String property, List<String> values, boolean required) {
            return put(PropertySchema.builder().name(property).type(PropertyType.ENUM)
                    .allowedValues(values).required(required).build());
        }

        SchemaBuilder enumeration(String property, List<String> values, String defaultValue) {
            return put(PropertySchema.builder().name(property).type(PropertyType.ENUM)
                    .allowedValues(values).defaultValue(defaultValue).build());
        }

        private SchemaBuilder put(PropertySchema property) {
            properties.put(property.getName(), property);
            return this;
        }

        ComponentSchema build() {
            return new ComponentSchema(name, container, properties);
        }
    }
}
