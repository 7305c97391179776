package com.wireframe.compiler.layout;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import com.wireframe.compiler.ir.model.ComponentNode;
import com.wireframe.compiler.ir.model.PropertyBag;

/**
 * Estimates component sizes without real font metrics.
 *
 * An explicit {@code width} or {@code height} prop always wins over the estimate.
 */
public class IntrinsicSizer {
    static final double FALLBACK_TEXT_WIDTH = 200;
    static final double DEFAULT_WIDTH = 120;

    private static final Map<String, Double> HEADING_SCALE = Map.of(
            "h1", 1.4, "h2", 1.0, "h3", 0.85, "h4", 0.75, "h5", 0.65, "h6", 0.55);
    private static final Map<String, Double> TEXT_SIZE_SCALE = Map.of(
            "xs", 0.75, "sm", 0.875, "md", 1.0, "lg", 1.125, "xl", 1.25);
    private static final Map<String, Double> IMAGE_RATIOS = Map.of(
            "landscape", 16.0 / 9.0, "portrait", 2.0 / 3.0, "square", 1.0, "icon", 1.0, "avatar", 1.0);
    private static final Map<String, Double> IMAGE_WIDTHS = Map.of(
            "landscape", 300.0, "portrait", 200.0, "square", 200.0, "icon", 64.0, "avatar", 64.0);

    private static final int ALERT_FONT_SIZE = 13;
    private static final double ALERT_PADDING = 12;
    private static final double ALERT_TITLE_GAP = 6;
    private static final double ALERT_INSET = 24;

    private final DensityMetrics metrics;
    private final SpacingResolver spacing;

    public IntrinsicSizer(DensityMetrics metrics, SpacingResolver spacing) {
        this.metrics = metrics;
        this.spacing = spacing;
    }

    /**
     * Explicit width prop, or null.
     */
    public Double explicitWidth(ComponentNode node) {
        Double width = node.getProps().getDouble("width");
        return width != null && width > 0 ? width : null;
    }

    public double height(ComponentNode node, double availableWidth) {
        PropertyBag props = node.getProps();
        Double explicit = props.getDouble("height");
        if (explicit != null && explicit > 0) {
            return explicit;
        }

        return switch (node.getComponentType()) {
            case "Heading" -> headingHeight(props, availableWidth);
            case "Text", "Paragraph", "Label" -> textHeight(props.getString("text"), props.getString("size"), availableWidth);
            case "Code" -> textHeight(props.getString("code"), null, availableWidth);
            case "Alert" -> alertHeight(props, availableWidth);
            case "Image" -> imageHeight(props, availableWidth);
            case "Table" -> tableHeight(props);
            case "SidebarMenu" -> Math.max(metrics.getControlHeight(), itemCount(props.getString("items")) * 40.0);
            case "Textarea" -> 100;
            case "Modal" -> 300;
            case "Card", "Stat", "StatCard" -> 120;
            case "Chart", "ChartPlaceholder" -> 250;
            case "List" -> 180;
            case "Topbar" -> 56;
            case "Divider" -> 1;
            case "Separate" -> separateSize(props);
            default -> metrics.getControlHeight();
        };
    }

    /**
     * Natural width, used where a horizontal stack does not stretch its children.
     */
    public double width(ComponentNode node) {
        Double explicit = explicitWidth(node);
        if (explicit != null) {
            return explicit;
        }

        PropertyBag props = node.getProps();
        String text = props.getString("text") == null ? "" : props.getString("text");
        return switch (node.getComponentType()) {
            case "Icon" -> metrics.iconSize(props.getString("size"));
            case "IconButton" -> metrics.iconButtonSize(props.getString("size"));
            case "Checkbox", "Radio" -> 24;
            case "Separate" -> separateSize(props);
            case "Button", "Link" -> Math.max(80, text.length() * 8 + 32);
            case "Label", "Text" -> Math.max(60, text.length() * 8 + 16);
            case "Heading" -> Math.max(80, text.length() * 12 + 16);
            case "Input", "Select", "Textarea" -> 200;
            case "Image" -> IMAGE_WIDTHS.getOrDefault(placeholder(props), 300.0);
            case "Table" -> 400;
            case "Card", "Stat", "StatCard" -> 280;
            case "SidebarMenu" -> 260;
            case "Badge" -> Math.max(50, text.length() * 7 + 16);
            default -> DEFAULT_WIDTH;
        };
    }

    int headingFontSize(String level) {
        double scale = HEADING_SCALE.getOrDefault(level == null ? "h2" : level.trim().toLowerCase(), 1.0);
        return (int) Math.max(10, Math.round(metrics.getHeadingFontSize() * scale));
    }

    int textFontSize(String size) {
        if (size == null || !TEXT_SIZE_SCALE.containsKey(size)) {
            return metrics.getTextFontSize();
        }
        return (int) Math.max(10, Math.round(metrics.getTextFontSize() * TEXT_SIZE_SCALE.get(size)));
    }

    private double headingHeight(PropertyBag props, double availableWidth) {
        String text = props.has("text") ? props.getString("text") : "Heading";
        int fontSize = headingFontSize(props.getString("level"));
        double lineHeight = Math.ceil(fontSize * DensityMetrics.HEADING_LINE_HEIGHT);
        List<String> lines = TextWrapper.wrap(text, textWidth(availableWidth), fontSize);
        double wrapped = Math.max(1, lines.size()) * lineHeight;

        // optional vertical spacing around the heading
        double padding = props.has("spacing") ? spacing.resolve(props.getString("spacing")) : 0;
        return Math.max(metrics.getControlHeight(), wrapped + padding * 2);
    }

    private double textHeight(String text, String size, double availableWidth) {
        int fontSize = textFontSize(size);
        double lineHeight = Math.ceil(fontSize * metrics.getTextLineHeight());
        List<String> lines = TextWrapper.wrap(text == null ? "" : text, textWidth(availableWidth), fontSize);
        return Math.max(metrics.getControlHeight(), Math.max(1, lines.size()) * lineHeight);
    }

    private double alertHeight(PropertyBag props, double availableWidth) {
        String title = props.getString("title") == null ? "" : props.getString("title");
        String text = props.getString("text") == null ? "Alert message" : props.getString("text");
        double titleLineHeight = Math.ceil(ALERT_FONT_SIZE * 1.25);
        double textLineHeight = Math.ceil(ALERT_FONT_SIZE * 1.4);
        double maxWidth = Math.max(40, (availableWidth > 0 ? availableWidth : 280) - ALERT_INSET);

        int titleLines = title.trim().isEmpty() ? 0 : TextWrapper.wrap(title, maxWidth, ALERT_FONT_SIZE).size();
        int textLines = TextWrapper.wrap(text, maxWidth, ALERT_FONT_SIZE).size();

        double height = ALERT_PADDING
                + titleLines * titleLineHeight
                + (titleLines > 0 ? ALERT_TITLE_GAP : 0)
                + Math.max(1, textLines) * textLineHeight
                + ALERT_PADDING;
        return Math.max(metrics.getControlHeight(), height);
    }

    private double imageHeight(PropertyBag props, double availableWidth) {
        double ratio = IMAGE_RATIOS.getOrDefault(placeholder(props), 16.0 / 9.0);
        return availableWidth > 0 ? availableWidth / ratio : 200;
    }

    private double tableHeight(PropertyBag props) {
        Double rows = props.getDouble("rows");
        double rowCount = rows == null || rows < 0 ? 5 : rows;
        double title = props.getString("title") == null || props.getString("title").isEmpty() ? 0 : 32;
        double pagination = Boolean.TRUE.equals(props.getBoolean("pagination")) ? 64 : 0;
        return title + 44 + rowCount * 36 + pagination;
    }

    private double separateSize(PropertyBag props) {
        if (props.get("size") instanceof Number number) {
            return Math.max(0, number.doubleValue());
        }
        return spacing.resolve(props.has("size") ? props.getString("size") : "md");
    }

    private static int itemCount(String items) {
        if (items == null) {
            return 3;
        }
        long count = Arrays.stream(items.split(","))
                .map(String::trim)
                .filter(item -> !item.isEmpty())
                .count();
        return count > 0 ? (int) count : 3;
    }

    private static String placeholder(PropertyBag props) {
        return props.has("placeholder") ? props.getString("placeholder") : "landscape";
    }

    private static double textWidth(double availableWidth) {
        return availableWidth > 0 ? availableWidth : FALLBACK_TEXT_WIDTH;
    }
}
