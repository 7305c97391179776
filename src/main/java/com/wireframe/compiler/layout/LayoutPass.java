package com.wireframe.compiler.layout;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.wireframe.compiler.ir.model.ComponentNode;
import com.wireframe.compiler.ir.model.ContainerNode;
import com.wireframe.compiler.ir.model.ContainerType;
import com.wireframe.compiler.ir.model.InstanceNode;
import com.wireframe.compiler.ir.model.IrNode;
import com.wireframe.compiler.ir.model.IrNodeGraph;
import com.wireframe.compiler.ir.model.NodeRef;

/**
 * One layout computation. Holds the scratch state of a single call and is discarded afterwards.
 *
 * {@link #measure} computes a node's height for a given width, bottom-up. {@link #place} then
 * assigns boxes top-down once the parent's origin is known. Nodes missing from the table, or
 * reached again while being measured, are skipped.
 */
class LayoutPass {
    private static final Logger log = LoggerFactory.getLogger(LayoutPass.class);

    static final int DEFAULT_COLUMNS = 12;
    static final double DEFAULT_SPLIT_WIDTH = 260;

    private final IrNodeGraph graph;
    private final DensityMetrics metrics;
    private final SpacingResolver spacing;
    private final IntrinsicSizer sizer;

    private final Map<String, Double> measured = new HashMap<>();
    private final Set<String> measuring = new HashSet<>();
    private final Map<String, LayoutBox> boxes = new LinkedHashMap<>();

    LayoutPass(IrNodeGraph graph, DensityMetrics metrics, String projectSpacing) {
        this.graph = graph;
        this.metrics = metrics;
        this.spacing = new SpacingResolver(metrics, projectSpacing);
        this.sizer = new IntrinsicSizer(metrics, spacing);
    }

    LayoutResult run(NodeRef root, double viewportWidth) {
        double width = Double.isNaN(viewportWidth) ? 0 : Math.max(0, viewportWidth);
        place(root, 0, 0, width, measure(root, width));
        return new LayoutResult(boxes);
    }

    // ---------------------------------------------------------------------
    // Measure
    // ---------------------------------------------------------------------

    double measure(NodeRef ref, double width) {
        IrNode node = lookup(ref);
        if (node == null) {
            return 0;
        }
        String key = node.getId() + "@" + width;
        Double cached = measured.get(key);
        if (cached != null) {
            return cached;
        }
        if (!measuring.add(node.getId())) {
            log.debug("Skipping {} reached again while measuring", node.getId());
            return 0;
        }
        try {
            double height = Math.max(0, measureNode(node, Math.max(0, width)));
            measured.put(key, height);
            return height;
        } finally {
            measuring.remove(node.getId());
        }
    }

    private double measureNode(IrNode node, double width) {
        if (node instanceof ComponentNode component) {
            Double explicitWidth = sizer.explicitWidth(component);
            return sizer.height(component, explicitWidth != null ? explicitWidth : width);
        }
        if (node instanceof InstanceNode instance) {
            return measure(instance.getExpandedRoot(), width);
        }
        return measureContainer((ContainerNode) node, width);
    }

    private double measureContainer(ContainerNode container, double width) {
        List<NodeRef> children = container.getChildren();
        double padding = spacing.padding(container.getStyle());

        if (children.isEmpty()) {
            return container.isCell() ? 0 : padding * 2 + metrics.getControlHeight();
        }

        double contentWidth = Math.max(0, width - padding * 2);
        double gap = spacing.gap(container.getStyle());

        double content = switch (container.getContainerType()) {
            case STACK -> isHorizontal(container)
                    ? measureRow(children, horizontalWidths(container, contentWidth, gap))
                    : measureColumn(children, contentWidth, gap);
            case GRID -> measureGrid(container, contentWidth, gap);
            case SPLIT -> measureSplit(container, contentWidth, gap);
            case PANEL, CARD -> measureColumn(children, contentWidth, gap);
        };
        return padding * 2 + content;
    }

    private double measureColumn(List<NodeRef> children, double width, double gap) {
        double total = 0;
        for (int i = 0; i < children.size(); i++) {
            total += measure(children.get(i), width);
            if (i < children.size() - 1) {
                total += gap;
            }
        }
        return total;
    }

    private double measureRow(List<NodeRef> children, double[] widths) {
        double max = 0;
        for (int i = 0; i < children.size(); i++) {
            max = Math.max(max, measure(children.get(i), widths[i]));
        }
        return max;
    }

    private double measureGrid(ContainerNode grid, double width, double gap) {
        GridPlan plan = planGrid(grid, width, gap);
        double total = 0;
        for (int row = 0; row < plan.rowHeights.size(); row++) {
            total += plan.rowHeights.get(row);
            if (row < plan.rowHeights.size() - 1) {
                total += gap;
            }
        }
        return total;
    }

    private double measureSplit(ContainerNode split, double width, double gap) {
        List<NodeRef> children = split.getChildren();
        if (children.size() == 1) {
            return measure(children.get(0), width);
        }
        SplitPlan plan = planSplit(split, width, gap);
        return Math.max(measure(children.get(0), plan.firstWidth), measure(children.get(1), plan.secondWidth));
    }

    // ---------------------------------------------------------------------
    // Place
    // ---------------------------------------------------------------------

    void place(NodeRef ref, double x, double y, double width, double height) {
        IrNode node = lookup(ref);
        if (node == null) {
            return;
        }

        if (node instanceof ComponentNode component) {
            Double explicitWidth = sizer.explicitWidth(component);
            double boxWidth = explicitWidth != null ? explicitWidth : Math.max(0, width);
            boxes.put(node.getId(), new LayoutBox(x, y, boxWidth, measure(ref, boxWidth)));
            return;
        }

        if (node instanceof InstanceNode instance) {
            // reserve the slot so the instance precedes its expansion
            boxes.put(node.getId(), null);
            place(instance.getExpandedRoot(), x, y, width, height);
            LayoutBox rootBox = boxes.get(instance.getExpandedRoot().getRef());
            if (rootBox == null) {
                boxes.remove(node.getId());
            } else {
                boxes.put(node.getId(), rootBox);
            }
            return;
        }

        ContainerNode container = (ContainerNode) node;
        double boxWidth = Math.max(0, width);
        double boxHeight = Math.max(0, height);
        boxes.put(container.getId(), new LayoutBox(x, y, boxWidth, boxHeight));

        if (container.getChildren().isEmpty()) {
            return;
        }

        double padding = spacing.padding(container.getStyle());
        double gap = spacing.gap(container.getStyle());
        double contentX = x + padding;
        double contentY = y + padding;
        double contentWidth = Math.max(0, boxWidth - padding * 2);
        double contentHeight = Math.max(0, boxHeight - padding * 2);

        switch (container.getContainerType()) {
            case STACK -> {
                if (isHorizontal(container)) {
                    placeRow(container, contentX, contentY, contentWidth, contentHeight, gap);
                } else {
                    placeColumn(container, contentX, contentY, contentWidth, gap);
                }
            }
            case GRID -> placeGrid(container, contentX, contentY, contentWidth, gap);
            case SPLIT -> placeSplit(container, contentX, contentY, contentWidth, contentHeight, gap);
            case PANEL, CARD -> placeColumn(container, contentX, contentY, contentWidth, gap);
        }
    }

    private void placeColumn(ContainerNode container, double x, double y, double width, double gap) {
        String align = normalizeAlign(container.getStyle().getAlign());
        double cursor = y;
        List<NodeRef> children = container.getChildren();

        for (int i = 0; i < children.size(); i++) {
            NodeRef child = children.get(i);
            Double explicitWidth = explicitWidth(child);
            double childWidth = explicitWidth != null ? explicitWidth : width;
            double childHeight = measure(child, childWidth);

            double childX = x;
            if (explicitWidth != null) {
                if ("center".equals(align)) {
                    childX = x + (width - childWidth) / 2;
                } else if ("end".equals(align)) {
                    childX = x + width - childWidth;
                }
            }

            place(child, childX, cursor, childWidth, childHeight);
            cursor += childHeight;
            if (i < children.size() - 1) {
                cursor += gap;
            }
        }
    }

    private void placeRow(ContainerNode container, double x, double y, double width, double height, double gap) {
        List<NodeRef> children = container.getChildren();
        double[] widths = horizontalWidths(container, width, gap);
        String justify = justify(container);
        String align = normalizeAlign(container.getStyle().getAlign());
        int count = children.size();

        double used = gap * (count - 1);
        for (double childWidth : widths) {
            used += childWidth;
        }
        double free = width - used;

        double cursor = x;
        double step = gap;
        switch (justify) {
            case "center" -> cursor = x + free / 2;
            case "end" -> cursor = x + free;
            case "spaceBetween" -> {
                if (count > 1 && free > 0) {
                    step = gap + free / (count - 1);
                }
            }
            case "spaceAround" -> {
                if (free > 0) {
                    cursor = x + free / count / 2;
                    step = gap + free / count;
                }
            }
            default -> {
                // stretch and start begin at the content edge
            }
        }

        for (int i = 0; i < count; i++) {
            NodeRef child = children.get(i);
            double childHeight;
            if (align == null && !isLeafLike(child)) {
                childHeight = height;
            } else {
                childHeight = measure(child, widths[i]);
            }

            double childY = y;
            if ("center".equals(align)) {
                childY = y + (height - childHeight) / 2;
            } else if ("end".equals(align)) {
                childY = y + height - childHeight;
            }

            place(child, cursor, childY, widths[i], childHeight);
            cursor += widths[i] + step;
        }
    }

    private void placeGrid(ContainerNode grid, double x, double y, double width, double gap) {
        GridPlan plan = planGrid(grid, width, gap);
        List<NodeRef> children = grid.getChildren();

        double[] rowY = new double[plan.rowHeights.size()];
        double cursor = y;
        for (int row = 0; row < rowY.length; row++) {
            rowY[row] = cursor;
            cursor += plan.rowHeights.get(row) + gap;
        }

        for (int i = 0; i < children.size(); i++) {
            GridSlot slot = plan.slots.get(i);
            NodeRef child = children.get(i);
            double cellX = x + slot.column * (plan.columnWidth + gap);
            double rowHeight = plan.rowHeights.get(slot.row);
            double childHeight = isLeafLike(child) ? measure(child, slot.width) : rowHeight;
            place(child, cellX, rowY[slot.row], slot.width, childHeight);
        }
    }

    private void placeSplit(ContainerNode split, double x, double y, double width, double height, double gap) {
        List<NodeRef> children = split.getChildren();
        if (children.size() == 1) {
            NodeRef only = children.get(0);
            place(only, x, y, width, isLeafLike(only) ? measure(only, width) : height);
            return;
        }
        if (children.size() > 2) {
            log.debug("split {} has {} children; laying out the first two", split.getId(), children.size());
        }

        SplitPlan plan = planSplit(split, width, gap);
        NodeRef first = children.get(0);
        NodeRef second = children.get(1);
        double secondX = x + plan.firstWidth + gap;

        place(first, x, y, plan.firstWidth, isLeafLike(first) ? measure(first, plan.firstWidth) : height);
        place(second, secondX, y, plan.secondWidth, isLeafLike(second) ? measure(second, plan.secondWidth) : height);
    }

    // ---------------------------------------------------------------------
    // Container arithmetic shared by both phases
    // ---------------------------------------------------------------------

    private double[] horizontalWidths(ContainerNode container, double width, double gap) {
        List<NodeRef> children = container.getChildren();
        int count = children.size();
        double[] widths = new double[count];
        if (count == 0) {
            return widths;
        }

        if ("stretch".equals(justify(container))) {
            double share = Math.max(0, (width - gap * (count - 1)) / count);
            Arrays.fill(widths, share);
            return widths;
        }

        for (int i = 0; i < count; i++) {
            IrNode leaf = resolve(children.get(i));
            widths[i] = leaf instanceof ComponentNode component ? sizer.width(component) : IntrinsicSizer.DEFAULT_WIDTH;
        }
        return widths;
    }

    private GridPlan planGrid(ContainerNode grid, double width, double gap) {
        Integer declared = grid.getParams().getInt("columns");
        int columns = declared != null && declared > 0 ? declared : DEFAULT_COLUMNS;
        double columnWidth = Math.max(0, (width - gap * (columns - 1)) / columns);

        GridPlan plan = new GridPlan(columnWidth);
        int row = 0;
        int column = 0;
        double rowHeight = 0;

        for (NodeRef child : grid.getChildren()) {
            int span = span(child, columns);
            if (column + span > columns) {
                plan.rowHeights.add(rowHeight);
                row++;
                column = 0;
                rowHeight = 0;
            }
            double cellWidth = columnWidth * span + gap * (span - 1);
            plan.slots.add(new GridSlot(row, column, cellWidth));
            rowHeight = Math.max(rowHeight, measure(child, cellWidth));
            column += span;
        }
        plan.rowHeights.add(rowHeight);
        return plan;
    }

    private SplitPlan planSplit(ContainerNode split, double width, double gap) {
        Double right = split.getParams().getDouble("right");
        Double left = split.getParams().getDouble("sidebar");
        if (left == null) {
            left = split.getParams().getDouble("left");
        }

        if (left == null && right != null && right >= 0) {
            double rest = Math.max(0, width - right - gap);
            return new SplitPlan(rest, right);
        }
        double fixed = left != null && left >= 0 ? left : DEFAULT_SPLIT_WIDTH;
        return new SplitPlan(fixed, Math.max(0, width - fixed - gap));
    }

    private int span(NodeRef ref, int columns) {
        IrNode node = lookup(ref);
        if (!(node instanceof ContainerNode container) || !container.isCell()) {
            return 1;
        }
        Integer span = container.getParams().getInt("span");
        if (span == null) {
            return 1;
        }
        return Math.max(1, Math.min(columns, span));
    }

    private Double explicitWidth(NodeRef ref) {
        IrNode leaf = resolve(ref);
        return leaf instanceof ComponentNode component ? sizer.explicitWidth(component) : null;
    }

    /**
     * Components keep their measured height wherever they are placed; containers may be stretched.
     */
    private boolean isLeafLike(NodeRef ref) {
        return resolve(ref) instanceof ComponentNode;
    }

    /**
     * Follows instance expansions down to the node that is actually drawn.
     */
    private IrNode resolve(NodeRef ref) {
        IrNode node = lookup(ref);
        Set<String> seen = new HashSet<>();
        while (node instanceof InstanceNode instance && seen.add(instance.getId())) {
            node = lookup(instance.getExpandedRoot());
        }
        return node;
    }

    private IrNode lookup(NodeRef ref) {
        IrNode node = graph.node(ref).orElse(null);
        if (node == null) {
            log.debug("Skipping missing node {}", ref);
        }
        return node;
    }

    private static boolean isHorizontal(ContainerNode container) {
        return container.getContainerType() == ContainerType.STACK
                && "horizontal".equals(container.getParams().getString("direction"));
    }

    private static String justify(ContainerNode container) {
        String justify = container.getStyle().getJustify();
        return justify == null ? "stretch" : justify;
    }

    /**
     * Maps {@code left}/{@code right} onto {@code start}/{@code end}. Null when no alignment is set.
     */
    private static String normalizeAlign(String align) {
        if (align == null) {
            return null;
        }
        return switch (align) {
            case "left", "top" -> "start";
            case "right", "bottom" -> "end";
            default -> align;
        };
    }

    private static final class GridPlan {
        private final double columnWidth;
        private final List<Double> rowHeights = new ArrayList<>();
        private final List<GridSlot> slots = new ArrayList<>();

        private GridPlan(double columnWidth) {
            this.columnWidth = columnWidth;
        }
    }

    private static final class GridSlot {
        private final int row;
        private final int column;
        private final double width;

        private GridSlot(int row, int column, double width) {
            this.row = row;
            this.column = column;
            this.width = width;
        }
    }

    private static final class SplitPlan {
        private final double firstWidth;
        private final double secondWidth;

        private SplitPlan(double firstWidth, double secondWidth) {
            this.firstWidth = firstWidth;
            this.secondWidth = secondWidth;
        }
    }
}
