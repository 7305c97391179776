package com.wireframe.compiler.layout;

import lombok.Value;

/**
 * Resolved bounding box of one node. Width and height are never negative or NaN.
 */
@Value
public class LayoutBox {
    double x;
    double y;
    double width;
    double height;

    public LayoutBox(double x, double y, double width, double height) {
        if (Double.isNaN(x) || Double.isNaN(y)) {
            throw new LayoutInvariantViolation("Box origin must be a number: (" + x + ", " + y + ")");
        }
        if (Double.isNaN(width) || width < 0) {
            throw new LayoutInvariantViolation("Box width must be >= 0, was " + width);
        }
        if (Double.isNaN(height) || height < 0) {
            throw new LayoutInvariantViolation("Box height must be >= 0, was " + height);
        }
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    public double right() {
        return x + width;
    }
}
