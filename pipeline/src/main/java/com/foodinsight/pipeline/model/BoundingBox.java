package com.foodinsight.pipeline.model;

import lombok.Value;

/**
 * Axis-aligned box [x1, y1, x2, y2] in pixels.
 */
@Value
public class BoundingBox {

    double x1;
    double y1;
    double x2;
    double y2;

    public BoundingBox translate(double dx, double dy) {
        return new BoundingBox(x1 + dx, y1 + dy, x2 + dx, y2 + dy);
    }
}
