package com.foodinsight.pipeline.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Value;

/**
 * Pixel rectangle in full-frame coordinates. {@code x2}/{@code y2} are exclusive.
 */
@Value
public class Region {

    @JsonProperty("x1")
    int x1;

    @JsonProperty("y1")
    int y1;

    @JsonProperty("x2")
    int x2;

    @JsonProperty("y2")
    int y2;

    public int getWidth() {
        return x2 - x1;
    }

    public int getHeight() {
        return y2 - y1;
    }

    public boolean contains(BoundingBox box) {
        return box.getX1() >= x1 && box.getY1() >= y1 && box.getX2() <= x2 && box.getY2() <= y2;
    }

    /**
     * Checks the region against a frame of the given size.
     *
     * @return null when valid, otherwise the reason it is not
     */
    public String validate(int frameWidth, int frameHeight) {
        if (x1 < 0 || y1 < 0) {
            return String.format("negative origin (%d, %d)", x1, y1);
        }
        if (getWidth() <= 0 || getHeight() <= 0) {
            return String.format("non-positive size %dx%d", getWidth(), getHeight());
        }
        if (x2 > frameWidth || y2 > frameHeight) {
            return String.format("(%d, %d) lies outside the %dx%d frame", x2, y2, frameWidth, frameHeight);
        }
        return null;
    }

    /**
     * Clamps the region to a frame, always leaving at least one pixel.
     */
    public Region clampTo(int frameWidth, int frameHeight) {
        int cx1 = Math.max(0, Math.min(x1, frameWidth - 1));
        int cy1 = Math.max(0, Math.min(y1, frameHeight - 1));
        int cx2 = Math.max(cx1 + 1, Math.min(x2, frameWidth));
        int cy2 = Math.max(cy1 + 1, Math.min(y2, frameHeight));
        if (cx1 == x1 && cy1 == y1 && cx2 == x2 && cy2 == y2) {
            return this;
        }
        return new Region(cx1, cy1, cx2, cy2);
    }

    @Override
    public String toString() {
        return String.format("(%d, %d) -> (%d, %d)", x1, y1, x2, y2);
    }
}
