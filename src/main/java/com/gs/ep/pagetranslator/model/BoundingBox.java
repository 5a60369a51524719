package com.gs.ep.pagetranslator.model;

import java.util.Objects;

/**
 * Axis-aligned rectangle in page display coordinates: origin at the top-left corner of the
 * crop box, y growing downwards, measured in PDF points.
 */
public final class BoundingBox {
    private final double x0;
    private final double y0;
    private final double x1;
    private final double y1;

    public BoundingBox(double x0, double y0, double x1, double y1) {
        this.x0 = Math.min(x0, x1);
        this.y0 = Math.min(y0, y1);
        this.x1 = Math.max(x0, x1);
        this.y1 = Math.max(y0, y1);
    }

    public double getX0() {
        return x0;
    }

    public double getY0() {
        return y0;
    }

    public double getX1() {
        return x1;
    }

    public double getY1() {
        return y1;
    }

    public double width() {
        return x1 - x0;
    }

    public double height() {
        return y1 - y0;
    }

    public boolean isDegenerate() {
        return width() <= 0 || height() <= 0;
    }

    public BoundingBox union(BoundingBox other) {
        return new BoundingBox(Math.min(x0, other.x0), Math.min(y0, other.y0),
                Math.max(x1, other.x1), Math.max(y1, other.y1));
    }

    /**
     * Shrinks the box by {@code dx} on the left and right and {@code dy} on the top and bottom.
     * An axis is left as is when insetting it would not leave a positive extent.
     */
    public BoundingBox inset(double dx, double dy) {
        double nx0 = x0;
        double nx1 = x1;
        double ny0 = y0;
        double ny1 = y1;
        if (width() - 2 * dx > 0) {
            nx0 += dx;
            nx1 -= dx;
        }
        if (height() - 2 * dy > 0) {
            ny0 += dy;
            ny1 -= dy;
        }
        return new BoundingBox(nx0, ny0, nx1, ny1);
    }

    public boolean contains(double x, double y) {
        return x >= x0 && x <= x1 && y >= y0 && y <= y1;
    }

    public boolean intersects(BoundingBox other) {
        return other.x0 < x1 && other.x1 > x0 && other.y0 < y1 && other.y1 > y0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BoundingBox)) {
            return false;
        }
        BoundingBox that = (BoundingBox) o;
        return Double.compare(that.x0, x0) == 0 && Double.compare(that.y0, y0) == 0
                && Double.compare(that.x1, x1) == 0 && Double.compare(that.y1, y1) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(x0, y0, x1, y1);
    }

    @Override
    public String toString() {
        return String.format("[%.1f,%.1f - %.1f,%.1f]", x0, y0, x1, y1);
    }
}
