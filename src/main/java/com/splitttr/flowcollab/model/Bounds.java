package com.splitttr.flowcollab.model;

/**
 * Spatial region of a node on the canvas, in pixels.
 */
public record Bounds(double x, double y, double width, double height) {

    public boolean overlaps(Bounds other) {
        return x < other.x + other.width
            && other.x < x + width
            && y < other.y + other.height
            && other.y < y + height;
    }

    public Bounds withX(double newX) {
        return new Bounds(newX, y, width, height);
    }
}
