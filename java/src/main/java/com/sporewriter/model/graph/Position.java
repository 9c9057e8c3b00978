package com.sporewriter.model.graph;

import lombok.Value;

/**
 * Planar node coordinates.
 */
@Value
public class Position {

    public static final Position ORIGIN = new Position(0.0, 0.0);

    double x;
    double y;

    /**
     * Null coordinates default to {@code 0.0}.
     */
    public static Position of(Double x, Double y) {
        return new Position(x != null ? x : 0.0, y != null ? y : 0.0);
    }

    public Position plus(double dx, double dy) {
        return new Position(x + dx, y + dy);
    }

    public double distanceTo(Position other) {
        return Math.hypot(x - other.x, y - other.y);
    }
}
