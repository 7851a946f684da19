package com.questrail.dxf.model;

/**
 * A 2D or 3D point or vector. {@code z} is {@code null} for 2D values, which are
 * written back without a z group.
 */
public record Point(double x, double y, Double z)
{
    public static Point of(double x, double y) {
        return new Point(x, y, null);
    }

    public static Point of(double x, double y, double z) {
        return new Point(x, y, z);
    }

    public boolean is3d() {
        return z != null;
    }
}
