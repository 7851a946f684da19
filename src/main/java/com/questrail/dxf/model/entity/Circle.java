package com.questrail.dxf.model.entity;

import com.questrail.dxf.model.Point;

import java.util.Objects;

/**
 * A {@code CIRCLE} entity.
 */
public final class Circle extends Entity
{
    public static final String TYPE = "CIRCLE";

    private Point center;
    private Double thickness;
    private Double radius;
    private Point extrusion;

    @Override
    public String type() {
        return TYPE;
    }

    public Point getCenter() {
        return center;
    }

    public void setCenter(Point center) {
        this.center = center;
    }

    public Double getThickness() {
        return thickness;
    }

    public void setThickness(Double thickness) {
        this.thickness = thickness;
    }

    public Double getRadius() {
        return radius;
    }

    public void setRadius(Double radius) {
        this.radius = radius;
    }

    /** Extrusion direction (group 210); absent means the world Z axis. */
    public Point getExtrusion() {
        return extrusion;
    }

    public void setExtrusion(Point extrusion) {
        this.extrusion = extrusion;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Circle that
            && commonEquals(that)
            && Objects.equals(center, that.center)
            && Objects.equals(thickness, that.thickness)
            && Objects.equals(radius, that.radius)
            && Objects.equals(extrusion, that.extrusion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(commonHashCode(), center, thickness, radius, extrusion);
    }
}
