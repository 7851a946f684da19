package com.questrail.dxf.model.entity;

import com.questrail.dxf.model.Point;

import java.util.Objects;

/**
 * An {@code ARC} entity. Angles are in degrees, counterclockwise from start to end.
 */
public final class Arc extends Entity
{
    public static final String TYPE = "ARC";

    private Point center;
    private Double thickness;
    private Double radius;
    private Double startAngle;
    private Double endAngle;
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

    public Double getStartAngle() {
        return startAngle;
    }

    public void setStartAngle(Double startAngle) {
        this.startAngle = startAngle;
    }

    public Double getEndAngle() {
        return endAngle;
    }

    public void setEndAngle(Double endAngle) {
        this.endAngle = endAngle;
    }

    public Point getExtrusion() {
        return extrusion;
    }

    public void setExtrusion(Point extrusion) {
        this.extrusion = extrusion;
    }

    /**
     * Sweep from start to end angle in degrees, derived from groups 50 and 51;
     * {@code null} unless both are present.
     */
    public Double angleLength() {
        if (startAngle == null || endAngle == null) {
            return null;
        }
        double length = endAngle - startAngle;
        return length < 0 ? length + 360.0 : length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Arc that
            && commonEquals(that)
            && Objects.equals(center, that.center)
            && Objects.equals(thickness, that.thickness)
            && Objects.equals(radius, that.radius)
            && Objects.equals(startAngle, that.startAngle)
            && Objects.equals(endAngle, that.endAngle)
            && Objects.equals(extrusion, that.extrusion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(commonHashCode(), center, thickness, radius, startAngle, endAngle, extrusion);
    }
}
