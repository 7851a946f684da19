package com.questrail.dxf.model.entity;

import com.questrail.dxf.model.Point;

import java.util.Objects;

/**
 * A {@code LINE} entity: a segment between two points.
 */
public final class Line extends Entity
{
    public static final String TYPE = "LINE";

    private Point start;
    private Point end;
    private Double thickness;
    private Point extrusion;

    @Override
    public String type() {
        return TYPE;
    }

    /** Start point (group 10). */
    public Point getStart() {
        return start;
    }

    public void setStart(Point start) {
        this.start = start;
    }

    /** End point (group 11). */
    public Point getEnd() {
        return end;
    }

    public void setEnd(Point end) {
        this.end = end;
    }

    public Double getThickness() {
        return thickness;
    }

    public void setThickness(Double thickness) {
        this.thickness = thickness;
    }

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
        return o instanceof Line that
            && commonEquals(that)
            && Objects.equals(start, that.start)
            && Objects.equals(end, that.end)
            && Objects.equals(thickness, that.thickness)
            && Objects.equals(extrusion, that.extrusion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(commonHashCode(), start, end, thickness, extrusion);
    }
}
