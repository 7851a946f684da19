package com.questrail.dxf.model.entity;

import com.questrail.dxf.model.Point;

import java.util.Objects;

/**
 * A {@code POINT} entity.
 */
public final class PointEntity extends Entity
{
    public static final String TYPE = "POINT";

    private Point position;
    private Double thickness;
    private Integer flags;
    private Point extrusion;

    @Override
    public String type() {
        return TYPE;
    }

    public Point getPosition() {
        return position;
    }

    public void setPosition(Point position) {
        this.position = position;
    }

    public Double getThickness() {
        return thickness;
    }

    public void setThickness(Double thickness) {
        this.thickness = thickness;
    }

    public Integer getFlags() {
        return flags;
    }

    public void setFlags(Integer flags) {
        this.flags = flags;
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
        return o instanceof PointEntity that
            && commonEquals(that)
            && Objects.equals(position, that.position)
            && Objects.equals(thickness, that.thickness)
            && Objects.equals(flags, that.flags)
            && Objects.equals(extrusion, that.extrusion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(commonHashCode(), position, thickness, flags, extrusion);
    }
}
