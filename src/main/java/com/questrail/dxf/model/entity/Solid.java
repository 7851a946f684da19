package com.questrail.dxf.model.entity;

import com.questrail.dxf.model.Point;

import java.util.Objects;

/**
 * A {@code SOLID} entity: a filled triangle or quadrilateral.
 */
public final class Solid extends Entity
{
    public static final String TYPE = "SOLID";

    private Point firstCorner;
    private Point secondCorner;
    private Point thirdCorner;
    private Point fourthCorner;
    private Double thickness;
    private Point extrusion;

    @Override
    public String type() {
        return TYPE;
    }

    public Point getFirstCorner() {
        return firstCorner;
    }

    public void setFirstCorner(Point firstCorner) {
        this.firstCorner = firstCorner;
    }

    public Point getSecondCorner() {
        return secondCorner;
    }

    public void setSecondCorner(Point secondCorner) {
        this.secondCorner = secondCorner;
    }

    public Point getThirdCorner() {
        return thirdCorner;
    }

    public void setThirdCorner(Point thirdCorner) {
        this.thirdCorner = thirdCorner;
    }

    public Point getFourthCorner() {
        return fourthCorner;
    }

    public void setFourthCorner(Point fourthCorner) {
        this.fourthCorner = fourthCorner;
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
        return o instanceof Solid that
            && commonEquals(that)
            && Objects.equals(firstCorner, that.firstCorner)
            && Objects.equals(secondCorner, that.secondCorner)
            && Objects.equals(thirdCorner, that.thirdCorner)
            && Objects.equals(fourthCorner, that.fourthCorner)
            && Objects.equals(thickness, that.thickness)
            && Objects.equals(extrusion, that.extrusion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(commonHashCode(), firstCorner, secondCorner, thirdCorner, fourthCorner, thickness, extrusion);
    }
}
