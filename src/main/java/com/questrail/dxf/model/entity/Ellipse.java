package com.questrail.dxf.model.entity;

import com.questrail.dxf.model.Point;

import java.util.Objects;

/**
 * An {@code ELLIPSE} entity. The major axis end point is relative to the center.
 */
public final class Ellipse extends Entity
{
    public static final String TYPE = "ELLIPSE";

    private Point center;
    private Point majorAxisEndPoint;
    private Double axisRatio;
    private Double startParameter;
    private Double endParameter;
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

    public Point getMajorAxisEndPoint() {
        return majorAxisEndPoint;
    }

    public void setMajorAxisEndPoint(Point majorAxisEndPoint) {
        this.majorAxisEndPoint = majorAxisEndPoint;
    }

    /** Ratio of minor axis to major axis (group 40). */
    public Double getAxisRatio() {
        return axisRatio;
    }

    public void setAxisRatio(Double axisRatio) {
        this.axisRatio = axisRatio;
    }

    public Double getStartParameter() {
        return startParameter;
    }

    public void setStartParameter(Double startParameter) {
        this.startParameter = startParameter;
    }

    public Double getEndParameter() {
        return endParameter;
    }

    public void setEndParameter(Double endParameter) {
        this.endParameter = endParameter;
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
        return o instanceof Ellipse that
            && commonEquals(that)
            && Objects.equals(center, that.center)
            && Objects.equals(majorAxisEndPoint, that.majorAxisEndPoint)
            && Objects.equals(axisRatio, that.axisRatio)
            && Objects.equals(startParameter, that.startParameter)
            && Objects.equals(endParameter, that.endParameter)
            && Objects.equals(extrusion, that.extrusion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(commonHashCode(), center, majorAxisEndPoint, axisRatio, startParameter, endParameter, extrusion);
    }
}
