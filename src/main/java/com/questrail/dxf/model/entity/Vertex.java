package com.questrail.dxf.model.entity;

import com.questrail.dxf.model.BitFlag;
import com.questrail.dxf.model.Flags;
import com.questrail.dxf.model.Point;

import java.util.EnumSet;
import java.util.Objects;

/**
 * A {@code VERTEX} record of a heavy {@link Polyline}.
 *
 * <p>Face indices (groups 71-74) are only used by polyface mesh faces; a
 * negative index marks an invisible edge.</p>
 */
public final class Vertex extends Entity
{
    public static final String TYPE = "VERTEX";

    private Point location;
    private Double startWidth;
    private Double endWidth;
    private Double bulge;
    private Double curveFitTangentDirection;
    private Integer flags;
    private Integer firstFaceIndex;
    private Integer secondFaceIndex;
    private Integer thirdFaceIndex;
    private Integer fourthFaceIndex;

    @Override
    public String type() {
        return TYPE;
    }

    public Point getLocation() {
        return location;
    }

    public void setLocation(Point location) {
        this.location = location;
    }

    public Double getStartWidth() {
        return startWidth;
    }

    public void setStartWidth(Double startWidth) {
        this.startWidth = startWidth;
    }

    public Double getEndWidth() {
        return endWidth;
    }

    public void setEndWidth(Double endWidth) {
        this.endWidth = endWidth;
    }

    public Double getBulge() {
        return bulge;
    }

    public void setBulge(Double bulge) {
        this.bulge = bulge;
    }

    public Double getCurveFitTangentDirection() {
        return curveFitTangentDirection;
    }

    public void setCurveFitTangentDirection(Double curveFitTangentDirection) {
        this.curveFitTangentDirection = curveFitTangentDirection;
    }

    public Integer getFlags() {
        return flags;
    }

    public void setFlags(Integer flags) {
        this.flags = flags;
    }

    public Integer getFirstFaceIndex() {
        return firstFaceIndex;
    }

    public void setFirstFaceIndex(Integer firstFaceIndex) {
        this.firstFaceIndex = firstFaceIndex;
    }

    public Integer getSecondFaceIndex() {
        return secondFaceIndex;
    }

    public void setSecondFaceIndex(Integer secondFaceIndex) {
        this.secondFaceIndex = secondFaceIndex;
    }

    public Integer getThirdFaceIndex() {
        return thirdFaceIndex;
    }

    public void setThirdFaceIndex(Integer thirdFaceIndex) {
        this.thirdFaceIndex = thirdFaceIndex;
    }

    public Integer getFourthFaceIndex() {
        return fourthFaceIndex;
    }

    public void setFourthFaceIndex(Integer fourthFaceIndex) {
        this.fourthFaceIndex = fourthFaceIndex;
    }

    public enum Flag implements BitFlag {
        EXTRA_VERTEX(1),
        CURVE_FIT_TANGENT(2),
        SPLINE_VERTEX(8),
        SPLINE_CONTROL_POINT(16),
        POLYLINE_3D_VERTEX(32),
        POLYGON_MESH_3D_VERTEX(64),
        POLYFACE_MESH_VERTEX(128);

        private final int mask;

        Flag(int mask) {
            this.mask = mask;
        }

        @Override
        public int mask() {
            return mask;
        }
    }

    public EnumSet<Flag> flagSet() {
        return Flags.decode(flags, Flag.class);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Vertex that
            && commonEquals(that)
            && Objects.equals(location, that.location)
            && Objects.equals(startWidth, that.startWidth)
            && Objects.equals(endWidth, that.endWidth)
            && Objects.equals(bulge, that.bulge)
            && Objects.equals(curveFitTangentDirection, that.curveFitTangentDirection)
            && Objects.equals(flags, that.flags)
            && Objects.equals(firstFaceIndex, that.firstFaceIndex)
            && Objects.equals(secondFaceIndex, that.secondFaceIndex)
            && Objects.equals(thirdFaceIndex, that.thirdFaceIndex)
            && Objects.equals(fourthFaceIndex, that.fourthFaceIndex);
    }

    @Override
    public int hashCode() {
        return Objects.hash(commonHashCode(), location, startWidth, endWidth, bulge, curveFitTangentDirection, flags);
    }
}
