package com.questrail.dxf.model.entity;

import com.questrail.dxf.model.BitFlag;
import com.questrail.dxf.model.Flags;
import com.questrail.dxf.model.Point;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;

/**
 * A {@code SPLINE} entity.
 *
 * <p>The declared counts (groups 72-74) are kept as read; the lists hold what
 * the drawing actually contains.</p>
 */
public final class Spline extends Entity
{
    public static final String TYPE = "SPLINE";

    private Point startTangent;
    private Point endTangent;
    private Double knotTolerance;
    private Double controlPointTolerance;
    private Double fitTolerance;
    private Integer flags;
    private Integer degree;
    private Integer knotCount;
    private Integer controlPointCount;
    private Integer fitPointCount;
    private Point normal;
    private final List<ControlPoint> controlPoints = new ArrayList<>();
    private final List<Point> fitPoints = new ArrayList<>();
    private final List<Double> knots = new ArrayList<>();

    @Override
    public String type() {
        return TYPE;
    }

    public Point getStartTangent() {
        return startTangent;
    }

    public void setStartTangent(Point startTangent) {
        this.startTangent = startTangent;
    }

    public Point getEndTangent() {
        return endTangent;
    }

    public void setEndTangent(Point endTangent) {
        this.endTangent = endTangent;
    }

    public Double getKnotTolerance() {
        return knotTolerance;
    }

    public void setKnotTolerance(Double knotTolerance) {
        this.knotTolerance = knotTolerance;
    }

    public Double getControlPointTolerance() {
        return controlPointTolerance;
    }

    public void setControlPointTolerance(Double controlPointTolerance) {
        this.controlPointTolerance = controlPointTolerance;
    }

    public Double getFitTolerance() {
        return fitTolerance;
    }

    public void setFitTolerance(Double fitTolerance) {
        this.fitTolerance = fitTolerance;
    }

    public Integer getFlags() {
        return flags;
    }

    public void setFlags(Integer flags) {
        this.flags = flags;
    }

    public Integer getDegree() {
        return degree;
    }

    public void setDegree(Integer degree) {
        this.degree = degree;
    }

    public Integer getKnotCount() {
        return knotCount;
    }

    public void setKnotCount(Integer knotCount) {
        this.knotCount = knotCount;
    }

    public Integer getControlPointCount() {
        return controlPointCount;
    }

    public void setControlPointCount(Integer controlPointCount) {
        this.controlPointCount = controlPointCount;
    }

    public Integer getFitPointCount() {
        return fitPointCount;
    }

    public void setFitPointCount(Integer fitPointCount) {
        this.fitPointCount = fitPointCount;
    }

    public Point getNormal() {
        return normal;
    }

    public void setNormal(Point normal) {
        this.normal = normal;
    }

    public List<ControlPoint> getControlPoints() {
        return controlPoints;
    }

    public List<Point> getFitPoints() {
        return fitPoints;
    }

    public List<Double> getKnots() {
        return knots;
    }

    public enum Flag implements BitFlag {
        CLOSED(1),
        PERIODIC(2),
        RATIONAL(4),
        PLANAR(8),
        LINEAR(16);

        private final int mask;

        Flag(int mask) {
            this.mask = mask;
        }

        @Override
        public int mask() {
            return mask;
        }
    }

    /** A control point with its optional weight (group 41). */
    public record ControlPoint(Point point, Double weight) {
        public ControlPoint {
            Objects.requireNonNull(point, "point");
        }
    }

    public EnumSet<Flag> flagSet() {
        return Flags.decode(flags, Flag.class);
    }

    /** Linear splines are planar too, whether or not the planar bit is set. */
    public boolean isPlanar() {
        EnumSet<Flag> set = flagSet();
        return set.contains(Flag.PLANAR) || set.contains(Flag.LINEAR);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Spline that
            && commonEquals(that)
            && Objects.equals(startTangent, that.startTangent)
            && Objects.equals(endTangent, that.endTangent)
            && Objects.equals(knotTolerance, that.knotTolerance)
            && Objects.equals(controlPointTolerance, that.controlPointTolerance)
            && Objects.equals(fitTolerance, that.fitTolerance)
            && Objects.equals(flags, that.flags)
            && Objects.equals(degree, that.degree)
            && Objects.equals(knotCount, that.knotCount)
            && Objects.equals(controlPointCount, that.controlPointCount)
            && Objects.equals(fitPointCount, that.fitPointCount)
            && Objects.equals(normal, that.normal)
            && Objects.equals(controlPoints, that.controlPoints)
            && Objects.equals(fitPoints, that.fitPoints)
            && Objects.equals(knots, that.knots);
    }

    @Override
    public int hashCode() {
        return Objects.hash(commonHashCode(), startTangent, endTangent, knotTolerance, controlPointTolerance, fitTolerance, flags);
    }
}
