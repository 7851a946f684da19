package com.questrail.dxf.codec.entity;

import com.questrail.dxf.codec.AbstractEntityCodec;
import com.questrail.dxf.codec.GroupWriter;
import com.questrail.dxf.codec.ParseContext;
import com.questrail.dxf.codec.Points;
import com.questrail.dxf.codec.RecordSchema;
import com.questrail.dxf.model.Point;
import com.questrail.dxf.model.entity.Spline;
import com.questrail.dxf.scan.Group;

/**
 * {@code SPLINE}.
 *
 * <p>Each control point (10) may be followed directly by its weight (41); the
 * weight is picked up with one group of lookahead. Knots (40) and fit points
 * (11) are plain repeated groups. The declared counts 72-74 are compared with
 * the lists once the entity has been read.</p>
 */
public final class SplineCodec extends AbstractEntityCodec<Spline>
{
    private static final int CONTROL_POINT = 10;
    private static final int WEIGHT = 41;

    private static final RecordSchema<Spline> SCHEMA = RecordSchema.<Spline>builder()
        .point(210, Spline::getNormal, Spline::setNormal)
        .integer(70, Spline::getFlags, Spline::setFlags)
        .integer(71, Spline::getDegree, Spline::setDegree)
        .integer(72, Spline::getKnotCount, Spline::setKnotCount)
        .integer(73, Spline::getControlPointCount, Spline::setControlPointCount)
        .integer(74, Spline::getFitPointCount, Spline::setFitPointCount)
        .real(42, Spline::getKnotTolerance, Spline::setKnotTolerance)
        .real(43, Spline::getControlPointTolerance, Spline::setControlPointTolerance)
        .real(44, Spline::getFitTolerance, Spline::setFitTolerance)
        .point(12, Spline::getStartTangent, Spline::setStartTangent)
        .point(13, Spline::getEndTangent, Spline::setEndTangent)
        .reals(40, Spline::getKnots)
        .points(11, Spline::getFitPoints)
        .build();

    public SplineCodec() {
        super(Spline.TYPE, Spline.class);
    }

    @Override
    protected Spline newEntity() {
        return new Spline();
    }

    @Override
    protected RecordSchema<Spline> schema() {
        return SCHEMA;
    }

    @Override
    protected boolean readSpecial(Spline spline, Group group, ParseContext context) {
        if (group.code() != CONTROL_POINT) {
            return false;
        }
        Point point = Points.read(context.scanner());
        Double weight = context.scanner()
            .nextIf(code -> code == WEIGHT)
            .map(Group::real)
            .orElse(null);
        spline.getControlPoints().add(new Spline.ControlPoint(point, weight));
        return true;
    }

    @Override
    protected void afterRead(Spline spline, ParseContext context) {
        context.checkCount(Spline.TYPE, "knots", spline.getKnotCount(), spline.getKnots().size());
        context.checkCount(Spline.TYPE, "control points", spline.getControlPointCount(), spline.getControlPoints().size());
        context.checkCount(Spline.TYPE, "fit points", spline.getFitPointCount(), spline.getFitPoints().size());
    }

    @Override
    protected void writeSpecial(Spline spline, GroupWriter out) {
        for (Spline.ControlPoint controlPoint : spline.getControlPoints()) {
            out.point(CONTROL_POINT, controlPoint.point());
            if (controlPoint.weight() != null) {
                out.real(WEIGHT, controlPoint.weight());
            }
        }
    }
}
