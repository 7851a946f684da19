package com.questrail.dxf.codec.entity;

import com.questrail.dxf.MalformedPointException;
import com.questrail.dxf.codec.AbstractEntityCodec;
import com.questrail.dxf.codec.GroupWriter;
import com.questrail.dxf.codec.ParseContext;
import com.questrail.dxf.codec.RecordSchema;
import com.questrail.dxf.model.Point;
import com.questrail.dxf.model.entity.Face3d;
import com.questrail.dxf.observability.DxfWarningEvent;
import com.questrail.dxf.scan.Group;
import com.questrail.dxf.scan.GroupScanner;

import java.util.List;

/**
 * {@code 3DFACE}.
 *
 * <p>Corners are read as one run of groups: an x code (10-13) opens a corner,
 * y (20-23) and z (30-33) codes fill it, and the next x code closes it and opens
 * the following one. The first code of any other kind ends the run and is
 * pushed back for the entity loop. The digit of the code is not checked against
 * the corner's position.</p>
 */
public final class Face3dCodec extends AbstractEntityCodec<Face3d>
{
    private static final RecordSchema<Face3d> SCHEMA = RecordSchema.<Face3d>builder()
        .integer(70, Face3d::getEdgeFlags, Face3d::setEdgeFlags)
        .build();

    public Face3dCodec() {
        super(Face3d.TYPE, Face3d.class);
    }

    @Override
    protected Face3d newEntity() {
        return new Face3d();
    }

    @Override
    protected RecordSchema<Face3d> schema() {
        return SCHEMA;
    }

    @Override
    protected boolean readSpecial(Face3d face, Group group, ParseContext context) {
        if (!isCornerX(group.code())) {
            return false;
        }
        readCorners(face, group, context);
        return true;
    }

    private static void readCorners(Face3d face, Group first, ParseContext context) {
        GroupScanner scanner = context.scanner();
        CornerBuilder corner = new CornerBuilder(first);
        while (true) {
            Group group = scanner.next();
            int code = group.code();
            if (isCornerX(code)) {
                add(face, corner.build(code), context);
                corner = new CornerBuilder(group);
            }
            else if (code >= 20 && code <= 23) {
                corner.y = group.real();
            }
            else if (code >= 30 && code <= 33) {
                corner.z = group.real();
            }
            else {
                scanner.rewind();
                add(face, corner.build(code), context);
                return;
            }
        }
    }

    private static void add(Face3d face, Point corner, ParseContext context) {
        List<Point> corners = face.getCorners();
        if (corners.size() == Face3d.MAX_CORNERS) {
            context.warn(DxfWarningEvent.Kind.COUNT_MISMATCH, Face3d.TYPE,
                "More than " + Face3d.MAX_CORNERS + " corners; dropped " + corner);
            return;
        }
        corners.add(corner);
    }

    private static boolean isCornerX(int code) {
        return code >= 10 && code <= 13;
    }

    @Override
    protected void writeSpecial(Face3d face, GroupWriter out) {
        List<Point> corners = face.getCorners();
        for (int i = 0; i < corners.size() && i < Face3d.MAX_CORNERS; i++) {
            out.point(10 + i, corners.get(i));
        }
    }

    private static final class CornerBuilder
    {
        private final int xCode;
        private final double x;
        private Double y;
        private Double z;

        private CornerBuilder(Group xGroup) {
            this.xCode = xGroup.code();
            this.x = xGroup.real();
        }

        private Point build(int nextCode) {
            if (y == null) {
                throw new MalformedPointException(xCode + 10, nextCode);
            }
            return z != null ? Point.of(x, y, z) : Point.of(x, y);
        }
    }
}
