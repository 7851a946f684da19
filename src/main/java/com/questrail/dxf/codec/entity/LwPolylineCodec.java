package com.questrail.dxf.codec.entity;

import com.questrail.dxf.MalformedPointException;
import com.questrail.dxf.codec.AbstractEntityCodec;
import com.questrail.dxf.codec.GroupWriter;
import com.questrail.dxf.codec.ParseContext;
import com.questrail.dxf.codec.RecordSchema;
import com.questrail.dxf.model.entity.LwPolyline;
import com.questrail.dxf.scan.Group;
import com.questrail.dxf.scan.GroupScanner;

/**
 * {@code LWPOLYLINE}.
 *
 * <p>The vertices form one run starting at the first code 10: codes 20, 30, 40,
 * 41 and 42 belong to the current vertex, a repeated 10 starts the next one and
 * any other code ends the run (it is pushed back for the entity loop). The
 * declared vertex count (90) is only compared with what was read.</p>
 */
public final class LwPolylineCodec extends AbstractEntityCodec<LwPolyline>
{
    private static final RecordSchema<LwPolyline> SCHEMA = RecordSchema.<LwPolyline>builder()
        .integer(90, LwPolyline::getVertexCount, LwPolyline::setVertexCount)
        .integer(70, LwPolyline::getFlags, LwPolyline::setFlags)
        .real(43, LwPolyline::getConstantWidth, LwPolyline::setConstantWidth)
        .real(38, LwPolyline::getElevation, LwPolyline::setElevation)
        .real(39, LwPolyline::getThickness, LwPolyline::setThickness)
        .point(210, LwPolyline::getExtrusion, LwPolyline::setExtrusion)
        .build();

    public LwPolylineCodec() {
        super(LwPolyline.TYPE, LwPolyline.class);
    }

    @Override
    protected LwPolyline newEntity() {
        return new LwPolyline();
    }

    @Override
    protected RecordSchema<LwPolyline> schema() {
        return SCHEMA;
    }

    @Override
    protected boolean readSpecial(LwPolyline polyline, Group group, ParseContext context) {
        if (group.code() != 10) {
            return false;
        }
        readVertices(polyline, group, context.scanner());
        return true;
    }

    private static void readVertices(LwPolyline polyline, Group first, GroupScanner scanner) {
        VertexBuilder vertex = new VertexBuilder(first.real());
        while (true) {
            Group group = scanner.next();
            switch (group.code()) {
                case 10 -> {
                    polyline.getVertices().add(vertex.build(10));
                    vertex = new VertexBuilder(group.real());
                }
                case 20 -> vertex.y = group.real();
                case 30 -> vertex.z = group.real();
                case 40 -> vertex.startWidth = group.real();
                case 41 -> vertex.endWidth = group.real();
                case 42 -> vertex.bulge = group.real();
                default -> {
                    scanner.rewind();
                    polyline.getVertices().add(vertex.build(group.code()));
                    return;
                }
            }
        }
    }

    @Override
    protected void afterRead(LwPolyline polyline, ParseContext context) {
        context.checkCount(LwPolyline.TYPE, "vertices", polyline.getVertexCount(), polyline.getVertices().size());
    }

    @Override
    protected void writeSpecial(LwPolyline polyline, GroupWriter out) {
        for (LwPolyline.Vertex vertex : polyline.getVertices()) {
            out.real(10, vertex.getX());
            out.real(20, vertex.getY());
            if (vertex.getZ() != null) {
                out.real(30, vertex.getZ());
            }
            if (vertex.getStartWidth() != null) {
                out.real(40, vertex.getStartWidth());
            }
            if (vertex.getEndWidth() != null) {
                out.real(41, vertex.getEndWidth());
            }
            if (vertex.getBulge() != null) {
                out.real(42, vertex.getBulge());
            }
        }
    }

    private static final class VertexBuilder
    {
        private final double x;
        private Double y;
        private Double z;
        private Double startWidth;
        private Double endWidth;
        private Double bulge;

        private VertexBuilder(double x) {
            this.x = x;
        }

        private LwPolyline.Vertex build(int nextCode) {
            if (y == null) {
                throw new MalformedPointException(20, nextCode);
            }
            LwPolyline.Vertex vertex = new LwPolyline.Vertex(x, y);
            vertex.setZ(z);
            vertex.setStartWidth(startWidth);
            vertex.setEndWidth(endWidth);
            vertex.setBulge(bulge);
            return vertex;
        }
    }
}
