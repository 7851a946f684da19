package com.questrail.dxf.codec.entity;

import com.questrail.dxf.codec.AbstractEntityCodec;
import com.questrail.dxf.codec.EntityCodecRegistry;
import com.questrail.dxf.codec.GroupWriter;
import com.questrail.dxf.codec.ParseContext;
import com.questrail.dxf.codec.RecordSchema;
import com.questrail.dxf.model.entity.Polyline;
import com.questrail.dxf.model.entity.SequenceEnd;
import com.questrail.dxf.model.entity.Vertex;
import com.questrail.dxf.observability.DxfWarningEvent;
import com.questrail.dxf.scan.Group;

/**
 * {@code POLYLINE}, with its trailing {@code VERTEX} records and the closing
 * {@code SEQEND}.
 *
 * <p>A {@code SEQEND} without properties is not kept; one is always written.</p>
 */
public final class PolylineCodec extends AbstractEntityCodec<Polyline>
{
    private static final RecordSchema<Polyline> SCHEMA = RecordSchema.<Polyline>builder()
        .point(10, Polyline::getElevationPoint, Polyline::setElevationPoint)
        .real(39, Polyline::getThickness, Polyline::setThickness)
        .integer(70, Polyline::getFlags, Polyline::setFlags)
        .real(40, Polyline::getDefaultStartWidth, Polyline::setDefaultStartWidth)
        .real(41, Polyline::getDefaultEndWidth, Polyline::setDefaultEndWidth)
        .integer(71, Polyline::getMeshVertexCountM, Polyline::setMeshVertexCountM)
        .integer(72, Polyline::getMeshVertexCountN, Polyline::setMeshVertexCountN)
        .integer(73, Polyline::getSmoothDensityM, Polyline::setSmoothDensityM)
        .integer(74, Polyline::getSmoothDensityN, Polyline::setSmoothDensityN)
        .integer(75, Polyline::getCurveSmoothType, Polyline::setCurveSmoothType)
        .point(210, Polyline::getExtrusion, Polyline::setExtrusion)
        .build();

    private final VertexCodec vertexCodec = new VertexCodec();
    private final SequenceEndCodec sequenceEndCodec = new SequenceEndCodec();

    public PolylineCodec() {
        super(Polyline.TYPE, Polyline.class);
    }

    @Override
    protected Polyline newEntity() {
        return new Polyline();
    }

    @Override
    protected RecordSchema<Polyline> schema() {
        return SCHEMA;
    }

    @Override
    public Polyline read(ParseContext context) {
        Polyline polyline = super.read(context);
        Group group = context.scanner().lastRead();
        while (group.isMarker(Vertex.TYPE)) {
            polyline.getVertices().add(vertexCodec.read(context));
            group = context.scanner().lastRead();
        }
        if (group.isMarker(SequenceEnd.TYPE)) {
            SequenceEnd sequenceEnd = sequenceEndCodec.read(context);
            if (!sequenceEnd.equals(new SequenceEnd())) {
                polyline.setSequenceEnd(sequenceEnd);
            }
        }
        else {
            context.warn(DxfWarningEvent.Kind.UNTERMINATED_STRUCTURE, Polyline.TYPE,
                "Vertex list ended by " + group + " instead of " + SequenceEnd.TYPE);
        }
        return polyline;
    }

    @Override
    protected void writeSpecial(Polyline polyline, GroupWriter out) {
        for (Vertex vertex : polyline.getVertices()) {
            EntityCodecRegistry.write(vertexCodec, vertex, out);
        }
        SequenceEnd sequenceEnd = polyline.getSequenceEnd();
        EntityCodecRegistry.write(sequenceEndCodec, sequenceEnd != null ? sequenceEnd : new SequenceEnd(), out);
    }
}
