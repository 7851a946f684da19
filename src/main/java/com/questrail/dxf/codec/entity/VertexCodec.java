package com.questrail.dxf.codec.entity;

import com.questrail.dxf.codec.AbstractEntityCodec;
import com.questrail.dxf.codec.RecordSchema;
import com.questrail.dxf.model.entity.Vertex;

/**
 * {@code VERTEX} records of a heavy polyline. Used by {@link PolylineCodec}; a
 * vertex outside a polyline is not an entity of its own.
 */
public final class VertexCodec extends AbstractEntityCodec<Vertex>
{
    private static final RecordSchema<Vertex> SCHEMA = RecordSchema.<Vertex>builder()
        .point(10, Vertex::getLocation, Vertex::setLocation)
        .real(40, Vertex::getStartWidth, Vertex::setStartWidth)
        .real(41, Vertex::getEndWidth, Vertex::setEndWidth)
        .real(42, Vertex::getBulge, Vertex::setBulge)
        .integer(70, Vertex::getFlags, Vertex::setFlags)
        .real(50, Vertex::getCurveFitTangentDirection, Vertex::setCurveFitTangentDirection)
        .integer(71, Vertex::getFirstFaceIndex, Vertex::setFirstFaceIndex)
        .integer(72, Vertex::getSecondFaceIndex, Vertex::setSecondFaceIndex)
        .integer(73, Vertex::getThirdFaceIndex, Vertex::setThirdFaceIndex)
        .integer(74, Vertex::getFourthFaceIndex, Vertex::setFourthFaceIndex)
        .build();

    public VertexCodec() {
        super(Vertex.TYPE, Vertex.class);
    }

    @Override
    protected Vertex newEntity() {
        return new Vertex();
    }

    @Override
    protected RecordSchema<Vertex> schema() {
        return SCHEMA;
    }
}
