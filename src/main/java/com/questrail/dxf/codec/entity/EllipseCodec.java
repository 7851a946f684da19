package com.questrail.dxf.codec.entity;

import com.questrail.dxf.codec.AbstractEntityCodec;
import com.questrail.dxf.codec.RecordSchema;
import com.questrail.dxf.model.entity.Ellipse;

public final class EllipseCodec extends AbstractEntityCodec<Ellipse>
{
    private static final RecordSchema<Ellipse> SCHEMA = RecordSchema.<Ellipse>builder()
        .point(10, Ellipse::getCenter, Ellipse::setCenter)
        .point(11, Ellipse::getMajorAxisEndPoint, Ellipse::setMajorAxisEndPoint)
        .point(210, Ellipse::getExtrusion, Ellipse::setExtrusion)
        .real(40, Ellipse::getAxisRatio, Ellipse::setAxisRatio)
        .real(41, Ellipse::getStartParameter, Ellipse::setStartParameter)
        .real(42, Ellipse::getEndParameter, Ellipse::setEndParameter)
        .build();

    public EllipseCodec() {
        super(Ellipse.TYPE, Ellipse.class);
    }

    @Override
    protected Ellipse newEntity() {
        return new Ellipse();
    }

    @Override
    protected RecordSchema<Ellipse> schema() {
        return SCHEMA;
    }
}
