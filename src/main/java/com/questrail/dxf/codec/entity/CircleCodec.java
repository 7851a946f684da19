package com.questrail.dxf.codec.entity;

import com.questrail.dxf.codec.AbstractEntityCodec;
import com.questrail.dxf.codec.RecordSchema;
import com.questrail.dxf.model.entity.Circle;

public final class CircleCodec extends AbstractEntityCodec<Circle>
{
    private static final RecordSchema<Circle> SCHEMA = RecordSchema.<Circle>builder()
        .real(39, Circle::getThickness, Circle::setThickness)
        .point(10, Circle::getCenter, Circle::setCenter)
        .real(40, Circle::getRadius, Circle::setRadius)
        .point(210, Circle::getExtrusion, Circle::setExtrusion)
        .build();

    public CircleCodec() {
        super(Circle.TYPE, Circle.class);
    }

    @Override
    protected Circle newEntity() {
        return new Circle();
    }

    @Override
    protected RecordSchema<Circle> schema() {
        return SCHEMA;
    }
}
