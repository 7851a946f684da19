package com.questrail.dxf.codec.entity;

import com.questrail.dxf.codec.AbstractEntityCodec;
import com.questrail.dxf.codec.RecordSchema;
import com.questrail.dxf.model.entity.Arc;

/**
 * {@code ARC}: the circle fields plus start (50) and end (51) angles. The angle
 * length is derived on the model and never written.
 */
public final class ArcCodec extends AbstractEntityCodec<Arc>
{
    private static final RecordSchema<Arc> SCHEMA = RecordSchema.<Arc>builder()
        .real(39, Arc::getThickness, Arc::setThickness)
        .point(10, Arc::getCenter, Arc::setCenter)
        .real(40, Arc::getRadius, Arc::setRadius)
        .point(210, Arc::getExtrusion, Arc::setExtrusion)
        .real(50, Arc::getStartAngle, Arc::setStartAngle)
        .real(51, Arc::getEndAngle, Arc::setEndAngle)
        .build();

    public ArcCodec() {
        super(Arc.TYPE, Arc.class);
    }

    @Override
    protected Arc newEntity() {
        return new Arc();
    }

    @Override
    protected RecordSchema<Arc> schema() {
        return SCHEMA;
    }
}
