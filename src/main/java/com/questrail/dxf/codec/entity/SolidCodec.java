package com.questrail.dxf.codec.entity;

import com.questrail.dxf.codec.AbstractEntityCodec;
import com.questrail.dxf.codec.RecordSchema;
import com.questrail.dxf.model.entity.Solid;

public final class SolidCodec extends AbstractEntityCodec<Solid>
{
    private static final RecordSchema<Solid> SCHEMA = RecordSchema.<Solid>builder()
        .point(10, Solid::getFirstCorner, Solid::setFirstCorner)
        .point(11, Solid::getSecondCorner, Solid::setSecondCorner)
        .point(12, Solid::getThirdCorner, Solid::setThirdCorner)
        .point(13, Solid::getFourthCorner, Solid::setFourthCorner)
        .real(39, Solid::getThickness, Solid::setThickness)
        .point(210, Solid::getExtrusion, Solid::setExtrusion)
        .build();

    public SolidCodec() {
        super(Solid.TYPE, Solid.class);
    }

    @Override
    protected Solid newEntity() {
        return new Solid();
    }

    @Override
    protected RecordSchema<Solid> schema() {
        return SCHEMA;
    }
}
