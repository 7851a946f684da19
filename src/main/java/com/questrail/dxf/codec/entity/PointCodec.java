package com.questrail.dxf.codec.entity;

import com.questrail.dxf.codec.AbstractEntityCodec;
import com.questrail.dxf.codec.RecordSchema;
import com.questrail.dxf.model.entity.PointEntity;

public final class PointCodec extends AbstractEntityCodec<PointEntity>
{
    private static final RecordSchema<PointEntity> SCHEMA = RecordSchema.<PointEntity>builder()
        .point(10, PointEntity::getPosition, PointEntity::setPosition)
        .real(39, PointEntity::getThickness, PointEntity::setThickness)
        .integer(70, PointEntity::getFlags, PointEntity::setFlags)
        .point(210, PointEntity::getExtrusion, PointEntity::setExtrusion)
        .build();

    public PointCodec() {
        super(PointEntity.TYPE, PointEntity.class);
    }

    @Override
    protected PointEntity newEntity() {
        return new PointEntity();
    }

    @Override
    protected RecordSchema<PointEntity> schema() {
        return SCHEMA;
    }
}
