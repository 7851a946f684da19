package com.questrail.dxf.codec.entity;

import com.questrail.dxf.codec.AbstractEntityCodec;
import com.questrail.dxf.codec.RecordSchema;
import com.questrail.dxf.model.entity.Insert;

/**
 * {@code INSERT}. Attributes that follow an insert ({@code 66} set) are
 * separate {@code ATTRIB} records and are not part of this entity.
 */
public final class InsertCodec extends AbstractEntityCodec<Insert>
{
    private static final RecordSchema<Insert> SCHEMA = RecordSchema.<Insert>builder()
        .text(2, Insert::getBlockName, Insert::setBlockName)
        .point(10, Insert::getPosition, Insert::setPosition)
        .real(41, Insert::getXScale, Insert::setXScale)
        .real(42, Insert::getYScale, Insert::setYScale)
        .real(43, Insert::getZScale, Insert::setZScale)
        .real(50, Insert::getRotation, Insert::setRotation)
        .integer(70, Insert::getColumnCount, Insert::setColumnCount)
        .integer(71, Insert::getRowCount, Insert::setRowCount)
        .real(44, Insert::getColumnSpacing, Insert::setColumnSpacing)
        .real(45, Insert::getRowSpacing, Insert::setRowSpacing)
        .point(210, Insert::getExtrusion, Insert::setExtrusion)
        .build();

    public InsertCodec() {
        super(Insert.TYPE, Insert.class);
    }

    @Override
    protected Insert newEntity() {
        return new Insert();
    }

    @Override
    protected RecordSchema<Insert> schema() {
        return SCHEMA;
    }
}
