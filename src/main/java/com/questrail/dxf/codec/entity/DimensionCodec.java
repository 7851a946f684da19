package com.questrail.dxf.codec.entity;

import com.questrail.dxf.codec.AbstractEntityCodec;
import com.questrail.dxf.codec.RecordSchema;
import com.questrail.dxf.model.entity.Dimension;

/**
 * {@code DIMENSION}. Only the fields common to all dimension subtypes; the
 * points 13-16 mean different things per subtype and are kept positionally.
 */
public final class DimensionCodec extends AbstractEntityCodec<Dimension>
{
    private static final RecordSchema<Dimension> SCHEMA = RecordSchema.<Dimension>builder()
        .text(2, Dimension::getBlockName, Dimension::setBlockName)
        .point(10, Dimension::getDefinitionPoint, Dimension::setDefinitionPoint)
        .point(11, Dimension::getTextMidpoint, Dimension::setTextMidpoint)
        .point(12, Dimension::getInsertionPoint, Dimension::setInsertionPoint)
        .integer(70, Dimension::getDimensionType, Dimension::setDimensionType)
        .integer(71, Dimension::getAttachmentPoint, Dimension::setAttachmentPoint)
        .real(42, Dimension::getActualMeasurement, Dimension::setActualMeasurement)
        .text(1, Dimension::getText, Dimension::setText)
        .real(53, Dimension::getTextRotation, Dimension::setTextRotation)
        .point(210, Dimension::getExtrusion, Dimension::setExtrusion)
        .text(3, Dimension::getStyleName, Dimension::setStyleName)
        .point(13, Dimension::getFirstDefinitionPoint, Dimension::setFirstDefinitionPoint)
        .point(14, Dimension::getSecondDefinitionPoint, Dimension::setSecondDefinitionPoint)
        .point(15, Dimension::getArcDefinitionPoint, Dimension::setArcDefinitionPoint)
        .point(16, Dimension::getArcLocationPoint, Dimension::setArcLocationPoint)
        .real(50, Dimension::getAngle, Dimension::setAngle)
        .build();

    public DimensionCodec() {
        super(Dimension.TYPE, Dimension.class);
    }

    @Override
    protected Dimension newEntity() {
        return new Dimension();
    }

    @Override
    protected RecordSchema<Dimension> schema() {
        return SCHEMA;
    }
}
