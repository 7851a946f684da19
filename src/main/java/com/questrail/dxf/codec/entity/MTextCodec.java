package com.questrail.dxf.codec.entity;

import com.questrail.dxf.codec.AbstractEntityCodec;
import com.questrail.dxf.codec.RecordSchema;
import com.questrail.dxf.model.entity.MText;

/**
 * {@code MTEXT}. The text arrives in chunks on codes 3 and 1 and is reassembled
 * in encounter order; see {@link com.questrail.dxf.codec.ChunkedText}.
 */
public final class MTextCodec extends AbstractEntityCodec<MText>
{
    private static final RecordSchema<MText> SCHEMA = RecordSchema.<MText>builder()
        .point(10, MText::getInsertionPoint, MText::setInsertionPoint)
        .real(40, MText::getHeight, MText::setHeight)
        .real(41, MText::getReferenceWidth, MText::setReferenceWidth)
        .integer(71, MText::getAttachmentPoint, MText::setAttachmentPoint)
        .integer(72, MText::getDrawingDirection, MText::setDrawingDirection)
        .chunkedText(1, 3, MText::getText, MText::setText)
        .text(7, MText::getStyle, MText::setStyle)
        .point(210, MText::getExtrusion, MText::setExtrusion)
        .point(11, MText::getDirectionVector, MText::setDirectionVector)
        .real(50, MText::getRotation, MText::setRotation)
        .integer(73, MText::getLineSpacingStyle, MText::setLineSpacingStyle)
        .real(44, MText::getLineSpacingFactor, MText::setLineSpacingFactor)
        .build();

    public MTextCodec() {
        super(MText.TYPE, MText.class);
    }

    @Override
    protected MText newEntity() {
        return new MText();
    }

    @Override
    protected RecordSchema<MText> schema() {
        return SCHEMA;
    }
}
