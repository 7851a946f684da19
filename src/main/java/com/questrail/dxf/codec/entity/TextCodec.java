package com.questrail.dxf.codec.entity;

import com.questrail.dxf.codec.AbstractEntityCodec;
import com.questrail.dxf.codec.RecordSchema;
import com.questrail.dxf.model.entity.Text;

public final class TextCodec extends AbstractEntityCodec<Text>
{
    private static final RecordSchema<Text> SCHEMA = RecordSchema.<Text>builder()
        .real(39, Text::getThickness, Text::setThickness)
        .point(10, Text::getStartPoint, Text::setStartPoint)
        .real(40, Text::getHeight, Text::setHeight)
        .text(1, Text::getText, Text::setText)
        .real(50, Text::getRotation, Text::setRotation)
        .real(41, Text::getWidthFactor, Text::setWidthFactor)
        .real(51, Text::getObliqueAngle, Text::setObliqueAngle)
        .text(7, Text::getStyle, Text::setStyle)
        .integer(71, Text::getGenerationFlags, Text::setGenerationFlags)
        .integer(72, Text::getHorizontalJustification, Text::setHorizontalJustification)
        .point(11, Text::getEndPoint, Text::setEndPoint)
        .point(210, Text::getExtrusion, Text::setExtrusion)
        .integer(73, Text::getVerticalJustification, Text::setVerticalJustification)
        .build();

    public TextCodec() {
        super(Text.TYPE, Text.class);
    }

    @Override
    protected Text newEntity() {
        return new Text();
    }

    @Override
    protected RecordSchema<Text> schema() {
        return SCHEMA;
    }
}
