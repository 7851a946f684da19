package com.questrail.dxf.codec.entity;

import com.questrail.dxf.codec.AbstractEntityCodec;
import com.questrail.dxf.codec.RecordSchema;
import com.questrail.dxf.model.entity.AttributeDefinition;

public final class AttributeDefinitionCodec extends AbstractEntityCodec<AttributeDefinition>
{
    private static final RecordSchema<AttributeDefinition> SCHEMA = RecordSchema.<AttributeDefinition>builder()
        .real(39, AttributeDefinition::getThickness, AttributeDefinition::setThickness)
        .point(10, AttributeDefinition::getStartPoint, AttributeDefinition::setStartPoint)
        .real(40, AttributeDefinition::getTextHeight, AttributeDefinition::setTextHeight)
        .text(1, AttributeDefinition::getDefaultValue, AttributeDefinition::setDefaultValue)
        .real(50, AttributeDefinition::getRotation, AttributeDefinition::setRotation)
        .real(41, AttributeDefinition::getScale, AttributeDefinition::setScale)
        .real(51, AttributeDefinition::getObliqueAngle, AttributeDefinition::setObliqueAngle)
        .text(7, AttributeDefinition::getTextStyle, AttributeDefinition::setTextStyle)
        .integer(71, AttributeDefinition::getTextGenerationFlags, AttributeDefinition::setTextGenerationFlags)
        .integer(72, AttributeDefinition::getHorizontalJustification, AttributeDefinition::setHorizontalJustification)
        .point(11, AttributeDefinition::getAlignmentPoint, AttributeDefinition::setAlignmentPoint)
        .point(210, AttributeDefinition::getExtrusion, AttributeDefinition::setExtrusion)
        .text(3, AttributeDefinition::getPrompt, AttributeDefinition::setPrompt)
        .text(2, AttributeDefinition::getTag, AttributeDefinition::setTag)
        .integer(70, AttributeDefinition::getAttributeFlags, AttributeDefinition::setAttributeFlags)
        .integer(73, AttributeDefinition::getFieldLength, AttributeDefinition::setFieldLength)
        .integer(74, AttributeDefinition::getVerticalJustification, AttributeDefinition::setVerticalJustification)
        .build();

    public AttributeDefinitionCodec() {
        super(AttributeDefinition.TYPE, AttributeDefinition.class);
    }

    @Override
    protected AttributeDefinition newEntity() {
        return new AttributeDefinition();
    }

    @Override
    protected RecordSchema<AttributeDefinition> schema() {
        return SCHEMA;
    }
}
