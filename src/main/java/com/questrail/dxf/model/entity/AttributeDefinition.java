package com.questrail.dxf.model.entity;

import com.questrail.dxf.model.BitFlag;
import com.questrail.dxf.model.Flags;
import com.questrail.dxf.model.Point;

import java.util.EnumSet;
import java.util.Objects;

/**
 * An {@code ATTDEF} entity: the template of a block attribute.
 *
 * <p>Text style and scale fall back to {@code STANDARD} and {@code 1.0} when the
 * drawing leaves them out; the fallbacks are not written back.</p>
 */
public final class AttributeDefinition extends Entity
{
    public static final String TYPE = "ATTDEF";

    private String defaultValue;
    private String tag;
    private String prompt;
    private String textStyle;
    private Point startPoint;
    private Point alignmentPoint;
    private Double thickness;
    private Double textHeight;
    private Double scale;
    private Double rotation;
    private Double obliqueAngle;
    private Integer attributeFlags;
    private Integer textGenerationFlags;
    private Integer horizontalJustification;
    private Integer fieldLength;
    private Integer verticalJustification;
    private Point extrusion;

    @Override
    public String type() {
        return TYPE;
    }

    public String getDefaultValue() {
        return defaultValue;
    }

    public void setDefaultValue(String defaultValue) {
        this.defaultValue = defaultValue;
    }

    public String getTag() {
        return tag;
    }

    public void setTag(String tag) {
        this.tag = tag;
    }

    public String getPrompt() {
        return prompt;
    }

    public void setPrompt(String prompt) {
        this.prompt = prompt;
    }

    public String getTextStyle() {
        return textStyle;
    }

    public void setTextStyle(String textStyle) {
        this.textStyle = textStyle;
    }

    public Point getStartPoint() {
        return startPoint;
    }

    public void setStartPoint(Point startPoint) {
        this.startPoint = startPoint;
    }

    public Point getAlignmentPoint() {
        return alignmentPoint;
    }

    public void setAlignmentPoint(Point alignmentPoint) {
        this.alignmentPoint = alignmentPoint;
    }

    public Double getThickness() {
        return thickness;
    }

    public void setThickness(Double thickness) {
        this.thickness = thickness;
    }

    public Double getTextHeight() {
        return textHeight;
    }

    public void setTextHeight(Double textHeight) {
        this.textHeight = textHeight;
    }

    public Double getScale() {
        return scale;
    }

    public void setScale(Double scale) {
        this.scale = scale;
    }

    public Double getRotation() {
        return rotation;
    }

    public void setRotation(Double rotation) {
        this.rotation = rotation;
    }

    public Double getObliqueAngle() {
        return obliqueAngle;
    }

    public void setObliqueAngle(Double obliqueAngle) {
        this.obliqueAngle = obliqueAngle;
    }

    public Integer getAttributeFlags() {
        return attributeFlags;
    }

    public void setAttributeFlags(Integer attributeFlags) {
        this.attributeFlags = attributeFlags;
    }

    public Integer getTextGenerationFlags() {
        return textGenerationFlags;
    }

    public void setTextGenerationFlags(Integer textGenerationFlags) {
        this.textGenerationFlags = textGenerationFlags;
    }

    public Integer getHorizontalJustification() {
        return horizontalJustification;
    }

    public void setHorizontalJustification(Integer horizontalJustification) {
        this.horizontalJustification = horizontalJustification;
    }

    public Integer getFieldLength() {
        return fieldLength;
    }

    public void setFieldLength(Integer fieldLength) {
        this.fieldLength = fieldLength;
    }

    public Integer getVerticalJustification() {
        return verticalJustification;
    }

    public void setVerticalJustification(Integer verticalJustification) {
        this.verticalJustification = verticalJustification;
    }

    public Point getExtrusion() {
        return extrusion;
    }

    public void setExtrusion(Point extrusion) {
        this.extrusion = extrusion;
    }

    public static final String DEFAULT_TEXT_STYLE = "STANDARD";

    public enum Flag implements BitFlag {
        INVISIBLE(1),
        CONSTANT(2),
        VERIFICATION_REQUIRED(4),
        PRESET(8);

        private final int mask;

        Flag(int mask) {
            this.mask = mask;
        }

        @Override
        public int mask() {
            return mask;
        }
    }

    public EnumSet<Flag> flags() {
        return Flags.decode(attributeFlags, Flag.class);
    }

    public EnumSet<TextGenerationFlag> generation() {
        return Flags.decode(textGenerationFlags, TextGenerationFlag.class);
    }

    public String textStyleOrDefault() {
        return textStyle != null ? textStyle : DEFAULT_TEXT_STYLE;
    }

    public double scaleOrDefault() {
        return scale != null ? scale : 1.0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof AttributeDefinition that
            && commonEquals(that)
            && Objects.equals(defaultValue, that.defaultValue)
            && Objects.equals(tag, that.tag)
            && Objects.equals(prompt, that.prompt)
            && Objects.equals(textStyle, that.textStyle)
            && Objects.equals(startPoint, that.startPoint)
            && Objects.equals(alignmentPoint, that.alignmentPoint)
            && Objects.equals(thickness, that.thickness)
            && Objects.equals(textHeight, that.textHeight)
            && Objects.equals(scale, that.scale)
            && Objects.equals(rotation, that.rotation)
            && Objects.equals(obliqueAngle, that.obliqueAngle)
            && Objects.equals(attributeFlags, that.attributeFlags)
            && Objects.equals(textGenerationFlags, that.textGenerationFlags)
            && Objects.equals(horizontalJustification, that.horizontalJustification)
            && Objects.equals(fieldLength, that.fieldLength)
            && Objects.equals(verticalJustification, that.verticalJustification)
            && Objects.equals(extrusion, that.extrusion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(commonHashCode(), defaultValue, tag, prompt, textStyle, startPoint, alignmentPoint);
    }
}
