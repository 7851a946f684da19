package com.questrail.dxf.model.entity;

import com.questrail.dxf.model.Flags;
import com.questrail.dxf.model.Point;

import java.util.EnumSet;
import java.util.Objects;

/**
 * A single-line {@code TEXT} entity.
 */
public final class Text extends Entity
{
    public static final String TYPE = "TEXT";

    private String text;
    private String style;
    private Point startPoint;
    private Point endPoint;
    private Double thickness;
    private Double height;
    private Double widthFactor;
    private Double rotation;
    private Double obliqueAngle;
    private Integer generationFlags;
    private Integer horizontalJustification;
    private Integer verticalJustification;
    private Point extrusion;

    @Override
    public String type() {
        return TYPE;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public String getStyle() {
        return style;
    }

    public void setStyle(String style) {
        this.style = style;
    }

    public Point getStartPoint() {
        return startPoint;
    }

    public void setStartPoint(Point startPoint) {
        this.startPoint = startPoint;
    }

    /** Second alignment point (group 11), used for justified text. */
    public Point getEndPoint() {
        return endPoint;
    }

    public void setEndPoint(Point endPoint) {
        this.endPoint = endPoint;
    }

    public Double getThickness() {
        return thickness;
    }

    public void setThickness(Double thickness) {
        this.thickness = thickness;
    }

    public Double getHeight() {
        return height;
    }

    public void setHeight(Double height) {
        this.height = height;
    }

    public Double getWidthFactor() {
        return widthFactor;
    }

    public void setWidthFactor(Double widthFactor) {
        this.widthFactor = widthFactor;
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

    public Integer getGenerationFlags() {
        return generationFlags;
    }

    public void setGenerationFlags(Integer generationFlags) {
        this.generationFlags = generationFlags;
    }

    public Integer getHorizontalJustification() {
        return horizontalJustification;
    }

    public void setHorizontalJustification(Integer horizontalJustification) {
        this.horizontalJustification = horizontalJustification;
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

    public EnumSet<TextGenerationFlag> generation() {
        return Flags.decode(generationFlags, TextGenerationFlag.class);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Text that
            && commonEquals(that)
            && Objects.equals(text, that.text)
            && Objects.equals(style, that.style)
            && Objects.equals(startPoint, that.startPoint)
            && Objects.equals(endPoint, that.endPoint)
            && Objects.equals(thickness, that.thickness)
            && Objects.equals(height, that.height)
            && Objects.equals(widthFactor, that.widthFactor)
            && Objects.equals(rotation, that.rotation)
            && Objects.equals(obliqueAngle, that.obliqueAngle)
            && Objects.equals(generationFlags, that.generationFlags)
            && Objects.equals(horizontalJustification, that.horizontalJustification)
            && Objects.equals(verticalJustification, that.verticalJustification)
            && Objects.equals(extrusion, that.extrusion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(commonHashCode(), text, style, startPoint, endPoint, thickness, height);
    }
}
