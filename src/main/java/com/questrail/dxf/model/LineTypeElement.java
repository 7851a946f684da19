package com.questrail.dxf.model;

import java.util.Objects;

/**
 * One dash, dot, space, or embedded shape/text of a line type pattern.
 */
public final class LineTypeElement
{
    private Double length;
    private Integer elementType;
    private Integer shapeNumber;
    private String styleHandle;
    private Double scale;
    private Double rotation;
    private Double xOffset;
    private Double yOffset;
    private String text;

    /** Dash length (group 49); negative for a space, 0 for a dot. */
    public Double getLength() {
        return length;
    }

    public void setLength(Double length) {
        this.length = length;
    }

    /** Complex element flags (group 74); 0 for a plain dash. */
    public Integer getElementType() {
        return elementType;
    }

    public void setElementType(Integer elementType) {
        this.elementType = elementType;
    }

    public Integer getShapeNumber() {
        return shapeNumber;
    }

    public void setShapeNumber(Integer shapeNumber) {
        this.shapeNumber = shapeNumber;
    }

    public String getStyleHandle() {
        return styleHandle;
    }

    public void setStyleHandle(String styleHandle) {
        this.styleHandle = styleHandle;
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

    public Double getXOffset() {
        return xOffset;
    }

    public void setXOffset(Double xOffset) {
        this.xOffset = xOffset;
    }

    public Double getYOffset() {
        return yOffset;
    }

    public void setYOffset(Double yOffset) {
        this.yOffset = yOffset;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof LineTypeElement that
            && Objects.equals(length, that.length)
            && Objects.equals(elementType, that.elementType)
            && Objects.equals(shapeNumber, that.shapeNumber)
            && Objects.equals(styleHandle, that.styleHandle)
            && Objects.equals(scale, that.scale)
            && Objects.equals(rotation, that.rotation)
            && Objects.equals(xOffset, that.xOffset)
            && Objects.equals(yOffset, that.yOffset)
            && Objects.equals(text, that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(length, elementType, shapeNumber, styleHandle, scale, rotation);
    }
}
