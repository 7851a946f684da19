package com.questrail.dxf.model.entity;

import com.questrail.dxf.model.Point;

import java.util.Objects;

/**
 * A multi-line {@code MTEXT} entity.
 *
 * <p>The text is kept whole. It is split into chunks of at most 250 characters
 * only when written.</p>
 */
public final class MText extends Entity
{
    public static final String TYPE = "MTEXT";

    private String text;
    private String style;
    private Point insertionPoint;
    private Point directionVector;
    private Double height;
    private Double referenceWidth;
    private Double rotation;
    private Double lineSpacingFactor;
    private Integer attachmentPoint;
    private Integer drawingDirection;
    private Integer lineSpacingStyle;
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

    public Point getInsertionPoint() {
        return insertionPoint;
    }

    public void setInsertionPoint(Point insertionPoint) {
        this.insertionPoint = insertionPoint;
    }

    public Point getDirectionVector() {
        return directionVector;
    }

    public void setDirectionVector(Point directionVector) {
        this.directionVector = directionVector;
    }

    public Double getHeight() {
        return height;
    }

    public void setHeight(Double height) {
        this.height = height;
    }

    public Double getReferenceWidth() {
        return referenceWidth;
    }

    public void setReferenceWidth(Double referenceWidth) {
        this.referenceWidth = referenceWidth;
    }

    public Double getRotation() {
        return rotation;
    }

    public void setRotation(Double rotation) {
        this.rotation = rotation;
    }

    public Double getLineSpacingFactor() {
        return lineSpacingFactor;
    }

    public void setLineSpacingFactor(Double lineSpacingFactor) {
        this.lineSpacingFactor = lineSpacingFactor;
    }

    /** 1 top left through 9 bottom right (group 71). */
    public Integer getAttachmentPoint() {
        return attachmentPoint;
    }

    public void setAttachmentPoint(Integer attachmentPoint) {
        this.attachmentPoint = attachmentPoint;
    }

    public Integer getDrawingDirection() {
        return drawingDirection;
    }

    public void setDrawingDirection(Integer drawingDirection) {
        this.drawingDirection = drawingDirection;
    }

    public Integer getLineSpacingStyle() {
        return lineSpacingStyle;
    }

    public void setLineSpacingStyle(Integer lineSpacingStyle) {
        this.lineSpacingStyle = lineSpacingStyle;
    }

    public Point getExtrusion() {
        return extrusion;
    }

    public void setExtrusion(Point extrusion) {
        this.extrusion = extrusion;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof MText that
            && commonEquals(that)
            && Objects.equals(text, that.text)
            && Objects.equals(style, that.style)
            && Objects.equals(insertionPoint, that.insertionPoint)
            && Objects.equals(directionVector, that.directionVector)
            && Objects.equals(height, that.height)
            && Objects.equals(referenceWidth, that.referenceWidth)
            && Objects.equals(rotation, that.rotation)
            && Objects.equals(lineSpacingFactor, that.lineSpacingFactor)
            && Objects.equals(attachmentPoint, that.attachmentPoint)
            && Objects.equals(drawingDirection, that.drawingDirection)
            && Objects.equals(lineSpacingStyle, that.lineSpacingStyle)
            && Objects.equals(extrusion, that.extrusion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(commonHashCode(), text, style, insertionPoint, directionVector, height, referenceWidth);
    }
}
