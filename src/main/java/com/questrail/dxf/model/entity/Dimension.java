package com.questrail.dxf.model.entity;

import com.questrail.dxf.model.Point;

import java.util.Objects;

/**
 * A {@code DIMENSION} entity. The geometry of the dimension itself is drawn by
 * the anonymous block named in {@link #getBlockName()}.
 */
public final class Dimension extends Entity
{
    public static final String TYPE = "DIMENSION";

    private String text;
    private String blockName;
    private String styleName;
    private Point definitionPoint;
    private Point textMidpoint;
    private Point insertionPoint;
    private Point firstDefinitionPoint;
    private Point secondDefinitionPoint;
    private Point arcDefinitionPoint;
    private Point arcLocationPoint;
    private Double actualMeasurement;
    private Double angle;
    private Double textRotation;
    private Integer dimensionType;
    private Integer attachmentPoint;
    private Point extrusion;

    @Override
    public String type() {
        return TYPE;
    }

    /** Override text (group 1); {@code <>} stands for the measurement. */
    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public String getBlockName() {
        return blockName;
    }

    public void setBlockName(String blockName) {
        this.blockName = blockName;
    }

    public String getStyleName() {
        return styleName;
    }

    public void setStyleName(String styleName) {
        this.styleName = styleName;
    }

    public Point getDefinitionPoint() {
        return definitionPoint;
    }

    public void setDefinitionPoint(Point definitionPoint) {
        this.definitionPoint = definitionPoint;
    }

    public Point getTextMidpoint() {
        return textMidpoint;
    }

    public void setTextMidpoint(Point textMidpoint) {
        this.textMidpoint = textMidpoint;
    }

    public Point getInsertionPoint() {
        return insertionPoint;
    }

    public void setInsertionPoint(Point insertionPoint) {
        this.insertionPoint = insertionPoint;
    }

    public Point getFirstDefinitionPoint() {
        return firstDefinitionPoint;
    }

    public void setFirstDefinitionPoint(Point firstDefinitionPoint) {
        this.firstDefinitionPoint = firstDefinitionPoint;
    }

    public Point getSecondDefinitionPoint() {
        return secondDefinitionPoint;
    }

    public void setSecondDefinitionPoint(Point secondDefinitionPoint) {
        this.secondDefinitionPoint = secondDefinitionPoint;
    }

    public Point getArcDefinitionPoint() {
        return arcDefinitionPoint;
    }

    public void setArcDefinitionPoint(Point arcDefinitionPoint) {
        this.arcDefinitionPoint = arcDefinitionPoint;
    }

    public Point getArcLocationPoint() {
        return arcLocationPoint;
    }

    public void setArcLocationPoint(Point arcLocationPoint) {
        this.arcLocationPoint = arcLocationPoint;
    }

    public Double getActualMeasurement() {
        return actualMeasurement;
    }

    public void setActualMeasurement(Double actualMeasurement) {
        this.actualMeasurement = actualMeasurement;
    }

    public Double getAngle() {
        return angle;
    }

    public void setAngle(Double angle) {
        this.angle = angle;
    }

    public Double getTextRotation() {
        return textRotation;
    }

    public void setTextRotation(Double textRotation) {
        this.textRotation = textRotation;
    }

    public Integer getDimensionType() {
        return dimensionType;
    }

    public void setDimensionType(Integer dimensionType) {
        this.dimensionType = dimensionType;
    }

    public Integer getAttachmentPoint() {
        return attachmentPoint;
    }

    public void setAttachmentPoint(Integer attachmentPoint) {
        this.attachmentPoint = attachmentPoint;
    }

    public Point getExtrusion() {
        return extrusion;
    }

    public void setExtrusion(Point extrusion) {
        this.extrusion = extrusion;
    }

    /** Dimension kind without the flag bits above 7 (group 70). */
    public Integer baseDimensionType() {
        return dimensionType == null ? null : dimensionType & 0x07;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Dimension that
            && commonEquals(that)
            && Objects.equals(text, that.text)
            && Objects.equals(blockName, that.blockName)
            && Objects.equals(styleName, that.styleName)
            && Objects.equals(definitionPoint, that.definitionPoint)
            && Objects.equals(textMidpoint, that.textMidpoint)
            && Objects.equals(insertionPoint, that.insertionPoint)
            && Objects.equals(firstDefinitionPoint, that.firstDefinitionPoint)
            && Objects.equals(secondDefinitionPoint, that.secondDefinitionPoint)
            && Objects.equals(arcDefinitionPoint, that.arcDefinitionPoint)
            && Objects.equals(arcLocationPoint, that.arcLocationPoint)
            && Objects.equals(actualMeasurement, that.actualMeasurement)
            && Objects.equals(angle, that.angle)
            && Objects.equals(textRotation, that.textRotation)
            && Objects.equals(dimensionType, that.dimensionType)
            && Objects.equals(attachmentPoint, that.attachmentPoint)
            && Objects.equals(extrusion, that.extrusion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(commonHashCode(), text, blockName, styleName, definitionPoint, textMidpoint, insertionPoint);
    }
}
