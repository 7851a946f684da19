package com.questrail.dxf.model.entity;

import com.questrail.dxf.model.Point;

import java.util.Objects;

/**
 * An {@code INSERT} entity: a placed reference to a block definition.
 */
public final class Insert extends Entity
{
    public static final String TYPE = "INSERT";

    private String blockName;
    private Point position;
    private Double xScale;
    private Double yScale;
    private Double zScale;
    private Double columnSpacing;
    private Double rowSpacing;
    private Double rotation;
    private Integer columnCount;
    private Integer rowCount;
    private Point extrusion;

    @Override
    public String type() {
        return TYPE;
    }

    public String getBlockName() {
        return blockName;
    }

    public void setBlockName(String blockName) {
        this.blockName = blockName;
    }

    public Point getPosition() {
        return position;
    }

    public void setPosition(Point position) {
        this.position = position;
    }

    public Double getXScale() {
        return xScale;
    }

    public void setXScale(Double xScale) {
        this.xScale = xScale;
    }

    public Double getYScale() {
        return yScale;
    }

    public void setYScale(Double yScale) {
        this.yScale = yScale;
    }

    public Double getZScale() {
        return zScale;
    }

    public void setZScale(Double zScale) {
        this.zScale = zScale;
    }

    public Double getColumnSpacing() {
        return columnSpacing;
    }

    public void setColumnSpacing(Double columnSpacing) {
        this.columnSpacing = columnSpacing;
    }

    public Double getRowSpacing() {
        return rowSpacing;
    }

    public void setRowSpacing(Double rowSpacing) {
        this.rowSpacing = rowSpacing;
    }

    public Double getRotation() {
        return rotation;
    }

    public void setRotation(Double rotation) {
        this.rotation = rotation;
    }

    public Integer getColumnCount() {
        return columnCount;
    }

    public void setColumnCount(Integer columnCount) {
        this.columnCount = columnCount;
    }

    public Integer getRowCount() {
        return rowCount;
    }

    public void setRowCount(Integer rowCount) {
        this.rowCount = rowCount;
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
        return o instanceof Insert that
            && commonEquals(that)
            && Objects.equals(blockName, that.blockName)
            && Objects.equals(position, that.position)
            && Objects.equals(xScale, that.xScale)
            && Objects.equals(yScale, that.yScale)
            && Objects.equals(zScale, that.zScale)
            && Objects.equals(columnSpacing, that.columnSpacing)
            && Objects.equals(rowSpacing, that.rowSpacing)
            && Objects.equals(rotation, that.rotation)
            && Objects.equals(columnCount, that.columnCount)
            && Objects.equals(rowCount, that.rowCount)
            && Objects.equals(extrusion, that.extrusion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(commonHashCode(), blockName, position, xScale, yScale, zScale, columnSpacing);
    }
}
