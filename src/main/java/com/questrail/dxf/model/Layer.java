package com.questrail.dxf.model;

import java.util.EnumSet;
import java.util.Objects;

/**
 * A {@code LAYER} table record.
 *
 * <p>The color index is kept as read: a negative index means the layer is
 * off, and its absolute value is the color.</p>
 */
public final class Layer extends TableEntry
{
    public static final String TYPE = "LAYER";

    private String lineType;
    private Integer colorIndex;
    private Boolean plot;
    private Integer lineweight;
    private String plotStyleHandle;
    private String materialHandle;
    private String visualStyleHandle;
    private Integer trueColor;

    @Override
    public String type() {
        return TYPE;
    }

    public String getLineType() {
        return lineType;
    }

    public void setLineType(String lineType) {
        this.lineType = lineType;
    }

    public Integer getColorIndex() {
        return colorIndex;
    }

    public void setColorIndex(Integer colorIndex) {
        this.colorIndex = colorIndex;
    }

    /** Whether the layer is plotted (group 290). */
    public Boolean getPlot() {
        return plot;
    }

    public void setPlot(Boolean plot) {
        this.plot = plot;
    }

    public Integer getLineweight() {
        return lineweight;
    }

    public void setLineweight(Integer lineweight) {
        this.lineweight = lineweight;
    }

    public String getPlotStyleHandle() {
        return plotStyleHandle;
    }

    public void setPlotStyleHandle(String plotStyleHandle) {
        this.plotStyleHandle = plotStyleHandle;
    }

    public String getMaterialHandle() {
        return materialHandle;
    }

    public void setMaterialHandle(String materialHandle) {
        this.materialHandle = materialHandle;
    }

    public String getVisualStyleHandle() {
        return visualStyleHandle;
    }

    public void setVisualStyleHandle(String visualStyleHandle) {
        this.visualStyleHandle = visualStyleHandle;
    }

    public Integer getTrueColor() {
        return trueColor;
    }

    public void setTrueColor(Integer trueColor) {
        this.trueColor = trueColor;
    }

    public enum Flag implements BitFlag
    {
        FROZEN(1),
        FROZEN_IN_NEW_VIEWPORTS(2),
        LOCKED(4);

        private final int mask;

        Flag(int mask) {
            this.mask = mask;
        }

        @Override
        public int mask() {
            return mask;
        }
    }

    public EnumSet<Flag> flagSet() {
        return Flags.decode(getFlags(), Flag.class);
    }

    /** Off layers carry a negative color index; a layer without a color is on. */
    public boolean isVisible() {
        return colorIndex == null || colorIndex >= 0;
    }

    public boolean isFrozen() {
        EnumSet<Flag> flags = flagSet();
        return flags.contains(Flag.FROZEN) || flags.contains(Flag.FROZEN_IN_NEW_VIEWPORTS);
    }

    public boolean isLocked() {
        return flagSet().contains(Flag.LOCKED);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Layer that
            && entryEquals(that)
            && Objects.equals(lineType, that.lineType)
            && Objects.equals(colorIndex, that.colorIndex)
            && Objects.equals(plot, that.plot)
            && Objects.equals(lineweight, that.lineweight)
            && Objects.equals(plotStyleHandle, that.plotStyleHandle)
            && Objects.equals(materialHandle, that.materialHandle)
            && Objects.equals(visualStyleHandle, that.visualStyleHandle)
            && Objects.equals(trueColor, that.trueColor);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entryHashCode(), lineType, colorIndex, plot, lineweight, plotStyleHandle, materialHandle);
    }
}
