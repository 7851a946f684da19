package com.questrail.dxf.model.entity;

import com.questrail.dxf.model.ApplicationGroup;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Entity
 * -----------------------------------------------------------------------------
 * Base of every graphical entity. Holds the properties common to all kinds
 * (handle, layer, color, line type...). Kind-specific fields live in the
 * subclasses.
 *
 * <p>Every optional property is {@code null} until set; an unset property is not
 * written. Hosts adding their own kinds through
 * {@link com.questrail.dxf.codec.EntityCodec} extend this class.</p>
 */
public abstract class Entity
{
    private String handle;
    private String lineType;
    private String layer;
    private Double lineTypeScale;
    private Boolean visible;
    private Integer colorIndex;
    private Boolean entitiesFollow;
    private Boolean inPaperSpace;
    private String ownerHandle;
    private String materialHandle;
    private Integer lineweight;
    private Integer trueColor;
    private final List<ApplicationGroup> applicationGroups = new ArrayList<>();

    /** The code-0 token of this kind, e.g. {@code LINE}. */
    public abstract String type();

    public String getHandle() {
        return handle;
    }

    public void setHandle(String handle) {
        this.handle = handle;
    }

    public String getLineType() {
        return lineType;
    }

    public void setLineType(String lineType) {
        this.lineType = lineType;
    }

    public String getLayer() {
        return layer;
    }

    public void setLayer(String layer) {
        this.layer = layer;
    }

    public Double getLineTypeScale() {
        return lineTypeScale;
    }

    public void setLineTypeScale(Double lineTypeScale) {
        this.lineTypeScale = lineTypeScale;
    }

    public Boolean getVisible() {
        return visible;
    }

    public void setVisible(Boolean visible) {
        this.visible = visible;
    }

    /** ACI color number; 0 is BYBLOCK and 256 BYLAYER. */
    public Integer getColorIndex() {
        return colorIndex;
    }

    public void setColorIndex(Integer colorIndex) {
        this.colorIndex = colorIndex;
    }

    public Boolean getEntitiesFollow() {
        return entitiesFollow;
    }

    public void setEntitiesFollow(Boolean entitiesFollow) {
        this.entitiesFollow = entitiesFollow;
    }

    public Boolean getInPaperSpace() {
        return inPaperSpace;
    }

    public void setInPaperSpace(Boolean inPaperSpace) {
        this.inPaperSpace = inPaperSpace;
    }

    public String getOwnerHandle() {
        return ownerHandle;
    }

    public void setOwnerHandle(String ownerHandle) {
        this.ownerHandle = ownerHandle;
    }

    public String getMaterialHandle() {
        return materialHandle;
    }

    public void setMaterialHandle(String materialHandle) {
        this.materialHandle = materialHandle;
    }

    public Integer getLineweight() {
        return lineweight;
    }

    public void setLineweight(Integer lineweight) {
        this.lineweight = lineweight;
    }

    /** 24-bit RGB color (group 420). */
    public Integer getTrueColor() {
        return trueColor;
    }

    public void setTrueColor(Integer trueColor) {
        this.trueColor = trueColor;
    }

    public List<ApplicationGroup> getApplicationGroups() {
        return applicationGroups;
    }

    protected final boolean commonEquals(Entity other) {
        return Objects.equals(handle, other.handle)
            && Objects.equals(lineType, other.lineType)
            && Objects.equals(layer, other.layer)
            && Objects.equals(lineTypeScale, other.lineTypeScale)
            && Objects.equals(visible, other.visible)
            && Objects.equals(colorIndex, other.colorIndex)
            && Objects.equals(entitiesFollow, other.entitiesFollow)
            && Objects.equals(inPaperSpace, other.inPaperSpace)
            && Objects.equals(ownerHandle, other.ownerHandle)
            && Objects.equals(materialHandle, other.materialHandle)
            && Objects.equals(lineweight, other.lineweight)
            && Objects.equals(trueColor, other.trueColor)
            && applicationGroups.equals(other.applicationGroups);
    }

    protected final int commonHashCode() {
        return Objects.hash(handle, layer, colorIndex, ownerHandle, applicationGroups);
    }

    @Override
    public String toString() {
        return type() + "{handle=" + handle + ", layer=" + layer + "}";
    }
}
