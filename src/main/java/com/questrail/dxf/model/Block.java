package com.questrail.dxf.model;

import com.questrail.dxf.model.entity.Entity;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;

/**
 * Block
 * -----------------------------------------------------------------------------
 * A {@code BLOCK} definition: a named, reusable group of entities placed in the
 * drawing by {@code INSERT} entities.
 *
 * <p>{@link #getEndBlock()} holds the properties of the closing {@code ENDBLK}
 * record and is {@code null} when that record carries none.</p>
 */
public final class Block
{
    private String xrefPath;
    private String name;
    private String secondName;
    private String description;
    private String handle;
    private String layer;
    private Point basePoint;
    private Boolean inPaperSpace;
    private Integer flags;
    private String ownerHandle;
    private EndBlock endBlock;
    private final List<ApplicationGroup> applicationGroups = new ArrayList<>();
    private final List<Entity> entities = new ArrayList<>();

    public String getXrefPath() {
        return xrefPath;
    }

    public void setXrefPath(String xrefPath) {
        this.xrefPath = xrefPath;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getSecondName() {
        return secondName;
    }

    public void setSecondName(String secondName) {
        this.secondName = secondName;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getHandle() {
        return handle;
    }

    public void setHandle(String handle) {
        this.handle = handle;
    }

    public String getLayer() {
        return layer;
    }

    public void setLayer(String layer) {
        this.layer = layer;
    }

    public Point getBasePoint() {
        return basePoint;
    }

    public void setBasePoint(Point basePoint) {
        this.basePoint = basePoint;
    }

    public Boolean getInPaperSpace() {
        return inPaperSpace;
    }

    public void setInPaperSpace(Boolean inPaperSpace) {
        this.inPaperSpace = inPaperSpace;
    }

    public Integer getFlags() {
        return flags;
    }

    public void setFlags(Integer flags) {
        this.flags = flags;
    }

    public String getOwnerHandle() {
        return ownerHandle;
    }

    public void setOwnerHandle(String ownerHandle) {
        this.ownerHandle = ownerHandle;
    }

    public EndBlock getEndBlock() {
        return endBlock;
    }

    public void setEndBlock(EndBlock endBlock) {
        this.endBlock = endBlock;
    }

    public List<ApplicationGroup> getApplicationGroups() {
        return applicationGroups;
    }

    public List<Entity> getEntities() {
        return entities;
    }

    public enum Flag implements BitFlag
    {
        ANONYMOUS(1),
        NON_CONSTANT_ATTRIBUTES(2),
        XREF(4),
        XREF_OVERLAY(8),
        EXTERNALLY_DEPENDENT(16),
        RESOLVED_XREF(32),
        REFERENCED_XREF(64);

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
        return Flags.decode(flags, Flag.class);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Block that
            && Objects.equals(xrefPath, that.xrefPath)
            && Objects.equals(name, that.name)
            && Objects.equals(secondName, that.secondName)
            && Objects.equals(description, that.description)
            && Objects.equals(handle, that.handle)
            && Objects.equals(layer, that.layer)
            && Objects.equals(basePoint, that.basePoint)
            && Objects.equals(inPaperSpace, that.inPaperSpace)
            && Objects.equals(flags, that.flags)
            && Objects.equals(ownerHandle, that.ownerHandle)
            && Objects.equals(endBlock, that.endBlock)
            && Objects.equals(applicationGroups, that.applicationGroups)
            && Objects.equals(entities, that.entities);
    }

    @Override
    public int hashCode() {
        return Objects.hash(xrefPath, name, secondName, description, handle, layer);
    }
}
