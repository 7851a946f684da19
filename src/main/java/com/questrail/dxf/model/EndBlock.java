package com.questrail.dxf.model;

import java.util.Objects;

/**
 * The properties carried by the {@code ENDBLK} record that closes a block
 * definition.
 */
public final class EndBlock
{
    private String handle;
    private String layer;
    private Boolean inPaperSpace;
    private String ownerHandle;

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

    public boolean isEmpty() {
        return handle == null && layer == null && inPaperSpace == null && ownerHandle == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof EndBlock that
            && Objects.equals(handle, that.handle)
            && Objects.equals(layer, that.layer)
            && Objects.equals(inPaperSpace, that.inPaperSpace)
            && Objects.equals(ownerHandle, that.ownerHandle);
    }

    @Override
    public int hashCode() {
        return Objects.hash(handle, layer, inPaperSpace, ownerHandle);
    }
}
