package com.questrail.dxf.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * TableEntry
 * -----------------------------------------------------------------------------
 * Base of the symbol table records ({@code VPORT}, {@code LTYPE},
 * {@code LAYER}). Holds the properties every record kind shares: name (group
 * 2), handle (5), owner (330), standard flags (70) and the
 * application-defined groups (102).
 */
public abstract class TableEntry
{
    private String name;
    private String handle;
    private String ownerHandle;
    private Integer flags;
    private final List<ApplicationGroup> applicationGroups = new ArrayList<>();

    /** The code-0 token of this record kind, e.g. {@code LAYER}. */
    public abstract String type();

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getHandle() {
        return handle;
    }

    public void setHandle(String handle) {
        this.handle = handle;
    }

    public String getOwnerHandle() {
        return ownerHandle;
    }

    public void setOwnerHandle(String ownerHandle) {
        this.ownerHandle = ownerHandle;
    }

    public Integer getFlags() {
        return flags;
    }

    public void setFlags(Integer flags) {
        this.flags = flags;
    }

    public List<ApplicationGroup> getApplicationGroups() {
        return applicationGroups;
    }

    protected final boolean entryEquals(TableEntry that) {
        return Objects.equals(name, that.name)
            && Objects.equals(handle, that.handle)
            && Objects.equals(ownerHandle, that.ownerHandle)
            && Objects.equals(flags, that.flags)
            && applicationGroups.equals(that.applicationGroups);
    }

    protected final int entryHashCode() {
        return Objects.hash(name, handle, ownerHandle, flags, applicationGroups);
    }

    @Override
    public String toString() {
        return type() + "[name=" + name + ", handle=" + handle + "]";
    }
}
