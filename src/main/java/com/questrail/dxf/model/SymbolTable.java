package com.questrail.dxf.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One {@code TABLE ... ENDTAB} block of the {@code TABLES} section: the table
 * header and its records in the order they were read.
 *
 * <p>{@code maxEntries} (group 70) is kept as declared; it is not adjusted when
 * records are added or removed.</p>
 */
public final class SymbolTable<R extends TableEntry>
{
    private String handle;
    private String ownerHandle;
    private Integer maxEntries;
    private final List<ApplicationGroup> applicationGroups = new ArrayList<>();
    private final List<R> entries = new ArrayList<>();

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

    public Integer getMaxEntries() {
        return maxEntries;
    }

    public void setMaxEntries(Integer maxEntries) {
        this.maxEntries = maxEntries;
    }

    public List<ApplicationGroup> getApplicationGroups() {
        return applicationGroups;
    }

    public List<R> getEntries() {
        return entries;
    }

    /** The first record named {@code name}. */
    public Optional<R> find(String name) {
        return entries.stream()
            .filter(entry -> Objects.equals(entry.getName(), name))
            .findFirst();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof SymbolTable<?> that
            && Objects.equals(handle, that.handle)
            && Objects.equals(ownerHandle, that.ownerHandle)
            && Objects.equals(maxEntries, that.maxEntries)
            && applicationGroups.equals(that.applicationGroups)
            && entries.equals(that.entries);
    }

    @Override
    public int hashCode() {
        return Objects.hash(handle, ownerHandle, maxEntries, applicationGroups, entries);
    }

    @Override
    public String toString() {
        return "SymbolTable[handle=" + handle + ", entries=" + entries + "]";
    }
}
