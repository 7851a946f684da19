package com.questrail.dxf.model;

import com.questrail.dxf.model.entity.Entity;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * DxfDocument
 * =============================================================================
 * A parsed drawing: up to five sections, each of which may be absent.
 *
 * <h2>Presence</h2>
 * Absent and empty are different states. A section that was not in the input
 * stays {@code null} and is not written; a section that was present but had no
 * records is kept as an empty container and written as an empty section.
 *
 * <h2>Keys</h2>
 * <ul>
 *   <li>classes are keyed by record name (group 1 of the {@code CLASS} record)</li>
 *   <li>blocks are keyed by block name (group 2 of the {@code BLOCK} record)</li>
 * </ul>
 * Both maps keep insertion order, which is the order written back.
 */
public final class DxfDocument
{
    private Header header;
    private Map<String, DxfClass> classes;
    private Tables tables;
    private Map<String, Block> blocks;
    private List<Entity> entities;

    public Optional<Header> getHeader() {
        return Optional.ofNullable(header);
    }

    public void setHeader(Header header) {
        this.header = header;
    }

    public Optional<Map<String, DxfClass>> getClasses() {
        return Optional.ofNullable(classes);
    }

    public void setClasses(Map<String, DxfClass> classes) {
        this.classes = classes;
    }

    public Optional<Tables> getTables() {
        return Optional.ofNullable(tables);
    }

    public void setTables(Tables tables) {
        this.tables = tables;
    }

    public Optional<Map<String, Block>> getBlocks() {
        return Optional.ofNullable(blocks);
    }

    public void setBlocks(Map<String, Block> blocks) {
        this.blocks = blocks;
    }

    public Optional<List<Entity>> getEntities() {
        return Optional.ofNullable(entities);
    }

    public void setEntities(List<Entity> entities) {
        this.entities = entities;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof DxfDocument that
            && Objects.equals(header, that.header)
            && Objects.equals(classes, that.classes)
            && Objects.equals(tables, that.tables)
            && Objects.equals(blocks, that.blocks)
            && Objects.equals(entities, that.entities);
    }

    @Override
    public int hashCode() {
        return Objects.hash(header, classes, tables, blocks, entities);
    }

    @Override
    public String toString() {
        return "DxfDocument[header=" + header
            + ", classes=" + (classes == null ? null : classes.keySet())
            + ", tables=" + tables
            + ", blocks=" + (blocks == null ? null : blocks.keySet())
            + ", entities=" + (entities == null ? null : entities.size()) + "]";
    }
}
