package com.questrail.dxf.observability;

import java.util.Objects;

/**
 * A top-level section has been read.
 *
 * @param sectionName {@code HEADER}, {@code CLASSES}, {@code TABLES}, {@code BLOCKS} or {@code ENTITIES}
 * @param recordCount number of records (or header variables) the section produced
 */
public record DxfSectionEvent(String sectionName, int recordCount) {
    public DxfSectionEvent {
        Objects.requireNonNull(sectionName, "sectionName");
    }
}
