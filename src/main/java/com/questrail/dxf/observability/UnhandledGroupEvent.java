package com.questrail.dxf.observability;

import com.questrail.dxf.scan.Group;

import java.util.Objects;

/**
 * A group that a record reconstructor did not recognize and discarded.
 *
 * @param recordKind the record kind being parsed ({@code LINE}, {@code LAYER}, {@code HEADER}...)
 * @param group      the discarded group
 */
public record UnhandledGroupEvent(String recordKind, Group group) {
    public UnhandledGroupEvent {
        Objects.requireNonNull(recordKind, "recordKind");
        Objects.requireNonNull(group, "group");
    }
}
