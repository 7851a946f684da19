package com.questrail.dxf.model;

import com.questrail.dxf.scan.Group;

import java.util.List;
import java.util.Objects;

/**
 * An application-defined group: the groups enclosed by {@code 102/{NAME} and
 * {@code 102/}}, kept in order and with their original codes.
 */
public record ApplicationGroup(String name, List<Group> groups)
{
    public ApplicationGroup {
        Objects.requireNonNull(name, "name");
        groups = List.copyOf(groups);
    }
}
