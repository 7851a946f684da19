package com.questrail.dxf.model;

/**
 * A named bit of a "standard flags" group. Implemented by the flag enums of the
 * record kinds.
 */
public interface BitFlag
{
    int mask();
}
