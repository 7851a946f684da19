package com.questrail.dxf.scan;

/**
 * The four value types a group code can carry.
 */
public enum GroupValueType
{
    TEXT,
    FLOAT,
    INTEGER,
    BOOLEAN
}
