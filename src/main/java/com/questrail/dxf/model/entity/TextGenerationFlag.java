package com.questrail.dxf.model.entity;

import com.questrail.dxf.model.BitFlag;

/**
 * Text generation flags (group 71) shared by {@code TEXT} and {@code ATTDEF}.
 */
public enum TextGenerationFlag implements BitFlag
{
    BACKWARDS(2),
    UPSIDE_DOWN(4);

    private final int mask;

    TextGenerationFlag(int mask) {
        this.mask = mask;
    }

    @Override
    public int mask() {
        return mask;
    }
}
