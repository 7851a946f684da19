package com.questrail.dxf.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Decomposition of integer flag groups into named booleans, and the reverse.
 * Purely combinational: a flag is set when {@code (value & mask) != 0}.
 */
public final class Flags
{
    private Flags() {}

    public static boolean isSet(int value, int mask) {
        return (value & mask) != 0;
    }

    public static <E extends Enum<E> & BitFlag> EnumSet<E> decode(Integer value, Class<E> type) {
        EnumSet<E> set = EnumSet.noneOf(type);
        if (value == null) {
            return set;
        }
        for (E flag : type.getEnumConstants()) {
            if (isSet(value, flag.mask())) {
                set.add(flag);
            }
        }
        return set;
    }

    public static int encode(Set<? extends BitFlag> flags) {
        int value = 0;
        for (BitFlag flag : flags) {
            value |= flag.mask();
        }
        return value;
    }
}
