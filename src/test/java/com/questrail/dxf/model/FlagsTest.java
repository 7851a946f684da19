package com.questrail.dxf.model;

import com.questrail.dxf.model.entity.LwPolyline;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

final class FlagsTest
{
    private enum Bit implements BitFlag
    {
        B1(1), B2(2), B4(4), B8(8), B16(16), B128(128);

        private final int mask;

        Bit(int mask) {
            this.mask = mask;
        }

        @Override
        public int mask() {
            return mask;
        }
    }

    /**
     * 133 is binary 10000101: bits 1, 4 and 128 are set, nothing else.
     */
    @Test
    void decomposesAValueIntoItsSetBits() {
        assertTrue(Flags.isSet(133, 1));
        assertTrue(Flags.isSet(133, 4));
        assertTrue(Flags.isSet(133, 128));
        assertFalse(Flags.isSet(133, 2));
        assertFalse(Flags.isSet(133, 8));

        assertEquals(EnumSet.of(Bit.B1, Bit.B4, Bit.B128), Flags.decode(133, Bit.class));
    }

    @Test
    void absentValueDecodesToNoFlags() {
        assertTrue(Flags.decode(null, Bit.class).isEmpty());
    }

    @Test
    void encodeIsTheInverseOfDecode() {
        assertEquals(133, Flags.encode(Flags.decode(133, Bit.class)));
        assertEquals(0, Flags.encode(EnumSet.noneOf(Bit.class)));
    }

    @Test
    void entityFlagViewsFollowTheRawValue() {
        LwPolyline polyline = new LwPolyline();
        polyline.setFlags(129);

        assertTrue(polyline.isClosed());
        assertEquals(EnumSet.of(LwPolyline.Flag.CLOSED, LwPolyline.Flag.PLINEGEN), polyline.flagSet());
    }
}
