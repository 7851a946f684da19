package com.questrail.dxf.scan;

import java.util.Objects;

/**
 * GroupValue
 * -----------------------------------------------------------------------------
 * Typed value of a single DXF group.
 *
 * <p>The variant is always the one {@link GroupCodes#typeOf(int)} assigns to the
 * group's code. Section and record markers ({@code SECTION}, {@code EOF},
 * {@code LINE}...) are {@link Text} values on code 0.</p>
 */
public sealed interface GroupValue
{
    GroupValueType type();

    record Text(String value) implements GroupValue {
        public Text {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public GroupValueType type() {
            return GroupValueType.TEXT;
        }

        @Override
        public String toString() {
            return value;
        }
    }

    record Real(double value) implements GroupValue {
        @Override
        public GroupValueType type() {
            return GroupValueType.FLOAT;
        }

        @Override
        public String toString() {
            return Double.toString(value);
        }
    }

    /** Integer codes span 16, 32 and 64-bit fields; all of them fit a {@code long}. */
    record Int(long value) implements GroupValue {
        @Override
        public GroupValueType type() {
            return GroupValueType.INTEGER;
        }

        @Override
        public String toString() {
            return Long.toString(value);
        }
    }

    record Bool(boolean value) implements GroupValue {
        @Override
        public GroupValueType type() {
            return GroupValueType.BOOLEAN;
        }

        @Override
        public String toString() {
            return value ? "1" : "0";
        }
    }
}
