package com.questrail.dxf.scan;

import com.questrail.dxf.InvalidGroupValueException;

import java.util.Objects;

/**
 * One (code, value) pair of a DXF group stream.
 *
 * <p>The typed accessors ({@link #text()}, {@link #real()}, {@link #integer()},
 * {@link #bool()}) expect the variant assigned to the code. Asking for another
 * variant means a record table binds a code to the wrong field type, which is a
 * programming error and raises {@link IllegalStateException}.</p>
 */
public record Group(int code, GroupValue value)
{
    public static final String SECTION = "SECTION";
    public static final String END_SECTION = "ENDSEC";
    public static final String EOF = "EOF";

    public Group {
        Objects.requireNonNull(value, "value");
    }

    public static Group text(int code, String value) {
        return new Group(code, new GroupValue.Text(value));
    }

    public static Group real(int code, double value) {
        return new Group(code, new GroupValue.Real(value));
    }

    public static Group integer(int code, long value) {
        return new Group(code, new GroupValue.Int(value));
    }

    public static Group bool(int code, boolean value) {
        return new Group(code, new GroupValue.Bool(value));
    }

    /** A code-0 marker group such as {@code SECTION} or {@code ENDBLK}. */
    public static Group marker(String token) {
        return text(0, token);
    }

    public boolean isMarker(String token) {
        return code == 0 && value instanceof GroupValue.Text t && t.value().equals(token);
    }

    public boolean isEof() {
        return isMarker(EOF);
    }

    /** True for a code-0 group: the start of the next sibling record or an end marker. */
    public boolean startsRecord() {
        return code == 0;
    }

    public String text() {
        if (value instanceof GroupValue.Text t) {
            return t.value();
        }
        throw wrongType("text");
    }

    public double real() {
        if (value instanceof GroupValue.Real r) {
            return r.value();
        }
        if (value instanceof GroupValue.Int i) {
            return i.value();
        }
        throw wrongType("float");
    }

    public int integer() {
        if (value instanceof GroupValue.Int i) {
            if (i.value() < Integer.MIN_VALUE || i.value() > Integer.MAX_VALUE) {
                throw new InvalidGroupValueException(code, i.toString(),
                    "Value " + i.value() + " of group code " + code + " does not fit a 32-bit field");
            }
            return (int) i.value();
        }
        throw wrongType("integer");
    }

    public long longValue() {
        if (value instanceof GroupValue.Int i) {
            return i.value();
        }
        throw wrongType("integer");
    }

    public boolean bool() {
        if (value instanceof GroupValue.Bool b) {
            return b.value();
        }
        throw wrongType("boolean");
    }

    private IllegalStateException wrongType(String expected) {
        return new IllegalStateException(
            "Group " + code + " carries a " + value.type() + " value, not " + expected);
    }

    @Override
    public String toString() {
        return code + "/" + value;
    }
}
