package com.questrail.dxf.scan;

import com.questrail.dxf.DxfSerializationException;
import com.questrail.dxf.InvalidGroupValueException;

import java.math.BigDecimal;

/**
 * GroupCodes
 * -----------------------------------------------------------------------------
 * The fixed partition of the group-code space into value types, and the
 * conversions between raw value lines and {@link GroupValue}s.
 *
 * <h2>Partition</h2>
 * <ul>
 *   <li>Text: codes up to 9, 100-109, 300-369, 390-399, 410-419, 430-439,
 *       470-481, 999, 1000-1009</li>
 *   <li>Float: 10-59, 110-149, 210-239, 460-469, 1010-1059</li>
 *   <li>Integer: 60-99, 160-179, 270-289, 370-389, 400-409, 420-429, 440-459,
 *       1060-1071</li>
 *   <li>Boolean: 290-299</li>
 * </ul>
 *
 * Every other code is undefined. Undefined codes are treated as text so the
 * stream can still be read; callers that care report them through
 * {@link #isDefined(int)}.
 *
 * <h2>Inverse law</h2>
 * For every code {@code c} and value {@code v} of type {@code typeOf(c)},
 * {@code parseValue(c, render(c, v)).equals(v)}.
 */
public final class GroupCodes
{
    private GroupCodes() {}

    public static GroupValueType typeOf(int code) {
        GroupValueType type = definedTypeOf(code);
        return type != null ? type : GroupValueType.TEXT;
    }

    public static boolean isDefined(int code) {
        return definedTypeOf(code) != null;
    }

    private static GroupValueType definedTypeOf(int code) {
        if (code <= 9
            || in(code, 100, 109)
            || in(code, 300, 369)
            || in(code, 390, 399)
            || in(code, 410, 419)
            || in(code, 430, 439)
            || in(code, 470, 481)
            || code == 999
            || in(code, 1000, 1009)) {
            return GroupValueType.TEXT;
        }
        if (in(code, 10, 59)
            || in(code, 110, 149)
            || in(code, 210, 239)
            || in(code, 460, 469)
            || in(code, 1010, 1059)) {
            return GroupValueType.FLOAT;
        }
        if (in(code, 60, 99)
            || in(code, 160, 179)
            || in(code, 270, 289)
            || in(code, 370, 389)
            || in(code, 400, 409)
            || in(code, 420, 429)
            || in(code, 440, 459)
            || in(code, 1060, 1071)) {
            return GroupValueType.INTEGER;
        }
        if (in(code, 290, 299)) {
            return GroupValueType.BOOLEAN;
        }
        return null;
    }

    private static boolean in(int code, int low, int high) {
        return code >= low && code <= high;
    }

    /**
     * Converts a value line (leading whitespace already removed) into the value
     * type of {@code code}. Text keeps trailing whitespace; numbers and booleans
     * are trimmed before conversion.
     *
     * @throws InvalidGroupValueException if the text is not a valid value of that type
     */
    public static GroupValue parseValue(int code, String raw) {
        return switch (typeOf(code)) {
            case TEXT -> new GroupValue.Text(raw);
            case FLOAT -> new GroupValue.Real(parseReal(code, raw));
            case INTEGER -> new GroupValue.Int(parseInteger(code, raw));
            case BOOLEAN -> new GroupValue.Bool(parseBoolean(code, raw));
        };
    }

    private static double parseReal(int code, String raw) {
        try {
            return Double.parseDouble(raw.trim());
        }
        catch (NumberFormatException e) {
            throw new InvalidGroupValueException(code, raw,
                "Invalid float value '" + raw + "' for group code " + code, e);
        }
    }

    private static long parseInteger(int code, String raw) {
        String trimmed = raw.trim();
        try {
            return Long.parseLong(trimmed);
        }
        catch (NumberFormatException e) {
            // Some writers emit whole integers as "5.0".
            try {
                return new BigDecimal(trimmed).longValueExact();
            }
            catch (NumberFormatException | ArithmeticException ignored) {
                throw new InvalidGroupValueException(code, raw,
                    "Invalid integer value '" + raw + "' for group code " + code, e);
            }
        }
    }

    private static boolean parseBoolean(int code, String raw) {
        return switch (raw.trim()) {
            case "0" -> false;
            case "1" -> true;
            default -> throw new InvalidGroupValueException(code, raw,
                "InvalidBoolean: '" + raw + "' for group code " + code + " must be 0 or 1");
        };
    }

    /**
     * Renders a value as the value line for {@code code}.
     *
     * @throws DxfSerializationException if the value type does not fit the code
     */
    public static String render(int code, GroupValue value) {
        GroupValueType type = typeOf(code);
        switch (type) {
            case TEXT:
                if (value instanceof GroupValue.Text t) {
                    return t.value();
                }
                break;
            case FLOAT:
                if (value instanceof GroupValue.Real r) {
                    return renderReal(r.value());
                }
                break;
            case INTEGER:
                if (value instanceof GroupValue.Int i) {
                    return Long.toString(i.value());
                }
                if (value instanceof GroupValue.Bool b) {
                    return b.value() ? "1" : "0";
                }
                break;
            case BOOLEAN:
                if (value instanceof GroupValue.Bool b) {
                    return b.value() ? "1" : "0";
                }
                break;
        }
        throw new DxfSerializationException(
            "Cannot write " + value.type() + " value " + value + " with group code " + code
                + " (expects " + type + ")");
    }

    /**
     * Float rendering: whole numbers carry a single fractional digit ({@code 4.0}),
     * everything else is the shortest plain decimal that reads back to the same double.
     */
    public static String renderReal(double value) {
        if (value == 0.0 || Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        String plain = BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
        return plain.indexOf('.') >= 0 ? plain : plain + ".0";
    }
}
