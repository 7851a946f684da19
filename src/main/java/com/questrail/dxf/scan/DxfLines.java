package com.questrail.dxf.scan;

import com.questrail.dxf.MalformedInputException;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits a DXF text blob into its raw lines.
 *
 * <p>Any of {@code \r\n}, {@code \r} and {@code \n} ends a line. One trailing line
 * terminator is tolerated; after it is removed the line count must be even,
 * since lines alternate strictly between codes and values.</p>
 */
public final class DxfLines
{
    private static final Pattern LINE_BREAK = Pattern.compile("\r\n|\r|\n");

    private DxfLines() {}

    public static List<String> split(String text) {
        if (text == null || text.isEmpty()) {
            throw new MalformedInputException("Empty input");
        }
        String[] lines = LINE_BREAK.split(text, -1);
        int count = lines.length;
        if (count > 1 && lines[count - 1].isEmpty()) {
            count--;
        }
        if (count % 2 != 0) {
            throw new MalformedInputException(
                "Input has an odd number of lines (" + count + "); codes and values must alternate");
        }
        return List.of(Arrays.copyOf(lines, count));
    }
}
