package com.questrail.dxf.scan;

import com.questrail.dxf.MalformedInputException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class DxfLinesTest
{
    @Test
    void acceptsAllThreeLineEndings() {
        List<String> expected = List.of("0", "LINE", "8", "0");

        assertEquals(expected, DxfLines.split("0\nLINE\n8\n0"));
        assertEquals(expected, DxfLines.split("0\r\nLINE\r\n8\r\n0"));
        assertEquals(expected, DxfLines.split("0\rLINE\r8\r0"));
        assertEquals(expected, DxfLines.split("0\r\nLINE\n8\r0"));
    }

    @Test
    void toleratesOneTrailingLineTerminator() {
        assertEquals(List.of("0", "EOF"), DxfLines.split("0\nEOF\n"));
        assertEquals(List.of("0", "EOF"), DxfLines.split("0\r\nEOF\r\n"));
    }

    @Test
    void keepsTrailingWhitespace() {
        assertEquals(List.of("3", "A  "), DxfLines.split("3\nA  "));
    }

    @Test
    void rejectsEmptyInput() {
        assertThrows(MalformedInputException.class, () -> DxfLines.split(""));
        assertThrows(MalformedInputException.class, () -> DxfLines.split(null));
    }

    @Test
    void rejectsAnOddNumberOfLines() {
        assertThrows(MalformedInputException.class, () -> DxfLines.split("0\nSECTION\n2"));
    }
}
