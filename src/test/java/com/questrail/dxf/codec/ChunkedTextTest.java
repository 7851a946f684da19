package com.questrail.dxf.codec;

import com.questrail.dxf.observability.NullDiagnosticsSink;
import com.questrail.dxf.scan.Group;
import com.questrail.dxf.scan.GroupScanner;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class ChunkedTextTest
{
    @Test
    void shortTextIsWrittenOnThePrimaryCode() {
        GroupWriter out = new GroupWriter(NullDiagnosticsSink.INSTANCE);

        ChunkedText.write(out, 1, 3, "Hello");

        assertEquals(List.of("1", "Hello"), out.lines());
    }

    @Test
    void textOfExactlyOneChunkStaysOnThePrimaryCode() {
        GroupWriter out = new GroupWriter(NullDiagnosticsSink.INSTANCE);

        ChunkedText.write(out, 1, 3, "x".repeat(250));

        assertEquals(2, out.lines().size());
        assertEquals("1", out.lines().get(0));
    }

    /**
     * 600 characters split into 250, 250 and 100, every chunk on the
     * continuation code.
     */
    @Test
    void longTextIsSplitIntoChunksOnTheContinuationCode() {
        String text = "a".repeat(250) + "b".repeat(250) + "c".repeat(100);
        GroupWriter out = new GroupWriter(NullDiagnosticsSink.INSTANCE);

        ChunkedText.write(out, 1, 3, text);

        List<String> lines = out.lines();
        assertEquals(6, lines.size());
        assertEquals(List.of("3", "3", "3"), List.of(lines.get(0), lines.get(2), lines.get(4)));
        assertEquals("a".repeat(250), lines.get(1));
        assertEquals("b".repeat(250), lines.get(3));
        assertEquals("c".repeat(100), lines.get(5));
    }

    @Test
    void appendingChunksRestoresTheText() {
        String text = "0123456789".repeat(60);
        String joined = null;

        for (String chunk : ChunkedText.split(text)) {
            joined = ChunkedText.append(joined, chunk);
        }

        assertEquals(text, joined);
    }

    @Test
    void whitespaceAtACutEndsThePreviousChunk() {
        String text = "a".repeat(250) + " b";

        List<String> chunks = ChunkedText.split(text);

        assertEquals(List.of("a".repeat(249), "a b"), chunks);
    }

    @Test
    void continuationChunksNeverStartWithWhitespace() {
        String text = "The quick brown fox jumps over the lazy dog. ".repeat(14).substring(0, 600);

        List<String> chunks = ChunkedText.split(text);

        assertEquals(text, String.join("", chunks));
        for (String chunk : chunks) {
            assertTrue(chunk.length() <= ChunkedText.MAX_CHUNK_LENGTH);
            assertFalse(Character.isWhitespace(chunk.charAt(0)), "chunk starts with whitespace: " + chunk);
        }
    }

    @Test
    void surrogatePairsAreNotSplit() {
        String text = "x".repeat(249) + "\uD83D\uDE00" + "y".repeat(10);

        List<String> chunks = ChunkedText.split(text);

        assertEquals("x".repeat(249), chunks.get(0));
        assertEquals("\uD83D\uDE00" + "y".repeat(10), chunks.get(1));
    }

    @Test
    void chunkedTextSurvivesARoundTripThroughTheScanner() {
        String text = "a".repeat(250) + " b" + " c".repeat(200);
        GroupWriter out = new GroupWriter(NullDiagnosticsSink.INSTANCE);
        ChunkedText.write(out, 1, 3, text);

        GroupScanner scanner = GroupScanner.of(String.join("\n", out.lines()) + "\n0\nEOF",
            NullDiagnosticsSink.INSTANCE);
        String joined = null;
        for (Group group = scanner.next(); !group.isEof(); group = scanner.next()) {
            assertEquals(3, group.code());
            joined = ChunkedText.append(joined, group.text());
        }

        assertEquals(text, joined);
    }
}
