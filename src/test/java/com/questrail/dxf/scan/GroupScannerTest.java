package com.questrail.dxf.scan;

import com.questrail.dxf.DxfText;
import com.questrail.dxf.MalformedInputException;
import com.questrail.dxf.ReadPastEndException;
import com.questrail.dxf.UnexpectedEndOfInputException;
import com.questrail.dxf.observability.DxfWarningEvent;
import com.questrail.dxf.observability.NullDiagnosticsSink;
import com.questrail.dxf.observability.RecordingDiagnosticsSink;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class GroupScannerTest
{
    private static GroupScanner scanner(Object... codesAndValues) {
        return GroupScanner.of(DxfText.of(codesAndValues), NullDiagnosticsSink.INSTANCE);
    }

    // ---------------------------------------------------------------------
    // Sequential reads
    // ---------------------------------------------------------------------

    @Test
    void readsGroupsInOrderWithTypedValues() {
        GroupScanner scanner = scanner(0, "LINE", 8, "Walls", 10, "1.5", 62, "3", 0, "EOF");

        assertEquals(Group.marker("LINE"), scanner.next());
        assertEquals(Group.text(8, "Walls"), scanner.next());
        assertEquals(Group.real(10, 1.5), scanner.next());
        assertEquals(Group.integer(62, 3), scanner.next());
        assertTrue(scanner.next().isEof());
        assertTrue(scanner.isExhausted());
    }

    @Test
    void lastReadIsTheMostRecentGroup() {
        GroupScanner scanner = scanner(0, "LINE", 8, "0", 0, "EOF");
        scanner.next();
        scanner.next();

        assertEquals(Group.text(8, "0"), scanner.lastRead());
        assertEquals(4, scanner.position());
    }

    @Test
    void lastReadBeforeAnyReadIsRejected() {
        assertThrows(IllegalStateException.class, () -> scanner(0, "EOF").lastRead());
    }

    /**
     * Text values keep trailing whitespace; some line type patterns rely on it.
     * Leading whitespace on both lines is insignificant.
     */
    @Test
    void valueLinesLoseLeadingWhitespaceOnly() {
        GroupScanner scanner = GroupScanner.of("  3\n   dash  \n 0\nEOF", NullDiagnosticsSink.INSTANCE);

        assertEquals(Group.text(3, "dash  "), scanner.next());
    }

    // ---------------------------------------------------------------------
    // Lookahead and rewind
    // ---------------------------------------------------------------------

    @Test
    void peekDoesNotMoveTheCursor() {
        GroupScanner scanner = scanner(10, "1.0", 20, "2.0", 0, "EOF");

        assertEquals(10, scanner.peek().code());
        assertEquals(10, scanner.peek().code());
        assertEquals(10, scanner.next().code());
    }

    @Test
    void nextIfUndoesTheReadWhenTheCodeDoesNotMatch() {
        GroupScanner scanner = scanner(10, "1.0", 20, "2.0", 0, "EOF");
        scanner.next();

        Optional<Group> z = scanner.nextIf(code -> code == 30);

        assertTrue(z.isEmpty());
        assertEquals(Group.real(10, 1.0), scanner.lastRead());
        assertEquals(Group.real(20, 2.0), scanner.next());
    }

    @Test
    void rewindReturnsTheSameGroupAgain() {
        GroupScanner scanner = scanner(1, "first", 2, "second", 0, "EOF");
        scanner.next();
        scanner.next();

        scanner.rewind();

        assertEquals(Group.text(1, "first"), scanner.lastRead());
        assertEquals(Group.text(2, "second"), scanner.next());
    }

    @Test
    void rewindingBeforeTheFirstLineIsRejected() {
        GroupScanner scanner = scanner(1, "first", 0, "EOF");
        scanner.next();

        assertThrows(IllegalStateException.class, () -> scanner.rewind(2));
        assertThrows(IllegalArgumentException.class, () -> scanner.rewind(-1));
    }

    @Test
    void rewindingOverEofClearsExhaustion() {
        GroupScanner scanner = scanner(0, "EOF");
        scanner.next();
        assertTrue(scanner.isExhausted());

        scanner.rewind();

        assertFalse(scanner.isExhausted());
        assertTrue(scanner.next().isEof());
    }

    // ---------------------------------------------------------------------
    // Structural errors
    // ---------------------------------------------------------------------

    @Test
    void readingPastEofFails() {
        GroupScanner scanner = scanner(0, "EOF", 0, "LINE");
        scanner.next();

        assertThrows(ReadPastEndException.class, scanner::next);
    }

    @Test
    void runningOutOfLinesBeforeEofFails() {
        GroupScanner scanner = scanner(0, "SECTION", 2, "HEADER");
        scanner.next();
        scanner.next();

        assertThrows(UnexpectedEndOfInputException.class, scanner::next);
        assertThrows(UnexpectedEndOfInputException.class, scanner::peek);
    }

    @Test
    void nonNumericCodeLineIsMalformed() {
        GroupScanner scanner = GroupScanner.of("X\nvalue\n0\nEOF", NullDiagnosticsSink.INSTANCE);

        assertThrows(MalformedInputException.class, scanner::next);
    }

    // ---------------------------------------------------------------------
    // Undefined codes
    // ---------------------------------------------------------------------

    @Test
    void undefinedCodeIsReadAsTextAndReportedOnce() {
        RecordingDiagnosticsSink sink = new RecordingDiagnosticsSink();
        GroupScanner scanner = GroupScanner.of(DxfText.of(1200, "x", 0, "EOF"), sink);

        assertEquals(Group.text(1200, "x"), scanner.next());
        scanner.rewind();
        scanner.next();

        assertEquals(1, sink.getWarnings(DxfWarningEvent.Kind.UNDEFINED_VALUE_TYPE).size());
    }
}
