package com.questrail.dxf.codec.section;

import com.questrail.dxf.DxfText;
import com.questrail.dxf.GroupShapeException;
import com.questrail.dxf.UnexpectedEndOfInputException;
import com.questrail.dxf.codec.EntityCodecRegistry;
import com.questrail.dxf.codec.ParseContext;
import com.questrail.dxf.model.DxfDocument;
import com.questrail.dxf.observability.DxfSectionEvent;
import com.questrail.dxf.observability.DxfWarningEvent;
import com.questrail.dxf.observability.RecordingDiagnosticsSink;
import com.questrail.dxf.scan.GroupScanner;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class DocumentReaderTest
{
    private final RecordingDiagnosticsSink sink = new RecordingDiagnosticsSink();
    private final EntityCodecRegistry entityCodecs = EntityCodecRegistry.withBuiltIns();
    private final DocumentReader reader = new DocumentReader(List.of(
        new HeaderSectionCodec(),
        new EntitiesSectionCodec(entityCodecs)));

    private DxfDocument read(String text) {
        return reader.read(new ParseContext(GroupScanner.of(text, sink), sink, entityCodecs));
    }

    @Test
    void sectionsWithoutCodecAreSkippedAndReadingContinues() {
        DxfDocument document = read(DxfText.of(
            0, "SECTION", 2, "OBJECTS",
            0, "DICTIONARY", 5, "C", 3, "ACAD_GROUP",
            0, "DICTIONARY", 5, "D",
            0, "ENDSEC",
            0, "SECTION", 2, "ENTITIES",
            0, "POINT", 10, "1.0", 20, "2.0",
            0, "ENDSEC",
            0, "EOF"));

        assertEquals(1, document.getEntities().orElseThrow().size());
        List<DxfWarningEvent> skipped = sink.getWarnings(DxfWarningEvent.Kind.SKIPPED_SECTION);
        assertEquals(1, skipped.size());
        assertTrue(skipped.get(0).message().contains("OBJECTS"));
        assertTrue(sink.getUnhandledGroups().isEmpty());
    }

    @Test
    void sectionsNotInTheTextStayAbsent() {
        DxfDocument document = read(DxfText.of(
            0, "SECTION", 2, "HEADER",
            9, "$ACADVER", 1, "AC1014",
            0, "ENDSEC",
            0, "EOF"));

        assertTrue(document.getHeader().isPresent());
        assertTrue(document.getClasses().isEmpty());
        assertTrue(document.getTables().isEmpty());
        assertTrue(document.getBlocks().isEmpty());
        assertTrue(document.getEntities().isEmpty());
    }

    @Test
    void emitsOneSectionEventPerSectionRead() {
        read(DxfText.of(
            0, "SECTION", 2, "HEADER",
            9, "$ACADVER", 1, "AC1014",
            0, "ENDSEC",
            0, "SECTION", 2, "ENTITIES",
            0, "POINT", 10, "1.0", 20, "2.0",
            0, "POINT", 10, "3.0", 20, "4.0",
            0, "ENDSEC",
            0, "EOF"));

        assertEquals(List.of(new DxfSectionEvent("HEADER", 1), new DxfSectionEvent("ENTITIES", 2)),
            sink.getSections());
    }

    @Test
    void strayGroupsBetweenSectionsAreReported() {
        DxfDocument document = read(DxfText.of(
            999, "written by hand",
            0, "POINT",
            0, "SECTION", 2, "HEADER",
            0, "ENDSEC",
            0, "EOF"));

        assertTrue(document.getHeader().isPresent());
        assertEquals(1, sink.getUnhandledGroups().size());
        assertEquals("DOCUMENT", sink.getUnhandledGroups().get(0).recordKind());
        List<DxfWarningEvent> stray = sink.getWarnings(DxfWarningEvent.Kind.STRAY_GROUP);
        assertEquals(1, stray.size());
        assertEquals("DOCUMENT", stray.get(0).recordKind());
    }

    @Test
    void nothingAfterEofIsRead() {
        DxfDocument document = read(DxfText.of(
            0, "EOF",
            0, "SECTION", 2, "HEADER",
            0, "ENDSEC"));

        assertTrue(document.getHeader().isEmpty());
        assertTrue(sink.getAllEvents().isEmpty());
    }

    @Test
    void theSectionNameMustFollowTheSectionMarker() {
        String text = DxfText.of(
            0, "SECTION", 9, "HEADER",
            0, "ENDSEC",
            0, "EOF");

        GroupShapeException e = assertThrows(GroupShapeException.class, () -> read(text));
        assertEquals(2, e.expectedCode());
        assertEquals(9, e.actualCode());
    }

    @Test
    void missingEofIsAnError() {
        String text = DxfText.of(
            0, "SECTION", 2, "HEADER",
            0, "ENDSEC");

        assertThrows(UnexpectedEndOfInputException.class, () -> read(text));
    }

    @Test
    void anUnterminatedSectionIsReported() {
        DxfDocument document = read(DxfText.of(
            0, "SECTION", 2, "ENTITIES",
            0, "POINT", 10, "1.0", 20, "2.0",
            0, "EOF"));

        assertEquals(1, document.getEntities().orElseThrow().size());
        assertEquals(1, sink.getWarnings(DxfWarningEvent.Kind.UNTERMINATED_STRUCTURE).size());
    }
}
