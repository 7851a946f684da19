package com.questrail.dxf.codec.section;

import com.questrail.dxf.DxfCodec;
import com.questrail.dxf.DxfText;
import com.questrail.dxf.model.DxfDocument;
import com.questrail.dxf.model.Header;
import com.questrail.dxf.model.HeaderValue;
import com.questrail.dxf.model.Point;
import com.questrail.dxf.observability.DxfWarningEvent;
import com.questrail.dxf.observability.RecordingDiagnosticsSink;
import com.questrail.dxf.scan.Group;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class HeaderSectionCodecTest
{
    private final RecordingDiagnosticsSink sink = new RecordingDiagnosticsSink();
    private final DxfCodec codec = new DxfCodec();

    private Header parseHeader(Object... groups) {
        Object[] framed = new Object[groups.length + 8];
        framed[0] = 0;
        framed[1] = "SECTION";
        framed[2] = 2;
        framed[3] = "HEADER";
        System.arraycopy(groups, 0, framed, 4, groups.length);
        framed[framed.length - 4] = 0;
        framed[framed.length - 3] = "ENDSEC";
        framed[framed.length - 2] = 0;
        framed[framed.length - 1] = "EOF";
        return codec.parse(DxfText.of(framed), sink).getHeader().orElseThrow();
    }

    @Test
    void readsScalarVariablesTypedByTheirCode() {
        Header header = parseHeader(
            9, "$ACADVER", 1, "AC1015",
            9, "$LTSCALE", 40, "2.5",
            9, "$INSUNITS", 70, "4");

        assertEquals(3, header.size());
        assertEquals("AC1015", header.getText("$ACADVER").orElseThrow());
        assertEquals(2.5, header.getReal("$LTSCALE").orElseThrow());
        assertEquals(4L, header.getInteger("$INSUNITS").orElseThrow());
        assertEquals(List.of("$ACADVER", "$LTSCALE", "$INSUNITS"), List.copyOf(header.names()));
    }

    @Test
    void readsPointVariables() {
        Header header = parseHeader(
            9, "$EXTMIN", 10, "-1.0", 20, "-2.0", 30, "0.0",
            9, "$LIMMIN", 10, "0.0", 20, "0.0",
            9, "$ACADVER", 1, "AC1015");

        assertEquals(Point.of(-1.0, -2.0, 0.0), header.getPoint("$EXTMIN").orElseThrow());
        assertEquals(Point.of(0.0, 0.0), header.getPoint("$LIMMIN").orElseThrow());
        assertFalse(header.getPoint("$LIMMIN").orElseThrow().is3d());
        assertEquals("AC1015", header.getText("$ACADVER").orElseThrow());
    }

    @Test
    void aLoneRealIsNotMistakenForAPoint() {
        Header header = parseHeader(
            9, "$TDCREATE", 40, "2451545.0",
            9, "$TDUPDATE", 40, "2451546.0");

        assertEquals(2451545.0, header.getReal("$TDCREATE").orElseThrow());
        assertEquals(2451546.0, header.getReal("$TDUPDATE").orElseThrow());
    }

    @Test
    void aVariableWithoutValueIsReportedAndReadingContinues() {
        Header header = parseHeader(
            9, "$EMPTY",
            9, "$ACADVER", 1, "AC1015");

        assertEquals(1, header.size());
        assertTrue(header.get("$EMPTY").isEmpty());
        assertEquals(1, sink.getWarnings(DxfWarningEvent.Kind.STRAY_GROUP).size());
    }

    @Test
    void groupsOutsideAVariableAreUnhandled() {
        Header header = parseHeader(
            999, "comment",
            9, "$ACADVER", 1, "AC1015");

        assertEquals(1, header.size());
        assertEquals(1, sink.getUnhandledGroups().size());
        assertEquals("HEADER", sink.getUnhandledGroups().get(0).recordKind());
    }

    @Test
    void sectionEventCountsVariables() {
        parseHeader(9, "$ACADVER", 1, "AC1015", 9, "$LTSCALE", 40, "1.0");

        assertEquals(1, sink.getSections().size());
        assertEquals("HEADER", sink.getSections().get(0).sectionName());
        assertEquals(2, sink.getSections().get(0).recordCount());
    }

    // -------------------------------------------------------------------------
    // Writing
    // -------------------------------------------------------------------------

    @Test
    void writesVariablesInInsertionOrder() {
        Header header = new Header()
            .put("$ACADVER", HeaderValue.of(Group.text(1, "AC1015")))
            .put("$EXTMIN", HeaderValue.point(10, Point.of(1.0, 2.0, 3.0)))
            .put("$INSUNITS", HeaderValue.of(Group.integer(70, 4)));
        DxfDocument document = new DxfDocument();
        document.setHeader(header);

        assertEquals(DxfText.of(
            0, "SECTION", 2, "HEADER",
            9, "$ACADVER", 1, "AC1015",
            9, "$EXTMIN", 10, "1.0", 20, "2.0", 30, "3.0",
            9, "$INSUNITS", 70, "4",
            0, "ENDSEC",
            0, "EOF"), codec.serializeToString(document));
    }

    @Test
    void anEmptyHeaderIsStillWritten() {
        DxfDocument document = new DxfDocument();
        document.setHeader(new Header());

        assertEquals(DxfText.of(0, "SECTION", 2, "HEADER", 0, "ENDSEC", 0, "EOF"),
            codec.serializeToString(document));
    }
}
