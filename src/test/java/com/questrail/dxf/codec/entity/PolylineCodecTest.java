package com.questrail.dxf.codec.entity;

import com.questrail.dxf.DxfCodec;
import com.questrail.dxf.DxfText;
import com.questrail.dxf.model.DxfDocument;
import com.questrail.dxf.model.Point;
import com.questrail.dxf.model.entity.Entity;
import com.questrail.dxf.model.entity.Line;
import com.questrail.dxf.model.entity.Polyline;
import com.questrail.dxf.model.entity.SequenceEnd;
import com.questrail.dxf.model.entity.Vertex;
import com.questrail.dxf.observability.DxfWarningEvent;
import com.questrail.dxf.observability.RecordingDiagnosticsSink;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class PolylineCodecTest
{
    private final RecordingDiagnosticsSink sink = new RecordingDiagnosticsSink();
    private final DxfCodec codec = new DxfCodec();

    @Test
    void readsVerticesUpToTheSequenceEnd() {
        List<Entity> entities = codec.parse(DxfText.entities(
            0, "POLYLINE",
            8, "0",
            66, "1",
            10, "0.0", 20, "0.0", 30, "0.0",
            70, "9",
            0, "VERTEX",
            8, "0",
            10, "1.0", 20, "2.0", 30, "0.0",
            42, "0.5",
            0, "VERTEX",
            8, "0",
            10, "3.0", 20, "4.0", 30, "0.0",
            70, "32",
            0, "SEQEND",
            8, "0",
            0, "LINE",
            10, "0.0", 20, "0.0",
            11, "1.0", 21, "1.0"), sink).getEntities().orElseThrow();

        assertEquals(2, entities.size());
        Polyline polyline = (Polyline) entities.get(0);
        assertTrue(polyline.getEntitiesFollow());
        assertEquals(EnumSet.of(Polyline.Flag.CLOSED, Polyline.Flag.POLYLINE_3D), polyline.flagSet());
        assertEquals(2, polyline.getVertices().size());
        assertEquals(0.5, polyline.getVertices().get(0).getBulge());
        assertEquals(Point.of(3.0, 4.0, 0.0), polyline.getVertices().get(1).getLocation());
        assertEquals("0", polyline.getSequenceEnd().getLayer());
        assertInstanceOf(Line.class, entities.get(1));
        assertTrue(sink.getWarnings().isEmpty());
    }

    @Test
    void missingSequenceEndIsAWarning() {
        List<Entity> entities = codec.parse(DxfText.entities(
            0, "POLYLINE",
            10, "0.0", 20, "0.0", 30, "0.0",
            0, "VERTEX",
            10, "1.0", 20, "2.0", 30, "0.0"), sink).getEntities().orElseThrow();

        Polyline polyline = (Polyline) entities.get(0);
        assertEquals(1, polyline.getVertices().size());
        assertNull(polyline.getSequenceEnd());
        assertEquals(1, sink.getWarnings(DxfWarningEvent.Kind.UNTERMINATED_STRUCTURE).size());
    }

    /**
     * A sequence end is always written, and one without properties is not
     * materialized when read back.
     */
    @Test
    void roundTripsWithAnImplicitSequenceEnd() {
        Polyline polyline = new Polyline();
        polyline.setElevationPoint(Point.of(0.0, 0.0, 0.0));
        polyline.setFlags(64);
        polyline.setMeshVertexCountM(4);
        polyline.setMeshVertexCountN(1);
        Vertex vertex = new Vertex();
        vertex.setLocation(Point.of(1.0, 1.0, 1.0));
        vertex.setFlags(128);
        vertex.setFirstFaceIndex(1);
        vertex.setSecondFaceIndex(-2);
        vertex.setThirdFaceIndex(3);
        polyline.getVertices().add(vertex);
        DxfDocument document = new DxfDocument();
        document.setEntities(List.of(polyline));

        String text = codec.serializeToString(document);

        assertTrue(text.contains("\n0\nSEQEND\n"));
        assertEquals(document, codec.parse(text, sink));
    }

    @Test
    void roundTripsAnExplicitSequenceEnd() {
        Polyline polyline = new Polyline();
        polyline.setElevationPoint(Point.of(0.0, 0.0, 0.0));
        Vertex vertex = new Vertex();
        vertex.setLocation(Point.of(1.0, 1.0, 0.0));
        polyline.getVertices().add(vertex);
        SequenceEnd sequenceEnd = new SequenceEnd();
        sequenceEnd.setHandle("2F");
        sequenceEnd.setLayer("Outline");
        polyline.setSequenceEnd(sequenceEnd);
        DxfDocument document = new DxfDocument();
        document.setEntities(List.of(polyline));

        assertEquals(document, codec.parse(codec.serializeToString(document), sink));
    }
}
