package com.questrail.dxf;

import com.questrail.dxf.codec.AbstractEntityCodec;
import com.questrail.dxf.codec.EntityCodecRegistry;
import com.questrail.dxf.codec.RecordSchema;
import com.questrail.dxf.config.DxfCodecConfig;
import com.questrail.dxf.model.Block;
import com.questrail.dxf.model.DxfDocument;
import com.questrail.dxf.model.Header;
import com.questrail.dxf.model.HeaderValue;
import com.questrail.dxf.model.Layer;
import com.questrail.dxf.model.Point;
import com.questrail.dxf.model.SymbolTable;
import com.questrail.dxf.model.Tables;
import com.questrail.dxf.model.entity.Circle;
import com.questrail.dxf.model.entity.Entity;
import com.questrail.dxf.model.entity.Line;
import com.questrail.dxf.observability.DxfWarningEvent;
import com.questrail.dxf.observability.RecordingDiagnosticsSink;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static org.junit.jupiter.api.Assertions.*;

final class DxfCodecTest
{
    private static final String MINIMAL_HEADER =
        "0\nSECTION\n2\nHEADER\n9\n$ACADVER\n1\nAC1014\n0\nENDSEC\n0\nEOF";

    private final RecordingDiagnosticsSink sink = new RecordingDiagnosticsSink();
    private final DxfCodec codec = new DxfCodec();

    // -------------------------------------------------------------------------
    // End to end
    // -------------------------------------------------------------------------

    @Test
    void parsesAMinimalHeaderDocument() {
        DxfDocument document = codec.parse(MINIMAL_HEADER, sink);

        Header header = document.getHeader().orElseThrow();
        assertEquals(1, header.size());
        assertEquals("AC1014", header.getText("$ACADVER").orElseThrow());
        assertTrue(document.getClasses().isEmpty());
        assertTrue(document.getTables().isEmpty());
        assertTrue(document.getBlocks().isEmpty());
        assertTrue(document.getEntities().isEmpty());
        assertTrue(sink.getWarnings().isEmpty());
        assertTrue(sink.getUnhandledGroups().isEmpty());
    }

    @Test
    void serializesAMinimalHeaderDocumentBackToTheSameText() {
        DxfDocument document = codec.parse(MINIMAL_HEADER, sink);

        assertEquals(MINIMAL_HEADER, codec.serializeToString(document));
    }

    @Test
    void acceptsWindowsLineEndingsAndIndentedCodes() {
        String text = MINIMAL_HEADER.replace("\n", "\r\n").replace("\r\n9\r\n", "\r\n  9\r\n");

        DxfDocument document = codec.parse(text, sink);

        assertEquals("AC1014", document.getHeader().orElseThrow().getText("$ACADVER").orElseThrow());
    }

    @Test
    void roundTripsADocumentWithEverySection() {
        DxfDocument document = new DxfDocument();

        document.setHeader(new Header()
            .put("$ACADVER", codec.headerValue("$ACADVER", "AC1015"))
            .put("$INSBASE", codec.headerValue("$INSBASE", Point.of(0.0, 0.0, 0.0))));

        Layer layer = new Layer();
        layer.setName("0");
        layer.setColorIndex(7);
        layer.setLineType("CONTINUOUS");
        SymbolTable<Layer> layers = new SymbolTable<>();
        layers.setMaxEntries(1);
        layers.getEntries().add(layer);
        Tables tables = new Tables();
        tables.setLayers(layers);
        document.setTables(tables);

        Line line = new Line();
        line.setLayer("0");
        line.setStart(Point.of(0.0, 0.0, 0.0));
        line.setEnd(Point.of(10.0, 0.0, 0.0));
        Block block = new Block();
        block.setName("TICK");
        block.setBasePoint(Point.of(0.0, 0.0, 0.0));
        block.getEntities().add(line);
        Map<String, Block> blocks = new LinkedHashMap<>();
        blocks.put("TICK", block);
        document.setBlocks(blocks);

        Circle circle = new Circle();
        circle.setHandle("3F");
        circle.setLayer("0");
        circle.setCenter(Point.of(1.5, -2.25, 0.0));
        circle.setRadius(0.1);
        List<Entity> entities = new ArrayList<>();
        entities.add(circle);
        document.setEntities(entities);

        DxfDocument parsed = codec.parse(codec.serializeToString(document), sink);

        assertEquals(document, parsed);
        assertTrue(sink.getWarnings().isEmpty());
        assertTrue(sink.getUnhandledGroups().isEmpty());
    }

    @Test
    void tokensInterleaveLinesWithSeparators() {
        DxfDocument document = codec.parse(MINIMAL_HEADER, sink);

        StringBuilder text = new StringBuilder();
        List<String> tokens = new ArrayList<>();
        Iterator<String> iterator = codec.tokens(document);
        while (iterator.hasNext()) {
            String token = iterator.next();
            tokens.add(token);
            text.append(token);
        }

        assertEquals(MINIMAL_HEADER, text.toString());
        assertEquals("0", tokens.get(0));
        assertEquals("\n", tokens.get(1));
        assertEquals("EOF", tokens.get(tokens.size() - 1));
    }

    // -------------------------------------------------------------------------
    // Errors
    // -------------------------------------------------------------------------

    @Test
    void parseErrorsAreReportedAndRethrown() {
        String text = "0\nSECTION\n2\nENTITIES\n0\nLINE\n10\nnot-a-number\n0\nENDSEC\n0\nEOF";

        assertThrows(InvalidGroupValueException.class, () -> codec.parse(text, sink));
        assertEquals(1, sink.getErrors().size());
        assertInstanceOf(InvalidGroupValueException.class, sink.getErrors().get(0).cause());
    }

    @Test
    void aCodeLineThatIsNotANumberIsMalformed() {
        String text = "0\nSECTION\nTWO\nHEADER\n0\nENDSEC\n0\nEOF";

        assertThrows(MalformedInputException.class, () -> codec.parse(text, sink));
    }

    @Test
    void aPointMissingItsYComponentIsMalformed() {
        String text = DxfText.entities(0, "POINT", 10, "1.0", 30, "2.0");

        assertThrows(MalformedPointException.class, () -> codec.parse(text, sink));
    }

    // -------------------------------------------------------------------------
    // Extension
    // -------------------------------------------------------------------------

    @Test
    void unknownEntitiesAreSkippedUntilACodecIsRegistered() {
        String text = DxfText.entities(
            0, "WIPEOUT", 8, "MASK", 10, "1.0", 20, "2.0",
            0, "POINT", 10, "0.0", 20, "0.0");

        DxfDocument before = codec.parse(text, sink);
        assertEquals(1, before.getEntities().orElseThrow().size());
        assertEquals(1, sink.getWarnings(DxfWarningEvent.Kind.UNSUPPORTED_ENTITY).size());

        codec.registerEntityCodec(new WipeoutCodec());
        DxfDocument after = codec.parse(text, new RecordingDiagnosticsSink());

        List<Entity> entities = after.getEntities().orElseThrow();
        assertEquals(2, entities.size());
        Wipeout wipeout = assertInstanceOf(Wipeout.class, entities.get(0));
        assertEquals("MASK", wipeout.getLayer());
        assertEquals(Point.of(1.0, 2.0), wipeout.getInsertionPoint());
    }

    @Test
    void registeredCodecsAlsoWriteTheirEntities() {
        codec.registerEntityCodec(new WipeoutCodec());
        Wipeout wipeout = new Wipeout();
        wipeout.setInsertionPoint(Point.of(4.0, 5.0));
        DxfDocument document = new DxfDocument();
        document.setEntities(new ArrayList<>(List.of(wipeout)));

        String text = codec.serializeToString(document, sink);

        assertTrue(text.contains(DxfText.of(0, "WIPEOUT", 10, "4.0", 20, "5.0")));
        assertEquals(document, codec.parse(text, sink));
    }

    @Test
    void registrationDoesNotLeakIntoTheSharedConfiguration() {
        EntityCodecRegistry shared = EntityCodecRegistry.withBuiltIns();
        DxfCodecConfig config = DxfCodecConfig.builder().withEntityCodecs(shared).build();

        new DxfCodec(config).registerEntityCodec(new WipeoutCodec());

        assertFalse(shared.kinds().contains(Wipeout.TYPE));
        assertFalse(new DxfCodec(config).entityCodecs().kinds().contains(Wipeout.TYPE));
    }

    @Test
    void headerValuesAreTypedByTheCatalog() {
        HeaderValue version = codec.headerValue("$ACADVER", "AC1032");
        HeaderValue scale = codec.headerValue("$LTSCALE", 2);

        assertEquals(1, version.code());
        assertEquals(40, scale.code());
        assertThrows(IllegalArgumentException.class, () -> codec.headerValue("$NOT_A_VARIABLE", 1));
        assertThrows(IllegalArgumentException.class, () -> codec.headerValue("$LTSCALE", "wide"));
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    static final class Wipeout extends Entity
    {
        static final String TYPE = "WIPEOUT";

        private Point insertionPoint;

        @Override
        public String type() {
            return TYPE;
        }

        Point getInsertionPoint() {
            return insertionPoint;
        }

        void setInsertionPoint(Point insertionPoint) {
            this.insertionPoint = insertionPoint;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Wipeout that
                && commonEquals(that)
                && Objects.equals(insertionPoint, that.insertionPoint);
        }

        @Override
        public int hashCode() {
            return Objects.hash(commonHashCode(), insertionPoint);
        }
    }

    static final class WipeoutCodec extends AbstractEntityCodec<Wipeout>
    {
        private static final RecordSchema<Wipeout> SCHEMA = RecordSchema.<Wipeout>builder()
            .point(10, Wipeout::getInsertionPoint, Wipeout::setInsertionPoint)
            .build();

        WipeoutCodec() {
            super(Wipeout.TYPE, Wipeout.class);
        }

        @Override
        protected Wipeout newEntity() {
            return new Wipeout();
        }

        @Override
        protected RecordSchema<Wipeout> schema() {
            return SCHEMA;
        }
    }
}
