package com.questrail.dxf.codec.section;

import com.questrail.dxf.DxfCodec;
import com.questrail.dxf.DxfText;
import com.questrail.dxf.model.Block;
import com.questrail.dxf.model.DxfDocument;
import com.questrail.dxf.model.EndBlock;
import com.questrail.dxf.model.Point;
import com.questrail.dxf.model.entity.Circle;
import com.questrail.dxf.model.entity.Line;
import com.questrail.dxf.observability.DxfWarningEvent;
import com.questrail.dxf.observability.RecordingDiagnosticsSink;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class BlocksSectionCodecTest
{
    private final RecordingDiagnosticsSink sink = new RecordingDiagnosticsSink();
    private final DxfCodec codec = new DxfCodec();

    private Map<String, Block> parseBlocks(Object... groups) {
        List<Object> framed = new ArrayList<>(List.of(0, "SECTION", 2, "BLOCKS"));
        framed.addAll(Arrays.asList(groups));
        framed.addAll(List.of(0, "ENDSEC", 0, "EOF"));
        return codec.parse(DxfText.of(framed.toArray()), sink).getBlocks().orElseThrow();
    }

    @Test
    void readsABlockWithItsEntitiesAndEndBlock() {
        Map<String, Block> blocks = parseBlocks(
            0, "BLOCK", 5, "20", 330, "1F", 100, "AcDbEntity", 8, "0", 100, "AcDbBlockBegin",
            2, "DOOR", 70, "2", 10, "1.0", 20, "2.0", 30, "0.0", 3, "DOOR", 4, "A door",
            0, "LINE", 8, "0", 10, "0.0", 20, "0.0", 11, "1.0", 21, "0.0",
            0, "CIRCLE", 8, "0", 10, "0.5", 20, "0.5", 40, "0.25",
            0, "ENDBLK", 5, "21", 330, "1F", 100, "AcDbEntity", 8, "0", 100, "AcDbBlockEnd");

        Block door = blocks.get("DOOR");
        assertEquals("20", door.getHandle());
        assertEquals("1F", door.getOwnerHandle());
        assertEquals("0", door.getLayer());
        assertEquals(2, door.getFlags());
        assertEquals(Point.of(1.0, 2.0, 0.0), door.getBasePoint());
        assertEquals("DOOR", door.getSecondName());
        assertNull(door.getXrefPath());
        assertEquals("A door", door.getDescription());
        assertTrue(door.flagSet().contains(Block.Flag.NON_CONSTANT_ATTRIBUTES));

        assertEquals(2, door.getEntities().size());
        assertInstanceOf(Line.class, door.getEntities().get(0));
        Circle circle = assertInstanceOf(Circle.class, door.getEntities().get(1));
        assertEquals(0.25, circle.getRadius());

        EndBlock end = door.getEndBlock();
        assertNotNull(end);
        assertEquals("21", end.getHandle());
        assertEquals("1F", end.getOwnerHandle());
        assertEquals("0", end.getLayer());

        assertTrue(sink.getWarnings().isEmpty());
        assertTrue(sink.getUnhandledGroups().isEmpty());
    }

    @Test
    void aBareEndBlockIsNotKept() {
        Map<String, Block> blocks = parseBlocks(
            0, "BLOCK", 2, "EMPTY",
            0, "ENDBLK");

        assertNull(blocks.get("EMPTY").getEndBlock());
        assertTrue(blocks.get("EMPTY").getEntities().isEmpty());
    }

    @Test
    void blocksKeepTheirOrder() {
        Map<String, Block> blocks = parseBlocks(
            0, "BLOCK", 2, "*Model_Space", 0, "ENDBLK",
            0, "BLOCK", 2, "*Paper_Space", 67, "1", 0, "ENDBLK",
            0, "BLOCK", 2, "A", 0, "ENDBLK");

        assertEquals(List.of("*Model_Space", "*Paper_Space", "A"), List.copyOf(blocks.keySet()));
        assertTrue(blocks.get("*Paper_Space").getInPaperSpace());
        assertEquals(3, sink.getSections().get(0).recordCount());
    }

    @Test
    void aBlockWithoutNameIsDropped() {
        Map<String, Block> blocks = parseBlocks(
            0, "BLOCK", 5, "30", 0, "ENDBLK",
            0, "BLOCK", 2, "KEPT", 0, "ENDBLK");

        assertEquals(List.of("KEPT"), List.copyOf(blocks.keySet()));
        List<DxfWarningEvent> warnings = sink.getWarnings(DxfWarningEvent.Kind.MISSING_NAME);
        assertEquals(1, warnings.size());
        assertEquals("BLOCK", warnings.get(0).recordKind());
    }

    @Test
    void aBlockCutShortByEndOfSectionKeepsWhatWasRead() {
        Map<String, Block> blocks = parseBlocks(
            0, "BLOCK", 2, "OPEN",
            0, "POINT", 10, "1.0", 20, "1.0");

        Block open = blocks.get("OPEN");
        assertEquals(1, open.getEntities().size());
        assertNull(open.getEndBlock());
        assertEquals(1, sink.getWarnings(DxfWarningEvent.Kind.UNTERMINATED_STRUCTURE).size());
    }

    @Test
    void unknownEntitiesInsideABlockAreSkipped() {
        Map<String, Block> blocks = parseBlocks(
            0, "BLOCK", 2, "MIXED",
            0, "HATCH", 2, "SOLID", 70, "1",
            0, "POINT", 10, "1.0", 20, "1.0",
            0, "ENDBLK");

        assertEquals(1, blocks.get("MIXED").getEntities().size());
        List<DxfWarningEvent> warnings = sink.getWarnings(DxfWarningEvent.Kind.UNSUPPORTED_ENTITY);
        assertEquals(1, warnings.size());
        assertEquals("BLOCK", warnings.get(0).recordKind());
    }

    @Test
    void roundTripsBlocks() {
        Line line = new Line();
        line.setLayer("0");
        line.setStart(Point.of(0.0, 0.0, 0.0));
        line.setEnd(Point.of(3.0, 4.0, 0.0));

        Block block = new Block();
        block.setName("ARROW");
        block.setHandle("2A");
        block.setLayer("0");
        block.setFlags(0);
        block.setBasePoint(Point.of(0.0, 0.0, 0.0));
        block.setSecondName("ARROW");
        block.getEntities().add(line);
        EndBlock end = new EndBlock();
        end.setHandle("2B");
        end.setLayer("0");
        block.setEndBlock(end);

        Map<String, Block> blocks = new LinkedHashMap<>();
        blocks.put(block.getName(), block);
        DxfDocument document = new DxfDocument();
        document.setBlocks(blocks);

        String text = codec.serializeToString(document);

        assertTrue(text.contains(DxfText.of(0, "ENDBLK", 5, "2B", 8, "0")));
        assertEquals(document, codec.parse(text, sink));
        assertTrue(sink.getWarnings().isEmpty());
    }
}
