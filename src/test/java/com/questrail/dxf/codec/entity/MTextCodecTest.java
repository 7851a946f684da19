package com.questrail.dxf.codec.entity;

import com.questrail.dxf.DxfCodec;
import com.questrail.dxf.DxfText;
import com.questrail.dxf.model.DxfDocument;
import com.questrail.dxf.model.Point;
import com.questrail.dxf.model.entity.MText;
import com.questrail.dxf.observability.NullDiagnosticsSink;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

final class MTextCodecTest
{
    private final DxfCodec codec = new DxfCodec();

    @Test
    void concatenatesChunksInEncounterOrder() {
        DxfDocument document = codec.parse(DxfText.entities(
            0, "MTEXT",
            10, "0.0", 20, "0.0",
            3, "first ",
            3, "second ",
            1, "last"), NullDiagnosticsSink.INSTANCE);

        MText text = (MText) document.getEntities().orElseThrow().get(0);
        assertEquals("first second last", text.getText());
    }

    /**
     * A 600 character text is written as three chunks on code 3 and read back
     * unchanged.
     */
    @Test
    void longTextRoundTripsThroughThreeChunks() {
        String content = "The quick brown fox jumps over the lazy dog. ".repeat(14).substring(0, 600);
        MText text = new MText();
        text.setInsertionPoint(Point.of(1.0, 1.0, 0.0));
        text.setHeight(2.5);
        text.setText(content);
        text.setStyle("Standard");
        DxfDocument document = new DxfDocument();
        document.setEntities(List.of(text));

        List<String> lines = codec.serialize(document, NullDiagnosticsSink.INSTANCE)
            .collect(Collectors.toList());
        MText parsed = (MText) codec.parse(String.join("\n", lines), NullDiagnosticsSink.INSTANCE)
            .getEntities().orElseThrow().get(0);

        long chunkCodes = 0;
        for (int i = 0; i < lines.size(); i += 2) {
            if (lines.get(i).equals("3")) {
                chunkCodes++;
            }
            assertNotEquals("1", lines.get(i));
        }
        assertEquals(3, chunkCodes);
        assertEquals(600, parsed.getText().length());
        assertEquals(text, parsed);
    }
}
