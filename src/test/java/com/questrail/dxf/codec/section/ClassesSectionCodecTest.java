package com.questrail.dxf.codec.section;

import com.questrail.dxf.DxfCodec;
import com.questrail.dxf.DxfText;
import com.questrail.dxf.model.DxfClass;
import com.questrail.dxf.model.DxfDocument;
import com.questrail.dxf.observability.DxfWarningEvent;
import com.questrail.dxf.observability.RecordingDiagnosticsSink;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class ClassesSectionCodecTest
{
    private final RecordingDiagnosticsSink sink = new RecordingDiagnosticsSink();
    private final DxfCodec codec = new DxfCodec();

    @Test
    void readsClassesKeyedByRecordName() {
        String text = DxfText.of(
            0, "SECTION", 2, "CLASSES",
            0, "CLASS",
            1, "ACDBDICTIONARYWDFLT",
            2, "AcDbDictionaryWithDefault",
            3, "ObjectDBX Classes",
            90, "0",
            91, "1",
            280, "0",
            281, "0",
            0, "CLASS",
            1, "MLEADERSTYLE",
            2, "AcDbMLeaderStyle",
            3, "ACDB_MLEADERSTYLE_CLASS",
            90, "4095",
            280, "0",
            281, "1",
            0, "ENDSEC",
            0, "EOF");

        Map<String, DxfClass> classes = codec.parse(text, sink).getClasses().orElseThrow();

        assertEquals(List.of("ACDBDICTIONARYWDFLT", "MLEADERSTYLE"), List.copyOf(classes.keySet()));
        DxfClass style = classes.get("MLEADERSTYLE");
        assertEquals("AcDbMLeaderStyle", style.getCppClassName());
        assertEquals("ACDB_MLEADERSTYLE_CLASS", style.getApplicationName());
        assertEquals(4095, style.getProxyFlags());
        assertNull(style.getInstanceCount());
        assertFalse(style.getWasAProxy());
        assertTrue(style.getIsAnEntity());
        assertEquals(1, classes.get("ACDBDICTIONARYWDFLT").getInstanceCount());
        assertTrue(sink.getWarnings().isEmpty());
        assertEquals(2, sink.getSections().get(0).recordCount());
    }

    @Test
    void aClassWithoutRecordNameIsDropped() {
        String text = DxfText.of(
            0, "SECTION", 2, "CLASSES",
            0, "CLASS",
            2, "AcDbOrphan",
            0, "CLASS",
            1, "KEPT",
            0, "ENDSEC",
            0, "EOF");

        Map<String, DxfClass> classes = codec.parse(text, sink).getClasses().orElseThrow();

        assertEquals(List.of("KEPT"), List.copyOf(classes.keySet()));
        List<DxfWarningEvent> warnings = sink.getWarnings(DxfWarningEvent.Kind.MISSING_NAME);
        assertEquals(1, warnings.size());
        assertEquals("CLASS", warnings.get(0).recordKind());
    }

    @Test
    void otherRecordsInTheSectionAreSkipped() {
        String text = DxfText.of(
            0, "SECTION", 2, "CLASSES",
            0, "BOGUS",
            1, "ignored",
            0, "CLASS",
            1, "KEPT",
            0, "ENDSEC",
            0, "EOF");

        Map<String, DxfClass> classes = codec.parse(text, sink).getClasses().orElseThrow();

        assertEquals(1, classes.size());
        assertEquals(1, sink.getWarnings(DxfWarningEvent.Kind.STRAY_GROUP).size());
    }

    @Test
    void roundTripsClasses() {
        DxfClass dxfClass = new DxfClass();
        dxfClass.setRecordName("SCALE");
        dxfClass.setCppClassName("AcDbScale");
        dxfClass.setApplicationName("ObjectDBX Classes");
        dxfClass.setProxyFlags(1153);
        dxfClass.setInstanceCount(0);
        dxfClass.setWasAProxy(false);
        dxfClass.setIsAnEntity(false);
        Map<String, DxfClass> classes = new LinkedHashMap<>();
        classes.put(dxfClass.getRecordName(), dxfClass);
        DxfDocument document = new DxfDocument();
        document.setClasses(classes);

        String text = codec.serializeToString(document);

        assertTrue(text.startsWith(DxfText.of(0, "SECTION", 2, "CLASSES", 0, "CLASS", 1, "SCALE")));
        assertEquals(document, codec.parse(text, sink));
    }
}
