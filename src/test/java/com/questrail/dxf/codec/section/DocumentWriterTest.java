package com.questrail.dxf.codec.section;

import com.questrail.dxf.DxfSerializationException;
import com.questrail.dxf.DxfText;
import com.questrail.dxf.codec.EntityCodecRegistry;
import com.questrail.dxf.codec.GroupWriter;
import com.questrail.dxf.codec.ParseContext;
import com.questrail.dxf.model.DxfClass;
import com.questrail.dxf.model.DxfDocument;
import com.questrail.dxf.model.Header;
import com.questrail.dxf.model.HeaderValue;
import com.questrail.dxf.model.Point;
import com.questrail.dxf.model.Tables;
import com.questrail.dxf.model.entity.Entity;
import com.questrail.dxf.model.entity.PointEntity;
import com.questrail.dxf.observability.DxfWarningEvent;
import com.questrail.dxf.observability.RecordingDiagnosticsSink;
import com.questrail.dxf.scan.Group;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

final class DocumentWriterTest
{
    private final RecordingDiagnosticsSink sink = new RecordingDiagnosticsSink();
    private final EntityCodecRegistry entityCodecs = EntityCodecRegistry.withBuiltIns();
    private final DocumentWriter writer = new DocumentWriter(List.of(
        new HeaderSectionCodec(),
        new ClassesSectionCodec(),
        new TablesSectionCodec(),
        new BlocksSectionCodec(entityCodecs),
        new EntitiesSectionCodec(entityCodecs)));

    private String write(DxfDocument document) {
        return writer.lines(document, sink).collect(Collectors.joining("\n"));
    }

    @Test
    void anEmptyDocumentIsJustEof() {
        assertEquals(DxfText.of(0, "EOF"), write(new DxfDocument()));
    }

    @Test
    void writesPresentSectionsInCanonicalOrder() {
        DxfDocument document = new DxfDocument();
        document.setEntities(new ArrayList<>());
        document.setClasses(new LinkedHashMap<>());
        document.setHeader(new Header());
        document.setTables(new Tables());
        document.setBlocks(new LinkedHashMap<>());

        List<String> sectionNames = new ArrayList<>();
        List<String> lines = writer.lines(document, sink).collect(Collectors.toList());
        for (int i = 0; i + 3 < lines.size(); i += 2) {
            if (lines.get(i).equals("0") && lines.get(i + 1).equals(Group.SECTION)) {
                sectionNames.add(lines.get(i + 3));
            }
        }

        assertEquals(List.of("HEADER", "CLASSES", "TABLES", "BLOCKS", "ENTITIES"), sectionNames);
        assertEquals(List.of("0", "EOF"), lines.subList(lines.size() - 2, lines.size()));
    }

    @Test
    void outputHasNoTrailingNewline() {
        DxfDocument document = new DxfDocument();
        document.setHeader(new Header().put("$ACADVER", HeaderValue.of(Group.text(1, "AC1014"))));

        String text = write(document);

        assertTrue(text.endsWith("EOF"));
        assertFalse(text.contains("\n\n"));
    }

    @Test
    void writesEntitiesInListOrder() {
        List<Entity> entities = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            PointEntity point = new PointEntity();
            point.setPosition(Point.of(i, 0.0));
            entities.add(point);
        }
        DxfDocument document = new DxfDocument();
        document.setEntities(entities);

        assertEquals(DxfText.of(
            0, "SECTION", 2, "ENTITIES",
            0, "POINT", 10, "0.0", 20, "0.0",
            0, "POINT", 10, "1.0", 20, "0.0",
            0, "POINT", 10, "2.0", 20, "0.0",
            0, "ENDSEC",
            0, "EOF"), write(document));
    }

    // -------------------------------------------------------------------------
    // Laziness
    // -------------------------------------------------------------------------

    /**
     * Pulling the first lines renders only the records those lines come from,
     * not the remainder of the section.
     */
    @Test
    void recordsAreRenderedOnlyWhenTheirLinesArePulled() {
        AtomicInteger rendered = new AtomicInteger();
        DocumentWriter counting = new DocumentWriter(List.of(new CountingSection(1000, rendered)));

        Iterator<String> lines = counting.lines(new DxfDocument(), sink).iterator();
        assertEquals(0, rendered.get());

        List<String> head = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            head.add(lines.next());
        }

        assertEquals(List.of("0", "SECTION", "2", "COUNTED", "999", "record 0"), head);
        assertEquals(1, rendered.get());
    }

    @Test
    void aConsumerThatStopsEarlyStopsProduction() {
        AtomicInteger rendered = new AtomicInteger();
        DocumentWriter counting = new DocumentWriter(List.of(new CountingSection(1000, rendered)));

        List<String> head = counting.lines(new DxfDocument(), sink).limit(10).collect(Collectors.toList());

        assertEquals(10, head.size());
        assertTrue(rendered.get() <= 4, "rendered " + rendered.get() + " records");
    }

    @Test
    void aValueThatDoesNotSuitItsCodeFailsWhileConsuming() {
        DxfDocument document = new DxfDocument();
        document.setHeader(new Header().put("$BROKEN", HeaderValue.of(Group.text(40, "not a real"))));

        Stream<String> lines = writer.lines(document, sink);

        assertThrows(DxfSerializationException.class, () -> lines.collect(Collectors.toList()));
    }

    @Test
    void entitiesWithoutCodecAreReportedAndLeftOut() {
        DxfDocument document = new DxfDocument();
        document.setEntities(new ArrayList<>(List.of(new Unknown(), new PointEntity())));

        String text = write(document);

        assertFalse(text.contains("UNKNOWN"));
        assertTrue(text.contains(DxfText.of(0, "POINT")));
        List<DxfWarningEvent> warnings = sink.getWarnings(DxfWarningEvent.Kind.UNSUPPORTED_ENTITY);
        assertEquals(1, warnings.size());
        assertEquals("ENTITIES", warnings.get(0).recordKind());
    }

    @Test
    void classesAreWrittenInMapOrder() {
        LinkedHashMap<String, DxfClass> classes = new LinkedHashMap<>();
        for (String name : List.of("B", "A", "C")) {
            DxfClass dxfClass = new DxfClass();
            dxfClass.setRecordName(name);
            classes.put(name, dxfClass);
        }
        DxfDocument document = new DxfDocument();
        document.setClasses(classes);

        assertEquals(DxfText.of(
            0, "SECTION", 2, "CLASSES",
            0, "CLASS", 1, "B",
            0, "CLASS", 1, "A",
            0, "CLASS", 1, "C",
            0, "ENDSEC",
            0, "EOF"), write(document));
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private static final class Unknown extends Entity
    {
        @Override
        public String type() {
            return "UNKNOWN";
        }
    }

    /** A section of comment records that counts how many of them were rendered. */
    private static final class CountingSection implements SectionCodec
    {
        private final int size;
        private final AtomicInteger rendered;

        CountingSection(int size, AtomicInteger rendered) {
            this.size = size;
            this.rendered = rendered;
        }

        @Override
        public String name() {
            return "COUNTED";
        }

        @Override
        public boolean isPresent(DxfDocument document) {
            return true;
        }

        @Override
        public int read(ParseContext context, DxfDocument document) {
            throw new UnsupportedOperationException();
        }

        @Override
        public Stream<Consumer<GroupWriter>> records(DxfDocument document) {
            return IntStream.range(0, size).<Consumer<GroupWriter>>mapToObj(i -> out -> {
                rendered.incrementAndGet();
                out.text(999, "record " + i);
            });
        }
    }
}
