package com.questrail.dxf.codec.section;

import com.questrail.dxf.codec.GroupWriter;
import com.questrail.dxf.model.DxfDocument;
import com.questrail.dxf.observability.DxfDiagnosticsSink;
import com.questrail.dxf.scan.Group;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * DocumentWriter
 * =============================================================================
 * Renders a {@link DxfDocument} as a lazy stream of output lines.
 *
 * <h2>Order</h2>
 * Present sections in the order the codecs are given (canonically HEADER,
 * CLASSES, TABLES, BLOCKS, ENTITIES), each framed by {@code 0/SECTION 2/NAME}
 * and {@code 0/ENDSEC}, then {@code 0/EOF}.
 *
 * <h2>Laziness</h2>
 * Lines are produced one record at a time as the stream is pulled. A consumer
 * that stops early stops production; nothing past the current record is
 * rendered.
 */
public final class DocumentWriter
{
    private static final int SECTION_NAME = 2;

    private final List<SectionCodec> sections;

    public DocumentWriter(List<SectionCodec> sections) {
        this.sections = List.copyOf(sections);
    }

    public Stream<String> lines(DxfDocument document, DxfDiagnosticsSink diagnostics) {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(diagnostics, "diagnostics");
        Deque<Supplier<Iterator<Consumer<GroupWriter>>>> parts = new ArrayDeque<>();
        for (SectionCodec section : sections) {
            if (!section.isPresent(document)) {
                continue;
            }
            parts.add(() -> single(out -> out.marker(Group.SECTION).text(SECTION_NAME, section.name())));
            parts.add(() -> section.records(document).iterator());
            parts.add(() -> single(out -> out.marker(Group.END_SECTION)));
        }
        parts.add(() -> single(out -> out.marker(Group.EOF)));
        Iterator<String> lines = new RecordLines(parts, diagnostics);
        return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(lines, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    private static Iterator<Consumer<GroupWriter>> single(Consumer<GroupWriter> record) {
        return Collections.singletonList(record).iterator();
    }

    /**
     * Pulls records from the parts in turn and renders each one only when its
     * lines are needed.
     */
    private static final class RecordLines implements Iterator<String>
    {
        private final Deque<Supplier<Iterator<Consumer<GroupWriter>>>> parts;
        private final DxfDiagnosticsSink diagnostics;

        private Iterator<Consumer<GroupWriter>> records = Collections.emptyIterator();
        private Iterator<String> current = Collections.emptyIterator();

        RecordLines(Deque<Supplier<Iterator<Consumer<GroupWriter>>>> parts, DxfDiagnosticsSink diagnostics) {
            this.parts = parts;
            this.diagnostics = diagnostics;
        }

        @Override
        public boolean hasNext() {
            while (!current.hasNext()) {
                while (!records.hasNext()) {
                    if (parts.isEmpty()) {
                        return false;
                    }
                    records = parts.poll().get();
                }
                GroupWriter out = new GroupWriter(diagnostics);
                records.next().accept(out);
                current = out.lines().iterator();
            }
            return true;
        }

        @Override
        public String next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return current.next();
        }
    }
}
