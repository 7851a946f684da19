package com.questrail.dxf.codec.section;

import com.questrail.dxf.codec.GroupWriter;
import com.questrail.dxf.codec.ParseContext;
import com.questrail.dxf.model.DxfDocument;

import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * SectionCodec
 * -----------------------------------------------------------------------------
 * Reads and writes the body of one top-level section.
 *
 * <h2>Reading</h2>
 * {@link #read} is called once {@code 0/SECTION} and {@code 2/NAME} have been
 * read. It consumes the section up to and including {@code 0/ENDSEC}. When the
 * input ends first it warns and returns with the {@code EOF} group as the
 * scanner's last read group.
 *
 * <h2>Writing</h2>
 * {@link #records} yields one writer per record, in order, without the section
 * markers. Records are only rendered when the writer is invoked.
 */
public interface SectionCodec
{
    /** The section name, e.g. {@code ENTITIES}. */
    String name();

    boolean isPresent(DxfDocument document);

    /**
     * Reads the section into {@code document}.
     *
     * @return the number of records (or header variables) read
     */
    int read(ParseContext context, DxfDocument document);

    Stream<Consumer<GroupWriter>> records(DxfDocument document);
}
