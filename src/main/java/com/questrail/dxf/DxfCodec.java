package com.questrail.dxf;

import com.questrail.dxf.codec.EntityCodec;
import com.questrail.dxf.codec.EntityCodecRegistry;
import com.questrail.dxf.codec.ParseContext;
import com.questrail.dxf.codec.section.BlocksSectionCodec;
import com.questrail.dxf.codec.section.ClassesSectionCodec;
import com.questrail.dxf.codec.section.DocumentReader;
import com.questrail.dxf.codec.section.DocumentWriter;
import com.questrail.dxf.codec.section.EntitiesSectionCodec;
import com.questrail.dxf.codec.section.HeaderSectionCodec;
import com.questrail.dxf.codec.section.SectionCodec;
import com.questrail.dxf.codec.section.TablesSectionCodec;
import com.questrail.dxf.config.DxfCodecConfig;
import com.questrail.dxf.model.DxfDocument;
import com.questrail.dxf.model.HeaderValue;
import com.questrail.dxf.observability.DxfDiagnosticsSink;
import com.questrail.dxf.observability.DxfErrorEvent;
import com.questrail.dxf.scan.GroupScanner;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * DxfCodec
 * =============================================================================
 * Entry point of the library: turns DXF text into a {@link DxfDocument} and back.
 *
 * <h2>Parsing</h2>
 * {@link #parse(String)} reads the whole text in one pass. Unknown group codes,
 * unknown sections and soft inconsistencies are reported to the diagnostics sink
 * and parsing continues; structural failures throw a {@link DxfParseException}
 * and no partial document is returned.
 *
 * <h2>Serializing</h2>
 * {@link #serialize(DxfDocument)} yields the output lines lazily, one record at a
 * time. {@link #serializeToString(DxfDocument)} drains it into newline-joined
 * text without a trailing newline.
 *
 * <h2>Extension</h2>
 * {@link #registerEntityCodec(EntityCodec)} adds (or replaces) support for an
 * entity kind. Registration must happen before the codec is used; instances are
 * not safe for concurrent modification.
 */
public final class DxfCodec
{
    private final DxfCodecConfig config;
    private final EntityCodecRegistry entityCodecs;
    private final DocumentReader reader;
    private final DocumentWriter writer;

    public DxfCodec() {
        this(DxfCodecConfig.defaults());
    }

    public DxfCodec(DxfCodecConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.entityCodecs = config.entityCodecs().copy();
        List<SectionCodec> sections = List.of(
            new HeaderSectionCodec(),
            new ClassesSectionCodec(),
            new TablesSectionCodec(),
            new BlocksSectionCodec(entityCodecs),
            new EntitiesSectionCodec(entityCodecs));
        this.reader = new DocumentReader(sections);
        this.writer = new DocumentWriter(sections);
    }

    public DxfDocument parse(String text) {
        return parse(text, config.diagnostics());
    }

    /**
     * Parses {@code text}, reporting diagnostics to {@code diagnostics}.
     *
     * @throws DxfParseException if the text is not a well-formed group stream
     */
    public DxfDocument parse(String text, DxfDiagnosticsSink diagnostics) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(diagnostics, "diagnostics");
        try {
            GroupScanner scanner = GroupScanner.of(text, diagnostics);
            return reader.read(new ParseContext(scanner, diagnostics, entityCodecs));
        }
        catch (DxfParseException e) {
            diagnostics.onError(new DxfErrorEvent(e.getMessage(), e));
            throw e;
        }
    }

    public Stream<String> serialize(DxfDocument document) {
        return serialize(document, config.diagnostics());
    }

    /**
     * Alternating code and value lines of {@code document}, produced as the
     * stream is consumed.
     *
     * @throws DxfSerializationException while the stream is consumed, if a field
     *                                   value does not suit its group code
     */
    public Stream<String> serialize(DxfDocument document, DxfDiagnosticsSink diagnostics) {
        return writer.lines(document, diagnostics);
    }

    /**
     * The serialized lines as text tokens with {@code "\n"} separators between
     * them, suitable for incremental writing to a file or a chunked blob.
     */
    public Iterator<String> tokens(DxfDocument document) {
        Iterator<String> lines = serialize(document).iterator();
        return new Iterator<>() {
            private boolean separatorDue;

            @Override
            public boolean hasNext() {
                return lines.hasNext();
            }

            @Override
            public String next() {
                if (!lines.hasNext()) {
                    throw new NoSuchElementException();
                }
                if (separatorDue) {
                    separatorDue = false;
                    return "\n";
                }
                separatorDue = true;
                return lines.next();
            }
        };
    }

    public String serializeToString(DxfDocument document) {
        return serializeToString(document, config.diagnostics());
    }

    public String serializeToString(DxfDocument document, DxfDiagnosticsSink diagnostics) {
        try (Stream<String> lines = serialize(document, diagnostics)) {
            return lines.collect(Collectors.joining("\n"));
        }
    }

    public DxfCodec registerEntityCodec(EntityCodec<?> codec) {
        entityCodecs.register(codec);
        return this;
    }

    /** The entity codecs this instance reads and writes with. */
    public EntityCodecRegistry entityCodecs() {
        return entityCodecs;
    }

    /**
     * Builds a header value for variable {@code name}, typed by the code the
     * configured catalog assigns to it.
     *
     * @throws IllegalArgumentException if the variable is unknown or the value does not fit
     */
    public HeaderValue headerValue(String name, Object value) {
        return config.headerCatalog().valueOf(name, value);
    }
}
