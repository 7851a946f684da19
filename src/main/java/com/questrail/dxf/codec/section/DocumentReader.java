package com.questrail.dxf.codec.section;

import com.questrail.dxf.GroupShapeException;
import com.questrail.dxf.codec.ParseContext;
import com.questrail.dxf.model.DxfDocument;
import com.questrail.dxf.observability.DxfSectionEvent;
import com.questrail.dxf.observability.DxfWarningEvent;
import com.questrail.dxf.scan.Group;
import com.questrail.dxf.scan.GroupScanner;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * DocumentReader
 * =============================================================================
 * Assembles a {@link DxfDocument} from a group stream.
 *
 * <h2>States</h2>
 * <ul>
 *   <li><b>Searching</b>: between sections, looking for {@code 0/SECTION}.
 *       Anything else found here is reported and skipped.</li>
 *   <li><b>In section</b>: {@code 2/NAME} selects a {@link SectionCodec}, which
 *       consumes the section through {@code 0/ENDSEC}.</li>
 *   <li><b>Done</b>: {@code 0/EOF} has been read.</li>
 * </ul>
 *
 * Sections without a codec are skipped with a {@code SKIPPED_SECTION} warning;
 * their content is not kept.
 */
public final class DocumentReader
{
    private static final int SECTION_NAME = 2;
    private static final String DOCUMENT = "DOCUMENT";

    private final Map<String, SectionCodec> sections = new LinkedHashMap<>();

    public DocumentReader(List<SectionCodec> sections) {
        for (SectionCodec section : sections) {
            this.sections.put(section.name(), section);
        }
    }

    public DxfDocument read(ParseContext context) {
        GroupScanner scanner = context.scanner();
        DxfDocument document = new DxfDocument();
        while (!scanner.isExhausted()) {
            Group group = scanner.next();
            if (group.isEof()) {
                break;
            }
            if (!group.isMarker(Group.SECTION)) {
                if (group.startsRecord()) {
                    context.warn(DxfWarningEvent.Kind.STRAY_GROUP, DOCUMENT,
                        "Unexpected " + group.text() + " record outside any section");
                }
                else {
                    context.unhandled(DOCUMENT, group);
                }
                continue;
            }
            Group name = scanner.next();
            if (name.code() != SECTION_NAME) {
                throw new GroupShapeException(
                    "Expected section name with code " + SECTION_NAME + " but got " + name,
                    SECTION_NAME, name.code());
            }
            SectionCodec section = sections.get(name.text());
            if (section == null) {
                context.warn(DxfWarningEvent.Kind.SKIPPED_SECTION, DOCUMENT,
                    "Section " + name.text() + " is not supported; its content was dropped");
                skipSection(context);
                continue;
            }
            int count = section.read(context, document);
            context.diagnostics().onSection(new DxfSectionEvent(section.name(), count));
        }
        return document;
    }

    private static void skipSection(ParseContext context) {
        Group group = context.skipRecord();
        while (!SectionBodies.endsSection(group)) {
            group = context.skipRecord();
        }
    }
}
