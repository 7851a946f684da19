package com.questrail.dxf.codec.section;

import com.questrail.dxf.codec.ParseContext;
import com.questrail.dxf.observability.DxfWarningEvent;
import com.questrail.dxf.scan.Group;
import com.questrail.dxf.scan.GroupScanner;

/**
 * Loops shared by the section codecs.
 */
final class SectionBodies
{
    private SectionBodies() {}

    /**
     * Reads a section made of {@code 0/marker} records. {@code readRecord} is
     * called with the marker as the last read group and must return with the
     * code-0 group that follows the record as the last read group.
     *
     * <p>Other records are reported and skipped. Loose groups are reported as
     * unhandled.</p>
     */
    static void readRecords(ParseContext context, String section, String marker, Runnable readRecord) {
        GroupScanner scanner = context.scanner();
        Group group = scanner.next();
        while (!group.isMarker(Group.END_SECTION)) {
            if (group.isEof()) {
                unterminated(context, section);
                return;
            }
            if (group.isMarker(marker)) {
                readRecord.run();
                group = scanner.lastRead();
            }
            else if (group.startsRecord()) {
                context.warn(DxfWarningEvent.Kind.STRAY_GROUP, section,
                    "Unexpected " + group.text() + " record skipped");
                group = context.skipRecord();
            }
            else {
                context.unhandled(section, group);
                group = scanner.next();
            }
        }
    }

    static boolean endsSection(Group group) {
        return group.isMarker(Group.END_SECTION) || group.isEof();
    }

    static void unterminated(ParseContext context, String section) {
        context.warn(DxfWarningEvent.Kind.UNTERMINATED_STRUCTURE, section,
            "Section " + section + " is not closed by " + Group.END_SECTION);
    }
}
