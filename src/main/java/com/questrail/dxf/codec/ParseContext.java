package com.questrail.dxf.codec;

import com.questrail.dxf.observability.DxfDiagnosticsSink;
import com.questrail.dxf.observability.DxfWarningEvent;
import com.questrail.dxf.observability.UnhandledGroupEvent;
import com.questrail.dxf.scan.Group;
import com.questrail.dxf.scan.GroupScanner;

import java.util.Objects;

/**
 * State shared by the reconstructors of a single parse pass: the scanner, the
 * diagnostics sink and the entity codecs to dispatch to.
 */
public final class ParseContext
{
    private final GroupScanner scanner;
    private final DxfDiagnosticsSink diagnostics;
    private final EntityCodecRegistry entityCodecs;

    public ParseContext(GroupScanner scanner, DxfDiagnosticsSink diagnostics, EntityCodecRegistry entityCodecs) {
        this.scanner = Objects.requireNonNull(scanner, "scanner");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        this.entityCodecs = Objects.requireNonNull(entityCodecs, "entityCodecs");
    }

    public GroupScanner scanner() {
        return scanner;
    }

    public DxfDiagnosticsSink diagnostics() {
        return diagnostics;
    }

    public EntityCodecRegistry entityCodecs() {
        return entityCodecs;
    }

    /**
     * The reconstruction loop shared by every record kind: reads groups until the
     * next code-0 group, offering each one to {@code handler}. Groups nobody
     * handles are reported and discarded.
     *
     * <p>On return the code-0 group that ended the record is the scanner's last
     * read group.</p>
     */
    public <R> R readFields(String recordKind, R record, GroupHandler<? super R> handler) {
        Group group = scanner.next();
        while (!group.startsRecord()) {
            if (!handler.handle(record, group, this)) {
                unhandled(recordKind, group);
            }
            group = scanner.next();
        }
        return record;
    }

    /**
     * Like {@link #readFields}, for a nested structure closed by a group with
     * {@code endCode} (for example {@code 301/}} after {@code 300/CONTEXT_DATA{}).
     * The closing group is consumed. A code-0 group before it means the structure
     * was never closed: it is reported and left unread for the enclosing record.
     */
    public <R> R readUntil(String recordKind, R record, GroupHandler<? super R> handler, int endCode) {
        Group group = scanner.next();
        while (group.code() != endCode) {
            if (group.startsRecord()) {
                scanner.rewind();
                warn(DxfWarningEvent.Kind.UNTERMINATED_STRUCTURE, recordKind,
                    "Missing closing group " + endCode + " before " + group);
                return record;
            }
            if (!handler.handle(record, group, this)) {
                unhandled(recordKind, group);
            }
            group = scanner.next();
        }
        return record;
    }

    /** Reads up to and including the next code-0 group, discarding what it passes, and returns it. */
    public Group skipRecord() {
        Group group = scanner.next();
        while (!group.startsRecord()) {
            group = scanner.next();
        }
        return group;
    }

    public void unhandled(String recordKind, Group group) {
        diagnostics.onUnhandledGroup(new UnhandledGroupEvent(recordKind, group));
    }

    public void warn(DxfWarningEvent.Kind kind, String recordKind, String message) {
        diagnostics.onWarning(new DxfWarningEvent(kind, recordKind, message));
    }

    /** Warns when a declared count disagrees with what was read; {@code null} means nothing was declared. */
    public void checkCount(String recordKind, String what, Integer declared, int actual) {
        if (declared != null && declared != actual) {
            warn(DxfWarningEvent.Kind.COUNT_MISMATCH, recordKind,
                "Declared " + declared + " " + what + " but read " + actual);
        }
    }
}
