package com.questrail.dxf.codec.table;

import com.questrail.dxf.codec.ApplicationGroups;
import com.questrail.dxf.codec.GroupWriter;
import com.questrail.dxf.codec.ParseContext;
import com.questrail.dxf.codec.RecordSchema;
import com.questrail.dxf.model.SymbolTable;
import com.questrail.dxf.model.TableEntry;
import com.questrail.dxf.observability.DxfWarningEvent;
import com.questrail.dxf.scan.Group;
import com.questrail.dxf.scan.GroupScanner;

import java.util.Objects;

/**
 * SymbolTableCodec
 * -----------------------------------------------------------------------------
 * One {@code TABLE} block: the table header, the records, and {@code ENDTAB}.
 *
 * <pre>
 *   0/TABLE  2/LAYER  5/handle  330/owner  70/max entries
 *   0/LAYER ...
 *   0/LAYER ...
 *   0/ENDTAB
 * </pre>
 *
 * A declared maximum that differs from the number of records read is only
 * reported. Records of another kind are reported and skipped.
 */
public final class SymbolTableCodec<R extends TableEntry>
{
    public static final String TABLE = "TABLE";
    public static final String END_TABLE = "ENDTAB";
    public static final int TABLE_NAME = 2;

    private static final int HANDLE = 5;
    private static final int SUBCLASS_MARKER = 100;

    private static final RecordSchema<SymbolTable<?>> HEADER = RecordSchema.<SymbolTable<?>>builder()
        .text(330, SymbolTable::getOwnerHandle, SymbolTable::setOwnerHandle)
        .integer(70, SymbolTable::getMaxEntries, SymbolTable::setMaxEntries)
        .build();

    private final AbstractTableEntryCodec<R> entryCodec;

    public SymbolTableCodec(AbstractTableEntryCodec<R> entryCodec) {
        this.entryCodec = Objects.requireNonNull(entryCodec, "entryCodec");
    }

    /** The table name, e.g. {@code LAYER}. */
    public String name() {
        return entryCodec.kind();
    }

    /**
     * Reads the table whose {@code 2/NAME} group was read last. On return the
     * group after {@code ENDTAB} is the last read group, or the {@code ENDSEC}
     * or {@code EOF} group that cut the table short.
     */
    public SymbolTable<R> read(ParseContext context) {
        SymbolTable<R> table = new SymbolTable<>();
        context.readFields(TABLE, table, HEADER.or(SymbolTableCodec::readHeaderField));

        GroupScanner scanner = context.scanner();
        Group group = scanner.lastRead();
        while (!group.isMarker(END_TABLE)) {
            if (group.isMarker(Group.END_SECTION) || group.isEof()) {
                context.warn(DxfWarningEvent.Kind.UNTERMINATED_STRUCTURE, name(),
                    "Table " + name() + " is not closed by " + END_TABLE);
                break;
            }
            if (group.isMarker(entryCodec.kind())) {
                addEntry(context, table, entryCodec.read(context));
            }
            else {
                context.warn(DxfWarningEvent.Kind.STRAY_GROUP, name(),
                    "Unexpected " + group.text() + " record in table " + name());
                context.skipRecord();
            }
            group = scanner.lastRead();
        }
        if (group.isMarker(END_TABLE)) {
            context.readFields(END_TABLE, table, (record, unused, ctx) -> false);
        }
        context.checkCount(name(), "table records", table.getMaxEntries(), table.getEntries().size());
        return table;
    }

    private void addEntry(ParseContext context, SymbolTable<R> table, R entry) {
        if (entryCodec.requiresName() && entry.getName() == null) {
            context.warn(DxfWarningEvent.Kind.MISSING_NAME, name(),
                "Record with handle " + entry.getHandle() + " has no name and was dropped");
            return;
        }
        table.getEntries().add(entry);
    }

    private static boolean readHeaderField(SymbolTable<?> table, Group group, ParseContext context) {
        return switch (group.code()) {
            case HANDLE -> {
                table.setHandle(group.text());
                yield true;
            }
            case ApplicationGroups.CODE -> {
                if (!ApplicationGroups.isStart(group)) {
                    yield false;
                }
                table.getApplicationGroups().add(ApplicationGroups.read(context, TABLE));
                yield true;
            }
            case SUBCLASS_MARKER -> true;
            default -> false;
        };
    }

    public void write(SymbolTable<R> table, GroupWriter out) {
        out.marker(TABLE);
        out.text(TABLE_NAME, name());
        if (table.getHandle() != null) {
            out.text(HANDLE, table.getHandle());
        }
        ApplicationGroups.write(out, table.getApplicationGroups());
        HEADER.write(table, out);
        for (R entry : table.getEntries()) {
            entryCodec.write(entry, out);
        }
        out.marker(END_TABLE);
    }
}
