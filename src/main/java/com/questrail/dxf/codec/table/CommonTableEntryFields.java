package com.questrail.dxf.codec.table;

import com.questrail.dxf.codec.ApplicationGroups;
import com.questrail.dxf.codec.GroupWriter;
import com.questrail.dxf.codec.ParseContext;
import com.questrail.dxf.codec.RecordSchema;
import com.questrail.dxf.model.TableEntry;
import com.questrail.dxf.scan.Group;

/**
 * Properties every symbol table record accepts, tried after the record kind's
 * own table. Subclass markers (100) are consumed and not kept.
 */
final class CommonTableEntryFields
{
    private static final int HANDLE = 5;
    private static final int SUBCLASS_MARKER = 100;

    private static final RecordSchema<TableEntry> SCHEMA = RecordSchema.<TableEntry>builder()
        .text(330, TableEntry::getOwnerHandle, TableEntry::setOwnerHandle)
        .text(2, TableEntry::getName, TableEntry::setName)
        .integer(70, TableEntry::getFlags, TableEntry::setFlags)
        .build();

    private CommonTableEntryFields() {}

    static boolean read(TableEntry entry, Group group, ParseContext context) {
        if (SCHEMA.handle(entry, group, context)) {
            return true;
        }
        return switch (group.code()) {
            case HANDLE -> {
                entry.setHandle(group.text());
                yield true;
            }
            case ApplicationGroups.CODE -> {
                if (!ApplicationGroups.isStart(group)) {
                    yield false;
                }
                entry.getApplicationGroups().add(ApplicationGroups.read(context, entry.type()));
                yield true;
            }
            case SUBCLASS_MARKER -> true;
            default -> false;
        };
    }

    static void write(TableEntry entry, GroupWriter out) {
        if (entry.getHandle() != null) {
            out.text(HANDLE, entry.getHandle());
        }
        ApplicationGroups.write(out, entry.getApplicationGroups());
        SCHEMA.write(entry, out);
    }
}
