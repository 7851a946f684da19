package com.questrail.dxf.codec.table;

import com.questrail.dxf.codec.GroupHandler;
import com.questrail.dxf.codec.GroupWriter;
import com.questrail.dxf.codec.ParseContext;
import com.questrail.dxf.codec.RecordSchema;
import com.questrail.dxf.model.TableEntry;
import com.questrail.dxf.scan.Group;

import java.util.Objects;

/**
 * AbstractTableEntryCodec
 * -----------------------------------------------------------------------------
 * Reads and writes one symbol table record kind. Works like
 * {@link com.questrail.dxf.codec.AbstractEntityCodec}: the kind's schema, then
 * {@link #readSpecial}, then the properties common to every table record.
 */
public abstract class AbstractTableEntryCodec<R extends TableEntry>
{
    private final String kind;

    protected AbstractTableEntryCodec(String kind) {
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    /** The code-0 token of the records, which is also the table name. */
    public final String kind() {
        return kind;
    }

    /** Whether a record without a name is dropped. */
    public boolean requiresName() {
        return true;
    }

    protected abstract R newEntry();

    protected abstract RecordSchema<R> schema();

    protected boolean readSpecial(R entry, Group group, ParseContext context) {
        return false;
    }

    protected void writeSpecial(R entry, GroupWriter out) {
    }

    protected void afterRead(R entry, ParseContext context) {
    }

    /**
     * Reads one record; the scanner's last read group is its {@code 0/KIND}
     * marker. Returns with the following code-0 group as the last read group.
     */
    public R read(ParseContext context) {
        R entry = newEntry();
        GroupHandler<R> handler = schema()
            .or(this::readSpecial)
            .or(CommonTableEntryFields::read);
        context.readFields(kind, entry, handler);
        afterRead(entry, context);
        return entry;
    }

    /** Writes one record, marker included. */
    public void write(R entry, GroupWriter out) {
        out.marker(kind);
        CommonTableEntryFields.write(entry, out);
        schema().write(entry, out);
        writeSpecial(entry, out);
    }
}
