package com.questrail.dxf.codec.section;

import com.questrail.dxf.GroupShapeException;
import com.questrail.dxf.codec.GroupWriter;
import com.questrail.dxf.codec.ParseContext;
import com.questrail.dxf.codec.table.LayerCodec;
import com.questrail.dxf.codec.table.LineTypeCodec;
import com.questrail.dxf.codec.table.SymbolTableCodec;
import com.questrail.dxf.codec.table.ViewPortCodec;
import com.questrail.dxf.model.DxfDocument;
import com.questrail.dxf.model.SymbolTable;
import com.questrail.dxf.model.TableEntry;
import com.questrail.dxf.model.Tables;
import com.questrail.dxf.observability.DxfWarningEvent;
import com.questrail.dxf.scan.Group;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * TablesSectionCodec
 * -----------------------------------------------------------------------------
 * The {@code TABLES} section. {@code VPORT}, {@code LTYPE} and {@code LAYER}
 * tables are read and written in that order; other tables are skipped with a
 * warning.
 */
public final class TablesSectionCodec implements SectionCodec
{
    public static final String NAME = "TABLES";

    private final Map<String, TableBinding<?>> bindings = new LinkedHashMap<>();

    public TablesSectionCodec() {
        register(new TableBinding<>(new SymbolTableCodec<>(new ViewPortCodec()), Tables::getViewPorts, Tables::setViewPorts));
        register(new TableBinding<>(new SymbolTableCodec<>(new LineTypeCodec()), Tables::getLineTypes, Tables::setLineTypes));
        register(new TableBinding<>(new SymbolTableCodec<>(new LayerCodec()), Tables::getLayers, Tables::setLayers));
    }

    private void register(TableBinding<?> binding) {
        bindings.put(binding.codec().name(), binding);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isPresent(DxfDocument document) {
        return document.getTables().isPresent();
    }

    @Override
    public int read(ParseContext context, DxfDocument document) {
        Tables tables = new Tables();
        document.setTables(tables);
        SectionBodies.readRecords(context, NAME, SymbolTableCodec.TABLE, () -> readTable(context, tables));
        return (int) bindings.values().stream()
            .filter(binding -> binding.getter().apply(tables).isPresent())
            .count();
    }

    private void readTable(ParseContext context, Tables tables) {
        Group name = context.scanner().next();
        if (name.code() != SymbolTableCodec.TABLE_NAME) {
            throw new GroupShapeException("Expected the table name after " + SymbolTableCodec.TABLE,
                SymbolTableCodec.TABLE_NAME, name.code());
        }
        TableBinding<?> binding = bindings.get(name.text());
        if (binding != null) {
            binding.read(context, tables);
            return;
        }
        context.warn(DxfWarningEvent.Kind.UNSUPPORTED_TABLE, NAME, "Table " + name.text() + " skipped");
        Group group = context.skipRecord();
        while (!group.isMarker(SymbolTableCodec.END_TABLE) && !SectionBodies.endsSection(group)) {
            group = context.skipRecord();
        }
        if (group.isMarker(SymbolTableCodec.END_TABLE)) {
            context.skipRecord();
        }
    }

    @Override
    public Stream<Consumer<GroupWriter>> records(DxfDocument document) {
        Optional<Tables> tables = document.getTables();
        if (tables.isEmpty()) {
            return Stream.empty();
        }
        return bindings.values().stream()
            .map(binding -> binding.writer(tables.get()))
            .flatMap(Optional::stream);
    }

    private record TableBinding<R extends TableEntry>(
        SymbolTableCodec<R> codec,
        Function<Tables, Optional<SymbolTable<R>>> getter,
        BiConsumer<Tables, SymbolTable<R>> setter
    ) {
        void read(ParseContext context, Tables tables) {
            setter.accept(tables, codec.read(context));
        }

        Optional<Consumer<GroupWriter>> writer(Tables tables) {
            return getter.apply(tables).map(this::tableWriter);
        }

        private Consumer<GroupWriter> tableWriter(SymbolTable<R> table) {
            return out -> codec.write(table, out);
        }
    }
}
