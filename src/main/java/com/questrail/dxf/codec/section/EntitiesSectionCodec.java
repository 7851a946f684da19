package com.questrail.dxf.codec.section;

import com.questrail.dxf.codec.EntityCodecRegistry;
import com.questrail.dxf.codec.GroupWriter;
import com.questrail.dxf.codec.ParseContext;
import com.questrail.dxf.model.DxfDocument;
import com.questrail.dxf.model.entity.Entity;
import com.questrail.dxf.scan.Group;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * The {@code ENTITIES} section: the drawing's entities, each one a record.
 */
public final class EntitiesSectionCodec implements SectionCodec
{
    public static final String NAME = "ENTITIES";

    private final EntityCodecRegistry entityCodecs;

    public EntitiesSectionCodec(EntityCodecRegistry entityCodecs) {
        this.entityCodecs = Objects.requireNonNull(entityCodecs, "entityCodecs");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isPresent(DxfDocument document) {
        return document.getEntities().isPresent();
    }

    @Override
    public int read(ParseContext context, DxfDocument document) {
        List<Entity> entities = new ArrayList<>();
        document.setEntities(entities);
        context.scanner().next();
        Group end = EntityLists.read(context, entities, Group.END_SECTION, NAME);
        if (end.isEof()) {
            SectionBodies.unterminated(context, NAME);
        }
        return entities.size();
    }

    @Override
    public Stream<Consumer<GroupWriter>> records(DxfDocument document) {
        return document.getEntities()
            .map(entities -> entities.stream())
            .orElseGet(Stream::empty)
            .map(this::entityWriter);
    }

    private Consumer<GroupWriter> entityWriter(Entity entity) {
        return out -> EntityLists.write(entityCodecs, entity, out, NAME);
    }
}
