package com.questrail.dxf.codec.section;

import com.questrail.dxf.codec.EntityCodec;
import com.questrail.dxf.codec.EntityCodecRegistry;
import com.questrail.dxf.codec.GroupWriter;
import com.questrail.dxf.codec.ParseContext;
import com.questrail.dxf.model.entity.Entity;
import com.questrail.dxf.observability.DxfWarningEvent;
import com.questrail.dxf.scan.Group;
import com.questrail.dxf.scan.GroupScanner;

import java.util.List;
import java.util.Optional;

/**
 * Entity runs, shared by the {@code ENTITIES} section and block definitions.
 */
final class EntityLists
{
    private EntityLists() {}

    /**
     * Reads entities, starting at the scanner's last read group, until a
     * {@code 0/terminator} group. Each entity is dispatched on its kind token to
     * the registered codec; kinds without one are skipped with a warning.
     *
     * @return the group that ended the run: the terminator, or the
     *         {@code ENDSEC} or {@code EOF} group when the run was not closed
     */
    static Group read(ParseContext context, List<Entity> entities, String terminator, String owner) {
        GroupScanner scanner = context.scanner();
        Group group = scanner.lastRead();
        while (!group.isMarker(terminator)) {
            if (SectionBodies.endsSection(group)) {
                return group;
            }
            if (!group.startsRecord()) {
                context.unhandled(owner, group);
                group = scanner.next();
                continue;
            }
            Optional<EntityCodec<?>> codec = context.entityCodecs().find(group.text());
            if (codec.isPresent()) {
                entities.add(codec.get().read(context));
                group = scanner.lastRead();
            }
            else {
                context.warn(DxfWarningEvent.Kind.UNSUPPORTED_ENTITY, owner,
                    "No codec for entity " + group.text() + "; skipped");
                group = context.skipRecord();
            }
        }
        return group;
    }

    /** Writes {@code entity} with its registered codec, or warns and writes nothing. */
    static void write(EntityCodecRegistry codecs, Entity entity, GroupWriter out, String owner) {
        Optional<EntityCodec<?>> codec = codecs.find(entity.type());
        if (codec.isEmpty()) {
            out.diagnostics().onWarning(new DxfWarningEvent(DxfWarningEvent.Kind.UNSUPPORTED_ENTITY, owner,
                "No codec for entity " + entity.type() + "; not written"));
            return;
        }
        EntityCodecRegistry.write(codec.get(), entity, out);
    }
}
