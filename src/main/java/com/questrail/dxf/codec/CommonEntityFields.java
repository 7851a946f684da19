package com.questrail.dxf.codec;

import com.questrail.dxf.model.entity.Entity;
import com.questrail.dxf.scan.Group;

/**
 * Properties every entity kind accepts, tried after the kind's own table.
 *
 * <p>The handle and application groups are written first, the way AutoCAD
 * writes them. Besides the simple fields this handles three structural codes:
 * {@code 102} application groups, {@code 100} subclass markers (consumed, not
 * kept) and {@code 101} embedded objects (skipped up to the next code 0).</p>
 */
public final class CommonEntityFields
{
    private static final int HANDLE = 5;
    private static final int SUBCLASS_MARKER = 100;
    private static final int EMBEDDED_OBJECT = 101;

    private static final RecordSchema<Entity> SCHEMA = RecordSchema.<Entity>builder()
        .text(330, Entity::getOwnerHandle, Entity::setOwnerHandle)
        .text(8, Entity::getLayer, Entity::setLayer)
        .text(6, Entity::getLineType, Entity::setLineType)
        .text(347, Entity::getMaterialHandle, Entity::setMaterialHandle)
        .integer(62, Entity::getColorIndex, Entity::setColorIndex)
        .integer(370, Entity::getLineweight, Entity::setLineweight)
        .real(48, Entity::getLineTypeScale, Entity::setLineTypeScale)
        .invertedFlag(60, Entity::getVisible, Entity::setVisible)
        .integer(420, Entity::getTrueColor, Entity::setTrueColor)
        .flag(66, Entity::getEntitiesFollow, Entity::setEntitiesFollow)
        .flag(67, Entity::getInPaperSpace, Entity::setInPaperSpace)
        .build();

    private CommonEntityFields() {}

    public static boolean read(Entity entity, Group group, ParseContext context) {
        if (SCHEMA.handle(entity, group, context)) {
            return true;
        }
        switch (group.code()) {
            case HANDLE:
                entity.setHandle(group.text());
                return true;
            case ApplicationGroups.CODE:
                if (!ApplicationGroups.isStart(group)) {
                    return false;
                }
                entity.getApplicationGroups().add(ApplicationGroups.read(context, entity.type()));
                return true;
            case SUBCLASS_MARKER:
                return true;
            case EMBEDDED_OBJECT:
                skipEmbeddedObject(context);
                return true;
            default:
                return false;
        }
    }

    private static void skipEmbeddedObject(ParseContext context) {
        context.skipRecord();
        context.scanner().rewind();
    }

    public static void write(Entity entity, GroupWriter out) {
        String handle = entity.getHandle();
        if (handle != null) {
            out.text(HANDLE, handle);
        }
        ApplicationGroups.write(out, entity.getApplicationGroups());
        SCHEMA.write(entity, out);
    }
}
