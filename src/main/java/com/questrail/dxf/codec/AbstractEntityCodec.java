package com.questrail.dxf.codec;

import com.questrail.dxf.model.entity.Entity;
import com.questrail.dxf.scan.Group;

import java.util.Objects;

/**
 * AbstractEntityCodec
 * -----------------------------------------------------------------------------
 * Skeleton shared by the built-in entity codecs.
 *
 * <p>Reading offers every group, in order, to:</p>
 * <ol>
 *   <li>the kind's {@link RecordSchema} (simple and structural fields)</li>
 *   <li>{@link #readSpecial} for codes that need more than a table entry
 *       (vertex runs, nested child records)</li>
 *   <li>{@link CommonEntityFields}</li>
 * </ol>
 * and reports whatever is left as unhandled. Writing mirrors it: common
 * properties, then the schema walk, then {@link #writeSpecial}.
 */
public abstract class AbstractEntityCodec<E extends Entity> implements EntityCodec<E>
{
    private final String kind;
    private final Class<E> entityType;

    protected AbstractEntityCodec(String kind, Class<E> entityType) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.entityType = Objects.requireNonNull(entityType, "entityType");
    }

    @Override
    public final String kind() {
        return kind;
    }

    @Override
    public final Class<E> entityType() {
        return entityType;
    }

    protected abstract E newEntity();

    protected abstract RecordSchema<E> schema();

    /**
     * Handles a code the schema does not claim. Returns {@code false} to pass
     * the group on to the common properties.
     */
    protected boolean readSpecial(E entity, Group group, ParseContext context) {
        return false;
    }

    protected void writeSpecial(E entity, GroupWriter out) {
    }

    /** Called once the entity's groups have been read, e.g. to check declared counts. */
    protected void afterRead(E entity, ParseContext context) {
    }

    @Override
    public E read(ParseContext context) {
        E entity = newEntity();
        GroupHandler<E> handler = schema()
            .or(this::readSpecial)
            .or(CommonEntityFields::read);
        context.readFields(kind, entity, handler);
        afterRead(entity, context);
        return entity;
    }

    @Override
    public void write(E entity, GroupWriter out) {
        CommonEntityFields.write(entity, out);
        schema().write(entity, out);
        writeSpecial(entity, out);
    }
}
