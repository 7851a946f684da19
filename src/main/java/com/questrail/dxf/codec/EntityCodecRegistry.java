package com.questrail.dxf.codec;

import com.questrail.dxf.DxfSerializationException;
import com.questrail.dxf.codec.entity.BuiltInEntityCodecs;
import com.questrail.dxf.model.entity.Entity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Entity kind token → {@link EntityCodec}.
 *
 * <p>Populated once at setup. The registry is not synchronized; it must not be
 * modified while a parse or serialize call is using it.</p>
 */
public final class EntityCodecRegistry
{
    private final Map<String, EntityCodec<?>> codecs = new LinkedHashMap<>();

    public static EntityCodecRegistry empty() {
        return new EntityCodecRegistry();
    }

    /** A registry holding every entity kind this library supports. */
    public static EntityCodecRegistry withBuiltIns() {
        EntityCodecRegistry registry = new EntityCodecRegistry();
        BuiltInEntityCodecs.all().forEach(registry::register);
        return registry;
    }

    /**
     * Registers {@code codec} for its kind, replacing any codec registered for
     * the same kind before.
     */
    public EntityCodecRegistry register(EntityCodec<?> codec) {
        Objects.requireNonNull(codec, "codec");
        codecs.put(codec.kind(), codec);
        return this;
    }

    public Optional<EntityCodec<?>> find(String kind) {
        return Optional.ofNullable(codecs.get(kind));
    }

    public Set<String> kinds() {
        return Collections.unmodifiableSet(codecs.keySet());
    }

    public EntityCodecRegistry copy() {
        EntityCodecRegistry copy = new EntityCodecRegistry();
        copy.codecs.putAll(codecs);
        return copy;
    }

    /**
     * Writes {@code entity} with {@code codec}, marker included.
     *
     * @throws DxfSerializationException if the codec does not handle the entity's class
     */
    public static <E extends Entity> void write(EntityCodec<E> codec, Entity entity, GroupWriter out) {
        if (!codec.entityType().isInstance(entity)) {
            throw new DxfSerializationException("Codec for " + codec.kind() + " cannot write "
                + entity.getClass().getName());
        }
        out.marker(codec.kind());
        codec.write(codec.entityType().cast(entity), out);
    }
}
