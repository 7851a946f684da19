package com.questrail.dxf.codec;

import com.questrail.dxf.model.entity.Entity;

/**
 * EntityCodec
 * -----------------------------------------------------------------------------
 * Reads and writes one entity kind.
 *
 * <p>This is the extension point for hosts: registering a codec for a kind the
 * library does not know makes the entities section (and block definitions)
 * reconstruct it instead of skipping it.</p>
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>{@link #read(ParseContext)} is called right after the {@code 0/KIND}
 *       group. It returns once it has read the code-0 group that follows the
 *       entity, which is then the scanner's last read group.</li>
 *   <li>{@link #write(Entity, GroupWriter)} writes everything after the
 *       {@code 0/KIND} group; the caller writes the marker.</li>
 * </ul>
 */
public interface EntityCodec<E extends Entity>
{
    /** The code-0 token this codec handles, e.g. {@code LINE}. */
    String kind();

    Class<E> entityType();

    E read(ParseContext context);

    void write(E entity, GroupWriter out);
}
