package com.questrail.dxf.model.entity;

/**
 * The {@code SEQEND} record closing a polyline's vertex list. Only common
 * properties apply.
 */
public final class SequenceEnd extends Entity
{
    public static final String TYPE = "SEQEND";

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SequenceEnd that && commonEquals(that);
    }

    @Override
    public int hashCode() {
        return commonHashCode();
    }
}
