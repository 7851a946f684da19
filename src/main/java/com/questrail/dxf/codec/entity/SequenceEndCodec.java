package com.questrail.dxf.codec.entity;

import com.questrail.dxf.codec.AbstractEntityCodec;
import com.questrail.dxf.codec.RecordSchema;
import com.questrail.dxf.model.entity.SequenceEnd;

public final class SequenceEndCodec extends AbstractEntityCodec<SequenceEnd>
{
    private static final RecordSchema<SequenceEnd> SCHEMA = RecordSchema.<SequenceEnd>builder().build();

    public SequenceEndCodec() {
        super(SequenceEnd.TYPE, SequenceEnd.class);
    }

    @Override
    protected SequenceEnd newEntity() {
        return new SequenceEnd();
    }

    @Override
    protected RecordSchema<SequenceEnd> schema() {
        return SCHEMA;
    }
}
