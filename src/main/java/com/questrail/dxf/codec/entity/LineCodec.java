package com.questrail.dxf.codec.entity;

import com.questrail.dxf.codec.AbstractEntityCodec;
import com.questrail.dxf.codec.RecordSchema;
import com.questrail.dxf.model.entity.Line;

/**
 * {@code LINE}: start (10), end (11), thickness (39), extrusion (210).
 */
public final class LineCodec extends AbstractEntityCodec<Line>
{
    private static final RecordSchema<Line> SCHEMA = RecordSchema.<Line>builder()
        .real(39, Line::getThickness, Line::setThickness)
        .point(10, Line::getStart, Line::setStart)
        .point(11, Line::getEnd, Line::setEnd)
        .point(210, Line::getExtrusion, Line::setExtrusion)
        .build();

    public LineCodec() {
        super(Line.TYPE, Line.class);
    }

    @Override
    protected Line newEntity() {
        return new Line();
    }

    @Override
    protected RecordSchema<Line> schema() {
        return SCHEMA;
    }
}
