package com.questrail.dxf.codec.entity;

import com.questrail.dxf.codec.EntityCodec;

import java.util.List;

/**
 * The entity kinds supported out of the box.
 *
 * <p>{@code VERTEX} and {@code SEQEND} are not listed: they only occur inside a
 * {@code POLYLINE} and are read by {@link PolylineCodec}.</p>
 */
public final class BuiltInEntityCodecs
{
    private BuiltInEntityCodecs() {}

    public static List<EntityCodec<?>> all() {
        return List.of(
            new PointCodec(),
            new LineCodec(),
            new CircleCodec(),
            new ArcCodec(),
            new EllipseCodec(),
            new SolidCodec(),
            new InsertCodec(),
            new TextCodec(),
            new MTextCodec(),
            new AttributeDefinitionCodec(),
            new DimensionCodec(),
            new Face3dCodec(),
            new LwPolylineCodec(),
            new PolylineCodec(),
            new SplineCodec(),
            new MultiLeaderCodec());
    }
}
