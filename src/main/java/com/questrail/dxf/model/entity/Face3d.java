package com.questrail.dxf.model.entity;

import com.questrail.dxf.model.BitFlag;
import com.questrail.dxf.model.Flags;
import com.questrail.dxf.model.Point;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;

/**
 * A {@code 3DFACE} entity with three or four corners.
 *
 * <p>Corner {@code i} is written on codes {@code 10+i}, {@code 20+i}, {@code 30+i}.</p>
 */
public final class Face3d extends Entity
{
    public static final String TYPE = "3DFACE";

    private Integer edgeFlags;
    private final List<Point> corners = new ArrayList<>();

    @Override
    public String type() {
        return TYPE;
    }

    /** Invisible edge flags (group 70). */
    public Integer getEdgeFlags() {
        return edgeFlags;
    }

    public void setEdgeFlags(Integer edgeFlags) {
        this.edgeFlags = edgeFlags;
    }

    public List<Point> getCorners() {
        return corners;
    }

    public static final int MAX_CORNERS = 4;

    public enum EdgeFlag implements BitFlag {
        FIRST_EDGE_INVISIBLE(1),
        SECOND_EDGE_INVISIBLE(2),
        THIRD_EDGE_INVISIBLE(4),
        FOURTH_EDGE_INVISIBLE(8);

        private final int mask;

        EdgeFlag(int mask) {
            this.mask = mask;
        }

        @Override
        public int mask() {
            return mask;
        }
    }

    public EnumSet<EdgeFlag> invisibleEdges() {
        return Flags.decode(edgeFlags, EdgeFlag.class);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Face3d that
            && commonEquals(that)
            && Objects.equals(edgeFlags, that.edgeFlags)
            && Objects.equals(corners, that.corners);
    }

    @Override
    public int hashCode() {
        return Objects.hash(commonHashCode(), edgeFlags, corners);
    }
}
