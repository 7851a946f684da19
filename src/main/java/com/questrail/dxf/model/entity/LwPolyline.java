package com.questrail.dxf.model.entity;

import com.questrail.dxf.model.BitFlag;
import com.questrail.dxf.model.Flags;
import com.questrail.dxf.model.Point;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;

/**
 * A lightweight polyline ({@code LWPOLYLINE}): a planar polyline whose vertices
 * are stored inline rather than as separate {@code VERTEX} records.
 */
public final class LwPolyline extends Entity
{
    public static final String TYPE = "LWPOLYLINE";

    private Double elevation;
    private Double thickness;
    private Double constantWidth;
    private Integer flags;
    private Integer vertexCount;
    private Point extrusion;
    private final List<Vertex> vertices = new ArrayList<>();

    @Override
    public String type() {
        return TYPE;
    }

    public Double getElevation() {
        return elevation;
    }

    public void setElevation(Double elevation) {
        this.elevation = elevation;
    }

    public Double getThickness() {
        return thickness;
    }

    public void setThickness(Double thickness) {
        this.thickness = thickness;
    }

    public Double getConstantWidth() {
        return constantWidth;
    }

    public void setConstantWidth(Double constantWidth) {
        this.constantWidth = constantWidth;
    }

    public Integer getFlags() {
        return flags;
    }

    public void setFlags(Integer flags) {
        this.flags = flags;
    }

    /** Vertex count as declared in group 90; the list itself is authoritative. */
    public Integer getVertexCount() {
        return vertexCount;
    }

    public void setVertexCount(Integer vertexCount) {
        this.vertexCount = vertexCount;
    }

    public Point getExtrusion() {
        return extrusion;
    }

    public void setExtrusion(Point extrusion) {
        this.extrusion = extrusion;
    }

    public List<Vertex> getVertices() {
        return vertices;
    }

    public enum Flag implements BitFlag {
        CLOSED(1),
        PLINEGEN(128);

        private final int mask;

        Flag(int mask) {
            this.mask = mask;
        }

        @Override
        public int mask() {
            return mask;
        }
    }

    public EnumSet<Flag> flagSet() {
        return Flags.decode(flags, Flag.class);
    }

    public boolean isClosed() {
        return flagSet().contains(Flag.CLOSED);
    }

    /**
     * One vertex of a lightweight polyline. Only x and y are required.
     */
    public static final class Vertex {
        private final double x;
        private final double y;
        private Double z;
        private Double startWidth;
        private Double endWidth;
        private Double bulge;

        public Vertex(double x, double y) {
            this.x = x;
            this.y = y;
        }

        public double getX() {
            return x;
        }

        public double getY() {
            return y;
        }

        public Double getZ() {
            return z;
        }

        public void setZ(Double z) {
            this.z = z;
        }

        public Double getStartWidth() {
            return startWidth;
        }

        public void setStartWidth(Double startWidth) {
            this.startWidth = startWidth;
        }

        public Double getEndWidth() {
            return endWidth;
        }

        public void setEndWidth(Double endWidth) {
            this.endWidth = endWidth;
        }

        public Double getBulge() {
            return bulge;
        }

        public void setBulge(Double bulge) {
            this.bulge = bulge;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Vertex that
                && Double.compare(x, that.x) == 0
                && Double.compare(y, that.y) == 0
                && Objects.equals(z, that.z)
                && Objects.equals(startWidth, that.startWidth)
                && Objects.equals(endWidth, that.endWidth)
                && Objects.equals(bulge, that.bulge);
        }

        @Override
        public int hashCode() {
            return Objects.hash(x, y, z, startWidth, endWidth, bulge);
        }

        @Override
        public String toString() {
            return "Vertex(" + x + ", " + y + (z != null ? ", " + z : "") + ")";
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof LwPolyline that
            && commonEquals(that)
            && Objects.equals(elevation, that.elevation)
            && Objects.equals(thickness, that.thickness)
            && Objects.equals(constantWidth, that.constantWidth)
            && Objects.equals(flags, that.flags)
            && Objects.equals(vertexCount, that.vertexCount)
            && Objects.equals(extrusion, that.extrusion)
            && Objects.equals(vertices, that.vertices);
    }

    @Override
    public int hashCode() {
        return Objects.hash(commonHashCode(), elevation, thickness, constantWidth, flags, vertexCount, extrusion);
    }
}
