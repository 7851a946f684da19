package com.questrail.dxf.model.entity;

import com.questrail.dxf.model.BitFlag;
import com.questrail.dxf.model.Flags;
import com.questrail.dxf.model.Point;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Polyline
 * -----------------------------------------------------------------------------
 * A heavy {@code POLYLINE} entity.
 *
 * <p>Unlike most entities its content does not end at the next code-0 group:
 * the {@code POLYLINE} record is followed by its {@link Vertex} records and a
 * closing {@link SequenceEnd}, all owned by this object.</p>
 */
public final class Polyline extends Entity
{
    public static final String TYPE = "POLYLINE";

    private Point elevationPoint;
    private Double thickness;
    private Double defaultStartWidth;
    private Double defaultEndWidth;
    private Integer flags;
    private Integer meshVertexCountM;
    private Integer meshVertexCountN;
    private Integer smoothDensityM;
    private Integer smoothDensityN;
    private Integer curveSmoothType;
    private Point extrusion;
    private SequenceEnd sequenceEnd;
    private final List<Vertex> vertices = new ArrayList<>();

    @Override
    public String type() {
        return TYPE;
    }

    /** Dummy point (group 10); only its z carries the elevation. */
    public Point getElevationPoint() {
        return elevationPoint;
    }

    public void setElevationPoint(Point elevationPoint) {
        this.elevationPoint = elevationPoint;
    }

    public Double getThickness() {
        return thickness;
    }

    public void setThickness(Double thickness) {
        this.thickness = thickness;
    }

    public Double getDefaultStartWidth() {
        return defaultStartWidth;
    }

    public void setDefaultStartWidth(Double defaultStartWidth) {
        this.defaultStartWidth = defaultStartWidth;
    }

    public Double getDefaultEndWidth() {
        return defaultEndWidth;
    }

    public void setDefaultEndWidth(Double defaultEndWidth) {
        this.defaultEndWidth = defaultEndWidth;
    }

    public Integer getFlags() {
        return flags;
    }

    public void setFlags(Integer flags) {
        this.flags = flags;
    }

    public Integer getMeshVertexCountM() {
        return meshVertexCountM;
    }

    public void setMeshVertexCountM(Integer meshVertexCountM) {
        this.meshVertexCountM = meshVertexCountM;
    }

    public Integer getMeshVertexCountN() {
        return meshVertexCountN;
    }

    public void setMeshVertexCountN(Integer meshVertexCountN) {
        this.meshVertexCountN = meshVertexCountN;
    }

    public Integer getSmoothDensityM() {
        return smoothDensityM;
    }

    public void setSmoothDensityM(Integer smoothDensityM) {
        this.smoothDensityM = smoothDensityM;
    }

    public Integer getSmoothDensityN() {
        return smoothDensityN;
    }

    public void setSmoothDensityN(Integer smoothDensityN) {
        this.smoothDensityN = smoothDensityN;
    }

    public Integer getCurveSmoothType() {
        return curveSmoothType;
    }

    public void setCurveSmoothType(Integer curveSmoothType) {
        this.curveSmoothType = curveSmoothType;
    }

    public Point getExtrusion() {
        return extrusion;
    }

    public void setExtrusion(Point extrusion) {
        this.extrusion = extrusion;
    }

    public SequenceEnd getSequenceEnd() {
        return sequenceEnd;
    }

    public void setSequenceEnd(SequenceEnd sequenceEnd) {
        this.sequenceEnd = sequenceEnd;
    }

    public List<Vertex> getVertices() {
        return vertices;
    }

    public enum Flag implements BitFlag {
        CLOSED(1),
        CURVE_FIT(2),
        SPLINE_FIT(4),
        POLYLINE_3D(8),
        POLYGON_MESH_3D(16),
        MESH_CLOSED_N(32),
        POLYFACE_MESH(64),
        CONTINUOUS_LINETYPE_PATTERN(128);

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

    public void setFlagSet(Set<Flag> flagSet) {
        this.flags = Flags.encode(flagSet);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Polyline that
            && commonEquals(that)
            && Objects.equals(elevationPoint, that.elevationPoint)
            && Objects.equals(thickness, that.thickness)
            && Objects.equals(defaultStartWidth, that.defaultStartWidth)
            && Objects.equals(defaultEndWidth, that.defaultEndWidth)
            && Objects.equals(flags, that.flags)
            && Objects.equals(meshVertexCountM, that.meshVertexCountM)
            && Objects.equals(meshVertexCountN, that.meshVertexCountN)
            && Objects.equals(smoothDensityM, that.smoothDensityM)
            && Objects.equals(smoothDensityN, that.smoothDensityN)
            && Objects.equals(curveSmoothType, that.curveSmoothType)
            && Objects.equals(extrusion, that.extrusion)
            && Objects.equals(sequenceEnd, that.sequenceEnd)
            && Objects.equals(vertices, that.vertices);
    }

    @Override
    public int hashCode() {
        return Objects.hash(commonHashCode(), elevationPoint, thickness, defaultStartWidth, defaultEndWidth, flags, meshVertexCountM);
    }
}
