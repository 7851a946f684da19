package com.questrail.dxf.model.entity;

import com.questrail.dxf.model.Point;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One {@code LEADER_LINE{ ... }} block: the vertices of a single leader line.
 */
public final class MultiLeaderLine
{
    private Point breakStartPoint;
    private Point breakEndPoint;
    private Integer breakPointIndex;
    private Integer leaderLineIndex;
    private final List<Point> vertices = new ArrayList<>();

    public Point getBreakStartPoint() {
        return breakStartPoint;
    }

    public void setBreakStartPoint(Point breakStartPoint) {
        this.breakStartPoint = breakStartPoint;
    }

    public Point getBreakEndPoint() {
        return breakEndPoint;
    }

    public void setBreakEndPoint(Point breakEndPoint) {
        this.breakEndPoint = breakEndPoint;
    }

    public Integer getBreakPointIndex() {
        return breakPointIndex;
    }

    public void setBreakPointIndex(Integer breakPointIndex) {
        this.breakPointIndex = breakPointIndex;
    }

    public Integer getLeaderLineIndex() {
        return leaderLineIndex;
    }

    public void setLeaderLineIndex(Integer leaderLineIndex) {
        this.leaderLineIndex = leaderLineIndex;
    }

    public List<Point> getVertices() {
        return vertices;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof MultiLeaderLine that
            && Objects.equals(breakStartPoint, that.breakStartPoint)
            && Objects.equals(breakEndPoint, that.breakEndPoint)
            && Objects.equals(breakPointIndex, that.breakPointIndex)
            && Objects.equals(leaderLineIndex, that.leaderLineIndex)
            && Objects.equals(vertices, that.vertices);
    }

    @Override
    public int hashCode() {
        return Objects.hash(breakStartPoint, breakEndPoint, breakPointIndex, leaderLineIndex, vertices);
    }
}
