package com.questrail.dxf.model.entity;

import com.questrail.dxf.model.Point;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One {@code LEADER{ ... }} block of a multileader context.
 */
public final class MultiLeaderLeader
{
    private Point lastLeaderLinePoint;
    private Point doglegVector;
    private Point breakStartPoint;
    private Point breakEndPoint;
    private Double doglegLength;
    private Integer leaderBranchIndex;
    private Boolean hasSetLastLeaderLinePoint;
    private Boolean hasSetDoglegVector;
    private final List<MultiLeaderLine> lines = new ArrayList<>();

    public Point getLastLeaderLinePoint() {
        return lastLeaderLinePoint;
    }

    public void setLastLeaderLinePoint(Point lastLeaderLinePoint) {
        this.lastLeaderLinePoint = lastLeaderLinePoint;
    }

    public Point getDoglegVector() {
        return doglegVector;
    }

    public void setDoglegVector(Point doglegVector) {
        this.doglegVector = doglegVector;
    }

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

    public Double getDoglegLength() {
        return doglegLength;
    }

    public void setDoglegLength(Double doglegLength) {
        this.doglegLength = doglegLength;
    }

    public Integer getLeaderBranchIndex() {
        return leaderBranchIndex;
    }

    public void setLeaderBranchIndex(Integer leaderBranchIndex) {
        this.leaderBranchIndex = leaderBranchIndex;
    }

    public Boolean getHasSetLastLeaderLinePoint() {
        return hasSetLastLeaderLinePoint;
    }

    public void setHasSetLastLeaderLinePoint(Boolean hasSetLastLeaderLinePoint) {
        this.hasSetLastLeaderLinePoint = hasSetLastLeaderLinePoint;
    }

    public Boolean getHasSetDoglegVector() {
        return hasSetDoglegVector;
    }

    public void setHasSetDoglegVector(Boolean hasSetDoglegVector) {
        this.hasSetDoglegVector = hasSetDoglegVector;
    }

    public List<MultiLeaderLine> getLines() {
        return lines;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof MultiLeaderLeader that
            && Objects.equals(lastLeaderLinePoint, that.lastLeaderLinePoint)
            && Objects.equals(doglegVector, that.doglegVector)
            && Objects.equals(breakStartPoint, that.breakStartPoint)
            && Objects.equals(breakEndPoint, that.breakEndPoint)
            && Objects.equals(doglegLength, that.doglegLength)
            && Objects.equals(leaderBranchIndex, that.leaderBranchIndex)
            && Objects.equals(hasSetLastLeaderLinePoint, that.hasSetLastLeaderLinePoint)
            && Objects.equals(hasSetDoglegVector, that.hasSetDoglegVector)
            && Objects.equals(lines, that.lines);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lastLeaderLinePoint, doglegVector, breakStartPoint, breakEndPoint, doglegLength, leaderBranchIndex);
    }
}
