package com.questrail.dxf.model.entity;

import com.questrail.dxf.model.Matrix4;
import com.questrail.dxf.model.Point;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The {@code CONTEXT_DATA{ ... }} block of a multileader: content placement,
 * text formatting, block content and the leaders.
 */
public final class MultiLeaderContext
{
    private Point contentBasePosition;
    private Point textNormalDirection;
    private Point textLocation;
    private Point textDirection;
    private Point blockContentNormalDirection;
    private Point blockContentPosition;
    private Double blockContentScale;
    private Double contentScale;
    private Double textHeight;
    private Double textRotation;
    private Double textWidth;
    private Double textHeight2;
    private Double textLineSpacingFactor;
    private Double blockContentRotation;
    private Integer breakPointIndex;
    private Integer textBackgroundColor;
    private Integer textBackgroundTransparency;
    private Integer blockContentColor;
    private Point planeOriginPoint;
    private Point planeXAxisDirection;
    private Point planeYAxisDirection;
    private Double arrowHeadSize;
    private Double textBackgroundScaleFactor;
    private Double textColumnWidth;
    private Double textColumnGutterWidth;
    private Double textColumnHeight;
    private Double landingGap;
    private Integer textLineSpacingStyle;
    private Integer textAttachment;
    private Integer textFlowDirection;
    private Integer textColumnType;
    private Integer textAngleType;
    private Integer textAlignmentType;
    private Integer blockContentConnectionType;
    private Integer blockAttributeIndex;
    private Boolean hasMText;
    private Boolean textBackgroundColorOn;
    private Boolean textBackgroundFillOn;
    private Boolean textUseAutoHeight;
    private Boolean textColumnFlowReversed;
    private Boolean textUseWordBreak;
    private Boolean hasBlock;
    private Boolean planeNormalReversed;
    private String defaultTextContents;
    private String textStyleId;
    private String blockContentId;
    private Matrix4 blockTransformationMatrix;
    private final List<MultiLeaderLeader> leaders = new ArrayList<>();

    public Point getContentBasePosition() {
        return contentBasePosition;
    }

    public void setContentBasePosition(Point contentBasePosition) {
        this.contentBasePosition = contentBasePosition;
    }

    public Point getTextNormalDirection() {
        return textNormalDirection;
    }

    public void setTextNormalDirection(Point textNormalDirection) {
        this.textNormalDirection = textNormalDirection;
    }

    public Point getTextLocation() {
        return textLocation;
    }

    public void setTextLocation(Point textLocation) {
        this.textLocation = textLocation;
    }

    public Point getTextDirection() {
        return textDirection;
    }

    public void setTextDirection(Point textDirection) {
        this.textDirection = textDirection;
    }

    public Point getBlockContentNormalDirection() {
        return blockContentNormalDirection;
    }

    public void setBlockContentNormalDirection(Point blockContentNormalDirection) {
        this.blockContentNormalDirection = blockContentNormalDirection;
    }

    public Point getBlockContentPosition() {
        return blockContentPosition;
    }

    public void setBlockContentPosition(Point blockContentPosition) {
        this.blockContentPosition = blockContentPosition;
    }

    public Double getBlockContentScale() {
        return blockContentScale;
    }

    public void setBlockContentScale(Double blockContentScale) {
        this.blockContentScale = blockContentScale;
    }

    public Double getContentScale() {
        return contentScale;
    }

    public void setContentScale(Double contentScale) {
        this.contentScale = contentScale;
    }

    public Double getTextHeight() {
        return textHeight;
    }

    public void setTextHeight(Double textHeight) {
        this.textHeight = textHeight;
    }

    public Double getTextRotation() {
        return textRotation;
    }

    public void setTextRotation(Double textRotation) {
        this.textRotation = textRotation;
    }

    public Double getTextWidth() {
        return textWidth;
    }

    public void setTextWidth(Double textWidth) {
        this.textWidth = textWidth;
    }

    public Double getTextHeight2() {
        return textHeight2;
    }

    public void setTextHeight2(Double textHeight2) {
        this.textHeight2 = textHeight2;
    }

    public Double getTextLineSpacingFactor() {
        return textLineSpacingFactor;
    }

    public void setTextLineSpacingFactor(Double textLineSpacingFactor) {
        this.textLineSpacingFactor = textLineSpacingFactor;
    }

    public Double getBlockContentRotation() {
        return blockContentRotation;
    }

    public void setBlockContentRotation(Double blockContentRotation) {
        this.blockContentRotation = blockContentRotation;
    }

    public Integer getBreakPointIndex() {
        return breakPointIndex;
    }

    public void setBreakPointIndex(Integer breakPointIndex) {
        this.breakPointIndex = breakPointIndex;
    }

    public Integer getTextBackgroundColor() {
        return textBackgroundColor;
    }

    public void setTextBackgroundColor(Integer textBackgroundColor) {
        this.textBackgroundColor = textBackgroundColor;
    }

    public Integer getTextBackgroundTransparency() {
        return textBackgroundTransparency;
    }

    public void setTextBackgroundTransparency(Integer textBackgroundTransparency) {
        this.textBackgroundTransparency = textBackgroundTransparency;
    }

    public Integer getBlockContentColor() {
        return blockContentColor;
    }

    public void setBlockContentColor(Integer blockContentColor) {
        this.blockContentColor = blockContentColor;
    }

    public Point getPlaneOriginPoint() {
        return planeOriginPoint;
    }

    public void setPlaneOriginPoint(Point planeOriginPoint) {
        this.planeOriginPoint = planeOriginPoint;
    }

    public Point getPlaneXAxisDirection() {
        return planeXAxisDirection;
    }

    public void setPlaneXAxisDirection(Point planeXAxisDirection) {
        this.planeXAxisDirection = planeXAxisDirection;
    }

    public Point getPlaneYAxisDirection() {
        return planeYAxisDirection;
    }

    public void setPlaneYAxisDirection(Point planeYAxisDirection) {
        this.planeYAxisDirection = planeYAxisDirection;
    }

    public Double getArrowHeadSize() {
        return arrowHeadSize;
    }

    public void setArrowHeadSize(Double arrowHeadSize) {
        this.arrowHeadSize = arrowHeadSize;
    }

    public Double getTextBackgroundScaleFactor() {
        return textBackgroundScaleFactor;
    }

    public void setTextBackgroundScaleFactor(Double textBackgroundScaleFactor) {
        this.textBackgroundScaleFactor = textBackgroundScaleFactor;
    }

    public Double getTextColumnWidth() {
        return textColumnWidth;
    }

    public void setTextColumnWidth(Double textColumnWidth) {
        this.textColumnWidth = textColumnWidth;
    }

    public Double getTextColumnGutterWidth() {
        return textColumnGutterWidth;
    }

    public void setTextColumnGutterWidth(Double textColumnGutterWidth) {
        this.textColumnGutterWidth = textColumnGutterWidth;
    }

    public Double getTextColumnHeight() {
        return textColumnHeight;
    }

    public void setTextColumnHeight(Double textColumnHeight) {
        this.textColumnHeight = textColumnHeight;
    }

    public Double getLandingGap() {
        return landingGap;
    }

    public void setLandingGap(Double landingGap) {
        this.landingGap = landingGap;
    }

    public Integer getTextLineSpacingStyle() {
        return textLineSpacingStyle;
    }

    public void setTextLineSpacingStyle(Integer textLineSpacingStyle) {
        this.textLineSpacingStyle = textLineSpacingStyle;
    }

    public Integer getTextAttachment() {
        return textAttachment;
    }

    public void setTextAttachment(Integer textAttachment) {
        this.textAttachment = textAttachment;
    }

    public Integer getTextFlowDirection() {
        return textFlowDirection;
    }

    public void setTextFlowDirection(Integer textFlowDirection) {
        this.textFlowDirection = textFlowDirection;
    }

    public Integer getTextColumnType() {
        return textColumnType;
    }

    public void setTextColumnType(Integer textColumnType) {
        this.textColumnType = textColumnType;
    }

    public Integer getTextAngleType() {
        return textAngleType;
    }

    public void setTextAngleType(Integer textAngleType) {
        this.textAngleType = textAngleType;
    }

    public Integer getTextAlignmentType() {
        return textAlignmentType;
    }

    public void setTextAlignmentType(Integer textAlignmentType) {
        this.textAlignmentType = textAlignmentType;
    }

    public Integer getBlockContentConnectionType() {
        return blockContentConnectionType;
    }

    public void setBlockContentConnectionType(Integer blockContentConnectionType) {
        this.blockContentConnectionType = blockContentConnectionType;
    }

    public Integer getBlockAttributeIndex() {
        return blockAttributeIndex;
    }

    public void setBlockAttributeIndex(Integer blockAttributeIndex) {
        this.blockAttributeIndex = blockAttributeIndex;
    }

    public Boolean getHasMText() {
        return hasMText;
    }

    public void setHasMText(Boolean hasMText) {
        this.hasMText = hasMText;
    }

    public Boolean getTextBackgroundColorOn() {
        return textBackgroundColorOn;
    }

    public void setTextBackgroundColorOn(Boolean textBackgroundColorOn) {
        this.textBackgroundColorOn = textBackgroundColorOn;
    }

    public Boolean getTextBackgroundFillOn() {
        return textBackgroundFillOn;
    }

    public void setTextBackgroundFillOn(Boolean textBackgroundFillOn) {
        this.textBackgroundFillOn = textBackgroundFillOn;
    }

    public Boolean getTextUseAutoHeight() {
        return textUseAutoHeight;
    }

    public void setTextUseAutoHeight(Boolean textUseAutoHeight) {
        this.textUseAutoHeight = textUseAutoHeight;
    }

    public Boolean getTextColumnFlowReversed() {
        return textColumnFlowReversed;
    }

    public void setTextColumnFlowReversed(Boolean textColumnFlowReversed) {
        this.textColumnFlowReversed = textColumnFlowReversed;
    }

    public Boolean getTextUseWordBreak() {
        return textUseWordBreak;
    }

    public void setTextUseWordBreak(Boolean textUseWordBreak) {
        this.textUseWordBreak = textUseWordBreak;
    }

    public Boolean getHasBlock() {
        return hasBlock;
    }

    public void setHasBlock(Boolean hasBlock) {
        this.hasBlock = hasBlock;
    }

    public Boolean getPlaneNormalReversed() {
        return planeNormalReversed;
    }

    public void setPlaneNormalReversed(Boolean planeNormalReversed) {
        this.planeNormalReversed = planeNormalReversed;
    }

    public String getDefaultTextContents() {
        return defaultTextContents;
    }

    public void setDefaultTextContents(String defaultTextContents) {
        this.defaultTextContents = defaultTextContents;
    }

    public String getTextStyleId() {
        return textStyleId;
    }

    public void setTextStyleId(String textStyleId) {
        this.textStyleId = textStyleId;
    }

    public String getBlockContentId() {
        return blockContentId;
    }

    public void setBlockContentId(String blockContentId) {
        this.blockContentId = blockContentId;
    }

    /** Block transformation (sixteen groups 47). */
    public Matrix4 getBlockTransformationMatrix() {
        return blockTransformationMatrix;
    }

    public void setBlockTransformationMatrix(Matrix4 blockTransformationMatrix) {
        this.blockTransformationMatrix = blockTransformationMatrix;
    }

    public List<MultiLeaderLeader> getLeaders() {
        return leaders;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof MultiLeaderContext that
            && Objects.equals(contentBasePosition, that.contentBasePosition)
            && Objects.equals(textNormalDirection, that.textNormalDirection)
            && Objects.equals(textLocation, that.textLocation)
            && Objects.equals(textDirection, that.textDirection)
            && Objects.equals(blockContentNormalDirection, that.blockContentNormalDirection)
            && Objects.equals(blockContentPosition, that.blockContentPosition)
            && Objects.equals(blockContentScale, that.blockContentScale)
            && Objects.equals(contentScale, that.contentScale)
            && Objects.equals(textHeight, that.textHeight)
            && Objects.equals(textRotation, that.textRotation)
            && Objects.equals(textWidth, that.textWidth)
            && Objects.equals(textHeight2, that.textHeight2)
            && Objects.equals(textLineSpacingFactor, that.textLineSpacingFactor)
            && Objects.equals(blockContentRotation, that.blockContentRotation)
            && Objects.equals(breakPointIndex, that.breakPointIndex)
            && Objects.equals(textBackgroundColor, that.textBackgroundColor)
            && Objects.equals(textBackgroundTransparency, that.textBackgroundTransparency)
            && Objects.equals(blockContentColor, that.blockContentColor)
            && Objects.equals(planeOriginPoint, that.planeOriginPoint)
            && Objects.equals(planeXAxisDirection, that.planeXAxisDirection)
            && Objects.equals(planeYAxisDirection, that.planeYAxisDirection)
            && Objects.equals(arrowHeadSize, that.arrowHeadSize)
            && Objects.equals(textBackgroundScaleFactor, that.textBackgroundScaleFactor)
            && Objects.equals(textColumnWidth, that.textColumnWidth)
            && Objects.equals(textColumnGutterWidth, that.textColumnGutterWidth)
            && Objects.equals(textColumnHeight, that.textColumnHeight)
            && Objects.equals(landingGap, that.landingGap)
            && Objects.equals(textLineSpacingStyle, that.textLineSpacingStyle)
            && Objects.equals(textAttachment, that.textAttachment)
            && Objects.equals(textFlowDirection, that.textFlowDirection)
            && Objects.equals(textColumnType, that.textColumnType)
            && Objects.equals(textAngleType, that.textAngleType)
            && Objects.equals(textAlignmentType, that.textAlignmentType)
            && Objects.equals(blockContentConnectionType, that.blockContentConnectionType)
            && Objects.equals(blockAttributeIndex, that.blockAttributeIndex)
            && Objects.equals(hasMText, that.hasMText)
            && Objects.equals(textBackgroundColorOn, that.textBackgroundColorOn)
            && Objects.equals(textBackgroundFillOn, that.textBackgroundFillOn)
            && Objects.equals(textUseAutoHeight, that.textUseAutoHeight)
            && Objects.equals(textColumnFlowReversed, that.textColumnFlowReversed)
            && Objects.equals(textUseWordBreak, that.textUseWordBreak)
            && Objects.equals(hasBlock, that.hasBlock)
            && Objects.equals(planeNormalReversed, that.planeNormalReversed)
            && Objects.equals(defaultTextContents, that.defaultTextContents)
            && Objects.equals(textStyleId, that.textStyleId)
            && Objects.equals(blockContentId, that.blockContentId)
            && Objects.equals(blockTransformationMatrix, that.blockTransformationMatrix)
            && Objects.equals(leaders, that.leaders);
    }

    @Override
    public int hashCode() {
        return Objects.hash(contentBasePosition, textNormalDirection, textLocation, textDirection, blockContentNormalDirection, blockContentPosition);
    }
}
