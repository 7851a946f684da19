package com.questrail.dxf.model.entity;

import com.questrail.dxf.model.Point;

import java.util.Objects;

/**
 * MultiLeader
 * -----------------------------------------------------------------------------
 * A {@code MULTILEADER} entity.
 *
 * <p>Besides its own fields a multileader carries one {@link MultiLeaderContext}
 * (the {@code CONTEXT_DATA{ ... }} block), which holds the leaders, which in
 * turn hold the leader lines. Each level has its own code table, so the same
 * code means different things depending on the level it appears at.</p>
 *
 * <p>Group 330 at this level is the block attribute id, not the owner handle.</p>
 */
public final class MultiLeader extends Entity
{
    public static final String TYPE = "MULTILEADER";

    private Point blockContentScale;
    private Double doglegLength;
    private Double arrowHeadSize;
    private Double blockContentRotation;
    private Double blockAttributeWidth;
    private Double textLineSpacingStyleFactor;
    private Integer propertyOverrideFlag;
    private Integer leaderLineColor;
    private Integer textColor;
    private Integer blockContentColor;
    private Integer arrowHeadIndex;
    private Integer textRightAttachmentType;
    private Integer leaderLineType;
    private Integer leaderLineWeight;
    private Integer contentType;
    private Integer textLeftAttachmentType;
    private Integer textAngleType;
    private Integer textAlignmentType;
    private Integer blockContentConnectionType;
    private Integer blockAttributeIndex;
    private Integer textAlignInIpe;
    private Integer textAttachmentPoint;
    private Integer textAttachmentDirectionMText;
    private Integer textAttachmentDirectionBottom;
    private Integer textAttachmentDirectionTop;
    private Boolean enableLanding;
    private Boolean enableDogleg;
    private Boolean enableFrameText;
    private Boolean enableAnnotationScale;
    private Boolean textDirectionNegative;
    private String blockAttributeTextString;
    private String blockAttributeId;
    private String leaderStyleId;
    private String leaderLineTypeId;
    private String arrowHeadId;
    private String textStyleId;
    private String blockContentId;
    private MultiLeaderContext context;

    @Override
    public String type() {
        return TYPE;
    }

    public Point getBlockContentScale() {
        return blockContentScale;
    }

    public void setBlockContentScale(Point blockContentScale) {
        this.blockContentScale = blockContentScale;
    }

    public Double getDoglegLength() {
        return doglegLength;
    }

    public void setDoglegLength(Double doglegLength) {
        this.doglegLength = doglegLength;
    }

    public Double getArrowHeadSize() {
        return arrowHeadSize;
    }

    public void setArrowHeadSize(Double arrowHeadSize) {
        this.arrowHeadSize = arrowHeadSize;
    }

    public Double getBlockContentRotation() {
        return blockContentRotation;
    }

    public void setBlockContentRotation(Double blockContentRotation) {
        this.blockContentRotation = blockContentRotation;
    }

    public Double getBlockAttributeWidth() {
        return blockAttributeWidth;
    }

    public void setBlockAttributeWidth(Double blockAttributeWidth) {
        this.blockAttributeWidth = blockAttributeWidth;
    }

    public Double getTextLineSpacingStyleFactor() {
        return textLineSpacingStyleFactor;
    }

    public void setTextLineSpacingStyleFactor(Double textLineSpacingStyleFactor) {
        this.textLineSpacingStyleFactor = textLineSpacingStyleFactor;
    }

    public Integer getPropertyOverrideFlag() {
        return propertyOverrideFlag;
    }

    public void setPropertyOverrideFlag(Integer propertyOverrideFlag) {
        this.propertyOverrideFlag = propertyOverrideFlag;
    }

    public Integer getLeaderLineColor() {
        return leaderLineColor;
    }

    public void setLeaderLineColor(Integer leaderLineColor) {
        this.leaderLineColor = leaderLineColor;
    }

    public Integer getTextColor() {
        return textColor;
    }

    public void setTextColor(Integer textColor) {
        this.textColor = textColor;
    }

    public Integer getBlockContentColor() {
        return blockContentColor;
    }

    public void setBlockContentColor(Integer blockContentColor) {
        this.blockContentColor = blockContentColor;
    }

    public Integer getArrowHeadIndex() {
        return arrowHeadIndex;
    }

    public void setArrowHeadIndex(Integer arrowHeadIndex) {
        this.arrowHeadIndex = arrowHeadIndex;
    }

    public Integer getTextRightAttachmentType() {
        return textRightAttachmentType;
    }

    public void setTextRightAttachmentType(Integer textRightAttachmentType) {
        this.textRightAttachmentType = textRightAttachmentType;
    }

    public Integer getLeaderLineType() {
        return leaderLineType;
    }

    public void setLeaderLineType(Integer leaderLineType) {
        this.leaderLineType = leaderLineType;
    }

    public Integer getLeaderLineWeight() {
        return leaderLineWeight;
    }

    public void setLeaderLineWeight(Integer leaderLineWeight) {
        this.leaderLineWeight = leaderLineWeight;
    }

    /** 1 block content, 2 MText content (group 172). */
    public Integer getContentType() {
        return contentType;
    }

    public void setContentType(Integer contentType) {
        this.contentType = contentType;
    }

    public Integer getTextLeftAttachmentType() {
        return textLeftAttachmentType;
    }

    public void setTextLeftAttachmentType(Integer textLeftAttachmentType) {
        this.textLeftAttachmentType = textLeftAttachmentType;
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

    public Integer getTextAlignInIpe() {
        return textAlignInIpe;
    }

    public void setTextAlignInIpe(Integer textAlignInIpe) {
        this.textAlignInIpe = textAlignInIpe;
    }

    public Integer getTextAttachmentPoint() {
        return textAttachmentPoint;
    }

    public void setTextAttachmentPoint(Integer textAttachmentPoint) {
        this.textAttachmentPoint = textAttachmentPoint;
    }

    public Integer getTextAttachmentDirectionMText() {
        return textAttachmentDirectionMText;
    }

    public void setTextAttachmentDirectionMText(Integer textAttachmentDirectionMText) {
        this.textAttachmentDirectionMText = textAttachmentDirectionMText;
    }

    public Integer getTextAttachmentDirectionBottom() {
        return textAttachmentDirectionBottom;
    }

    public void setTextAttachmentDirectionBottom(Integer textAttachmentDirectionBottom) {
        this.textAttachmentDirectionBottom = textAttachmentDirectionBottom;
    }

    public Integer getTextAttachmentDirectionTop() {
        return textAttachmentDirectionTop;
    }

    public void setTextAttachmentDirectionTop(Integer textAttachmentDirectionTop) {
        this.textAttachmentDirectionTop = textAttachmentDirectionTop;
    }

    public Boolean getEnableLanding() {
        return enableLanding;
    }

    public void setEnableLanding(Boolean enableLanding) {
        this.enableLanding = enableLanding;
    }

    public Boolean getEnableDogleg() {
        return enableDogleg;
    }

    public void setEnableDogleg(Boolean enableDogleg) {
        this.enableDogleg = enableDogleg;
    }

    public Boolean getEnableFrameText() {
        return enableFrameText;
    }

    public void setEnableFrameText(Boolean enableFrameText) {
        this.enableFrameText = enableFrameText;
    }

    public Boolean getEnableAnnotationScale() {
        return enableAnnotationScale;
    }

    public void setEnableAnnotationScale(Boolean enableAnnotationScale) {
        this.enableAnnotationScale = enableAnnotationScale;
    }

    public Boolean getTextDirectionNegative() {
        return textDirectionNegative;
    }

    public void setTextDirectionNegative(Boolean textDirectionNegative) {
        this.textDirectionNegative = textDirectionNegative;
    }

    public String getBlockAttributeTextString() {
        return blockAttributeTextString;
    }

    public void setBlockAttributeTextString(String blockAttributeTextString) {
        this.blockAttributeTextString = blockAttributeTextString;
    }

    public String getBlockAttributeId() {
        return blockAttributeId;
    }

    public void setBlockAttributeId(String blockAttributeId) {
        this.blockAttributeId = blockAttributeId;
    }

    public String getLeaderStyleId() {
        return leaderStyleId;
    }

    public void setLeaderStyleId(String leaderStyleId) {
        this.leaderStyleId = leaderStyleId;
    }

    public String getLeaderLineTypeId() {
        return leaderLineTypeId;
    }

    public void setLeaderLineTypeId(String leaderLineTypeId) {
        this.leaderLineTypeId = leaderLineTypeId;
    }

    public String getArrowHeadId() {
        return arrowHeadId;
    }

    public void setArrowHeadId(String arrowHeadId) {
        this.arrowHeadId = arrowHeadId;
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

    public MultiLeaderContext getContext() {
        return context;
    }

    public void setContext(MultiLeaderContext context) {
        this.context = context;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof MultiLeader that
            && commonEquals(that)
            && Objects.equals(blockContentScale, that.blockContentScale)
            && Objects.equals(doglegLength, that.doglegLength)
            && Objects.equals(arrowHeadSize, that.arrowHeadSize)
            && Objects.equals(blockContentRotation, that.blockContentRotation)
            && Objects.equals(blockAttributeWidth, that.blockAttributeWidth)
            && Objects.equals(textLineSpacingStyleFactor, that.textLineSpacingStyleFactor)
            && Objects.equals(propertyOverrideFlag, that.propertyOverrideFlag)
            && Objects.equals(leaderLineColor, that.leaderLineColor)
            && Objects.equals(textColor, that.textColor)
            && Objects.equals(blockContentColor, that.blockContentColor)
            && Objects.equals(arrowHeadIndex, that.arrowHeadIndex)
            && Objects.equals(textRightAttachmentType, that.textRightAttachmentType)
            && Objects.equals(leaderLineType, that.leaderLineType)
            && Objects.equals(leaderLineWeight, that.leaderLineWeight)
            && Objects.equals(contentType, that.contentType)
            && Objects.equals(textLeftAttachmentType, that.textLeftAttachmentType)
            && Objects.equals(textAngleType, that.textAngleType)
            && Objects.equals(textAlignmentType, that.textAlignmentType)
            && Objects.equals(blockContentConnectionType, that.blockContentConnectionType)
            && Objects.equals(blockAttributeIndex, that.blockAttributeIndex)
            && Objects.equals(textAlignInIpe, that.textAlignInIpe)
            && Objects.equals(textAttachmentPoint, that.textAttachmentPoint)
            && Objects.equals(textAttachmentDirectionMText, that.textAttachmentDirectionMText)
            && Objects.equals(textAttachmentDirectionBottom, that.textAttachmentDirectionBottom)
            && Objects.equals(textAttachmentDirectionTop, that.textAttachmentDirectionTop)
            && Objects.equals(enableLanding, that.enableLanding)
            && Objects.equals(enableDogleg, that.enableDogleg)
            && Objects.equals(enableFrameText, that.enableFrameText)
            && Objects.equals(enableAnnotationScale, that.enableAnnotationScale)
            && Objects.equals(textDirectionNegative, that.textDirectionNegative)
            && Objects.equals(blockAttributeTextString, that.blockAttributeTextString)
            && Objects.equals(blockAttributeId, that.blockAttributeId)
            && Objects.equals(leaderStyleId, that.leaderStyleId)
            && Objects.equals(leaderLineTypeId, that.leaderLineTypeId)
            && Objects.equals(arrowHeadId, that.arrowHeadId)
            && Objects.equals(textStyleId, that.textStyleId)
            && Objects.equals(blockContentId, that.blockContentId)
            && Objects.equals(context, that.context);
    }

    @Override
    public int hashCode() {
        return Objects.hash(commonHashCode(), blockContentScale, doglegLength, arrowHeadSize, blockContentRotation, blockAttributeWidth, textLineSpacingStyleFactor);
    }
}
