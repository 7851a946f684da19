package com.questrail.dxf.codec.entity;

import com.questrail.dxf.codec.AbstractEntityCodec;
import com.questrail.dxf.codec.GroupWriter;
import com.questrail.dxf.codec.ParseContext;
import com.questrail.dxf.codec.RecordSchema;
import com.questrail.dxf.model.entity.MultiLeader;
import com.questrail.dxf.model.entity.MultiLeaderContext;
import com.questrail.dxf.model.entity.MultiLeaderLeader;
import com.questrail.dxf.model.entity.MultiLeaderLine;
import com.questrail.dxf.scan.Group;

import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * MultiLeaderCodec
 * =============================================================================
 * {@code MULTILEADER}: three levels of nested structure inside one entity.
 *
 * <pre>
 *   MULTILEADER fields
 *     300 CONTEXT_DATA{        ... 301 }
 *       302 LEADER{            ... 303 }
 *         304 LEADER_LINE{     ... 305 }
 * </pre>
 *
 * Each level has its own table. Codes are only meaningful at their level:
 * 302 is the block attribute text on the entity but opens a leader inside the
 * context, and 304 is the default text inside the context but opens a leader
 * line inside a leader.
 */
public final class MultiLeaderCodec extends AbstractEntityCodec<MultiLeader>
{
    private static final RecordSchema<MultiLeaderLine> LINE = RecordSchema.<MultiLeaderLine>builder()
        .points(10, MultiLeaderLine::getVertices)
        .point(11, MultiLeaderLine::getBreakStartPoint, MultiLeaderLine::setBreakStartPoint)
        .point(12, MultiLeaderLine::getBreakEndPoint, MultiLeaderLine::setBreakEndPoint)
        .integer(90, MultiLeaderLine::getBreakPointIndex, MultiLeaderLine::setBreakPointIndex)
        .integer(91, MultiLeaderLine::getLeaderLineIndex, MultiLeaderLine::setLeaderLineIndex)
        .build();

    private static final RecordSchema<MultiLeaderLeader> LEADER = RecordSchema.<MultiLeaderLeader>builder()
        .bool(290, MultiLeaderLeader::getHasSetLastLeaderLinePoint, MultiLeaderLeader::setHasSetLastLeaderLinePoint)
        .bool(291, MultiLeaderLeader::getHasSetDoglegVector, MultiLeaderLeader::setHasSetDoglegVector)
        .point(10, MultiLeaderLeader::getLastLeaderLinePoint, MultiLeaderLeader::setLastLeaderLinePoint)
        .point(11, MultiLeaderLeader::getDoglegVector, MultiLeaderLeader::setDoglegVector)
        .point(12, MultiLeaderLeader::getBreakStartPoint, MultiLeaderLeader::setBreakStartPoint)
        .point(13, MultiLeaderLeader::getBreakEndPoint, MultiLeaderLeader::setBreakEndPoint)
        .integer(90, MultiLeaderLeader::getLeaderBranchIndex, MultiLeaderLeader::setLeaderBranchIndex)
        .real(40, MultiLeaderLeader::getDoglegLength, MultiLeaderLeader::setDoglegLength)
        .custom(children(304, "LEADER_LINE{", 305, "MULTILEADER.LEADER_LINE",
            MultiLeaderLeader::getLines, MultiLeaderLine::new, LINE))
        .build();

    private static final RecordSchema<MultiLeaderContext> CONTEXT = RecordSchema.<MultiLeaderContext>builder()
        .real(40, MultiLeaderContext::getContentScale, MultiLeaderContext::setContentScale)
        .point(10, MultiLeaderContext::getContentBasePosition, MultiLeaderContext::setContentBasePosition)
        .real(41, MultiLeaderContext::getTextHeight, MultiLeaderContext::setTextHeight)
        .real(140, MultiLeaderContext::getArrowHeadSize, MultiLeaderContext::setArrowHeadSize)
        .real(145, MultiLeaderContext::getLandingGap, MultiLeaderContext::setLandingGap)
        .integer(174, MultiLeaderContext::getTextAngleType, MultiLeaderContext::setTextAngleType)
        .integer(175, MultiLeaderContext::getTextAlignmentType, MultiLeaderContext::setTextAlignmentType)
        .integer(176, MultiLeaderContext::getBlockContentConnectionType, MultiLeaderContext::setBlockContentConnectionType)
        .integer(177, MultiLeaderContext::getBlockAttributeIndex, MultiLeaderContext::setBlockAttributeIndex)
        .bool(290, MultiLeaderContext::getHasMText, MultiLeaderContext::setHasMText)
        .text(304, MultiLeaderContext::getDefaultTextContents, MultiLeaderContext::setDefaultTextContents)
        .point(11, MultiLeaderContext::getTextNormalDirection, MultiLeaderContext::setTextNormalDirection)
        .text(340, MultiLeaderContext::getTextStyleId, MultiLeaderContext::setTextStyleId)
        .point(12, MultiLeaderContext::getTextLocation, MultiLeaderContext::setTextLocation)
        .point(13, MultiLeaderContext::getTextDirection, MultiLeaderContext::setTextDirection)
        .real(42, MultiLeaderContext::getTextRotation, MultiLeaderContext::setTextRotation)
        .real(43, MultiLeaderContext::getTextWidth, MultiLeaderContext::setTextWidth)
        .real(44, MultiLeaderContext::getTextHeight2, MultiLeaderContext::setTextHeight2)
        .real(45, MultiLeaderContext::getTextLineSpacingFactor, MultiLeaderContext::setTextLineSpacingFactor)
        .integer(170, MultiLeaderContext::getTextLineSpacingStyle, MultiLeaderContext::setTextLineSpacingStyle)
        .integer(90, MultiLeaderContext::getBreakPointIndex, MultiLeaderContext::setBreakPointIndex)
        .integer(91, MultiLeaderContext::getTextBackgroundColor, MultiLeaderContext::setTextBackgroundColor)
        .real(141, MultiLeaderContext::getTextBackgroundScaleFactor, MultiLeaderContext::setTextBackgroundScaleFactor)
        .integer(92, MultiLeaderContext::getTextBackgroundTransparency, MultiLeaderContext::setTextBackgroundTransparency)
        .bool(291, MultiLeaderContext::getTextBackgroundColorOn, MultiLeaderContext::setTextBackgroundColorOn)
        .bool(292, MultiLeaderContext::getTextBackgroundFillOn, MultiLeaderContext::setTextBackgroundFillOn)
        .integer(173, MultiLeaderContext::getTextColumnType, MultiLeaderContext::setTextColumnType)
        .bool(293, MultiLeaderContext::getTextUseAutoHeight, MultiLeaderContext::setTextUseAutoHeight)
        .real(142, MultiLeaderContext::getTextColumnWidth, MultiLeaderContext::setTextColumnWidth)
        .real(143, MultiLeaderContext::getTextColumnGutterWidth, MultiLeaderContext::setTextColumnGutterWidth)
        .bool(294, MultiLeaderContext::getTextColumnFlowReversed, MultiLeaderContext::setTextColumnFlowReversed)
        .real(144, MultiLeaderContext::getTextColumnHeight, MultiLeaderContext::setTextColumnHeight)
        .bool(295, MultiLeaderContext::getTextUseWordBreak, MultiLeaderContext::setTextUseWordBreak)
        .bool(296, MultiLeaderContext::getHasBlock, MultiLeaderContext::setHasBlock)
        .text(341, MultiLeaderContext::getBlockContentId, MultiLeaderContext::setBlockContentId)
        .point(14, MultiLeaderContext::getBlockContentNormalDirection, MultiLeaderContext::setBlockContentNormalDirection)
        .point(15, MultiLeaderContext::getBlockContentPosition, MultiLeaderContext::setBlockContentPosition)
        .real(16, MultiLeaderContext::getBlockContentScale, MultiLeaderContext::setBlockContentScale)
        .real(46, MultiLeaderContext::getBlockContentRotation, MultiLeaderContext::setBlockContentRotation)
        .integer(93, MultiLeaderContext::getBlockContentColor, MultiLeaderContext::setBlockContentColor)
        .matrix(47, MultiLeaderContext::getBlockTransformationMatrix, MultiLeaderContext::setBlockTransformationMatrix)
        .point(110, MultiLeaderContext::getPlaneOriginPoint, MultiLeaderContext::setPlaneOriginPoint)
        .point(111, MultiLeaderContext::getPlaneXAxisDirection, MultiLeaderContext::setPlaneXAxisDirection)
        .point(112, MultiLeaderContext::getPlaneYAxisDirection, MultiLeaderContext::setPlaneYAxisDirection)
        .bool(297, MultiLeaderContext::getPlaneNormalReversed, MultiLeaderContext::setPlaneNormalReversed)
        .integer(171, MultiLeaderContext::getTextAttachment, MultiLeaderContext::setTextAttachment)
        .integer(172, MultiLeaderContext::getTextFlowDirection, MultiLeaderContext::setTextFlowDirection)
        .custom(children(302, "LEADER{", 303, "MULTILEADER.LEADER",
            MultiLeaderContext::getLeaders, MultiLeaderLeader::new, LEADER))
        .build();

    private static final RecordSchema<MultiLeader> SCHEMA = RecordSchema.<MultiLeader>builder()
        .custom(child(300, "CONTEXT_DATA{", 301, "MULTILEADER.CONTEXT_DATA",
            MultiLeader::getContext, MultiLeader::setContext, MultiLeaderContext::new, CONTEXT))
        .text(340, MultiLeader::getLeaderStyleId, MultiLeader::setLeaderStyleId)
        .integer(90, MultiLeader::getPropertyOverrideFlag, MultiLeader::setPropertyOverrideFlag)
        .integer(170, MultiLeader::getLeaderLineType, MultiLeader::setLeaderLineType)
        .integer(91, MultiLeader::getLeaderLineColor, MultiLeader::setLeaderLineColor)
        .text(341, MultiLeader::getLeaderLineTypeId, MultiLeader::setLeaderLineTypeId)
        .integer(171, MultiLeader::getLeaderLineWeight, MultiLeader::setLeaderLineWeight)
        .bool(290, MultiLeader::getEnableLanding, MultiLeader::setEnableLanding)
        .bool(291, MultiLeader::getEnableDogleg, MultiLeader::setEnableDogleg)
        .real(41, MultiLeader::getDoglegLength, MultiLeader::setDoglegLength)
        .text(342, MultiLeader::getArrowHeadId, MultiLeader::setArrowHeadId)
        .real(42, MultiLeader::getArrowHeadSize, MultiLeader::setArrowHeadSize)
        .integer(172, MultiLeader::getContentType, MultiLeader::setContentType)
        .text(343, MultiLeader::getTextStyleId, MultiLeader::setTextStyleId)
        .integer(173, MultiLeader::getTextLeftAttachmentType, MultiLeader::setTextLeftAttachmentType)
        .integer(95, MultiLeader::getTextRightAttachmentType, MultiLeader::setTextRightAttachmentType)
        .integer(174, MultiLeader::getTextAngleType, MultiLeader::setTextAngleType)
        .integer(175, MultiLeader::getTextAlignmentType, MultiLeader::setTextAlignmentType)
        .integer(92, MultiLeader::getTextColor, MultiLeader::setTextColor)
        .bool(292, MultiLeader::getEnableFrameText, MultiLeader::setEnableFrameText)
        .text(344, MultiLeader::getBlockContentId, MultiLeader::setBlockContentId)
        .integer(93, MultiLeader::getBlockContentColor, MultiLeader::setBlockContentColor)
        .point(10, MultiLeader::getBlockContentScale, MultiLeader::setBlockContentScale)
        .real(43, MultiLeader::getBlockContentRotation, MultiLeader::setBlockContentRotation)
        .integer(176, MultiLeader::getBlockContentConnectionType, MultiLeader::setBlockContentConnectionType)
        .bool(293, MultiLeader::getEnableAnnotationScale, MultiLeader::setEnableAnnotationScale)
        .integer(94, MultiLeader::getArrowHeadIndex, MultiLeader::setArrowHeadIndex)
        .text(330, MultiLeader::getBlockAttributeId, MultiLeader::setBlockAttributeId)
        .integer(177, MultiLeader::getBlockAttributeIndex, MultiLeader::setBlockAttributeIndex)
        .real(44, MultiLeader::getBlockAttributeWidth, MultiLeader::setBlockAttributeWidth)
        .text(302, MultiLeader::getBlockAttributeTextString, MultiLeader::setBlockAttributeTextString)
        .bool(294, MultiLeader::getTextDirectionNegative, MultiLeader::setTextDirectionNegative)
        .integer(178, MultiLeader::getTextAlignInIpe, MultiLeader::setTextAlignInIpe)
        .integer(179, MultiLeader::getTextAttachmentPoint, MultiLeader::setTextAttachmentPoint)
        .real(45, MultiLeader::getTextLineSpacingStyleFactor, MultiLeader::setTextLineSpacingStyleFactor)
        .integer(271, MultiLeader::getTextAttachmentDirectionMText, MultiLeader::setTextAttachmentDirectionMText)
        .integer(272, MultiLeader::getTextAttachmentDirectionBottom, MultiLeader::setTextAttachmentDirectionBottom)
        .integer(273, MultiLeader::getTextAttachmentDirectionTop, MultiLeader::setTextAttachmentDirectionTop)
        .build();

    public MultiLeaderCodec() {
        super(MultiLeader.TYPE, MultiLeader.class);
    }

    @Override
    protected MultiLeader newEntity() {
        return new MultiLeader();
    }

    @Override
    protected RecordSchema<MultiLeader> schema() {
        return SCHEMA;
    }

    /** A single nested structure, e.g. the context of the entity. */
    private static <P, C> RecordSchema.FieldBinding<P> child(int openCode, String openToken, int closeCode,
                                                             String kind, Function<P, C> getter,
                                                             BiConsumer<P, C> setter, Supplier<C> factory,
                                                             RecordSchema<C> schema) {
        return new RecordSchema.FieldBinding<>() {
            @Override
            public int[] codes() {
                return new int[] { openCode };
            }

            @Override
            public void read(P parent, Group group, ParseContext context) {
                setter.accept(parent, context.readUntil(kind, factory.get(), schema, closeCode));
            }

            @Override
            public void write(P parent, GroupWriter out) {
                C child = getter.apply(parent);
                if (child != null) {
                    writeBlock(out, openCode, openToken, closeCode, schema, child);
                }
            }
        };
    }

    /** A repeated nested structure, e.g. the leaders of a context. */
    private static <P, C> RecordSchema.FieldBinding<P> children(int openCode, String openToken, int closeCode,
                                                                String kind, Function<P, List<C>> list,
                                                                Supplier<C> factory, RecordSchema<C> schema) {
        return new RecordSchema.FieldBinding<>() {
            @Override
            public int[] codes() {
                return new int[] { openCode };
            }

            @Override
            public void read(P parent, Group group, ParseContext context) {
                list.apply(parent).add(context.readUntil(kind, factory.get(), schema, closeCode));
            }

            @Override
            public void write(P parent, GroupWriter out) {
                for (C child : list.apply(parent)) {
                    writeBlock(out, openCode, openToken, closeCode, schema, child);
                }
            }
        };
    }

    private static <C> void writeBlock(GroupWriter out, int openCode, String openToken, int closeCode,
                                       RecordSchema<C> schema, C child) {
        out.text(openCode, openToken);
        schema.write(child, out);
        out.text(closeCode, "}");
    }
}
