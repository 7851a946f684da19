package com.questrail.dxf.codec.table;

import com.questrail.dxf.codec.RecordSchema;
import com.questrail.dxf.model.ViewPort;

/**
 * {@code VPORT} records. Several records may share a name, so nameless
 * records are kept as well.
 */
public final class ViewPortCodec extends AbstractTableEntryCodec<ViewPort>
{
    private static final RecordSchema<ViewPort> SCHEMA = RecordSchema.<ViewPort>builder()
        .point(10, ViewPort::getLowerLeftCorner, ViewPort::setLowerLeftCorner)
        .point(11, ViewPort::getUpperRightCorner, ViewPort::setUpperRightCorner)
        .point(12, ViewPort::getCenter, ViewPort::setCenter)
        .point(13, ViewPort::getSnapBasePoint, ViewPort::setSnapBasePoint)
        .point(14, ViewPort::getSnapSpacing, ViewPort::setSnapSpacing)
        .point(15, ViewPort::getGridSpacing, ViewPort::setGridSpacing)
        .point(16, ViewPort::getViewDirection, ViewPort::setViewDirection)
        .point(17, ViewPort::getViewTarget, ViewPort::setViewTarget)
        .real(40, ViewPort::getHeight, ViewPort::setHeight)
        .real(41, ViewPort::getAspectRatio, ViewPort::setAspectRatio)
        .real(42, ViewPort::getLensLength, ViewPort::setLensLength)
        .real(43, ViewPort::getFrontClippingPlane, ViewPort::setFrontClippingPlane)
        .real(44, ViewPort::getBackClippingPlane, ViewPort::setBackClippingPlane)
        .real(45, ViewPort::getViewHeight, ViewPort::setViewHeight)
        .real(50, ViewPort::getSnapRotationAngle, ViewPort::setSnapRotationAngle)
        .real(51, ViewPort::getViewTwistAngle, ViewPort::setViewTwistAngle)
        .integer(71, ViewPort::getViewMode, ViewPort::setViewMode)
        .integer(72, ViewPort::getCircleSides, ViewPort::setCircleSides)
        .integer(73, ViewPort::getFastZoom, ViewPort::setFastZoom)
        .integer(74, ViewPort::getUcsIcon, ViewPort::setUcsIcon)
        .integer(75, ViewPort::getSnapOn, ViewPort::setSnapOn)
        .integer(76, ViewPort::getGridOn, ViewPort::setGridOn)
        .integer(77, ViewPort::getSnapStyle, ViewPort::setSnapStyle)
        .integer(78, ViewPort::getSnapIsoPair, ViewPort::setSnapIsoPair)
        .integer(281, ViewPort::getRenderMode, ViewPort::setRenderMode)
        .integer(65, ViewPort::getUcsPerViewport, ViewPort::setUcsPerViewport)
        .point(110, ViewPort::getUcsOrigin, ViewPort::setUcsOrigin)
        .point(111, ViewPort::getUcsXAxis, ViewPort::setUcsXAxis)
        .point(112, ViewPort::getUcsYAxis, ViewPort::setUcsYAxis)
        .integer(79, ViewPort::getOrthographicType, ViewPort::setOrthographicType)
        .real(146, ViewPort::getElevation, ViewPort::setElevation)
        .integer(60, ViewPort::getGridFlags, ViewPort::setGridFlags)
        .integer(61, ViewPort::getMajorGridLines, ViewPort::setMajorGridLines)
        .text(348, ViewPort::getVisualStyleHandle, ViewPort::setVisualStyleHandle)
        .bool(292, ViewPort::getDefaultLightingOn, ViewPort::setDefaultLightingOn)
        .integer(282, ViewPort::getDefaultLightingType, ViewPort::setDefaultLightingType)
        .real(141, ViewPort::getBrightness, ViewPort::setBrightness)
        .real(142, ViewPort::getContrast, ViewPort::setContrast)
        .integer(63, ViewPort::getAmbientColorIndex, ViewPort::setAmbientColorIndex)
        .integer(421, ViewPort::getAmbientTrueColor, ViewPort::setAmbientTrueColor)
        .text(431, ViewPort::getAmbientColorName, ViewPort::setAmbientColorName)
        .text(361, ViewPort::getSunHandle, ViewPort::setSunHandle)
        .build();

    public ViewPortCodec() {
        super(ViewPort.TYPE);
    }

    @Override
    public boolean requiresName() {
        return false;
    }

    @Override
    protected ViewPort newEntry() {
        return new ViewPort();
    }

    @Override
    protected RecordSchema<ViewPort> schema() {
        return SCHEMA;
    }
}
