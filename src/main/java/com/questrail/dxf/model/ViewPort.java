package com.questrail.dxf.model;

import java.util.Objects;

/**
 * A {@code VPORT} table record: one viewport of a viewport configuration.
 * Several records may share a name when the configuration is split into
 * multiple viewports.
 *
 * <p>The ambient color may be given as a true color (421), a color name (431),
 * or both. Each is kept on its own code.</p>
 */
public final class ViewPort extends TableEntry
{
    public static final String TYPE = "VPORT";

    private Point lowerLeftCorner;
    private Point upperRightCorner;
    private Point center;
    private Point snapBasePoint;
    private Point snapSpacing;
    private Point gridSpacing;
    private Point viewDirection;
    private Point viewTarget;
    private Double height;
    private Double aspectRatio;
    private Double lensLength;
    private Double frontClippingPlane;
    private Double backClippingPlane;
    private Double viewHeight;
    private Double snapRotationAngle;
    private Double viewTwistAngle;
    private Integer gridFlags;
    private Integer majorGridLines;
    private Integer ambientColorIndex;
    private Integer ucsPerViewport;
    private Integer viewMode;
    private Integer circleSides;
    private Integer fastZoom;
    private Integer ucsIcon;
    private Integer snapOn;
    private Integer gridOn;
    private Integer snapStyle;
    private Integer snapIsoPair;
    private Integer orthographicType;
    private Point ucsOrigin;
    private Point ucsXAxis;
    private Point ucsYAxis;
    private Double brightness;
    private Double contrast;
    private Double elevation;
    private Integer renderMode;
    private Integer defaultLightingType;
    private Boolean defaultLightingOn;
    private String visualStyleHandle;
    private String sunHandle;
    private Integer ambientTrueColor;
    private String ambientColorName;

    @Override
    public String type() {
        return TYPE;
    }

    public Point getLowerLeftCorner() {
        return lowerLeftCorner;
    }

    public void setLowerLeftCorner(Point lowerLeftCorner) {
        this.lowerLeftCorner = lowerLeftCorner;
    }

    public Point getUpperRightCorner() {
        return upperRightCorner;
    }

    public void setUpperRightCorner(Point upperRightCorner) {
        this.upperRightCorner = upperRightCorner;
    }

    public Point getCenter() {
        return center;
    }

    public void setCenter(Point center) {
        this.center = center;
    }

    public Point getSnapBasePoint() {
        return snapBasePoint;
    }

    public void setSnapBasePoint(Point snapBasePoint) {
        this.snapBasePoint = snapBasePoint;
    }

    public Point getSnapSpacing() {
        return snapSpacing;
    }

    public void setSnapSpacing(Point snapSpacing) {
        this.snapSpacing = snapSpacing;
    }

    public Point getGridSpacing() {
        return gridSpacing;
    }

    public void setGridSpacing(Point gridSpacing) {
        this.gridSpacing = gridSpacing;
    }

    /** Direction from the target to the viewer (group 16). */
    public Point getViewDirection() {
        return viewDirection;
    }

    public void setViewDirection(Point viewDirection) {
        this.viewDirection = viewDirection;
    }

    public Point getViewTarget() {
        return viewTarget;
    }

    public void setViewTarget(Point viewTarget) {
        this.viewTarget = viewTarget;
    }

    public Double getHeight() {
        return height;
    }

    public void setHeight(Double height) {
        this.height = height;
    }

    public Double getAspectRatio() {
        return aspectRatio;
    }

    public void setAspectRatio(Double aspectRatio) {
        this.aspectRatio = aspectRatio;
    }

    public Double getLensLength() {
        return lensLength;
    }

    public void setLensLength(Double lensLength) {
        this.lensLength = lensLength;
    }

    public Double getFrontClippingPlane() {
        return frontClippingPlane;
    }

    public void setFrontClippingPlane(Double frontClippingPlane) {
        this.frontClippingPlane = frontClippingPlane;
    }

    public Double getBackClippingPlane() {
        return backClippingPlane;
    }

    public void setBackClippingPlane(Double backClippingPlane) {
        this.backClippingPlane = backClippingPlane;
    }

    public Double getViewHeight() {
        return viewHeight;
    }

    public void setViewHeight(Double viewHeight) {
        this.viewHeight = viewHeight;
    }

    public Double getSnapRotationAngle() {
        return snapRotationAngle;
    }

    public void setSnapRotationAngle(Double snapRotationAngle) {
        this.snapRotationAngle = snapRotationAngle;
    }

    public Double getViewTwistAngle() {
        return viewTwistAngle;
    }

    public void setViewTwistAngle(Double viewTwistAngle) {
        this.viewTwistAngle = viewTwistAngle;
    }

    public Integer getGridFlags() {
        return gridFlags;
    }

    public void setGridFlags(Integer gridFlags) {
        this.gridFlags = gridFlags;
    }

    public Integer getMajorGridLines() {
        return majorGridLines;
    }

    public void setMajorGridLines(Integer majorGridLines) {
        this.majorGridLines = majorGridLines;
    }

    public Integer getAmbientColorIndex() {
        return ambientColorIndex;
    }

    public void setAmbientColorIndex(Integer ambientColorIndex) {
        this.ambientColorIndex = ambientColorIndex;
    }

    public Integer getUcsPerViewport() {
        return ucsPerViewport;
    }

    public void setUcsPerViewport(Integer ucsPerViewport) {
        this.ucsPerViewport = ucsPerViewport;
    }

    public Integer getViewMode() {
        return viewMode;
    }

    public void setViewMode(Integer viewMode) {
        this.viewMode = viewMode;
    }

    public Integer getCircleSides() {
        return circleSides;
    }

    public void setCircleSides(Integer circleSides) {
        this.circleSides = circleSides;
    }

    public Integer getFastZoom() {
        return fastZoom;
    }

    public void setFastZoom(Integer fastZoom) {
        this.fastZoom = fastZoom;
    }

    public Integer getUcsIcon() {
        return ucsIcon;
    }

    public void setUcsIcon(Integer ucsIcon) {
        this.ucsIcon = ucsIcon;
    }

    public Integer getSnapOn() {
        return snapOn;
    }

    public void setSnapOn(Integer snapOn) {
        this.snapOn = snapOn;
    }

    public Integer getGridOn() {
        return gridOn;
    }

    public void setGridOn(Integer gridOn) {
        this.gridOn = gridOn;
    }

    public Integer getSnapStyle() {
        return snapStyle;
    }

    public void setSnapStyle(Integer snapStyle) {
        this.snapStyle = snapStyle;
    }

    public Integer getSnapIsoPair() {
        return snapIsoPair;
    }

    public void setSnapIsoPair(Integer snapIsoPair) {
        this.snapIsoPair = snapIsoPair;
    }

    public Integer getOrthographicType() {
        return orthographicType;
    }

    public void setOrthographicType(Integer orthographicType) {
        this.orthographicType = orthographicType;
    }

    public Point getUcsOrigin() {
        return ucsOrigin;
    }

    public void setUcsOrigin(Point ucsOrigin) {
        this.ucsOrigin = ucsOrigin;
    }

    public Point getUcsXAxis() {
        return ucsXAxis;
    }

    public void setUcsXAxis(Point ucsXAxis) {
        this.ucsXAxis = ucsXAxis;
    }

    public Point getUcsYAxis() {
        return ucsYAxis;
    }

    public void setUcsYAxis(Point ucsYAxis) {
        this.ucsYAxis = ucsYAxis;
    }

    public Double getBrightness() {
        return brightness;
    }

    public void setBrightness(Double brightness) {
        this.brightness = brightness;
    }

    public Double getContrast() {
        return contrast;
    }

    public void setContrast(Double contrast) {
        this.contrast = contrast;
    }

    public Double getElevation() {
        return elevation;
    }

    public void setElevation(Double elevation) {
        this.elevation = elevation;
    }

    public Integer getRenderMode() {
        return renderMode;
    }

    public void setRenderMode(Integer renderMode) {
        this.renderMode = renderMode;
    }

    public Integer getDefaultLightingType() {
        return defaultLightingType;
    }

    public void setDefaultLightingType(Integer defaultLightingType) {
        this.defaultLightingType = defaultLightingType;
    }

    public Boolean getDefaultLightingOn() {
        return defaultLightingOn;
    }

    public void setDefaultLightingOn(Boolean defaultLightingOn) {
        this.defaultLightingOn = defaultLightingOn;
    }

    public String getVisualStyleHandle() {
        return visualStyleHandle;
    }

    public void setVisualStyleHandle(String visualStyleHandle) {
        this.visualStyleHandle = visualStyleHandle;
    }

    public String getSunHandle() {
        return sunHandle;
    }

    public void setSunHandle(String sunHandle) {
        this.sunHandle = sunHandle;
    }

    public Integer getAmbientTrueColor() {
        return ambientTrueColor;
    }

    public void setAmbientTrueColor(Integer ambientTrueColor) {
        this.ambientTrueColor = ambientTrueColor;
    }

    public String getAmbientColorName() {
        return ambientColorName;
    }

    public void setAmbientColorName(String ambientColorName) {
        this.ambientColorName = ambientColorName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof ViewPort that
            && entryEquals(that)
            && Objects.equals(lowerLeftCorner, that.lowerLeftCorner)
            && Objects.equals(upperRightCorner, that.upperRightCorner)
            && Objects.equals(center, that.center)
            && Objects.equals(snapBasePoint, that.snapBasePoint)
            && Objects.equals(snapSpacing, that.snapSpacing)
            && Objects.equals(gridSpacing, that.gridSpacing)
            && Objects.equals(viewDirection, that.viewDirection)
            && Objects.equals(viewTarget, that.viewTarget)
            && Objects.equals(height, that.height)
            && Objects.equals(aspectRatio, that.aspectRatio)
            && Objects.equals(lensLength, that.lensLength)
            && Objects.equals(frontClippingPlane, that.frontClippingPlane)
            && Objects.equals(backClippingPlane, that.backClippingPlane)
            && Objects.equals(viewHeight, that.viewHeight)
            && Objects.equals(snapRotationAngle, that.snapRotationAngle)
            && Objects.equals(viewTwistAngle, that.viewTwistAngle)
            && Objects.equals(gridFlags, that.gridFlags)
            && Objects.equals(majorGridLines, that.majorGridLines)
            && Objects.equals(ambientColorIndex, that.ambientColorIndex)
            && Objects.equals(ucsPerViewport, that.ucsPerViewport)
            && Objects.equals(viewMode, that.viewMode)
            && Objects.equals(circleSides, that.circleSides)
            && Objects.equals(fastZoom, that.fastZoom)
            && Objects.equals(ucsIcon, that.ucsIcon)
            && Objects.equals(snapOn, that.snapOn)
            && Objects.equals(gridOn, that.gridOn)
            && Objects.equals(snapStyle, that.snapStyle)
            && Objects.equals(snapIsoPair, that.snapIsoPair)
            && Objects.equals(orthographicType, that.orthographicType)
            && Objects.equals(ucsOrigin, that.ucsOrigin)
            && Objects.equals(ucsXAxis, that.ucsXAxis)
            && Objects.equals(ucsYAxis, that.ucsYAxis)
            && Objects.equals(brightness, that.brightness)
            && Objects.equals(contrast, that.contrast)
            && Objects.equals(elevation, that.elevation)
            && Objects.equals(renderMode, that.renderMode)
            && Objects.equals(defaultLightingType, that.defaultLightingType)
            && Objects.equals(defaultLightingOn, that.defaultLightingOn)
            && Objects.equals(visualStyleHandle, that.visualStyleHandle)
            && Objects.equals(sunHandle, that.sunHandle)
            && Objects.equals(ambientTrueColor, that.ambientTrueColor)
            && Objects.equals(ambientColorName, that.ambientColorName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entryHashCode(), lowerLeftCorner, upperRightCorner, center, snapBasePoint, snapSpacing, gridSpacing);
    }
}
