package com.questrail.dxf.model;

import java.util.Objects;

/**
 * A {@code CLASS} record of the {@code CLASSES} section: an application-defined
 * class whose instances appear in the drawing.
 */
public final class DxfClass
{
    private String recordName;
    private String cppClassName;
    private String applicationName;
    private Integer proxyFlags;
    private Integer instanceCount;
    private Boolean wasAProxy;
    private Boolean isAnEntity;

    /** DXF record name (group 1); the key of the classes map. */
    public String getRecordName() {
        return recordName;
    }

    public void setRecordName(String recordName) {
        this.recordName = recordName;
    }

    public String getCppClassName() {
        return cppClassName;
    }

    public void setCppClassName(String cppClassName) {
        this.cppClassName = cppClassName;
    }

    public String getApplicationName() {
        return applicationName;
    }

    public void setApplicationName(String applicationName) {
        this.applicationName = applicationName;
    }

    public Integer getProxyFlags() {
        return proxyFlags;
    }

    public void setProxyFlags(Integer proxyFlags) {
        this.proxyFlags = proxyFlags;
    }

    public Integer getInstanceCount() {
        return instanceCount;
    }

    public void setInstanceCount(Integer instanceCount) {
        this.instanceCount = instanceCount;
    }

    public Boolean getWasAProxy() {
        return wasAProxy;
    }

    public void setWasAProxy(Boolean wasAProxy) {
        this.wasAProxy = wasAProxy;
    }

    public Boolean getIsAnEntity() {
        return isAnEntity;
    }

    public void setIsAnEntity(Boolean isAnEntity) {
        this.isAnEntity = isAnEntity;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof DxfClass that
            && Objects.equals(recordName, that.recordName)
            && Objects.equals(cppClassName, that.cppClassName)
            && Objects.equals(applicationName, that.applicationName)
            && Objects.equals(proxyFlags, that.proxyFlags)
            && Objects.equals(instanceCount, that.instanceCount)
            && Objects.equals(wasAProxy, that.wasAProxy)
            && Objects.equals(isAnEntity, that.isAnEntity);
    }

    @Override
    public int hashCode() {
        return Objects.hash(recordName, cppClassName, applicationName, proxyFlags, instanceCount, wasAProxy);
    }
}
