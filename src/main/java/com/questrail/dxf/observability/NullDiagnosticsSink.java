package com.questrail.dxf.observability;

/**
 * No-op implementation of DxfDiagnosticsSink.
 */
public final class NullDiagnosticsSink implements DxfDiagnosticsSink {
    public static final NullDiagnosticsSink INSTANCE = new NullDiagnosticsSink();

    private NullDiagnosticsSink() {}

    @Override
    public void onUnhandledGroup(UnhandledGroupEvent event) {}

    @Override
    public void onWarning(DxfWarningEvent event) {}

    @Override
    public void onSection(DxfSectionEvent event) {}

    @Override
    public void onError(DxfErrorEvent event) {}
}
