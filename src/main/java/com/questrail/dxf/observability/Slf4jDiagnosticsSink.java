package com.questrail.dxf.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of DxfDiagnosticsSink that emits logs via SLF4J.
 *
 * <p>Unhandled groups are expected in real drawings (extended data, newer
 * releases) and are logged at DEBUG only.</p>
 */
public final class Slf4jDiagnosticsSink implements DxfDiagnosticsSink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jDiagnosticsSink.class);

    @Override
    public void onUnhandledGroup(UnhandledGroupEvent event) {
        if (log.isDebugEnabled()) {
            log.debug("Unhandled {} group {}: {}",
                event.recordKind(),
                event.group().code(),
                event.group().value());
        }
    }

    @Override
    public void onWarning(DxfWarningEvent event) {
        log.warn("DXF {} [{}]: {}", event.kind(), event.recordKind(), event.message());
    }

    @Override
    public void onSection(DxfSectionEvent event) {
        log.debug("DXF section {} read ({} records)", event.sectionName(), event.recordCount());
    }

    @Override
    public void onError(DxfErrorEvent event) {
        log.error("DXF Error: {}", event.message(), event.cause());
    }
}
