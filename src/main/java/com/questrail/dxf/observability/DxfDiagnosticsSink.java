package com.questrail.dxf.observability;

/**
 * Receives diagnostics raised while a document is parsed or written.
 *
 * <p>The codec never consults global logging state. Every parse and serialize
 * call is handed a sink, and everything non-fatal it notices is reported here:
 * skipped groups, consistency warnings, assembled sections. Fatal failures are
 * reported through {@link #onError(DxfErrorEvent)} just before the exception is
 * rethrown to the caller.</p>
 *
 * Implementations can provide logging, metrics, or collection for tests.
 */
public interface DxfDiagnosticsSink {
    /**
     * Called when a record skips a group whose code it does not recognize.
     * @param event the skipped group and the record kind that skipped it
     */
    void onUnhandledGroup(UnhandledGroupEvent event);

    /**
     * Called for soft consistency problems (count mismatches, missing names,
     * skipped sections). Parsing continues with whatever was read.
     * @param event the warning
     */
    void onWarning(DxfWarningEvent event);

    /**
     * Called when a top-level section has been assembled.
     * @param event the section name and how many records it produced
     */
    void onSection(DxfSectionEvent event);

    /**
     * Called when a parse is about to fail.
     * @param event the error event
     */
    void onError(DxfErrorEvent event);
}
