package com.questrail.dxf.observability;

/**
 * A fatal failure, reported before the exception reaches the caller.
 *
 * @param message description of the failure
 * @param cause   the exception about to propagate, if any
 */
public record DxfErrorEvent(String message, Throwable cause) {
}
