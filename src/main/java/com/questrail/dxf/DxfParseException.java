package com.questrail.dxf;

/**
 * Indicates that a DXF group stream could not be turned into a document.
 *
 * This is the root of the fatal parse failures:
 * <ul>
 *   <li>Structural scanner errors (truncated input, reads past {@code EOF})</li>
 *   <li>Shape mismatches inside fixed-shape structures (points, matrices)</li>
 *   <li>Value coercion failures (booleans, numbers)</li>
 * </ul>
 *
 * Unknown codes and soft consistency problems are never reported through this
 * type; they go to the diagnostics sink and parsing continues.
 */
public class DxfParseException extends RuntimeException
{
    public DxfParseException(String message) {
        super(message);
    }

    public DxfParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
