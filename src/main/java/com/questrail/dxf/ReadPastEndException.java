package com.questrail.dxf;

/**
 * A group was requested after the {@code 0/EOF} group had already been consumed.
 */
public final class ReadPastEndException extends DxfParseException
{
    public ReadPastEndException(String message) {
        super(message);
    }
}
