package com.questrail.dxf;

/**
 * The input ran out of lines before the {@code 0/EOF} group was read.
 */
public final class UnexpectedEndOfInputException extends DxfParseException
{
    public UnexpectedEndOfInputException(String message) {
        super(message);
    }
}
