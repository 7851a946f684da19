package com.questrail.dxf;

/**
 * The raw text does not have the shape of a group stream: it is empty, has an
 * odd number of lines, or carries a code line that is not an integer.
 */
public final class MalformedInputException extends DxfParseException
{
    public MalformedInputException(String message) {
        super(message);
    }

    public MalformedInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
