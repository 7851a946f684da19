package com.questrail.dxf;

/**
 * A value line could not be converted to the type its group code requires.
 *
 * <p>Boolean codes accept only {@code "0"} and {@code "1"}; float and integer codes
 * must carry parseable numeric text.</p>
 */
public final class InvalidGroupValueException extends DxfParseException
{
    private final int code;
    private final String rawValue;

    public InvalidGroupValueException(int code, String rawValue, String message) {
        super(message);
        this.code = code;
        this.rawValue = rawValue;
    }

    public InvalidGroupValueException(int code, String rawValue, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.rawValue = rawValue;
    }

    public int code() {
        return code;
    }

    public String rawValue() {
        return rawValue;
    }
}
