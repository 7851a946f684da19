package com.questrail.dxf;

/**
 * A fixed-shape run of groups carried a code other than the one its shape requires.
 */
public class GroupShapeException extends DxfParseException
{
    private final int expectedCode;
    private final int actualCode;

    public GroupShapeException(String message, int expectedCode, int actualCode) {
        super(message);
        this.expectedCode = expectedCode;
        this.actualCode = actualCode;
    }

    public int expectedCode() {
        return expectedCode;
    }

    public int actualCode() {
        return actualCode;
    }
}
