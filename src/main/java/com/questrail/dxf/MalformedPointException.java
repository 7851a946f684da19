package com.questrail.dxf;

public final class MalformedPointException extends GroupShapeException
{
    public MalformedPointException(int expectedCode, int actualCode) {
        super("Expected code for point value to be " + expectedCode + " but got " + actualCode,
            expectedCode, actualCode);
    }
}
