package com.questrail.dxf;

public final class MalformedMatrixException extends GroupShapeException
{
    public MalformedMatrixException(int expectedCode, int actualCode) {
        super("Expected matrix value with code " + expectedCode + " but got " + actualCode,
            expectedCode, actualCode);
    }
}
