package com.questrail.dxf;

/**
 * Raised when a document cannot be written because a value does not match the
 * type its group code requires. This is an internal consistency error, never a
 * data error: absent optional fields are simply omitted.
 */
public final class DxfSerializationException extends RuntimeException
{
    public DxfSerializationException(String message) {
        super(message);
    }
}
