package com.questrail.dxf.codec;

import com.questrail.dxf.MalformedMatrixException;
import com.questrail.dxf.model.Matrix4;
import com.questrail.dxf.scan.Group;
import com.questrail.dxf.scan.GroupScanner;

/**
 * Reads and writes 4x4 matrices: sixteen consecutive groups sharing one code,
 * with no terminator.
 */
public final class Matrices
{
    private Matrices() {}

    /**
     * Reads a matrix whose first value is the scanner's last read group.
     *
     * @throws MalformedMatrixException if any of the sixteen groups carries another code
     */
    public static Matrix4 read(GroupScanner scanner, int code) {
        scanner.rewind();
        double[] values = new double[Matrix4.SIZE];
        for (int i = 0; i < Matrix4.SIZE; i++) {
            Group group = scanner.next();
            if (group.code() != code) {
                throw new MalformedMatrixException(code, group.code());
            }
            values[i] = group.real();
        }
        return new Matrix4(values);
    }

    public static void write(GroupWriter out, int code, Matrix4 matrix) {
        for (double value : matrix.values()) {
            out.real(code, value);
        }
    }
}
