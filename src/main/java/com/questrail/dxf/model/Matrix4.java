package com.questrail.dxf.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * A 4x4 transformation matrix, stored as the 16 values in the order they are
 * written in the group stream (row-major).
 */
public final class Matrix4
{
    public static final int SIZE = 16;

    private final double[] values;

    public Matrix4(double[] values) {
        Objects.requireNonNull(values, "values");
        if (values.length != SIZE) {
            throw new IllegalArgumentException("A matrix has 16 values, got " + values.length);
        }
        this.values = values.clone();
    }

    public static Matrix4 identity() {
        double[] values = new double[SIZE];
        for (int i = 0; i < 4; i++) {
            values[i * 4 + i] = 1.0;
        }
        return new Matrix4(values);
    }

    public double get(int row, int column) {
        return values[row * 4 + column];
    }

    public double[] values() {
        return values.clone();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Matrix4 other && Arrays.equals(values, other.values));
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "Matrix4" + Arrays.toString(values);
    }
}
