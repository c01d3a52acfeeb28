package org.euler.model;

import java.util.Arrays;

/**
 * An immutable 3x3 matrix of doubles, stored row-major.
 * Used as the rotation-matrix form of a rotation (acting on column vectors).
 */
public final class Matrix3 {

    /**
     * Tolerance used by {@link #isRotation(double)} when callers do not supply one.
     */
    public static final double ORTHONORMAL_TOLERANCE = 1e-6;

    private static final Matrix3 IDENTITY = new Matrix3(new double[][]{
            {1.0, 0.0, 0.0},
            {0.0, 1.0, 0.0},
            {0.0, 0.0, 1.0}
    });

    private final double[] data;

    /**
     * Constructs a matrix from its rows.
     * The input is copied to keep immutability.
     *
     * @param rows exactly 3 rows of exactly 3 values each
     */
    public Matrix3(double[][] rows) {
        if (rows == null) {
            throw new IllegalArgumentException("rows must not be null");
        }
        if (rows.length != 3) {
            throw new IllegalArgumentException("Matrix3 needs 3 rows but got " + rows.length);
        }
        this.data = new double[9];
        for (int r = 0; r < 3; r++) {
            if (rows[r] == null || rows[r].length != 3) {
                throw new IllegalArgumentException("Row " + r + " must have exactly 3 values");
            }
            System.arraycopy(rows[r], 0, data, r * 3, 3);
        }
    }

    private Matrix3(double[] rowMajor, boolean owned) {
        this.data = owned ? rowMajor : Arrays.copyOf(rowMajor, 9);
    }

    /**
     * Builds a matrix from 9 values given row by row.
     */
    public static Matrix3 of(double... rowMajor) {
        if (rowMajor == null || rowMajor.length != 9) {
            throw new IllegalArgumentException("Matrix3.of needs exactly 9 values");
        }
        return new Matrix3(rowMajor, false);
    }

    public static Matrix3 identity() {
        return IDENTITY;
    }

    /**
     * Returns the value at (row, col).
     *
     * @throws IndexOutOfBoundsException if row or col is not in 0..2
     */
    public double get(int row, int col) {
        if (row < 0 || row > 2 || col < 0 || col > 2) {
            throw new IndexOutOfBoundsException("row=" + row + ", col=" + col);
        }
        return data[row * 3 + col];
    }

    /**
     * Returns a defensive copy of the rows.
     */
    public double[][] toArrayCopy() {
        double[][] out = new double[3][3];
        for (int r = 0; r < 3; r++) {
            System.arraycopy(data, r * 3, out[r], 0, 3);
        }
        return out;
    }

    public Matrix3 multiply(Matrix3 other) {
        requireOther(other);
        double[] out = new double[9];
        for (int r = 0; r < 3; r++) {
            for (int c = 0; c < 3; c++) {
                out[r * 3 + c] = data[r * 3] * other.data[c]
                        + data[r * 3 + 1] * other.data[3 + c]
                        + data[r * 3 + 2] * other.data[6 + c];
            }
        }
        return new Matrix3(out, true);
    }

    public Matrix3 transpose() {
        return new Matrix3(new double[]{
                data[0], data[3], data[6],
                data[1], data[4], data[7],
                data[2], data[5], data[8]
        }, true);
    }

    public double determinant() {
        return data[0] * (data[4] * data[8] - data[5] * data[7])
                - data[1] * (data[3] * data[8] - data[5] * data[6])
                + data[2] * (data[3] * data[7] - data[4] * data[6]);
    }

    /**
     * Largest absolute element-wise difference to another matrix.
     */
    public double maxAbsDifference(Matrix3 other) {
        requireOther(other);
        double max = 0.0;
        for (int n = 0; n < 9; n++) {
            max = Math.max(max, Math.abs(data[n] - other.data[n]));
        }
        return max;
    }

    /**
     * True if M * M^T is the identity and det(M) is +1, both within the tolerance.
     */
    public boolean isRotation(double tolerance) {
        if (!(tolerance >= 0.0)) {
            throw new IllegalArgumentException("tolerance must be >= 0");
        }
        for (double v : data) {
            if (!Double.isFinite(v)) {
                return false;
            }
        }
        if (multiply(transpose()).maxAbsDifference(IDENTITY) > tolerance) {
            return false;
        }
        return Math.abs(determinant() - 1.0) <= tolerance;
    }

    /**
     * Returns this matrix if it is a proper rotation within {@link #ORTHONORMAL_TOLERANCE}.
     *
     * @throws NonOrthonormalMatrixException otherwise
     */
    public Matrix3 requireRotation() {
        if (!isRotation(ORTHONORMAL_TOLERANCE)) {
            throw new NonOrthonormalMatrixException(
                    "Not a rotation matrix within " + ORTHONORMAL_TOLERANCE + ": " + this
            );
        }
        return this;
    }

    private static void requireOther(Matrix3 other) {
        if (other == null) {
            throw new IllegalArgumentException("other must not be null");
        }
    }

    @Override
    public String toString() {
        return "Matrix3[" + Arrays.toString(Arrays.copyOfRange(data, 0, 3))
                + ", " + Arrays.toString(Arrays.copyOfRange(data, 3, 6))
                + ", " + Arrays.toString(Arrays.copyOfRange(data, 6, 9)) + "]";
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(data);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null) return false;
        if (obj.getClass() != this.getClass()) return false;

        Matrix3 other = (Matrix3) obj;
        return Arrays.equals(this.data, other.data);
    }
}
