package org.euler.model;

import java.util.Arrays;

/**
 * An immutable quaternion w + xi + yj + zk.
 * Only unit quaternions describe rotations; {@link #toRotationMatrix()} scales
 * by the squared norm so slightly denormalized input still yields a rotation.
 */
public final class Quaternion {

    private static final Quaternion IDENTITY = new Quaternion(1.0, 0.0, 0.0, 0.0);

    private final double w;
    private final double x;
    private final double y;
    private final double z;

    public Quaternion(double w, double x, double y, double z) {
        this.w = w;
        this.x = x;
        this.y = y;
        this.z = z;
    }

    public static Quaternion identity() {
        return IDENTITY;
    }

    /**
     * @param quadruple (w, x, y, z)
     */
    public static Quaternion of(double... quadruple) {
        if (quadruple == null || quadruple.length != 4) {
            throw new IllegalArgumentException("A quaternion needs exactly 4 values (w, x, y, z)");
        }
        return new Quaternion(quadruple[0], quadruple[1], quadruple[2], quadruple[3]);
    }

    public double w() {
        return w;
    }

    public double x() {
        return x;
    }

    public double y() {
        return y;
    }

    public double z() {
        return z;
    }

    /**
     * @return (w, x, y, z) as a new array
     */
    public double[] quadruple() {
        return new double[]{w, x, y, z};
    }

    /**
     * Hamilton product this * other.
     * As rotations: apply other first, then this.
     */
    public Quaternion multiply(Quaternion other) {
        if (other == null) {
            throw new IllegalArgumentException("other must not be null");
        }
        return new Quaternion(
                w * other.w - x * other.x - y * other.y - z * other.z,
                w * other.x + x * other.w + y * other.z - z * other.y,
                w * other.y - x * other.z + y * other.w + z * other.x,
                w * other.z + x * other.y - y * other.x + z * other.w
        );
    }

    public Quaternion conjugate() {
        return new Quaternion(w, -x, -y, -z);
    }

    public double norm() {
        return Math.sqrt(w * w + x * x + y * y + z * z);
    }

    /**
     * @throws IllegalStateException for the zero quaternion
     */
    public Quaternion normalized() {
        double n = norm();
        if (n == 0.0) {
            throw new IllegalStateException("Cannot normalize a zero quaternion");
        }
        return new Quaternion(w / n, x / n, y / n, z / n);
    }

    /**
     * Rotation matrix of this quaternion (active rotation of column vectors).
     *
     * @throws IllegalStateException for the zero quaternion
     */
    public Matrix3 toRotationMatrix() {
        double n = w * w + x * x + y * y + z * z;
        if (n == 0.0) {
            throw new IllegalStateException("The zero quaternion has no rotation matrix");
        }
        double s = 2.0 / n;
        return new Matrix3(new double[][]{
                {1 - s * (y * y + z * z), s * (x * y - w * z), s * (x * z + w * y)},
                {s * (x * y + w * z), 1 - s * (x * x + z * z), s * (y * z - w * x)},
                {s * (x * z - w * y), s * (y * z + w * x), 1 - s * (x * x + y * y)}
        });
    }

    /**
     * Unit quaternion of a rotation matrix.
     * Picks the numerically largest of w, x, y, z as pivot to stay stable near 180 degrees.
     */
    public static Quaternion fromRotationMatrix(Matrix3 m) {
        if (m == null) {
            throw new IllegalArgumentException("m must not be null");
        }
        double m00 = m.get(0, 0), m01 = m.get(0, 1), m02 = m.get(0, 2);
        double m10 = m.get(1, 0), m11 = m.get(1, 1), m12 = m.get(1, 2);
        double m20 = m.get(2, 0), m21 = m.get(2, 1), m22 = m.get(2, 2);

        double trace = m00 + m11 + m22;
        double qw, qx, qy, qz;

        if (trace > 0) {
            double s = 0.5 / Math.sqrt(trace + 1.0);
            qw = 0.25 / s;
            qx = (m21 - m12) * s;
            qy = (m02 - m20) * s;
            qz = (m10 - m01) * s;
        } else if (m00 > m11 && m00 > m22) {
            double s = 2.0 * Math.sqrt(1.0 + m00 - m11 - m22);
            qw = (m21 - m12) / s;
            qx = 0.25 * s;
            qy = (m01 + m10) / s;
            qz = (m02 + m20) / s;
        } else if (m11 > m22) {
            double s = 2.0 * Math.sqrt(1.0 + m11 - m00 - m22);
            qw = (m02 - m20) / s;
            qx = (m01 + m10) / s;
            qy = 0.25 * s;
            qz = (m12 + m21) / s;
        } else {
            double s = 2.0 * Math.sqrt(1.0 + m22 - m00 - m11);
            qw = (m10 - m01) / s;
            qx = (m02 + m20) / s;
            qy = (m12 + m21) / s;
            qz = 0.25 * s;
        }
        return new Quaternion(qw, qx, qy, qz);
    }

    @Override
    public String toString() {
        return "Quaternion(" + w + ", " + x + ", " + y + ", " + z + ")";
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(quadruple());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null) return false;
        if (obj.getClass() != this.getClass()) return false;

        Quaternion other = (Quaternion) obj;
        return Double.compare(w, other.w) == 0
                && Double.compare(x, other.x) == 0
                && Double.compare(y, other.y) == 0
                && Double.compare(z, other.z) == 0;
    }
}
