package org.euler.model;

/**
 * Three angles in radians, in the order of the convention they belong to.
 * The same three numbers mean different rotations under different conventions;
 * the triple itself carries no convention.
 * Values are kept as given (no wrapping into a canonical range).
 */
public record AngleTriple(double first, double second, double third) {

    public static final AngleTriple ZERO = new AngleTriple(0.0, 0.0, 0.0);

    /**
     * @throws InvalidTripleLengthException if the array does not hold exactly 3 values
     */
    public static AngleTriple of(double... angles) {
        if (angles == null) {
            throw new IllegalArgumentException("angles must not be null");
        }
        if (angles.length != 3) {
            throw new InvalidTripleLengthException(angles.length);
        }
        return new AngleTriple(angles[0], angles[1], angles[2]);
    }

    public static AngleTriple ofDegrees(double first, double second, double third) {
        return new AngleTriple(Math.toRadians(first), Math.toRadians(second), Math.toRadians(third));
    }

    public double get(int index) {
        return switch (index) {
            case 0 -> first;
            case 1 -> second;
            case 2 -> third;
            default -> throw new IndexOutOfBoundsException("index=" + index + ", size=3");
        };
    }

    public double[] toArray() {
        return new double[]{first, second, third};
    }

    public double[] toDegrees() {
        return new double[]{Math.toDegrees(first), Math.toDegrees(second), Math.toDegrees(third)};
    }

    /** (third, second, first) */
    public AngleTriple reversed() {
        return new AngleTriple(third, second, first);
    }

    public AngleTriple negated() {
        return new AngleTriple(-first, -second, -third);
    }
}
