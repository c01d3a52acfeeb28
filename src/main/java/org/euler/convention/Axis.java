package org.euler.convention;

/**
 * Coordinate axis of an elementary rotation, with the cyclic order X -> Y -> Z -> X.
 */
public enum Axis {
    X, Y, Z;

    private static final Axis[] VALUES = values();

    public int index() {
        return ordinal();
    }

    /** Cyclic successor: X -> Y, Y -> Z, Z -> X. */
    public Axis next() {
        return VALUES[(ordinal() + 1) % 3];
    }

    public static Axis of(int index) {
        if (index < 0 || index > 2) {
            throw new IllegalArgumentException("Axis index must be 0, 1 or 2 but got " + index);
        }
        return VALUES[index];
    }

    public static Axis ofLetter(char letter) {
        return switch (Character.toUpperCase(letter)) {
            case 'X' -> X;
            case 'Y' -> Y;
            case 'Z' -> Z;
            default -> throw new IllegalArgumentException("Not an axis letter: " + letter);
        };
    }
}
