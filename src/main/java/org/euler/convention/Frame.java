package org.euler.convention;

/**
 * STATIC: elementary rotations about the fixed world axes (extrinsic).
 * ROTATING: about the body axes as moved by the preceding rotations (intrinsic).
 */
public enum Frame {
    STATIC('s'), ROTATING('r');

    private final char suffix;

    Frame(char suffix) {
        this.suffix = suffix;
    }

    public int bit() {
        return ordinal();
    }

    /** Suffix used in convention names such as "XYZs" or "ZXZr". */
    public char suffix() {
        return suffix;
    }

    public static Frame ofBit(int bit) {
        return switch (bit) {
            case 0 -> STATIC;
            case 1 -> ROTATING;
            default -> throw new IllegalArgumentException("Frame bit must be 0 or 1 but got " + bit);
        };
    }
}
