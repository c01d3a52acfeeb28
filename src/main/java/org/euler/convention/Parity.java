package org.euler.convention;

/**
 * Whether the axes of a convention follow the cyclic order X -> Y -> Z (EVEN) or the reverse (ODD).
 */
public enum Parity {
    EVEN, ODD;

    public int bit() {
        return ordinal();
    }

    public static Parity ofBit(int bit) {
        return switch (bit) {
            case 0 -> EVEN;
            case 1 -> ODD;
            default -> throw new IllegalArgumentException("Parity bit must be 0 or 1 but got " + bit);
        };
    }
}
