package org.euler.convention;

import java.util.Objects;

/**
 * The (inner axis, parity, repetition, frame) code of a base Euler-angle convention,
 * after Ken Shoemake, "Euler Angle Conversion", Graphics Gems IV (1994), p. 222.
 *
 * The three rotation axes follow from the code:
 *   i = inner axis
 *   j = next(i + parity)
 *   k = next(i - parity + 1)
 * so odd parity swaps the roles of j and k. With repetition the pattern is i-j-i, otherwise i-j-k.
 */
public record AxisCode(Axis innerAxis, Parity parity, boolean repetition, Frame frame) {

    // next(a) for a in 0..3; index 3 lets i + parity run past Z
    private static final int[] NEXT_AXIS = {1, 2, 0, 1};

    public AxisCode {
        Objects.requireNonNull(innerAxis, "innerAxis must not be null");
        Objects.requireNonNull(parity, "parity must not be null");
        Objects.requireNonNull(frame, "frame must not be null");
    }

    /**
     * Builds a code from the integer tuple form (i, parity, repetition, frame),
     * e.g. (2, 0, 1, 1) for ZXZ in a rotating frame.
     */
    public static AxisCode of(int innerAxis, int parity, int repetition, int frame) {
        if (repetition != 0 && repetition != 1) {
            throw new IllegalArgumentException("Repetition flag must be 0 or 1 but got " + repetition);
        }
        return new AxisCode(Axis.of(innerAxis), Parity.ofBit(parity), repetition == 1, Frame.ofBit(frame));
    }

    public int i() {
        return innerAxis.index();
    }

    public int j() {
        return NEXT_AXIS[i() + parity.bit()];
    }

    public int k() {
        return NEXT_AXIS[i() - parity.bit() + 1];
    }

    public boolean isOddParity() {
        return parity == Parity.ODD;
    }

    public boolean isRotatingFrame() {
        return frame == Frame.ROTATING;
    }

    /**
     * @return {i, parity, repetition, frame} as integers
     */
    public int[] toTuple() {
        return new int[]{i(), parity.bit(), repetition ? 1 : 0, frame.bit()};
    }

    /**
     * Conventional name of this code, e.g. "XYZs" for (0,0,0,0) or "ZYXr" for (0,0,0,1).
     * Rotating-frame names list the axes in reverse order of the static one with the same axes.
     */
    public String conventionName() {
        int third = repetition ? i() : k();
        Axis[] sequence = {innerAxis, Axis.of(j()), Axis.of(third)};
        StringBuilder sb = new StringBuilder(4);
        if (frame == Frame.ROTATING) {
            for (int n = 2; n >= 0; n--) sb.append(sequence[n].name());
        } else {
            for (Axis axis : sequence) sb.append(axis.name());
        }
        return sb.append(frame.suffix()).toString();
    }

    @Override
    public String toString() {
        return conventionName() + "(" + i() + ", " + parity.bit() + ", " + (repetition ? 1 : 0) + ", " + frame.bit() + ")";
    }
}
