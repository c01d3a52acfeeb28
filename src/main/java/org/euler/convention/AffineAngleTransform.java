package org.euler.convention;

import org.euler.model.AngleTriple;

import java.util.Arrays;
import java.util.Objects;

/**
 * Per-angle affine map: out[n] = scale[n] * in[n] + offset[n].
 *
 * Covers the reparameterizations used by the derived texture conventions
 * (e.g. Kocks: phi = pi - Phi) and can always be inverted exactly in closed form,
 * so a table only needs to state one direction.
 */
public final class AffineAngleTransform implements AngleTransform {

    private static final AffineAngleTransform IDENTITY =
            new AffineAngleTransform(new double[]{1, 1, 1}, new double[]{0, 0, 0});

    private final double[] scale;
    private final double[] offset;

    private AffineAngleTransform(double[] scale, double[] offset) {
        this.scale = scale;
        this.offset = offset;
    }

    /**
     * @param scale  3 finite, non-zero factors
     * @param offset 3 finite offsets in radians
     */
    public static AffineAngleTransform of(double[] scale, double[] offset) {
        requireThree(scale, "scale");
        requireThree(offset, "offset");
        for (int n = 0; n < 3; n++) {
            if (!Double.isFinite(scale[n]) || scale[n] == 0.0) {
                throw new IllegalArgumentException("scale[" + n + "] must be finite and non-zero but was " + scale[n]);
            }
            if (!Double.isFinite(offset[n])) {
                throw new IllegalArgumentException("offset[" + n + "] must be finite but was " + offset[n]);
            }
        }
        return new AffineAngleTransform(Arrays.copyOf(scale, 3), Arrays.copyOf(offset, 3));
    }

    public static AffineAngleTransform identity() {
        return IDENTITY;
    }

    @Override
    public AngleTriple apply(AngleTriple angles) {
        Objects.requireNonNull(angles, "angles must not be null");
        return new AngleTriple(
                scale[0] * angles.first() + offset[0],
                scale[1] * angles.second() + offset[1],
                scale[2] * angles.third() + offset[2]
        );
    }

    /**
     * in[n] = (out[n] - offset[n]) / scale[n], written as another affine map.
     */
    public AffineAngleTransform inverse() {
        double[] s = new double[3];
        double[] o = new double[3];
        for (int n = 0; n < 3; n++) {
            s[n] = 1.0 / scale[n];
            o[n] = -offset[n] / scale[n];
        }
        return new AffineAngleTransform(s, o);
    }

    public double[] scale() {
        return Arrays.copyOf(scale, 3);
    }

    public double[] offset() {
        return Arrays.copyOf(offset, 3);
    }

    private static void requireThree(double[] values, String name) {
        if (values == null) {
            throw new IllegalArgumentException(name + " must not be null");
        }
        if (values.length != 3) {
            throw new IllegalArgumentException(name + " needs exactly 3 values but got " + values.length);
        }
    }

    @Override
    public String toString() {
        return "Affine(scale=" + Arrays.toString(scale) + ", offset=" + Arrays.toString(offset) + ")";
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(scale) + Arrays.hashCode(offset);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof AffineAngleTransform other)) return false;
        return Arrays.equals(scale, other.scale) && Arrays.equals(offset, other.offset);
    }
}
