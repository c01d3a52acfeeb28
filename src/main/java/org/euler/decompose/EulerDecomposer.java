package org.euler.decompose;

import org.euler.convention.AxisCode;
import org.euler.model.AngleTriple;
import org.euler.model.Matrix3;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Rotation matrix -> Euler angles for any {@link AxisCode}, after Ken Shoemake,
 * "Euler Angle Conversion", Graphics Gems IV (1994), p. 222.
 *
 * At gimbal lock (middle angle aligning the first and third axes) the split between
 * the first and third angle is not unique. The whole combined angle is then put into
 * the first extracted angle and the other one is set to 0, before the frame swap.
 * The result still reproduces the input matrix.
 */
public final class EulerDecomposer {

    private static final Logger log = LoggerFactory.getLogger(EulerDecomposer.class);

    /**
     * Below this magnitude of the relevant sine/cosine term the decomposition takes the gimbal-lock branch.
     * Matrices rebuilt from quaternions carry entry noise around 1e-16; above this threshold that noise
     * is divided by a term large enough to keep the outer angles accurate.
     */
    public static final double GIMBAL_EPSILON = 1e-8;

    private EulerDecomposer() {
    }

    /**
     * @param m    rotation matrix (orthonormality is the caller's responsibility)
     * @param code axis code of a base convention
     * @return the angles in the convention's own order
     */
    public static AngleTriple decompose(Matrix3 m, AxisCode code) {
        Objects.requireNonNull(m, "m must not be null");
        Objects.requireNonNull(code, "code must not be null");

        int i = code.i();
        int j = code.j();
        int k = code.k();

        double ax;
        double ay;
        double az;

        if (code.repetition()) {
            double sy = Math.sqrt(m.get(i, j) * m.get(i, j) + m.get(i, k) * m.get(i, k));
            if (sy > GIMBAL_EPSILON) {
                ax = Math.atan2(m.get(i, j), m.get(i, k));
                ay = Math.atan2(sy, m.get(i, i));
                az = Math.atan2(m.get(j, i), -m.get(k, i));
            } else {
                ax = Math.atan2(-m.get(j, k), m.get(j, j));
                ay = Math.atan2(sy, m.get(i, i));
                az = 0.0;
                log.debug("Gimbal lock in {} (sin of middle angle {}), folded into one angle", code, sy);
            }
        } else {
            double cy = Math.sqrt(m.get(i, i) * m.get(i, i) + m.get(j, i) * m.get(j, i));
            if (cy > GIMBAL_EPSILON) {
                ax = Math.atan2(m.get(k, j), m.get(k, k));
                ay = Math.atan2(-m.get(k, i), cy);
                az = Math.atan2(m.get(j, i), m.get(i, i));
            } else {
                ax = Math.atan2(-m.get(j, k), m.get(j, j));
                ay = Math.atan2(-m.get(k, i), cy);
                az = 0.0;
                log.debug("Gimbal lock in {} (cos of middle angle {}), folded into one angle", code, cy);
            }
        }

        if (code.isOddParity()) {
            ax = -ax;
            ay = -ay;
            az = -az;
        }
        if (code.isRotatingFrame()) {
            return new AngleTriple(az, ay, ax);
        }
        return new AngleTriple(ax, ay, az);
    }
}
